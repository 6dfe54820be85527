package com.ryuqq.dispatcher.core.model;

/**
 * 문서 저장소 내 단일 문서를 가리키는 참조.
 *
 * <p>컬렉션 이름과 문서 ID의 조합으로 문서를 유일하게 식별합니다.
 * 경로 표기는 {@code collection/id} 형식입니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>collection, id 모두 null 또는 빈 문자열 불가</li>
 *   <li>collection, id 에 경로 구분자({@code /}) 포함 불가</li>
 * </ul>
 *
 * @param collection 컬렉션 이름
 * @param id 문서 ID
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public record DocumentReference(
    String collection,
    String id
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException collection 또는 id가 유효하지 않은 경우
     */
    public DocumentReference {
        if (collection == null || collection.isBlank()) {
            throw new IllegalArgumentException("collection cannot be null or blank");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (collection.contains("/") || id.contains("/")) {
            throw new IllegalArgumentException("collection and id cannot contain '/' (current: " + collection + "/" + id + ")");
        }
    }

    /**
     * 경로 문자열로부터 참조 생성.
     *
     * @param path {@code collection/id} 형식의 경로
     * @return DocumentReference 인스턴스
     * @throws IllegalArgumentException 경로 형식이 올바르지 않은 경우
     */
    public static DocumentReference of(String path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        int separator = path.indexOf('/');
        if (separator <= 0 || separator == path.length() - 1) {
            throw new IllegalArgumentException("path must be in 'collection/id' form (current: " + path + ")");
        }
        return new DocumentReference(path.substring(0, separator), path.substring(separator + 1));
    }

    /**
     * 문서가 속한 컬렉션 참조.
     *
     * @return 상위 컬렉션
     */
    public CollectionReference parent() {
        return new CollectionReference(collection);
    }

    /**
     * 문서 경로.
     *
     * @return {@code collection/id}
     */
    public String path() {
        return collection + "/" + id;
    }

    @Override
    public String toString() {
        return "DocumentReference{" + path() + '}';
    }
}

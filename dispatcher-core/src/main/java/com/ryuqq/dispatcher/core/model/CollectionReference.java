package com.ryuqq.dispatcher.core.model;

import java.security.SecureRandom;

/**
 * 문서 컬렉션 참조.
 *
 * <p>{@link #document()}는 저장소가 키를 생성하는 방식의 문서 생성(add)에 사용되며,
 * 20자리 영숫자 ID를 무작위로 만들어 냅니다.</p>
 *
 * @param name 컬렉션 이름
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public record CollectionReference(String name) {

    private static final String AUTO_ID_ALPHABET =
        "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
    private static final int AUTO_ID_LENGTH = 20;
    private static final SecureRandom RANDOM = new SecureRandom();

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name이 null, 빈 문자열이거나 '/'를 포함하는 경우
     */
    public CollectionReference {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (name.contains("/")) {
            throw new IllegalArgumentException("name cannot contain '/' (current: " + name + ")");
        }
    }

    /**
     * CollectionReference 생성.
     *
     * @param name 컬렉션 이름
     * @return CollectionReference 인스턴스
     */
    public static CollectionReference of(String name) {
        return new CollectionReference(name);
    }

    /**
     * 지정한 ID의 문서 참조.
     *
     * @param id 문서 ID
     * @return DocumentReference
     */
    public DocumentReference document(String id) {
        return new DocumentReference(name, id);
    }

    /**
     * 자동 생성 ID를 가진 새 문서 참조.
     *
     * @return 20자리 영숫자 ID를 가진 DocumentReference
     */
    public DocumentReference document() {
        StringBuilder id = new StringBuilder(AUTO_ID_LENGTH);
        for (int i = 0; i < AUTO_ID_LENGTH; i++) {
            id.append(AUTO_ID_ALPHABET.charAt(RANDOM.nextInt(AUTO_ID_ALPHABET.length())));
        }
        return new DocumentReference(name, id.toString());
    }
}

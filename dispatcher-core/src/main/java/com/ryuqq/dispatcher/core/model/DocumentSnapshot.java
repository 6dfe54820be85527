package com.ryuqq.dispatcher.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 특정 시점에 읽은 문서의 불변 스냅샷.
 *
 * <p>직접 읽기와 트랜잭션 읽기 모두 같은 형태의 스냅샷을 반환하므로
 * 핸들러는 어떤 읽기 모드에서 호출되었는지 구분할 필요가 없습니다.</p>
 *
 * <p>문서가 존재하지 않으면 {@link #exists()}가 false이고 version은 0입니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class DocumentSnapshot {

    private final DocumentReference reference;
    private final Map<String, Object> data;
    private final long version;

    private DocumentSnapshot(DocumentReference reference, Map<String, Object> data, long version) {
        if (reference == null) {
            throw new IllegalArgumentException("reference cannot be null");
        }
        if (version < 0) {
            throw new IllegalArgumentException("version must be non-negative (current: " + version + ")");
        }
        this.reference = reference;
        this.data = data == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        this.version = version;
    }

    /**
     * 존재하는 문서의 스냅샷 생성.
     *
     * @param reference 문서 참조
     * @param data 문서 필드
     * @param version 문서 버전 (커밋 시마다 증가)
     * @return DocumentSnapshot 인스턴스
     * @throws IllegalArgumentException reference 또는 data가 null인 경우
     */
    public static DocumentSnapshot of(DocumentReference reference, Map<String, Object> data, long version) {
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        return new DocumentSnapshot(reference, data, version);
    }

    /**
     * 존재하지 않는 문서의 스냅샷 생성.
     *
     * @param reference 문서 참조
     * @return exists() == false 인 스냅샷
     */
    public static DocumentSnapshot missing(DocumentReference reference) {
        return new DocumentSnapshot(reference, null, 0L);
    }

    public DocumentReference getReference() {
        return reference;
    }

    public boolean exists() {
        return data != null;
    }

    /**
     * 문서 필드 조회.
     *
     * @return 문서가 존재하면 필드 맵 (수정 불가), 없으면 empty
     */
    public Optional<Map<String, Object>> getData() {
        return Optional.ofNullable(data);
    }

    /**
     * 단일 필드 값 조회.
     *
     * @param field 필드 이름
     * @return 필드 값, 문서나 필드가 없으면 null
     */
    public Object get(String field) {
        return data == null ? null : data.get(field);
    }

    public long getVersion() {
        return version;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DocumentSnapshot that = (DocumentSnapshot) o;
        return version == that.version
            && reference.equals(that.reference)
            && Objects.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(reference, data, version);
    }

    @Override
    public String toString() {
        return "DocumentSnapshot{" + reference.path() + ", exists=" + exists() + ", version=" + version + '}';
    }
}

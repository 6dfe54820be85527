package com.ryuqq.dispatcher.core.model;

/**
 * 쓰기 연산(update, delete)의 사전 조건.
 *
 * <p>조건을 만족하지 않으면 저장소는 커밋 시점에
 * {@code StoreErrorCode.FAILED_PRECONDITION}으로 실패합니다.</p>
 *
 * @param exists 문서 존재 여부 조건 (null이면 검사하지 않음)
 * @param version 기대하는 문서 버전 (null이면 검사하지 않음)
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public record Precondition(Boolean exists, Long version) {

    /**
     * 조건 없음.
     */
    public static final Precondition NONE = new Precondition(null, null);

    public Precondition {
        if (version != null && version < 0) {
            throw new IllegalArgumentException("version must be non-negative (current: " + version + ")");
        }
    }

    public static Precondition exists(boolean exists) {
        return new Precondition(exists, null);
    }

    /**
     * 문서가 지정한 버전일 때만 쓰기를 허용하는 조건.
     *
     * @param version 기대 버전
     * @return Precondition
     */
    public static Precondition version(long version) {
        return new Precondition(null, version);
    }

    public boolean isNone() {
        return exists == null && version == null;
    }
}

package com.ryuqq.dispatcher.core.error;

/**
 * 문서 저장소 오류 코드.
 *
 * <p>gRPC 상태 코드 체계를 따릅니다. {@link #isTransient()}가 true인 코드는
 * 동일한 작업을 다시 시도하면 성공할 수 있는 일시적 오류입니다.</p>
 *
 * <p><strong>일시적 오류:</strong></p>
 * <ul>
 *   <li>UNAVAILABLE, RESOURCE_EXHAUSTED, INTERNAL, DEADLINE_EXCEEDED</li>
 *   <li>DATA_LOSS, ABORTED, CANCELLED</li>
 * </ul>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public enum StoreErrorCode {

    CANCELLED(true),
    UNKNOWN(false),
    INVALID_ARGUMENT(false),
    DEADLINE_EXCEEDED(true),
    NOT_FOUND(false),
    ALREADY_EXISTS(false),
    PERMISSION_DENIED(false),
    RESOURCE_EXHAUSTED(true),
    FAILED_PRECONDITION(false),
    ABORTED(true),
    OUT_OF_RANGE(false),
    UNIMPLEMENTED(false),
    INTERNAL(true),
    UNAVAILABLE(true),
    DATA_LOSS(true),
    UNAUTHENTICATED(false);

    private final boolean transientFailure;

    StoreErrorCode(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    /**
     * 재시도로 회복 가능한 일시적 오류인지 확인.
     *
     * @return 일시적 오류면 true
     */
    public boolean isTransient() {
        return transientFailure;
    }
}

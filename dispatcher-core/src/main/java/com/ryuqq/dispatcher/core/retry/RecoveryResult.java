package com.ryuqq.dispatcher.core.retry;

/**
 * 실패 후 재시도 판단 결과.
 *
 * <ul>
 *   <li>{@link Retried}: 백오프 대기를 마쳤으며 호출자가 다음 시도를 실행해야 함</li>
 *   <li>{@link GaveUp}: 재시도 불가 또는 횟수 소진, 롤백 대상</li>
 * </ul>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public sealed interface RecoveryResult permits RecoveryResult.Retried, RecoveryResult.GaveUp {

    default boolean isRetried() {
        return this instanceof Retried;
    }

    default boolean isGaveUp() {
        return this instanceof GaveUp;
    }

    /**
     * 재시도해야 함.
     *
     * @param retryNumber 다음에 실행할 시도 번호 (1 이상)
     * @param delayMillis 재시도 전 대기한 시간 (밀리초)
     */
    record Retried(int retryNumber, long delayMillis) implements RecoveryResult {

        public Retried {
            if (retryNumber < 1) {
                throw new IllegalArgumentException("retryNumber must be positive (current: " + retryNumber + ")");
            }
            if (delayMillis < 0) {
                throw new IllegalArgumentException("delayMillis must be non-negative (current: " + delayMillis + ")");
            }
        }
    }

    /**
     * 재시도를 포기함.
     *
     * @param error 마지막 시도의 오류
     */
    record GaveUp(Exception error) implements RecoveryResult {

        public GaveUp {
            if (error == null) {
                throw new IllegalArgumentException("error cannot be null");
            }
        }
    }
}

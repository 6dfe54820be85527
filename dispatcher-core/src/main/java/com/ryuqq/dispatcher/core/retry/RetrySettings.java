package com.ryuqq.dispatcher.core.retry;

/**
 * 이벤트 재시도 수치 설정.
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>retryMax: 50</li>
 *   <li>retryIntervalExtendFactorMillis: 50ms</li>
 *   <li>retryIntervalMaxMillis: 1000ms</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * RetrySettings settings = new RetrySettings()
 *     .withRetryMax(10)
 *     .withRetryIntervalExtendFactorMillis(100);
 * }</pre>
 *
 * @param retryMax 최대 시도 횟수 (1 이상, 1이면 재시도하지 않음)
 * @param retryIntervalExtendFactorMillis 간격 증가 단위 (밀리초, 0 이상)
 * @param retryIntervalMaxMillis 간격 상한 (밀리초, 0 이상)
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public record RetrySettings(
    int retryMax,
    long retryIntervalExtendFactorMillis,
    long retryIntervalMaxMillis
) {

    public static final int DEFAULT_RETRY_MAX = 50;
    public static final long DEFAULT_RETRY_INTERVAL_EXTEND_FACTOR_MILLIS = 50L;
    public static final long DEFAULT_RETRY_INTERVAL_MAX_MILLIS = 1000L;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException retryMax가 1 미만이거나 간격이 음수인 경우
     */
    public RetrySettings {
        if (retryMax < 1) {
            throw new IllegalArgumentException("retryMax must be positive (current: " + retryMax + ")");
        }
        if (retryIntervalExtendFactorMillis < 0) {
            throw new IllegalArgumentException(
                "retryIntervalExtendFactorMillis must be non-negative (current: " + retryIntervalExtendFactorMillis + ")"
            );
        }
        if (retryIntervalMaxMillis < 0) {
            throw new IllegalArgumentException(
                "retryIntervalMaxMillis must be non-negative (current: " + retryIntervalMaxMillis + ")"
            );
        }
    }

    /**
     * 기본 설정으로 생성.
     */
    public RetrySettings() {
        this(DEFAULT_RETRY_MAX, DEFAULT_RETRY_INTERVAL_EXTEND_FACTOR_MILLIS, DEFAULT_RETRY_INTERVAL_MAX_MILLIS);
    }

    public RetrySettings withRetryMax(int retryMax) {
        return new RetrySettings(retryMax, retryIntervalExtendFactorMillis, retryIntervalMaxMillis);
    }

    public RetrySettings withRetryIntervalExtendFactorMillis(long retryIntervalExtendFactorMillis) {
        return new RetrySettings(retryMax, retryIntervalExtendFactorMillis, retryIntervalMaxMillis);
    }

    public RetrySettings withRetryIntervalMaxMillis(long retryIntervalMaxMillis) {
        return new RetrySettings(retryMax, retryIntervalExtendFactorMillis, retryIntervalMaxMillis);
    }
}

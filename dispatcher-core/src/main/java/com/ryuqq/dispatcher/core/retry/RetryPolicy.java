package com.ryuqq.dispatcher.core.retry;

/**
 * 재시도 정책.
 *
 * <p>각 원자 이벤트는 자신의 재시도 정책을 가지며, 한 번의 publish에 포함된
 * 여러 이벤트의 정책은 {@link AggregateRetryPolicy}로 합쳐집니다.</p>
 *
 * <p><strong>재시도 간격:</strong></p>
 * <pre>
 * delay(n) = min(retryIntervalExtendFactorMillis * n, retryIntervalMaxMillis)
 * </pre>
 * <p>예: factor=100ms, max=1000ms → 100, 200, 300, ..., 1000, 1000, ...</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public interface RetryPolicy {

    /**
     * 최대 시도 횟수 (최초 시도 포함).
     *
     * <p>retryMax가 10이면 핸들러 실행은 최대 10회입니다.
     * 1이면 재시도하지 않습니다.</p>
     *
     * @return 최대 시도 횟수
     */
    int retryMax();

    /**
     * 재시도 번호에 곱해지는 간격 증가 단위 (밀리초).
     *
     * @return 증가 단위
     */
    long retryIntervalExtendFactorMillis();

    /**
     * 재시도 간격 상한 (밀리초).
     *
     * @return 간격 상한
     */
    long retryIntervalMaxMillis();

    /**
     * 발생한 오류가 재시도로 회복 가능한지 판단.
     *
     * @param error 핸들러 또는 저장소에서 발생한 오류
     * @return 재시도 대상이면 true
     */
    boolean isRetryableError(Throwable error);
}

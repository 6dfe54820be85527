package com.ryuqq.dispatcher.core.retry;

/**
 * 선형 증가 후 상한에서 고정되는 재시도 간격 계산기.
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(retryIntervalExtendFactorMillis * retryNumber, retryIntervalMaxMillis)
 * </pre>
 *
 * <p><strong>예시 (factor=100ms, max=500ms):</strong></p>
 * <ul>
 *   <li>retryNumber=1: 100ms</li>
 *   <li>retryNumber=3: 300ms</li>
 *   <li>retryNumber=9: 500ms (상한)</li>
 * </ul>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class LinearBackoff {

    private LinearBackoff() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param policy 재시도 정책
     * @param retryNumber 재시도 번호 (1부터 시작)
     * @return 재시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException policy가 null이거나 retryNumber가 양수가 아닌 경우
     */
    public static long calculate(RetryPolicy policy, int retryNumber) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (retryNumber <= 0) {
            throw new IllegalArgumentException("retryNumber must be positive (current: " + retryNumber + ")");
        }

        // overflow 시 상한으로 고정
        long linear;
        try {
            linear = Math.multiplyExact(policy.retryIntervalExtendFactorMillis(), (long) retryNumber);
        } catch (ArithmeticException e) {
            linear = Long.MAX_VALUE;
        }
        return Math.min(linear, policy.retryIntervalMaxMillis());
    }
}

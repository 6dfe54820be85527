package com.ryuqq.dispatcher.core.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 실패한 시도를 재시도할지 결정하고, 재시도한다면 백오프만큼 대기합니다.
 *
 * <p>다음 시도의 실행은 호출자가 담당합니다. 호출자는 루프에서 {@link RecoveryResult.Retried}를
 * 받는 동안 다음 시도를 실행하므로 재시도 횟수와 호출 스택 깊이는 무관합니다.</p>
 *
 * <p><strong>판단 규칙:</strong></p>
 * <pre>
 * if (policy.isRetryableError(error) && retryCount + 1 < policy.retryMax()) {
 *     sleep(LinearBackoff.calculate(policy, retryCount + 1));
 *     return Retried(retryCount + 1, delay);
 * }
 * return GaveUp(error);
 * </pre>
 *
 * <p>retryCount는 실패한 시도의 0 기반 번호입니다 (최초 시도 = 0).
 * 따라서 retryMax가 N이면 최대 N회 실행됩니다.</p>
 *
 * <p><strong>인터럽트:</strong> 대기 중 인터럽트되면 인터럽트 플래그를 복원하고
 * 재시도를 포기({@link RecoveryResult.GaveUp})합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class RetryEvaluator {

    private static final Logger log = LoggerFactory.getLogger(RetryEvaluator.class);

    private final Sleeper sleeper;

    public RetryEvaluator() {
        this(new ThreadSleeper());
    }

    public RetryEvaluator(Sleeper sleeper) {
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.sleeper = sleeper;
    }

    /**
     * 실패한 시도에 대한 재시도 판단 및 대기.
     *
     * @param policy 적용할 재시도 정책
     * @param error 실패한 시도의 오류
     * @param retryCount 실패한 시도의 번호 (0부터 시작)
     * @return Retried(다음 시도 번호, 대기 시간) 또는 GaveUp
     * @throws IllegalArgumentException 인자가 유효하지 않은 경우
     */
    public RecoveryResult evaluate(RetryPolicy policy, Exception error, int retryCount) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be non-negative (current: " + retryCount + ")");
        }

        int nextRetry = retryCount + 1;
        boolean retryable = policy.isRetryableError(error);
        if (!retryable || nextRetry >= policy.retryMax()) {
            log.debug("Giving up after attempt {}: retryable={}, retryMax={}",
                nextRetry, retryable, policy.retryMax());
            return new RecoveryResult.GaveUp(error);
        }

        long delayMillis = LinearBackoff.calculate(policy, nextRetry);
        log.info("Attempt {} failed with {}, retrying in {}ms (retryMax: {})",
            nextRetry, error.getClass().getSimpleName(), delayMillis, policy.retryMax());

        try {
            sleeper.sleep(delayMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Retry backoff interrupted before retry {}, giving up", nextRetry);
            return new RecoveryResult.GaveUp(error);
        }

        return new RecoveryResult.Retried(nextRetry, delayMillis);
    }
}

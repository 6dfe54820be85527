package com.ryuqq.dispatcher.core.retry;

import java.util.List;
import java.util.Objects;

/**
 * 여러 이벤트의 재시도 정책을 하나로 합친 정책.
 *
 * <p>한 번의 publish는 포함된 모든 원자 이벤트의 핸들러를 하나의 단위로 실행하므로,
 * 재시도 역시 하나의 정책으로 결정됩니다.</p>
 *
 * <p><strong>결합 규칙:</strong></p>
 * <ul>
 *   <li>retryMax: 최솟값</li>
 *   <li>retryIntervalExtendFactorMillis: 최댓값</li>
 *   <li>retryIntervalMaxMillis: 최댓값</li>
 *   <li>isRetryableError: 모든 정책이 재시도 대상으로 판단할 때만 true</li>
 * </ul>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class AggregateRetryPolicy implements RetryPolicy {

    private final List<RetryPolicy> policies;
    private final int retryMax;
    private final long retryIntervalExtendFactorMillis;
    private final long retryIntervalMaxMillis;

    private AggregateRetryPolicy(List<RetryPolicy> policies) {
        this.policies = policies;
        this.retryMax = policies.stream().mapToInt(RetryPolicy::retryMax).min().orElseThrow();
        this.retryIntervalExtendFactorMillis = policies.stream()
            .mapToLong(RetryPolicy::retryIntervalExtendFactorMillis).max().orElseThrow();
        this.retryIntervalMaxMillis = policies.stream()
            .mapToLong(RetryPolicy::retryIntervalMaxMillis).max().orElseThrow();
    }

    /**
     * 정책 목록을 결합.
     *
     * @param policies 결합할 정책 (1개 이상)
     * @return AggregateRetryPolicy
     * @throws IllegalArgumentException policies가 null, 비어 있거나 null 원소를 포함하는 경우
     */
    public static AggregateRetryPolicy of(List<? extends RetryPolicy> policies) {
        if (policies == null || policies.isEmpty()) {
            throw new IllegalArgumentException("policies cannot be null or empty");
        }
        if (policies.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("policies cannot contain null");
        }
        return new AggregateRetryPolicy(List.copyOf(policies));
    }

    @Override
    public int retryMax() {
        return retryMax;
    }

    @Override
    public long retryIntervalExtendFactorMillis() {
        return retryIntervalExtendFactorMillis;
    }

    @Override
    public long retryIntervalMaxMillis() {
        return retryIntervalMaxMillis;
    }

    @Override
    public boolean isRetryableError(Throwable error) {
        for (RetryPolicy policy : policies) {
            if (!policy.isRetryableError(error)) {
                return false;
            }
        }
        return true;
    }

    public List<RetryPolicy> getPolicies() {
        return policies;
    }

    @Override
    public String toString() {
        return "AggregateRetryPolicy{" +
            "size=" + policies.size() +
            ", retryMax=" + retryMax +
            ", retryIntervalExtendFactorMillis=" + retryIntervalExtendFactorMillis +
            ", retryIntervalMaxMillis=" + retryIntervalMaxMillis +
            '}';
    }
}

package com.ryuqq.dispatcher.core.retry;

import com.ryuqq.dispatcher.core.event.AbstractDomainEvent;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * LinearBackoff 테스트.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
class LinearBackoffTest {

    private static final RetryPolicy POLICY = new AbstractDomainEvent(10, 100, 500) {
    };

    @Test
    void calculate_선형_증가_후_상한_고정() {
        // when
        List<Long> delays = new ArrayList<>();
        for (int retry = 1; retry <= 9; retry++) {
            delays.add(LinearBackoff.calculate(POLICY, retry));
        }

        // then
        assertThat(delays).containsExactly(100L, 200L, 300L, 400L, 500L, 500L, 500L, 500L, 500L);
    }

    @Test
    void calculate_overflow_시_상한_반환() {
        // given
        RetryPolicy huge = new AbstractDomainEvent(10, Long.MAX_VALUE / 2, 1000) {
        };

        // when & then
        assertThat(LinearBackoff.calculate(huge, 3)).isEqualTo(1000L);
    }

    @Test
    void calculate_0번째_재시도_예외() {
        assertThatThrownBy(() -> LinearBackoff.calculate(POLICY, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("retryNumber must be positive");
    }
}

package com.ryuqq.dispatcher.core.event;

import com.ryuqq.dispatcher.core.error.RetryableError;
import com.ryuqq.dispatcher.core.error.RetryableException;
import com.ryuqq.dispatcher.core.error.StoreErrorCode;
import com.ryuqq.dispatcher.core.error.StoreException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * AbstractDomainEvent 기본 설정 및 기본 오류 분류 테스트.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
class AbstractDomainEventTest {

    static class OrderPlaced extends AbstractDomainEvent {
    }

    static class StoreFailure extends StoreException implements RetryableError {
        StoreFailure() {
            super(StoreErrorCode.UNAVAILABLE, "down");
        }

        @Override
        public boolean isRetryable() {
            return false;
        }
    }

    private final OrderPlaced event = new OrderPlaced();

    @Test
    void 기본_재시도_설정() {
        assertThat(event.retryMax()).isEqualTo(50);
        assertThat(event.retryIntervalExtendFactorMillis()).isEqualTo(50L);
        assertThat(event.retryIntervalMaxMillis()).isEqualTo(1000L);
    }

    @Test
    void eventName_클래스_이름() {
        assertThat(event.eventName()).isEqualTo("OrderPlaced");
    }

    @Test
    void RetryableError_자체_판단_우선() {
        assertThat(event.isRetryableError(new RetryableException("retry me"))).isTrue();
        assertThat(event.isRetryableError(new RetryableException("do not", false))).isFalse();
        assertThat(event.isRetryableError(new StoreFailure())).isFalse();
    }

    @ParameterizedTest
    @EnumSource(StoreErrorCode.class)
    void StoreException_일시적_코드만_재시도(StoreErrorCode code) {
        assertThat(event.isRetryableError(new StoreException(code, "failure"))).isEqualTo(code.isTransient());
    }

    @Test
    void 그_외_오류_재시도_불가() {
        assertThat(event.isRetryableError(new IllegalStateException())).isFalse();
        assertThat(event.isRetryableError(new IOException())).isFalse();
        assertThat(event.isRetryableError(null)).isFalse();
    }

    @Test
    void CombinedDomainEvent_of_순서_유지() {
        // given
        OrderPlaced first = new OrderPlaced();
        OrderPlaced second = new OrderPlaced();

        // when
        CombinedDomainEvent combined = CombinedDomainEvent.of("checkout", List.of(first, second));

        // then
        assertThat(combined.events()).containsExactly(first, second);
        assertThat(combined.eventName()).isEqualTo("checkout");
    }

    @Test
    void CombinedDomainEvent_of_null_원소_예외() {
        assertThatThrownBy(() -> CombinedDomainEvent.of("checkout", java.util.Arrays.asList(event, null)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

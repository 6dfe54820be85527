package com.ryuqq.dispatcher.core.retry;

import com.ryuqq.dispatcher.core.error.RetryableException;
import com.ryuqq.dispatcher.core.event.AbstractDomainEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * RetryEvaluator 유닛 테스트.
 *
 * <p>재시도 판단 규칙을 검증합니다:</p>
 * <ul>
 *   <li>재시도 가능 + 횟수 남음 → 대기 후 Retried(다음 시도 번호)</li>
 *   <li>재시도 불가 또는 횟수 소진 → GaveUp</li>
 *   <li>대기 중 인터럽트 → GaveUp + 인터럽트 플래그 복원</li>
 * </ul>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class RetryEvaluatorTest {

    @Mock
    private Sleeper sleeper;

    private RetryEvaluator evaluator;

    private final RetryPolicy policy = new AbstractDomainEvent(3, 100, 150) {
    };

    @BeforeEach
    void setUp() {
        evaluator = new RetryEvaluator(sleeper);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    // ============================================================
    // 1. 재시도 실행
    // ============================================================

    @Test
    void evaluate_재시도_가능_오류_대기_후_다음_시도_번호_반환() throws Exception {
        // when
        RecoveryResult result = evaluator.evaluate(policy, new RetryableException("flaky"), 0);

        // then
        assertThat(result).isEqualTo(new RecoveryResult.Retried(1, 100));
        verify(sleeper).sleep(100L);
    }

    @Test
    void evaluate_두번째_실패_간격_상한_적용() throws Exception {
        // when
        RecoveryResult result = evaluator.evaluate(policy, new RetryableException("flaky"), 1);

        // then
        assertThat(result.isRetried()).isTrue();
        verify(sleeper).sleep(150L);
        assertThat(((RecoveryResult.Retried) result).retryNumber()).isEqualTo(2);
    }

    // ============================================================
    // 2. 재시도 포기
    // ============================================================

    @Test
    void evaluate_횟수_소진_GaveUp() {
        // given
        RuntimeException error = new RetryableException("flaky");

        // when
        RecoveryResult result = evaluator.evaluate(policy, error, 2);

        // then
        assertThat(result).isEqualTo(new RecoveryResult.GaveUp(error));
        verifyNoInteractions(sleeper);
    }

    @Test
    void evaluate_재시도_불가_오류_즉시_GaveUp() {
        // given
        IllegalStateException error = new IllegalStateException("bug");

        // when
        RecoveryResult result = evaluator.evaluate(policy, error, 0);

        // then
        assertThat(result.isGaveUp()).isTrue();
        verifyNoInteractions(sleeper);
    }

    @Test
    void evaluate_retryMax_1이면_재시도하지_않음() {
        // given
        RetryPolicy once = new AbstractDomainEvent(1, 100, 100) {
        };

        // when
        RecoveryResult result = evaluator.evaluate(once, new RetryableException("flaky"), 0);

        // then
        assertThat(result.isGaveUp()).isTrue();
        verifyNoInteractions(sleeper);
    }

    // ============================================================
    // 3. 인터럽트
    // ============================================================

    @Test
    void evaluate_대기_중_인터럽트_GaveUp_인터럽트_플래그_복원() throws Exception {
        // given
        doThrow(new InterruptedException()).when(sleeper).sleep(anyLong());
        RuntimeException error = new RetryableException("flaky");

        // when
        RecoveryResult result = evaluator.evaluate(policy, error, 0);

        // then
        assertThat(result).isEqualTo(new RecoveryResult.GaveUp(error));
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }
}

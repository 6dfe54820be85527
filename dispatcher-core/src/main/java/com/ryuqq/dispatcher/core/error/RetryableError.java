package com.ryuqq.dispatcher.core.error;

/**
 * 스스로 재시도 가능 여부를 표시하는 오류.
 *
 * <p>기본 재시도 분류는 이 인터페이스를 구현한 오류의 판단을 저장소 오류 코드보다 우선합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public interface RetryableError {

    /**
     * @return 재시도하면 성공할 수 있는 오류이면 true
     */
    boolean isRetryable();
}

package com.ryuqq.dispatcher.core.retry;

/**
 * 재시도 대기 수단.
 *
 * <p>기본 구현은 {@link ThreadSleeper}이며, 테스트에서는 실제로 대기하지 않고
 * 요청된 대기 시간만 기록하는 구현으로 교체합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * 지정된 시간 동안 대기.
     *
     * @param millis 대기 시간 (밀리초)
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    void sleep(long millis) throws InterruptedException;
}

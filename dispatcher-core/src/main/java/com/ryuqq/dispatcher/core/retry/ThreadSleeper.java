package com.ryuqq.dispatcher.core.retry;

/**
 * {@link Thread#sleep(long)} 기반 Sleeper.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class ThreadSleeper implements Sleeper {

    @Override
    public void sleep(long millis) throws InterruptedException {
        if (millis > 0) {
            Thread.sleep(millis);
        }
    }
}

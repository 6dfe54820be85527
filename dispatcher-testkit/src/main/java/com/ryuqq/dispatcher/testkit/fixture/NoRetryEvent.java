package com.ryuqq.dispatcher.testkit.fixture;

import com.ryuqq.dispatcher.core.event.AbstractDomainEvent;

/**
 * Test event that never retries.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class NoRetryEvent extends AbstractDomainEvent {

    public NoRetryEvent() {
        super(10, 100, 500);
    }

    @Override
    public boolean isRetryableError(Throwable error) {
        return false;
    }
}

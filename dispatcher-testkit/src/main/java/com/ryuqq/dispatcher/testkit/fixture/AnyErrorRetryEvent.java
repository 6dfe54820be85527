package com.ryuqq.dispatcher.testkit.fixture;

import com.ryuqq.dispatcher.core.event.AbstractDomainEvent;
import com.ryuqq.dispatcher.core.retry.RetrySettings;

/**
 * Test event that treats every error as retryable.
 *
 * <p>Defaults to 10 attempts, 100ms factor, 500ms cap, which yields the delay
 * sequence 100, 200, 300, 400, 500, 500, 500, 500, 500.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class AnyErrorRetryEvent extends AbstractDomainEvent {

    public AnyErrorRetryEvent() {
        this(new RetrySettings(10, 100, 500));
    }

    public AnyErrorRetryEvent(RetrySettings retrySettings) {
        super(retrySettings);
    }

    @Override
    public boolean isRetryableError(Throwable error) {
        return true;
    }
}

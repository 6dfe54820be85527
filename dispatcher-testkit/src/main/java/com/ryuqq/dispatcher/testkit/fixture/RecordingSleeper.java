package com.ryuqq.dispatcher.testkit.fixture;

import com.ryuqq.dispatcher.core.retry.Sleeper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Sleeper that records requested delays without actually sleeping.
 *
 * <p>Retry tests use it to assert the exact backoff sequence:</p>
 * <pre>
 * RecordingSleeper sleeper = new RecordingSleeper();
 * publisher = new DefaultDomainEventPublisher(store, sleeper);
 * ...
 * assertThat(sleeper.history()).containsExactly(100L, 200L, 300L);
 * </pre>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class RecordingSleeper implements Sleeper {

    private final List<Long> history = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void sleep(long millis) {
        history.add(millis);
    }

    /**
     * @return requested delays in call order (copy)
     */
    public List<Long> history() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    public void clear() {
        history.clear();
    }
}

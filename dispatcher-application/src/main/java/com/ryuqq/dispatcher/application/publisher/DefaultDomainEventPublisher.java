package com.ryuqq.dispatcher.application.publisher;

import com.ryuqq.dispatcher.application.dispatch.DispatchMode;
import com.ryuqq.dispatcher.application.dispatch.DispatchStrategies;
import com.ryuqq.dispatcher.application.dispatch.DispatchStrategy;
import com.ryuqq.dispatcher.core.error.DomainEventDispatchException;
import com.ryuqq.dispatcher.core.event.DomainEvent;
import com.ryuqq.dispatcher.core.handler.DomainEventHandler;
import com.ryuqq.dispatcher.core.handler.DomainEventSubscriber;
import com.ryuqq.dispatcher.core.retry.RecoveryResult;
import com.ryuqq.dispatcher.core.retry.RetryEvaluator;
import com.ryuqq.dispatcher.core.retry.Sleeper;
import com.ryuqq.dispatcher.core.retry.ThreadSleeper;
import com.ryuqq.dispatcher.core.spi.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

/**
 * {@link DomainEventPublisher} 기본 구현.
 *
 * <p><strong>publish 흐름:</strong></p>
 * <ol>
 *   <li>EventCombinator로 이벤트를 펼치고 핸들러 수집, 결합 재시도 정책 생성</li>
 *   <li>핸들러 형태로 DispatchMode 선택 후 해당 전략 실행 (시도 0)</li>
 *   <li>실패 시 RetryEvaluator가 대기 후 다음 시도 번호를 돌려주면 같은 전략을 다시 실행, 포기하면 중단</li>
 *   <li>포기 시 모든 핸들러 rollback (등록 순) 후 마지막 오류 전파</li>
 *   <li>성공 시 모든 핸들러 onSuccess (등록 순)</li>
 * </ol>
 *
 * <p><strong>Hook 오류:</strong> rollback/onSuccess에서 발생한 오류는 잡지 않고 전파되며,
 * rollback 오류는 원래 오류를 가릴 수 있습니다. 원래 오류는 suppressed로 첨부됩니다.</p>
 *
 * <p>동시에 여러 스레드에서 publish해도 안전합니다. 호출 간 잠금은 없으며,
 * 같은 문서에 대한 상호 배제는 저장소 트랜잭션의 충돌 감지에 맡깁니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class DefaultDomainEventPublisher implements DomainEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(DefaultDomainEventPublisher.class);

    private final List<DomainEventSubscriber> subscribers = new CopyOnWriteArrayList<>();
    private final DispatchStrategies strategies;
    private final RetryEvaluator retryEvaluator;
    private final EventCombinator combinator;
    private final PublisherConfig config;

    public DefaultDomainEventPublisher(DocumentStore store) {
        this(store, new ThreadSleeper());
    }

    /**
     * @param store 문서 저장소
     * @param sleeper 재시도 대기 수단 (테스트에서 교체)
     */
    public DefaultDomainEventPublisher(DocumentStore store, Sleeper sleeper) {
        this(store, sleeper, new PublisherConfig());
    }

    public DefaultDomainEventPublisher(DocumentStore store, Sleeper sleeper, PublisherConfig config) {
        this(DispatchStrategies.create(store), new RetryEvaluator(sleeper), new EventCombinator(), config);
    }

    public DefaultDomainEventPublisher(
        DispatchStrategies strategies,
        RetryEvaluator retryEvaluator,
        EventCombinator combinator,
        PublisherConfig config
    ) {
        if (strategies == null) {
            throw new IllegalArgumentException("strategies cannot be null");
        }
        if (retryEvaluator == null) {
            throw new IllegalArgumentException("retryEvaluator cannot be null");
        }
        if (combinator == null) {
            throw new IllegalArgumentException("combinator cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.strategies = strategies;
        this.retryEvaluator = retryEvaluator;
        this.combinator = combinator;
        this.config = config;
    }

    @Override
    public void addSubscriber(DomainEventSubscriber subscriber) {
        if (subscriber == null) {
            throw new IllegalArgumentException("subscriber cannot be null");
        }
        subscribers.add(subscriber);
    }

    @Override
    public List<DomainEventSubscriber> getSubscribers() {
        return Collections.unmodifiableList(subscribers);
    }

    @Override
    public void publish(DomainEvent... events) {
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        publish(Arrays.asList(events));
    }

    @Override
    public void publish(List<? extends DomainEvent> events) {
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        if (events.isEmpty()) {
            return;
        }

        Optional<Publication> combined = combinator.combine(events, List.copyOf(subscribers));
        if (combined.isEmpty()) {
            log.debug("Nothing to dispatch: {} published event(s) expanded to no atomic events", events.size());
            return;
        }

        Publication publication = combined.get();
        DispatchMode mode = DispatchMode.select(publication.handlers());
        DispatchStrategy strategy = strategies.forMode(mode);
        log.debug("Dispatching [{}] to {} handler(s) in {} mode",
            publication.eventNames(), publication.handlers().size(), mode);

        dispatchWithRetry(strategy, publication);

        for (DomainEventHandler handler : publication.handlers()) {
            try {
                handler.onSuccess();
            } catch (Exception e) {
                throw propagate(e, "onSuccess hook failed for " + publication.eventNames());
            }
        }
    }

    @Override
    public CompletableFuture<Void> publishAsync(Executor executor, DomainEvent... events) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        List<DomainEvent> snapshot = List.copyOf(Arrays.asList(events));
        return CompletableFuture.runAsync(() -> publish(snapshot), executor);
    }

    /**
     * 전략이 성공하거나 RetryEvaluator가 포기할 때까지 시도를 반복합니다.
     * 호출 스택 깊이는 시도 횟수와 무관합니다.
     */
    private void dispatchWithRetry(DispatchStrategy strategy, Publication publication) {
        Exception lastRecovered = null;
        int attempt = 0;
        while (true) {
            try {
                strategy.dispatch(publication.handlers());
                break;
            } catch (Exception e) {
                RecoveryResult result = retryEvaluator.evaluate(publication.retryPolicy(), e, attempt);
                if (result instanceof RecoveryResult.Retried retried) {
                    lastRecovered = e;
                    attempt = retried.retryNumber();
                    continue;
                }
                log.warn("Giving up [{}] after {} attempt(s) in {} mode: {}",
                    publication.eventNames(), attempt + 1, strategy.mode(), e.toString());
                rollbackAll(publication, e);
                throw propagate(e, "Dispatch failed for " + publication.eventNames());
            }
        }

        if (lastRecovered != null && config.propagateRecoveredErrors()) {
            throw propagate(lastRecovered, "Dispatch recovered after retry for " + publication.eventNames());
        }
    }

    private void rollbackAll(Publication publication, Exception cause) {
        for (DomainEventHandler handler : publication.handlers()) {
            try {
                handler.rollback();
            } catch (Exception e) {
                e.addSuppressed(cause);
                throw propagate(e, "rollback hook failed for " + publication.eventNames());
            }
        }
    }

    private static RuntimeException propagate(Exception error, String message) {
        if (error instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        return new DomainEventDispatchException(message, error);
    }
}

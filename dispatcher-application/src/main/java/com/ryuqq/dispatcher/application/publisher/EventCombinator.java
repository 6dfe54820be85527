package com.ryuqq.dispatcher.application.publisher;

import com.ryuqq.dispatcher.core.event.AtomicDomainEvent;
import com.ryuqq.dispatcher.core.event.CombinedDomainEvent;
import com.ryuqq.dispatcher.core.event.DomainEvent;
import com.ryuqq.dispatcher.core.handler.DomainEventHandler;
import com.ryuqq.dispatcher.core.handler.DomainEventSubscriber;
import com.ryuqq.dispatcher.core.retry.AggregateRetryPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * publish된 이벤트 목록을 하나의 실행 단위({@link Publication})로 합칩니다.
 *
 * <p><strong>처리 순서:</strong></p>
 * <ol>
 *   <li>묶음 이벤트를 제자리에서 원자 이벤트로 펼침 (한 단계)</li>
 *   <li>원자 이벤트마다 모든 구독자에게 핸들러 요청, 거절(empty)은 제외</li>
 *   <li>원자 이벤트 전체의 결합 재시도 정책 생성 (이벤트가 하나여도 동일)</li>
 * </ol>
 *
 * <p>구독자 호출은 publish당 원자 이벤트마다 한 번이며 재시도마다 반복되지 않습니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class EventCombinator {

    /**
     * 묶음 이벤트를 펼친 원자 이벤트 목록.
     *
     * @param events publish된 이벤트
     * @return 원자 이벤트 (순서 유지)
     * @throws IllegalArgumentException events가 null이거나 null 원소를 포함하는 경우
     */
    public List<AtomicDomainEvent> expand(List<? extends DomainEvent> events) {
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        List<AtomicDomainEvent> expanded = new ArrayList<>();
        for (DomainEvent event : events) {
            if (event == null) {
                throw new IllegalArgumentException("events cannot contain null");
            }
            if (event instanceof CombinedDomainEvent combined) {
                List<AtomicDomainEvent> members = combined.events();
                if (members == null || members.stream().anyMatch(Objects::isNull)) {
                    throw new IllegalArgumentException(
                        "combined event " + combined.eventName() + " returned null events"
                    );
                }
                expanded.addAll(members);
            } else {
                expanded.add((AtomicDomainEvent) event);
            }
        }
        return expanded;
    }

    /**
     * 이벤트와 구독자로부터 실행 단위 생성.
     *
     * @param events publish된 이벤트
     * @param subscribers 등록된 구독자 (등록 순)
     * @return 실행 단위, 펼친 원자 이벤트가 없으면 empty
     * @throws IllegalStateException 구독자가 Optional 대신 null을 반환한 경우
     */
    public Optional<Publication> combine(List<? extends DomainEvent> events, List<DomainEventSubscriber> subscribers) {
        if (subscribers == null) {
            throw new IllegalArgumentException("subscribers cannot be null");
        }
        List<AtomicDomainEvent> expanded = expand(events);
        if (expanded.isEmpty()) {
            return Optional.empty();
        }

        List<DomainEventHandler> handlers = new ArrayList<>();
        for (AtomicDomainEvent event : expanded) {
            for (DomainEventSubscriber subscriber : subscribers) {
                Optional<DomainEventHandler> handler = subscriber.onEvent(event);
                if (handler == null) {
                    throw new IllegalStateException(
                        "subscriber " + subscriber.getClass().getName() + " returned null for " + event.eventName()
                    );
                }
                handler.ifPresent(handlers::add);
            }
        }

        return Optional.of(new Publication(expanded, handlers, AggregateRetryPolicy.of(expanded)));
    }
}

package com.ryuqq.dispatcher.application.publisher;

import com.ryuqq.dispatcher.core.event.AtomicDomainEvent;
import com.ryuqq.dispatcher.core.handler.DomainEventHandler;
import com.ryuqq.dispatcher.core.retry.AggregateRetryPolicy;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 한 번의 publish 호출이 실행할 단위.
 *
 * @param events 펼쳐진 원자 이벤트 (1개 이상)
 * @param handlers 구독자가 반환한 핸들러 (이벤트 순, 이벤트 안에서는 구독자 등록 순)
 * @param retryPolicy 모든 원자 이벤트의 결합 재시도 정책
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public record Publication(
    List<AtomicDomainEvent> events,
    List<DomainEventHandler> handlers,
    AggregateRetryPolicy retryPolicy
) {

    public Publication {
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("events cannot be null or empty");
        }
        if (handlers == null) {
            throw new IllegalArgumentException("handlers cannot be null");
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        events = List.copyOf(events);
        handlers = List.copyOf(handlers);
    }

    /**
     * @return 로그용 이벤트 이름 목록 (예: "OrderPlaced,StockReserved")
     */
    public String eventNames() {
        return events.stream().map(AtomicDomainEvent::eventName).collect(Collectors.joining(","));
    }
}

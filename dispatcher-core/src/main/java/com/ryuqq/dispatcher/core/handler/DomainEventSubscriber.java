package com.ryuqq.dispatcher.core.handler;

import com.ryuqq.dispatcher.core.event.AtomicDomainEvent;

import java.util.Optional;

/**
 * 이벤트 구독자.
 *
 * <p>publish된 원자 이벤트마다 호출되며, 관심 있는 이벤트에 대해서만 핸들러를 생성합니다.
 * 묶음 이벤트는 펼쳐진 뒤 전달되므로 구독자는 원자 이벤트만 받습니다.</p>
 *
 * <pre>{@code
 * publisher.addSubscriber(event ->
 *     event instanceof OrderPlaced placed
 *         ? Optional.of(new ReserveStockHandler(placed))
 *         : Optional.empty());
 * }</pre>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface DomainEventSubscriber {

    /**
     * @param event 원자 이벤트
     * @return 처리할 핸들러, 관심 없는 이벤트면 empty
     */
    Optional<DomainEventHandler> onEvent(AtomicDomainEvent event);
}

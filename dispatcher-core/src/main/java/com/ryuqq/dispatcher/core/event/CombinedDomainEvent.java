package com.ryuqq.dispatcher.core.event;

import java.util.List;
import java.util.Objects;

/**
 * 여러 원자 이벤트를 하나로 묶은 이벤트.
 *
 * <p>publish 시 한 단계만 펼쳐집니다. 묶음 안의 이벤트는 원자 이벤트만 허용되므로
 * 중첩 묶음은 타입 수준에서 불가능합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public non-sealed interface CombinedDomainEvent extends DomainEvent {

    /**
     * 묶인 원자 이벤트 (순서 유지).
     *
     * @return 원자 이벤트 목록, 비어 있을 수 있음
     */
    List<AtomicDomainEvent> events();

    /**
     * 원자 이벤트 목록으로 묶음 이벤트 생성.
     *
     * @param eventName 이벤트 이름
     * @param events 묶을 이벤트
     * @return CombinedDomainEvent
     * @throws IllegalArgumentException 인자가 null이거나 null 원소를 포함하는 경우
     */
    static CombinedDomainEvent of(String eventName, List<? extends AtomicDomainEvent> events) {
        if (eventName == null || eventName.isBlank()) {
            throw new IllegalArgumentException("eventName cannot be null or blank");
        }
        if (events == null || events.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("events cannot be null or contain null");
        }
        List<AtomicDomainEvent> copy = List.copyOf(events);
        return new CombinedDomainEvent() {
            @Override
            public List<AtomicDomainEvent> events() {
                return copy;
            }

            @Override
            public String eventName() {
                return eventName;
            }
        };
    }
}

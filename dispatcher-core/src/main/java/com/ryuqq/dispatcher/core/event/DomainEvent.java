package com.ryuqq.dispatcher.core.event;

/**
 * 도메인 이벤트.
 *
 * <p>DomainEvent는 두 가지 형태 중 하나입니다:</p>
 * <ul>
 *   <li>{@link AtomicDomainEvent}: 구독자에게 전달되고 자신의 재시도 정책을 가지는 단일 이벤트</li>
 *   <li>{@link CombinedDomainEvent}: 여러 원자 이벤트의 묶음. publish 시 펼쳐지며 핸들러에 직접 전달되지 않음</li>
 * </ul>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public sealed interface DomainEvent permits AtomicDomainEvent, CombinedDomainEvent {

    /**
     * 이벤트 이름 (로깅/진단용).
     *
     * @return 기본값은 구현 클래스의 simple name
     */
    default String eventName() {
        return getClass().getSimpleName();
    }
}

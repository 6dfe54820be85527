package com.ryuqq.dispatcher.core.event;

import com.ryuqq.dispatcher.core.retry.RetryPolicy;

/**
 * 단일 도메인 이벤트.
 *
 * <p>구독자에게 전달되는 유일한 이벤트 형태이며, 처리 실패 시 적용할
 * 재시도 정책을 스스로 정의합니다. 대부분의 이벤트는 {@link AbstractDomainEvent}를 상속합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public non-sealed interface AtomicDomainEvent extends DomainEvent, RetryPolicy {
}

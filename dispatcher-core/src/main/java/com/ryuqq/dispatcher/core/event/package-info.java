/**
 * 도메인 이벤트 모델.
 *
 * <p>원자 이벤트({@link com.ryuqq.dispatcher.core.event.AtomicDomainEvent})와
 * 묶음 이벤트({@link com.ryuqq.dispatcher.core.event.CombinedDomainEvent})로 구성됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.core.event;

/**
 * 이벤트 발행자와 이벤트 결합.
 *
 * <ul>
 *   <li>{@link com.ryuqq.dispatcher.application.publisher.DomainEventPublisher}: 발행 API</li>
 *   <li>{@link com.ryuqq.dispatcher.application.publisher.DefaultDomainEventPublisher}: 재시도/롤백/성공 알림을 포함한 기본 구현</li>
 *   <li>{@link com.ryuqq.dispatcher.application.publisher.EventCombinator}: 묶음 이벤트 펼치기, 핸들러 수집, 결합 재시도 정책</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.application.publisher;

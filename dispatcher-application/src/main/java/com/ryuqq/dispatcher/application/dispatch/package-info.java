/**
 * 실행 모드 선택과 모드별 실행 전략.
 *
 * <p>{@link com.ryuqq.dispatcher.application.dispatch.DispatchMode#select(java.util.Collection)}가
 * 핸들러 집합에서 모드를 고르고, 해당 {@link com.ryuqq.dispatcher.application.dispatch.DispatchStrategy}가
 * 한 번의 시도를 실행합니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.application.dispatch;

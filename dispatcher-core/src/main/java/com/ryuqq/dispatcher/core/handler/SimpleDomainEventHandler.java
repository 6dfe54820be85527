package com.ryuqq.dispatcher.core.handler;

/**
 * 저장소를 사용하지 않는 핸들러 (예: 메일 발송, 외부 API 호출).
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public non-sealed interface SimpleDomainEventHandler extends DomainEventHandler {

    /**
     * 이벤트 처리. 재시도로 여러 번 호출될 수 있습니다.
     *
     * @throws Exception 처리 실패
     */
    void handleEvent() throws Exception;
}

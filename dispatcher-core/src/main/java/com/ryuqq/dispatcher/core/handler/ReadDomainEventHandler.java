package com.ryuqq.dispatcher.core.handler;

import com.ryuqq.dispatcher.core.context.ReadContext;

/**
 * 저장소를 읽기만 하는 핸들러.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public non-sealed interface ReadDomainEventHandler extends DomainEventHandler {

    /**
     * 필요한 값을 읽어 핸들러에 보관. 재시도로 여러 번 호출될 수 있습니다.
     *
     * @param context 읽기 뷰 (트랜잭션 모드에서는 트랜잭션 읽기)
     * @throws Exception 읽기 실패
     */
    void prepareHandleEvent(ReadContext context) throws Exception;

    void handleEvent() throws Exception;
}

package com.ryuqq.dispatcher.core.handler;

import com.ryuqq.dispatcher.core.context.WriteContext;

/**
 * 저장소에 쓰기만 하는 핸들러. 트랜잭션 없이 원자적 배치로 처리됩니다.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public non-sealed interface BatchDomainEventHandler extends DomainEventHandler {

    /**
     * 쓰기 적재. 재시도로 여러 번 호출될 수 있습니다.
     *
     * @param context 쓰기 뷰
     * @throws Exception 처리 실패
     */
    void handleEvent(WriteContext context) throws Exception;
}

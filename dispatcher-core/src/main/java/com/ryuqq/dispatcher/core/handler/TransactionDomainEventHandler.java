package com.ryuqq.dispatcher.core.handler;

import com.ryuqq.dispatcher.core.context.ReadContext;
import com.ryuqq.dispatcher.core.context.WriteContext;

/**
 * 트랜잭션이 필요한 핸들러.
 *
 * <p>prepareHandleEvent에서 읽은 값과 handleEvent에서 쓴 값이 같은 트랜잭션에 속합니다.
 * 모든 핸들러의 준비 단계가 실행 단계보다 먼저 실행되므로 트랜잭션의
 * "읽기 후 쓰기" 규칙이 지켜집니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public non-sealed interface TransactionDomainEventHandler extends DomainEventHandler {

    void prepareHandleEvent(ReadContext context) throws Exception;

    void handleEvent(WriteContext context) throws Exception;
}

package com.ryuqq.dispatcher.application.dispatch;

import com.ryuqq.dispatcher.application.context.TransactionReadContext;
import com.ryuqq.dispatcher.application.context.TransactionWriteContext;
import com.ryuqq.dispatcher.core.context.ReadContext;
import com.ryuqq.dispatcher.core.context.WriteContext;
import com.ryuqq.dispatcher.core.handler.DomainEventHandler;
import com.ryuqq.dispatcher.core.spi.DocumentStore;

import java.util.List;

/**
 * 트랜잭션 핸들러가 하나라도 있을 때의 실행 전략.
 *
 * <p>하나의 트랜잭션 콜백 안에서:</p>
 * <ol>
 *   <li>READ/TRANSACTION 핸들러 prepareHandleEvent (트랜잭션 읽기)</li>
 *   <li>TRANSACTION/BATCH 핸들러는 handleEvent(writeContext), 나머지는 handleEvent()</li>
 * </ol>
 *
 * <p>모든 읽기가 첫 쓰기보다 먼저 일어나므로 저장소의 "읽기 후 쓰기" 규칙이 지켜집니다.
 * 저장소는 쓰기 충돌 시 콜백 전체를 다시 실행할 수 있으며, 이는 publisher의 재시도와 별개입니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class TransactionDispatchStrategy implements DispatchStrategy {

    private final DocumentStore store;

    public TransactionDispatchStrategy(DocumentStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    @Override
    public DispatchMode mode() {
        return DispatchMode.TRANSACTIONAL;
    }

    @Override
    public void dispatch(List<DomainEventHandler> handlers) throws Exception {
        HandlerInvoker.requireSupported(mode(), handlers);

        store.runTransaction(transaction -> {
            ReadContext readContext = new TransactionReadContext(transaction);
            for (DomainEventHandler handler : handlers) {
                HandlerInvoker.prepare(handler, readContext);
            }

            WriteContext writeContext = new TransactionWriteContext(transaction);
            for (DomainEventHandler handler : handlers) {
                HandlerInvoker.handle(handler, writeContext);
            }
            return null;
        });
    }
}

package com.ryuqq.dispatcher.application.dispatch;

import com.ryuqq.dispatcher.application.context.BatchWriteContext;
import com.ryuqq.dispatcher.application.context.DirectReadContext;
import com.ryuqq.dispatcher.core.context.ReadContext;
import com.ryuqq.dispatcher.core.context.WriteContext;
import com.ryuqq.dispatcher.core.handler.DomainEventHandler;
import com.ryuqq.dispatcher.core.spi.DocumentStore;
import com.ryuqq.dispatcher.core.spi.DocumentWriteBatch;

import java.util.List;

/**
 * 쓰기 배치 핸들러가 있고 트랜잭션 핸들러가 없을 때의 실행 전략.
 *
 * <p><strong>실행 순서:</strong></p>
 * <ol>
 *   <li>READ 핸들러 prepareHandleEvent (저장소 직접 읽기, 배치와의 일관성 보장 없음)</li>
 *   <li>시도마다 새 배치 생성</li>
 *   <li>BATCH 핸들러는 handleEvent(writeContext), 나머지는 handleEvent()</li>
 *   <li>모든 핸들러 실행 후 배치 한 번 커밋</li>
 * </ol>
 *
 * <p>커밋 전에 실패하면 배치는 버려지므로 아무것도 저장되지 않습니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class BatchDispatchStrategy implements DispatchStrategy {

    private final DocumentStore store;

    public BatchDispatchStrategy(DocumentStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    @Override
    public DispatchMode mode() {
        return DispatchMode.BATCHED;
    }

    @Override
    public void dispatch(List<DomainEventHandler> handlers) throws Exception {
        HandlerInvoker.requireSupported(mode(), handlers);

        ReadContext readContext = new DirectReadContext(store);
        for (DomainEventHandler handler : handlers) {
            HandlerInvoker.prepare(handler, readContext);
        }

        DocumentWriteBatch batch = store.batch();
        WriteContext writeContext = new BatchWriteContext(batch);
        for (DomainEventHandler handler : handlers) {
            HandlerInvoker.handle(handler, writeContext);
        }

        batch.commit();
    }
}

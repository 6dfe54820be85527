package com.ryuqq.dispatcher.application.dispatch;

import com.ryuqq.dispatcher.application.context.DirectReadContext;
import com.ryuqq.dispatcher.core.context.ReadContext;
import com.ryuqq.dispatcher.core.handler.DomainEventHandler;
import com.ryuqq.dispatcher.core.spi.DocumentStore;

import java.util.List;

/**
 * 읽기 핸들러가 있고 쓰기 핸들러가 없을 때의 실행 전략.
 *
 * <p><strong>실행 순서:</strong></p>
 * <ol>
 *   <li>READ 핸들러 prepareHandleEvent (저장소 직접 읽기)</li>
 *   <li>모든 핸들러 handleEvent (등록 순서)</li>
 * </ol>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class ReadOnlyDispatchStrategy implements DispatchStrategy {

    private final DocumentStore store;

    public ReadOnlyDispatchStrategy(DocumentStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    @Override
    public DispatchMode mode() {
        return DispatchMode.READ_ONLY;
    }

    @Override
    public void dispatch(List<DomainEventHandler> handlers) throws Exception {
        HandlerInvoker.requireSupported(mode(), handlers);

        ReadContext readContext = new DirectReadContext(store);
        for (DomainEventHandler handler : handlers) {
            HandlerInvoker.prepare(handler, readContext);
        }
        for (DomainEventHandler handler : handlers) {
            HandlerInvoker.handle(handler, null);
        }
    }
}

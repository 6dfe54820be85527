package com.ryuqq.dispatcher.application.dispatch;

import com.ryuqq.dispatcher.core.context.ReadContext;
import com.ryuqq.dispatcher.core.context.WriteContext;
import com.ryuqq.dispatcher.core.handler.BatchDomainEventHandler;
import com.ryuqq.dispatcher.core.handler.DomainEventHandler;
import com.ryuqq.dispatcher.core.handler.HandlerKind;
import com.ryuqq.dispatcher.core.handler.ReadDomainEventHandler;
import com.ryuqq.dispatcher.core.handler.SimpleDomainEventHandler;
import com.ryuqq.dispatcher.core.handler.TransactionDomainEventHandler;

import java.util.List;

/**
 * 핸들러 형태별 준비/실행 호출.
 */
final class HandlerInvoker {

    private HandlerInvoker() {
    }

    static void requireSupported(DispatchMode mode, List<DomainEventHandler> handlers) {
        if (handlers == null) {
            throw new IllegalArgumentException("handlers cannot be null");
        }
        for (DomainEventHandler handler : handlers) {
            HandlerKind kind = HandlerKind.of(handler);
            if (!mode.supports(kind)) {
                throw new IllegalArgumentException(
                    "Dispatch mode " + mode + " cannot run " + kind + " handler " + handler.getClass().getName()
                );
            }
        }
    }

    /**
     * 준비 단계가 있는 핸들러만 prepareHandleEvent 호출.
     */
    static void prepare(DomainEventHandler handler, ReadContext context) throws Exception {
        switch (HandlerKind.of(handler)) {
            case READ -> ((ReadDomainEventHandler) handler).prepareHandleEvent(context);
            case TRANSACTION -> ((TransactionDomainEventHandler) handler).prepareHandleEvent(context);
            case SIMPLE, BATCH -> {
            }
        }
    }

    /**
     * 형태에 맞는 handleEvent 호출. 쓰기 형태는 writeContext가 필요합니다.
     */
    static void handle(DomainEventHandler handler, WriteContext writeContext) throws Exception {
        switch (HandlerKind.of(handler)) {
            case SIMPLE -> ((SimpleDomainEventHandler) handler).handleEvent();
            case READ -> ((ReadDomainEventHandler) handler).handleEvent();
            case BATCH -> ((BatchDomainEventHandler) handler).handleEvent(requireWriteContext(writeContext));
            case TRANSACTION -> ((TransactionDomainEventHandler) handler).handleEvent(requireWriteContext(writeContext));
        }
    }

    private static WriteContext requireWriteContext(WriteContext writeContext) {
        if (writeContext == null) {
            throw new IllegalStateException("Write handler invoked without a write context");
        }
        return writeContext;
    }
}

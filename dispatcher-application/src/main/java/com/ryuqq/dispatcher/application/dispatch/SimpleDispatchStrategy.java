package com.ryuqq.dispatcher.application.dispatch;

import com.ryuqq.dispatcher.core.handler.DomainEventHandler;

import java.util.List;

/**
 * 저장소를 사용하지 않는 핸들러만 있을 때의 실행 전략.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class SimpleDispatchStrategy implements DispatchStrategy {

    @Override
    public DispatchMode mode() {
        return DispatchMode.SIMPLE;
    }

    @Override
    public void dispatch(List<DomainEventHandler> handlers) throws Exception {
        HandlerInvoker.requireSupported(mode(), handlers);
        for (DomainEventHandler handler : handlers) {
            HandlerInvoker.handle(handler, null);
        }
    }
}

package com.ryuqq.dispatcher.application.dispatch;

import com.ryuqq.dispatcher.core.spi.DocumentStore;

import java.util.EnumMap;
import java.util.Map;

/**
 * 모드별 실행 전략 레지스트리.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class DispatchStrategies {

    private final Map<DispatchMode, DispatchStrategy> strategies;

    private DispatchStrategies(Map<DispatchMode, DispatchStrategy> strategies) {
        this.strategies = strategies;
    }

    /**
     * 주어진 저장소에 대한 네 가지 기본 전략 생성.
     *
     * @param store 문서 저장소
     * @return DispatchStrategies
     */
    public static DispatchStrategies create(DocumentStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        Map<DispatchMode, DispatchStrategy> strategies = new EnumMap<>(DispatchMode.class);
        register(strategies, new SimpleDispatchStrategy());
        register(strategies, new ReadOnlyDispatchStrategy(store));
        register(strategies, new BatchDispatchStrategy(store));
        register(strategies, new TransactionDispatchStrategy(store));
        return new DispatchStrategies(strategies);
    }

    private static void register(Map<DispatchMode, DispatchStrategy> strategies, DispatchStrategy strategy) {
        strategies.put(strategy.mode(), strategy);
    }

    /**
     * @param mode 실행 모드
     * @return 해당 모드의 전략
     */
    public DispatchStrategy forMode(DispatchMode mode) {
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        return strategies.get(mode);
    }
}

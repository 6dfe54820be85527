package com.ryuqq.dispatcher.application.dispatch;

import com.ryuqq.dispatcher.core.handler.DomainEventHandler;
import com.ryuqq.dispatcher.core.handler.HandlerKind;

import java.util.Collection;

/**
 * 한 번의 publish에 적용되는 실행 모드.
 *
 * <p>선언 순서가 우선순위입니다. 핸들러 집합에서 가장 높은 요구 모드가 전체 모드가 되며,
 * 하위 형태의 핸들러는 상위 모드 안에서 함께 실행됩니다.</p>
 *
 * <p><strong>선택 규칙:</strong></p>
 * <pre>
 * TRANSACTION 핸들러 존재 → TRANSACTIONAL
 * BATCH 핸들러 존재       → BATCHED
 * READ 핸들러 존재        → READ_ONLY
 * 그 외                   → SIMPLE
 * </pre>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public enum DispatchMode {

    SIMPLE,
    READ_ONLY,
    BATCHED,
    TRANSACTIONAL;

    /**
     * 핸들러 형태가 요구하는 최소 모드.
     *
     * @param kind 핸들러 형태
     * @return 최소 모드
     */
    public static DispatchMode requiredFor(HandlerKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        return switch (kind) {
            case SIMPLE -> SIMPLE;
            case READ -> READ_ONLY;
            case BATCH -> BATCHED;
            case TRANSACTION -> TRANSACTIONAL;
        };
    }

    /**
     * 핸들러 집합에 대한 실행 모드 선택.
     *
     * @param handlers 핸들러 집합 (비어 있으면 SIMPLE)
     * @return 선택된 모드
     * @throws IllegalArgumentException handlers가 null이거나 형태를 판별할 수 없는 핸들러를 포함하는 경우
     */
    public static DispatchMode select(Collection<? extends DomainEventHandler> handlers) {
        if (handlers == null) {
            throw new IllegalArgumentException("handlers cannot be null");
        }
        DispatchMode selected = SIMPLE;
        for (DomainEventHandler handler : handlers) {
            DispatchMode required = requiredFor(HandlerKind.of(handler));
            if (required.compareTo(selected) > 0) {
                selected = required;
            }
        }
        return selected;
    }

    /**
     * 이 모드에서 실행 가능한 핸들러 형태인지 확인.
     *
     * @param kind 핸들러 형태
     * @return 실행 가능하면 true
     */
    public boolean supports(HandlerKind kind) {
        return requiredFor(kind).compareTo(this) <= 0;
    }
}

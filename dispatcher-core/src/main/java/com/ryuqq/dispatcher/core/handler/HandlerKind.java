package com.ryuqq.dispatcher.core.handler;

/**
 * 핸들러 형태.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public enum HandlerKind {

    SIMPLE,
    READ,
    BATCH,
    TRANSACTION;

    /**
     * 핸들러의 형태 판별.
     *
     * @param handler 핸들러
     * @return 핸들러가 구현한 형태
     * @throws IllegalArgumentException handler가 null이거나 두 가지 이상의 형태를 구현한 경우
     */
    public static HandlerKind of(DomainEventHandler handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }

        HandlerKind kind = null;
        int matches = 0;
        if (handler instanceof SimpleDomainEventHandler) {
            kind = SIMPLE;
            matches++;
        }
        if (handler instanceof ReadDomainEventHandler) {
            kind = READ;
            matches++;
        }
        if (handler instanceof BatchDomainEventHandler) {
            kind = BATCH;
            matches++;
        }
        if (handler instanceof TransactionDomainEventHandler) {
            kind = TRANSACTION;
            matches++;
        }

        if (matches != 1) {
            throw new IllegalArgumentException(
                "handler must implement exactly one handler variant (current: " + handler.getClass().getName() + ")"
            );
        }
        return kind;
    }

    /**
     * @return 준비 단계(prepareHandleEvent)가 있는 형태면 true
     */
    public boolean hasPreparePhase() {
        return this == READ || this == TRANSACTION;
    }

    /**
     * @return 실행 단계에서 WriteContext를 받는 형태면 true
     */
    public boolean writes() {
        return this == BATCH || this == TRANSACTION;
    }
}

package com.ryuqq.dispatcher.core.error;

/**
 * 핸들러가 던진 checked 예외를 publish 호출자에게 전달하기 위한 래퍼.
 *
 * <p>unchecked 예외는 래핑 없이 그대로 전달되며, 이 예외의 cause는 항상 핸들러의 원본 오류입니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class DomainEventDispatchException extends RuntimeException {

    public DomainEventDispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}

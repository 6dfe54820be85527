package com.ryuqq.dispatcher.core.error;

/**
 * 재시도 가능 여부를 명시적으로 지정하는 예외.
 *
 * <p>핸들러가 외부 시스템 실패 등을 재시도 대상(또는 명시적 비대상)으로
 * 표시할 때 사용합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class RetryableException extends RuntimeException implements RetryableError {

    private final boolean retryable;

    public RetryableException(String message) {
        this(message, true, null);
    }

    public RetryableException(String message, Throwable cause) {
        this(message, true, cause);
    }

    public RetryableException(String message, boolean retryable) {
        this(message, retryable, null);
    }

    public RetryableException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    @Override
    public boolean isRetryable() {
        return retryable;
    }
}

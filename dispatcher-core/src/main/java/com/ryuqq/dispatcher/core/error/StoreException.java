package com.ryuqq.dispatcher.core.error;

/**
 * 문서 저장소 작업 실패.
 *
 * <p>모든 저장소 어댑터는 읽기/쓰기/커밋 실패를 이 예외와 {@link StoreErrorCode}로 보고합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class StoreException extends RuntimeException {

    private final StoreErrorCode code;

    public StoreException(StoreErrorCode code, String message) {
        this(code, message, null);
    }

    public StoreException(StoreErrorCode code, String message, Throwable cause) {
        super(message, cause);
        if (code == null) {
            throw new IllegalArgumentException("code cannot be null");
        }
        this.code = code;
    }

    public StoreErrorCode getCode() {
        return code;
    }

    @Override
    public String getMessage() {
        return code + ": " + super.getMessage();
    }
}

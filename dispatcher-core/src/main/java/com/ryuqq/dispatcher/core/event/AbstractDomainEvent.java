package com.ryuqq.dispatcher.core.event;

import com.ryuqq.dispatcher.core.error.RetryableError;
import com.ryuqq.dispatcher.core.error.StoreException;
import com.ryuqq.dispatcher.core.retry.RetrySettings;

/**
 * 기본 재시도 설정과 기본 오류 분류를 제공하는 원자 이벤트 기반 클래스.
 *
 * <p><strong>기본 재시도 설정:</strong> retryMax=50, factor=50ms, max=1000ms
 * ({@link RetrySettings#RetrySettings()})</p>
 *
 * <p><strong>기본 오류 분류 ({@link #isRetryableError(Throwable)}):</strong></p>
 * <ol>
 *   <li>{@link RetryableError}를 구현한 오류: 자신의 {@code isRetryable()} 결과</li>
 *   <li>{@link StoreException}: 오류 코드가 일시적({@code isTransient()})이면 true</li>
 *   <li>그 외: false</li>
 * </ol>
 *
 * <p>하위 클래스는 분류 규칙을 재정의할 수 있습니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public abstract class AbstractDomainEvent implements AtomicDomainEvent {

    private final RetrySettings retrySettings;

    protected AbstractDomainEvent() {
        this(new RetrySettings());
    }

    protected AbstractDomainEvent(RetrySettings retrySettings) {
        if (retrySettings == null) {
            throw new IllegalArgumentException("retrySettings cannot be null");
        }
        this.retrySettings = retrySettings;
    }

    protected AbstractDomainEvent(int retryMax, long retryIntervalExtendFactorMillis, long retryIntervalMaxMillis) {
        this(new RetrySettings(retryMax, retryIntervalExtendFactorMillis, retryIntervalMaxMillis));
    }

    public RetrySettings getRetrySettings() {
        return retrySettings;
    }

    @Override
    public int retryMax() {
        return retrySettings.retryMax();
    }

    @Override
    public long retryIntervalExtendFactorMillis() {
        return retrySettings.retryIntervalExtendFactorMillis();
    }

    @Override
    public long retryIntervalMaxMillis() {
        return retrySettings.retryIntervalMaxMillis();
    }

    @Override
    public boolean isRetryableError(Throwable error) {
        if (error instanceof RetryableError retryableError) {
            return retryableError.isRetryable();
        }
        if (error instanceof StoreException storeException) {
            return storeException.getCode().isTransient();
        }
        return false;
    }

    @Override
    public String toString() {
        return eventName() + "{" + retrySettings + '}';
    }
}

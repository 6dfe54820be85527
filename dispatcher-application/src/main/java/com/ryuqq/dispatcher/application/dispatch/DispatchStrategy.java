package com.ryuqq.dispatcher.application.dispatch;

import com.ryuqq.dispatcher.core.handler.DomainEventHandler;

import java.util.List;

/**
 * 핸들러 집합을 한 번 실행하는 전략 (한 번의 시도).
 *
 * <p>전략은 오류를 처리하지 않고 그대로 던집니다. 재시도와 롤백은 publisher의
 * 공통 오류 처리 경로가 담당합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public interface DispatchStrategy {

    /**
     * @return 이 전략이 구현하는 모드
     */
    DispatchMode mode();

    /**
     * 핸들러를 등록 순서대로 한 번 실행.
     *
     * @param handlers 실행할 핸들러 (모두 {@link #mode()}가 지원하는 형태)
     * @throws Exception 핸들러 또는 저장소 오류 (원본 그대로)
     * @throws IllegalArgumentException 이 모드가 지원하지 않는 형태의 핸들러가 포함된 경우
     */
    void dispatch(List<DomainEventHandler> handlers) throws Exception;
}

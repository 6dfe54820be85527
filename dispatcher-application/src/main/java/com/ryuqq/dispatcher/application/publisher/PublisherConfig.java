package com.ryuqq.dispatcher.application.publisher;

/**
 * DomainEventPublisher 설정.
 *
 * <p><strong>propagateRecoveredErrors:</strong></p>
 * <ul>
 *   <li>false (기본값): 재시도 끝에 성공하면 publish는 정상 반환하고 onSuccess가 호출됩니다</li>
 *   <li>true: 재시도가 성공해도 재시도를 유발한 오류를 다시 던집니다.
 *       이 경우 rollback과 onSuccess 모두 호출되지 않습니다</li>
 * </ul>
 *
 * @param propagateRecoveredErrors 회복된 오류를 호출자에게 전파할지 여부
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public record PublisherConfig(boolean propagateRecoveredErrors) {

    /**
     * 기본 설정으로 생성 (propagateRecoveredErrors=false).
     */
    public PublisherConfig() {
        this(false);
    }

    public PublisherConfig withPropagateRecoveredErrors(boolean propagateRecoveredErrors) {
        return new PublisherConfig(propagateRecoveredErrors);
    }
}

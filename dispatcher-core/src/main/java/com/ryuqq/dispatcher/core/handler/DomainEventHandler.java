package com.ryuqq.dispatcher.core.handler;

/**
 * 이벤트 처리기.
 *
 * <p>구독자가 이벤트마다 생성하므로 상태를 가져도 됩니다. 준비 단계에서 읽은 값을
 * 필드에 보관한 뒤 실행 단계에서 사용하는 방식이 일반적입니다.</p>
 *
 * <p>핸들러는 정확히 한 가지 형태를 구현합니다:</p>
 * <ul>
 *   <li>{@link SimpleDomainEventHandler}: 저장소를 사용하지 않음</li>
 *   <li>{@link ReadDomainEventHandler}: 읽기만 함</li>
 *   <li>{@link BatchDomainEventHandler}: 쓰기만 함</li>
 *   <li>{@link TransactionDomainEventHandler}: 읽고 쓰며 트랜잭션이 필요함</li>
 * </ul>
 *
 * <p><strong>주의:</strong> 준비/실행 메서드는 재시도로 인해 여러 번 호출될 수 있습니다.
 * {@link #onSuccess()}와 {@link #rollback()}에서 던진 예외는 롤백되지 않고 호출자에게 전파됩니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public sealed interface DomainEventHandler
    permits SimpleDomainEventHandler, ReadDomainEventHandler, BatchDomainEventHandler, TransactionDomainEventHandler {

    /**
     * 이번 publish의 모든 핸들러가 성공한 뒤 한 번 호출.
     *
     * @throws Exception 성공 후처리 실패
     */
    default void onSuccess() throws Exception {
    }

    /**
     * 재시도를 포기했을 때 한 번 호출. 저장소 외 부수효과를 되돌릴 때 재정의합니다.
     *
     * @throws Exception 롤백 실패
     */
    default void rollback() throws Exception {
    }
}

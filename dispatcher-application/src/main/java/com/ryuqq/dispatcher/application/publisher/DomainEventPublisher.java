package com.ryuqq.dispatcher.application.publisher;

import com.ryuqq.dispatcher.core.event.DomainEvent;
import com.ryuqq.dispatcher.core.handler.DomainEventSubscriber;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 도메인 이벤트 발행자.
 *
 * <p>구독자를 보관하고, publish된 이벤트에 대해 구독자가 만든 핸들러를
 * 알맞은 일관성 범위(단순 호출, 읽기, 배치, 트랜잭션)에서 실행합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * DomainEventPublisher publisher = new DefaultDomainEventPublisher(store);
 * publisher.addSubscriber(new StockSubscriber());
 * publisher.addSubscriber(new MailSubscriber());
 *
 * publisher.publish(new OrderPlaced(orderId));
 * </pre>
 *
 * <p><strong>결과:</strong></p>
 * <ul>
 *   <li>정상 반환: 모든 핸들러가 성공했고 모든 onSuccess가 호출됨</li>
 *   <li>예외: 재시도 불가 오류 또는 재시도 소진. 모든 핸들러의 rollback이 호출된 뒤
 *       마지막 시도의 오류가 전파됨 (checked 예외는 DomainEventDispatchException으로 래핑)</li>
 * </ul>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public interface DomainEventPublisher {

    /**
     * 구독자 등록 (추가만 가능, 제거 불가).
     *
     * @param subscriber 구독자
     * @throws IllegalArgumentException subscriber가 null인 경우
     */
    void addSubscriber(DomainEventSubscriber subscriber);

    /**
     * @return 등록 순서의 구독자 목록 (수정 불가)
     */
    List<DomainEventSubscriber> getSubscribers();

    /**
     * 이벤트 발행. 호출 스레드에서 동기로 실행됩니다.
     *
     * @param events 발행할 이벤트 (비어 있으면 아무것도 하지 않음)
     */
    void publish(DomainEvent... events);

    void publish(List<? extends DomainEvent> events);

    /**
     * 주어진 Executor에서 이벤트 발행.
     *
     * @param executor 실행할 Executor
     * @param events 발행할 이벤트
     * @return publish와 같은 성공/실패 계약으로 완료되는 Future
     */
    CompletableFuture<Void> publishAsync(Executor executor, DomainEvent... events);
}

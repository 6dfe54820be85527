package com.ryuqq.dispatcher.adapter.inmemory.store;

/**
 * InMemoryDocumentStore 설정.
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>maxTransactionAttempts: 5 (커밋 충돌 시 트랜잭션 콜백을 다시 실행하는 최대 횟수, 최초 실행 포함)</li>
 * </ul>
 *
 * @param maxTransactionAttempts 트랜잭션 최대 실행 횟수 (1 이상)
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public record InMemoryStoreConfig(int maxTransactionAttempts) {

    public static final int DEFAULT_MAX_TRANSACTION_ATTEMPTS = 5;

    public InMemoryStoreConfig {
        if (maxTransactionAttempts < 1) {
            throw new IllegalArgumentException(
                "maxTransactionAttempts must be positive (current: " + maxTransactionAttempts + ")"
            );
        }
    }

    /**
     * 기본 설정으로 생성.
     */
    public InMemoryStoreConfig() {
        this(DEFAULT_MAX_TRANSACTION_ATTEMPTS);
    }

    public InMemoryStoreConfig withMaxTransactionAttempts(int maxTransactionAttempts) {
        return new InMemoryStoreConfig(maxTransactionAttempts);
    }
}

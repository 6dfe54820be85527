package com.ryuqq.dispatcher.adapter.inmemory.store;

import com.ryuqq.dispatcher.core.error.StoreErrorCode;
import com.ryuqq.dispatcher.core.error.StoreException;
import com.ryuqq.dispatcher.core.model.CollectionReference;
import com.ryuqq.dispatcher.core.model.DocumentReference;
import com.ryuqq.dispatcher.core.model.DocumentSnapshot;
import com.ryuqq.dispatcher.core.model.Precondition;
import com.ryuqq.dispatcher.core.model.Query;
import com.ryuqq.dispatcher.core.model.SetOptions;
import com.ryuqq.dispatcher.core.spi.DocumentTransaction;
import com.ryuqq.dispatcher.core.spi.DocumentWriteBatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryDocumentStore 고유 동작 테스트.
 *
 * <p>Contract Test 외에 어댑터 고유 동작을 검증합니다:</p>
 * <ul>
 *   <li>커밋 실패 주입</li>
 *   <li>트랜잭션 충돌 재시도 횟수 제한</li>
 *   <li>스냅샷 격리와 종료된 트랜잭션</li>
 *   <li>버전 증가</li>
 * </ul>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
class InMemoryDocumentStoreTest {

    private static final DocumentReference SF = CollectionReference.of("cities").document("SF");
    private static final DocumentReference LA = CollectionReference.of("cities").document("LA");

    private InMemoryDocumentStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
    }

    private void seed(DocumentReference reference, Map<String, Object> data) {
        DocumentWriteBatch batch = store.batch();
        batch.set(reference, data, SetOptions.OVERWRITE);
        batch.commit();
    }

    // ============================================================
    // 1. 커밋 실패 주입
    // ============================================================

    @Test
    void injectCommitFailures_지정_횟수만큼_커밋_실패_후_정상화() {
        // given
        store.injectCommitFailures(StoreErrorCode.UNAVAILABLE, 2);

        // when & then
        for (int i = 0; i < 2; i++) {
            DocumentWriteBatch batch = store.batch();
            batch.set(SF, Map.of("name", "San Francisco"), SetOptions.OVERWRITE);
            assertThatThrownBy(batch::commit)
                .isInstanceOf(StoreException.class)
                .satisfies(e -> assertThat(((StoreException) e).getCode()).isEqualTo(StoreErrorCode.UNAVAILABLE));
            assertThat(store.get(SF).exists()).isFalse();
        }

        seed(SF, Map.of("name", "San Francisco"));
        assertThat(store.get(SF).exists()).isTrue();
    }

    @Test
    void injectCommitFailures_ABORTED_트랜잭션은_콜백_재실행() throws Exception {
        // given
        store.injectCommitFailures(StoreErrorCode.ABORTED, 1);
        AtomicInteger attempts = new AtomicInteger();

        // when
        store.runTransaction(tx -> {
            attempts.incrementAndGet();
            tx.set(SF, Map.of("name", "San Francisco"), SetOptions.OVERWRITE);
            return null;
        });

        // then
        assertThat(attempts.get()).isEqualTo(2);
        assertThat(store.get(SF).exists()).isTrue();
    }

    @Test
    void injectCommitFailures_일시적_오류_트랜잭션은_재실행하지_않고_전파() {
        // given
        store.injectCommitFailures(StoreErrorCode.DEADLINE_EXCEEDED, 1);
        AtomicInteger attempts = new AtomicInteger();

        // when & then
        assertThatThrownBy(() -> store.runTransaction(tx -> {
            attempts.incrementAndGet();
            tx.set(SF, Map.of("name", "San Francisco"), SetOptions.OVERWRITE);
            return null;
        }))
            .isInstanceOf(StoreException.class)
            .satisfies(e -> assertThat(((StoreException) e).getCode()).isEqualTo(StoreErrorCode.DEADLINE_EXCEEDED));
        assertThat(attempts.get()).isEqualTo(1);
    }

    // ============================================================
    // 2. 충돌 재시도 제한
    // ============================================================

    @Test
    void runTransaction_매번_충돌하면_maxTransactionAttempts_후_ABORTED() {
        // given
        store = new InMemoryDocumentStore(new InMemoryStoreConfig().withMaxTransactionAttempts(3));
        seed(SF, Map.of("population", 1));
        AtomicInteger attempts = new AtomicInteger();

        // when & then
        assertThatThrownBy(() -> store.runTransaction(tx -> {
            int population = ((Number) tx.get(SF).get("population")).intValue();
            seed(SF, Map.of("population", population + attempts.incrementAndGet()));
            tx.update(SF, Map.of("population", 0), Precondition.NONE);
            return null;
        }))
            .isInstanceOf(StoreException.class)
            .hasMessageContaining("aborted after 3 attempts")
            .satisfies(e -> assertThat(((StoreException) e).getCode()).isEqualTo(StoreErrorCode.ABORTED));
        assertThat(attempts.get()).isEqualTo(3);
        assertThat(store.get(SF).get("population")).isNotEqualTo(0);
    }

    @Test
    void config_0회_예외() {
        assertThatThrownBy(() -> new InMemoryStoreConfig(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxTransactionAttempts must be positive");
    }

    // ============================================================
    // 3. 스냅샷 격리
    // ============================================================

    @Test
    void transaction_시작_이후_커밋은_읽기에_보이지_않음() throws Exception {
        // given
        seed(SF, Map.of("population", 1));
        AtomicReference<Object> firstRead = new AtomicReference<>();
        AtomicReference<Object> secondRead = new AtomicReference<>();
        AtomicInteger attempts = new AtomicInteger();

        // when
        store.runTransaction(tx -> {
            if (attempts.incrementAndGet() == 1) {
                seed(LA, Map.of("population", 2));
                firstRead.set(tx.get(LA).exists());
            } else {
                secondRead.set(tx.get(LA).exists());
            }
            return null;
        });

        // then
        assertThat(firstRead.get()).isEqualTo(false);
        assertThat(attempts.get()).isEqualTo(2);
        assertThat(secondRead.get()).isEqualTo(true);
    }

    @Test
    void transaction_콜백_종료_후_사용_불가() throws Exception {
        // given
        AtomicReference<DocumentTransaction> leaked = new AtomicReference<>();
        store.runTransaction(tx -> {
            leaked.set(tx);
            return null;
        });

        // when & then
        assertThatThrownBy(() -> leaked.get().get(SF))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("no longer active");
        assertThatThrownBy(() -> leaked.get().set(SF, Map.of(), SetOptions.OVERWRITE))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void transaction_query_결과_문서도_충돌_감지() throws Exception {
        // given
        seed(SF, Map.of("state", "CA"));
        AtomicInteger attempts = new AtomicInteger();

        // when
        store.runTransaction(tx -> {
            tx.query(Query.collection("cities").whereEqualTo("state", "CA"));
            if (attempts.incrementAndGet() == 1) {
                seed(SF, Map.of("state", "CA", "touched", true));
            }
            tx.set(LA, Map.of("state", "CA"), SetOptions.OVERWRITE);
            return null;
        });

        // then
        assertThat(attempts.get()).isEqualTo(2);
    }

    // ============================================================
    // 4. 버전 / 입력 격리
    // ============================================================

    @Test
    void 커밋마다_버전_증가_같은_커밋은_같은_버전() {
        // given
        DocumentWriteBatch batch = store.batch();
        batch.set(SF, Map.of("n", 1), SetOptions.OVERWRITE);
        batch.set(LA, Map.of("n", 1), SetOptions.OVERWRITE);
        batch.commit();
        long first = store.get(SF).getVersion();

        // when
        seed(SF, Map.of("n", 2));

        // then
        assertThat(store.get(LA).getVersion()).isEqualTo(first);
        assertThat(store.get(SF).getVersion()).isGreaterThan(first);
    }

    @Test
    void 적재_후_원본_맵_변경은_반영되지_않음() {
        // given
        Map<String, Object> data = new HashMap<>();
        data.put("name", "San Francisco");
        DocumentWriteBatch batch = store.batch();
        batch.set(SF, data, SetOptions.OVERWRITE);

        // when
        data.put("name", "changed");
        batch.commit();

        // then
        DocumentSnapshot snapshot = store.get(SF);
        assertThat(snapshot.get("name")).isEqualTo("San Francisco");
    }

    @Test
    void 같은_배치_내_같은_문서_쓰기는_순서대로_적용() {
        // given
        DocumentWriteBatch batch = store.batch();
        batch.create(SF, Map.of("a", 1));
        batch.update(SF, Map.of("b", 2), Precondition.NONE);
        batch.delete(LA, Precondition.NONE);

        // when
        batch.commit();

        // then
        assertThat(store.get(SF).getData()).contains(Map.of("a", 1, "b", 2));
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void clear_모든_문서_제거() {
        // given
        seed(SF, Map.of("n", 1));

        // when
        store.clear();

        // then
        assertThat(store.size()).isZero();
        assertThat(store.get(SF).exists()).isFalse();
    }
}

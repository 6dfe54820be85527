package com.ryuqq.dispatcher.adapter.inmemory.store;

import com.ryuqq.dispatcher.core.error.StoreErrorCode;
import com.ryuqq.dispatcher.core.error.StoreException;
import com.ryuqq.dispatcher.core.model.DocumentReference;
import com.ryuqq.dispatcher.core.model.DocumentSnapshot;
import com.ryuqq.dispatcher.core.model.Precondition;
import com.ryuqq.dispatcher.core.model.Query;
import com.ryuqq.dispatcher.core.model.QuerySnapshot;
import com.ryuqq.dispatcher.core.model.SetOptions;
import com.ryuqq.dispatcher.core.spi.DocumentStore;
import com.ryuqq.dispatcher.core.spi.DocumentWriteBatch;
import com.ryuqq.dispatcher.core.spi.TransactionFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory implementation of {@link DocumentStore} SPI for testing and reference purposes.
 *
 * <p>Documents live in a single map guarded by a {@link ReentrantReadWriteLock}.
 * Every commit (batch or transaction) is applied under the write lock and stamps all
 * documents it writes with the same, monotonically increasing version.</p>
 *
 * <p><strong>Commit semantics:</strong></p>
 * <ul>
 *   <li>All staged writes are validated against a working copy first; if any write fails
 *       (ALREADY_EXISTS, NOT_FOUND, FAILED_PRECONDITION) nothing is written</li>
 *   <li>Writes to the same document within one commit apply in staging order</li>
 * </ul>
 *
 * <p><strong>Transactions:</strong></p>
 * <ul>
 *   <li>Optimistic: the callback runs against a snapshot copy without holding any lock</li>
 *   <li>At commit, every document read must still have the version that was read;
 *       otherwise the commit fails with ABORTED and the callback is run again, up to
 *       {@link InMemoryStoreConfig#maxTransactionAttempts()} times</li>
 *   <li>An exception from the callback aborts the transaction and is propagated unchanged</li>
 * </ul>
 *
 * <p><strong>Test support:</strong> {@link #injectCommitFailures(StoreErrorCode, int)}
 * makes the next commits fail with the given code before anything is applied.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Flat collections only; no subcollections or nested field paths</li>
 *   <li>Data lost on process restart</li>
 * </ul>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class InMemoryDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentStore.class);

    private final InMemoryStoreConfig config;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<DocumentReference, StoredDocument> documents = new HashMap<>();

    private long versionSequence;
    private StoreErrorCode injectedFailureCode;
    private int injectedFailuresRemaining;

    public InMemoryDocumentStore() {
        this(new InMemoryStoreConfig());
    }

    public InMemoryDocumentStore(InMemoryStoreConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    @Override
    public DocumentSnapshot get(DocumentReference reference) {
        if (reference == null) {
            throw new IllegalArgumentException("reference cannot be null");
        }
        lock.readLock().lock();
        try {
            return StoredDocument.toSnapshot(reference, documents.get(reference));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<DocumentSnapshot> getAll(List<DocumentReference> references) {
        if (references == null || references.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("references cannot be null or contain null");
        }
        lock.readLock().lock();
        try {
            List<DocumentSnapshot> result = new ArrayList<>(references.size());
            for (DocumentReference reference : references) {
                result.add(StoredDocument.toSnapshot(reference, documents.get(reference)));
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public QuerySnapshot query(Query query) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        lock.readLock().lock();
        try {
            return QueryEvaluator.evaluate(query, documents);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public DocumentWriteBatch batch() {
        return new InMemoryWriteBatch(this);
    }

    @Override
    public <T> T runTransaction(TransactionFunction<T> function) throws Exception {
        if (function == null) {
            throw new IllegalArgumentException("function cannot be null");
        }

        StoreException lastConflict = null;
        for (int attempt = 1; attempt <= config.maxTransactionAttempts(); attempt++) {
            InMemoryTransaction transaction = new InMemoryTransaction(snapshot());
            T result;
            try {
                result = function.apply(transaction);
            } finally {
                transaction.close();
            }

            try {
                commit(transaction.writes(), transaction.readVersions());
                return result;
            } catch (StoreException e) {
                if (e.getCode() != StoreErrorCode.ABORTED) {
                    throw e;
                }
                lastConflict = e;
                log.debug("Transaction attempt {}/{} aborted: {}",
                    attempt, config.maxTransactionAttempts(), e.getMessage());
            }
        }

        throw new StoreException(
            StoreErrorCode.ABORTED,
            "Transaction aborted after " + config.maxTransactionAttempts() + " attempts",
            lastConflict
        );
    }

    /**
     * 다음 {@code times}번의 커밋을 지정한 코드로 실패시킵니다 (테스트용).
     *
     * @param code 실패 코드
     * @param times 실패 횟수 (0이면 해제)
     */
    public void injectCommitFailures(StoreErrorCode code, int times) {
        if (code == null) {
            throw new IllegalArgumentException("code cannot be null");
        }
        if (times < 0) {
            throw new IllegalArgumentException("times must be non-negative (current: " + times + ")");
        }
        lock.writeLock().lock();
        try {
            injectedFailureCode = code;
            injectedFailuresRemaining = times;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return 저장된 문서 수
     */
    public int size() {
        lock.readLock().lock();
        try {
            return documents.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 모든 문서와 주입된 실패를 제거합니다.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            documents.clear();
            injectedFailuresRemaining = 0;
            injectedFailureCode = null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public InMemoryStoreConfig getConfig() {
        return config;
    }

    Map<DocumentReference, StoredDocument> snapshot() {
        lock.readLock().lock();
        try {
            return new HashMap<>(documents);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 적재된 쓰기를 원자적으로 반영합니다.
     *
     * @param writes 적재 순서의 쓰기
     * @param readVersions 트랜잭션이 읽은 문서 버전 (배치는 빈 맵)
     * @throws StoreException 충돌(ABORTED), 쓰기 실패, 주입된 실패
     */
    void commit(List<WriteOperation> writes, Map<DocumentReference, Long> readVersions) {
        lock.writeLock().lock();
        try {
            failIfInjected();

            for (Map.Entry<DocumentReference, Long> read : readVersions.entrySet()) {
                long current = StoredDocument.versionOf(documents.get(read.getKey()));
                if (current != read.getValue()) {
                    throw new StoreException(
                        StoreErrorCode.ABORTED,
                        read.getKey().path() + " changed since it was read (read version: "
                            + read.getValue() + ", current: " + current + ")"
                    );
                }
            }

            if (writes.isEmpty()) {
                return;
            }

            long nextVersion = versionSequence + 1;
            Map<DocumentReference, StoredDocument> staged = new LinkedHashMap<>();
            for (WriteOperation write : writes) {
                DocumentReference reference = write.reference();
                StoredDocument current = staged.containsKey(reference) ? staged.get(reference) : documents.get(reference);
                staged.put(reference, apply(write, current, nextVersion));
            }

            versionSequence = nextVersion;
            for (Map.Entry<DocumentReference, StoredDocument> entry : staged.entrySet()) {
                if (entry.getValue() == null) {
                    documents.remove(entry.getKey());
                } else {
                    documents.put(entry.getKey(), entry.getValue());
                }
            }
            log.debug("Committed {} write(s) at version {}", writes.size(), nextVersion);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void failIfInjected() {
        if (injectedFailuresRemaining > 0) {
            injectedFailuresRemaining--;
            throw new StoreException(injectedFailureCode, "Injected commit failure");
        }
    }

    /**
     * @return 쓰기 후 문서, 삭제되면 null
     */
    private static StoredDocument apply(WriteOperation write, StoredDocument current, long version) {
        DocumentReference reference = write.reference();

        if (write instanceof WriteOperation.SetWrite set) {
            Map<String, Object> data = new LinkedHashMap<>();
            if (set.options() == SetOptions.MERGE && current != null) {
                data.putAll(current.data());
            }
            data.putAll(set.data());
            return new StoredDocument(data, version);
        }
        if (write instanceof WriteOperation.CreateWrite create) {
            if (current != null) {
                throw new StoreException(StoreErrorCode.ALREADY_EXISTS, reference.path() + " already exists");
            }
            return new StoredDocument(create.data(), version);
        }
        if (write instanceof WriteOperation.UpdateWrite update) {
            if (current == null) {
                throw new StoreException(StoreErrorCode.NOT_FOUND, reference.path() + " does not exist");
            }
            checkPrecondition(reference, update.precondition(), current);
            Map<String, Object> data = new LinkedHashMap<>(current.data());
            data.putAll(update.fields());
            return new StoredDocument(data, version);
        }
        if (write instanceof WriteOperation.DeleteWrite delete) {
            checkPrecondition(reference, delete.precondition(), current);
            return null;
        }
        throw new IllegalStateException("Unknown write operation: " + write);
    }

    private static void checkPrecondition(DocumentReference reference, Precondition precondition, StoredDocument current) {
        if (precondition.exists() != null && precondition.exists() != (current != null)) {
            throw new StoreException(
                StoreErrorCode.FAILED_PRECONDITION,
                reference.path() + " existence precondition failed (expected exists: " + precondition.exists() + ")"
            );
        }
        if (precondition.version() != null && StoredDocument.versionOf(current) != precondition.version()) {
            throw new StoreException(
                StoreErrorCode.FAILED_PRECONDITION,
                reference.path() + " version precondition failed (expected: " + precondition.version()
                    + ", current: " + StoredDocument.versionOf(current) + ")"
            );
        }
    }
}

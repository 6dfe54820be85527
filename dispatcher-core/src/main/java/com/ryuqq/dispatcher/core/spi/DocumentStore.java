package com.ryuqq.dispatcher.core.spi;

import com.ryuqq.dispatcher.core.model.DocumentReference;
import com.ryuqq.dispatcher.core.model.DocumentSnapshot;
import com.ryuqq.dispatcher.core.model.Query;
import com.ryuqq.dispatcher.core.model.QuerySnapshot;

import java.util.List;

/**
 * Document Store SPI used by the publisher to read, batch and transact.
 *
 * <p>The publisher never talks to a concrete database. It asks the store for
 * plain reads, a fresh {@link DocumentWriteBatch}, or a transactional run of a
 * callback, and wraps each in the corresponding handler context.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Plain reads of single documents, multiple documents and queries</li>
 *   <li>Write batches that commit all staged writes atomically or none</li>
 *   <li>Optimistic transactions with snapshot reads and commit-time conflict detection</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods may be called concurrently by independent publishes</li>
 *   <li>Failures are reported as {@link com.ryuqq.dispatcher.core.error.StoreException}
 *       carrying a {@link com.ryuqq.dispatcher.core.error.StoreErrorCode}</li>
 *   <li>Transient failures must use a code whose {@code isTransient()} is true so the
 *       publisher's default retry classification can recover from them</li>
 * </ul>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public interface DocumentStore {

    /**
     * Reads a single document outside of any transaction.
     *
     * @param reference the document to read
     * @return the snapshot; {@code exists()} is false when the document is absent
     * @throws IllegalArgumentException if reference is null
     */
    DocumentSnapshot get(DocumentReference reference);

    /**
     * Reads several documents at once.
     *
     * @param references the documents to read
     * @return snapshots in the same order as {@code references}, missing documents included
     * @throws IllegalArgumentException if references is null or contains null
     */
    List<DocumentSnapshot> getAll(List<DocumentReference> references);

    /**
     * Runs a query against the current committed state.
     *
     * @param query the query
     * @return the matching documents
     */
    QuerySnapshot query(Query query);

    /**
     * Creates a new, empty write batch.
     *
     * @return a batch that stays invisible until {@link DocumentWriteBatch#commit()}
     */
    DocumentWriteBatch batch();

    /**
     * Runs {@code function} inside a transaction and commits its writes atomically.
     *
     * <p>The store may invoke the function more than once when a commit conflicts
     * with a concurrent writer. An exception thrown by the function aborts the
     * transaction without writing anything and is propagated unchanged.</p>
     *
     * @param function the transactional work
     * @param <T> result type
     * @return the value returned by the successful invocation of {@code function}
     * @throws Exception whatever {@code function} throws, or a
     *         {@link com.ryuqq.dispatcher.core.error.StoreException} when the commit fails
     */
    <T> T runTransaction(TransactionFunction<T> function) throws Exception;
}

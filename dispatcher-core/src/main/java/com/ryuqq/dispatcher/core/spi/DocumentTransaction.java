package com.ryuqq.dispatcher.core.spi;

import com.ryuqq.dispatcher.core.model.DocumentReference;
import com.ryuqq.dispatcher.core.model.DocumentSnapshot;
import com.ryuqq.dispatcher.core.model.Precondition;
import com.ryuqq.dispatcher.core.model.Query;
import com.ryuqq.dispatcher.core.model.QuerySnapshot;
import com.ryuqq.dispatcher.core.model.SetOptions;

import java.util.List;
import java.util.Map;

/**
 * A running store transaction.
 *
 * <p>Reads observe a consistent snapshot taken when the transaction started.
 * Writes are buffered and applied only when the enclosing
 * {@link DocumentStore#runTransaction(TransactionFunction)} commits.</p>
 *
 * <p><strong>Ordering rule:</strong> all reads must happen before the first write.
 * A read after a write fails with {@link IllegalStateException}.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public interface DocumentTransaction {

    DocumentSnapshot get(DocumentReference reference);

    List<DocumentSnapshot> getAll(List<DocumentReference> references);

    QuerySnapshot query(Query query);

    void set(DocumentReference reference, Map<String, Object> data, SetOptions options);

    /**
     * Creates a document; the commit fails with {@code ALREADY_EXISTS} if it is present.
     */
    void create(DocumentReference reference, Map<String, Object> data);

    /**
     * Updates fields of an existing document; the commit fails with {@code NOT_FOUND} if it is absent.
     */
    void update(DocumentReference reference, Map<String, Object> fields, Precondition precondition);

    void delete(DocumentReference reference, Precondition precondition);
}

package com.ryuqq.dispatcher.core.spi;

import com.ryuqq.dispatcher.core.model.DocumentReference;
import com.ryuqq.dispatcher.core.model.Precondition;
import com.ryuqq.dispatcher.core.model.SetOptions;

import java.util.Map;

/**
 * A write-only group of writes committed atomically.
 *
 * <p>Staged writes are invisible until {@link #commit()}. If any write in the
 * batch cannot be applied, none of them are. A batch can be committed once;
 * staging or committing again afterwards fails with {@link IllegalStateException}.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public interface DocumentWriteBatch {

    void set(DocumentReference reference, Map<String, Object> data, SetOptions options);

    void create(DocumentReference reference, Map<String, Object> data);

    void update(DocumentReference reference, Map<String, Object> fields, Precondition precondition);

    void delete(DocumentReference reference, Precondition precondition);

    /**
     * Applies all staged writes atomically.
     *
     * @throws com.ryuqq.dispatcher.core.error.StoreException if the commit fails; nothing is written
     * @throws IllegalStateException if the batch was already committed
     */
    void commit();

    /**
     * @return number of staged writes
     */
    int size();
}

package com.ryuqq.dispatcher.adapter.inmemory.store;

import com.ryuqq.dispatcher.core.model.DocumentReference;
import com.ryuqq.dispatcher.core.model.Precondition;
import com.ryuqq.dispatcher.core.model.SetOptions;
import com.ryuqq.dispatcher.core.spi.DocumentWriteBatch;

import java.util.Map;

/**
 * In-memory {@link DocumentWriteBatch}.
 *
 * <p>Writes are buffered locally and handed to the owning store in one commit call.
 * Not thread-safe; a batch belongs to one dispatch attempt.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class InMemoryWriteBatch implements DocumentWriteBatch {

    private final InMemoryDocumentStore store;
    private final WriteBuffer buffer = new WriteBuffer();
    private boolean committed;

    InMemoryWriteBatch(InMemoryDocumentStore store) {
        this.store = store;
    }

    @Override
    public void set(DocumentReference reference, Map<String, Object> data, SetOptions options) {
        ensureOpen();
        buffer.set(reference, data, options);
    }

    @Override
    public void create(DocumentReference reference, Map<String, Object> data) {
        ensureOpen();
        buffer.create(reference, data);
    }

    @Override
    public void update(DocumentReference reference, Map<String, Object> fields, Precondition precondition) {
        ensureOpen();
        buffer.update(reference, fields, precondition);
    }

    @Override
    public void delete(DocumentReference reference, Precondition precondition) {
        ensureOpen();
        buffer.delete(reference, precondition);
    }

    @Override
    public void commit() {
        ensureOpen();
        committed = true;
        store.commit(buffer.operations(), Map.of());
    }

    @Override
    public int size() {
        return buffer.size();
    }

    private void ensureOpen() {
        if (committed) {
            throw new IllegalStateException("Write batch has already been committed");
        }
    }
}

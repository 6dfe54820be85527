package com.ryuqq.dispatcher.adapter.inmemory.store;

import com.ryuqq.dispatcher.core.model.DocumentReference;
import com.ryuqq.dispatcher.core.model.DocumentSnapshot;
import com.ryuqq.dispatcher.core.model.Precondition;
import com.ryuqq.dispatcher.core.model.Query;
import com.ryuqq.dispatcher.core.model.QuerySnapshot;
import com.ryuqq.dispatcher.core.model.SetOptions;
import com.ryuqq.dispatcher.core.spi.DocumentTransaction;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory {@link DocumentTransaction}.
 *
 * <p>Reads are served from a snapshot copied when the transaction began, and the
 * version of every document read is recorded. At commit the store compares those
 * versions with the committed state and aborts on any difference.</p>
 *
 * <p>Query reads record the versions of the returned documents only. A document that
 * starts matching the query concurrently is not detected as a conflict.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class InMemoryTransaction implements DocumentTransaction {

    private final Map<DocumentReference, StoredDocument> snapshot;
    private final Map<DocumentReference, Long> readVersions = new HashMap<>();
    private final WriteBuffer buffer = new WriteBuffer();
    private boolean active = true;

    InMemoryTransaction(Map<DocumentReference, StoredDocument> snapshot) {
        this.snapshot = snapshot;
    }

    @Override
    public DocumentSnapshot get(DocumentReference reference) {
        ensureReadable();
        if (reference == null) {
            throw new IllegalArgumentException("reference cannot be null");
        }
        return read(reference);
    }

    @Override
    public List<DocumentSnapshot> getAll(List<DocumentReference> references) {
        ensureReadable();
        if (references == null || references.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("references cannot be null or contain null");
        }
        List<DocumentSnapshot> result = new ArrayList<>(references.size());
        for (DocumentReference reference : references) {
            result.add(read(reference));
        }
        return result;
    }

    @Override
    public QuerySnapshot query(Query query) {
        ensureReadable();
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        QuerySnapshot result = QueryEvaluator.evaluate(query, snapshot);
        for (DocumentSnapshot document : result.documents()) {
            readVersions.put(document.getReference(), document.getVersion());
        }
        return result;
    }

    @Override
    public void set(DocumentReference reference, Map<String, Object> data, SetOptions options) {
        ensureActive();
        buffer.set(reference, data, options);
    }

    @Override
    public void create(DocumentReference reference, Map<String, Object> data) {
        ensureActive();
        buffer.create(reference, data);
    }

    @Override
    public void update(DocumentReference reference, Map<String, Object> fields, Precondition precondition) {
        ensureActive();
        buffer.update(reference, fields, precondition);
    }

    @Override
    public void delete(DocumentReference reference, Precondition precondition) {
        ensureActive();
        buffer.delete(reference, precondition);
    }

    List<WriteOperation> writes() {
        return buffer.operations();
    }

    Map<DocumentReference, Long> readVersions() {
        return Map.copyOf(readVersions);
    }

    void close() {
        active = false;
    }

    private DocumentSnapshot read(DocumentReference reference) {
        StoredDocument document = snapshot.get(reference);
        readVersions.put(reference, StoredDocument.versionOf(document));
        return StoredDocument.toSnapshot(reference, document);
    }

    private void ensureReadable() {
        ensureActive();
        if (!buffer.isEmpty()) {
            throw new IllegalStateException("Transaction reads must happen before any write");
        }
    }

    private void ensureActive() {
        if (!active) {
            throw new IllegalStateException("Transaction is no longer active");
        }
    }
}

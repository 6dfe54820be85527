package com.ryuqq.dispatcher.application.context;

import com.ryuqq.dispatcher.core.context.ReadContext;
import com.ryuqq.dispatcher.core.model.DocumentReference;
import com.ryuqq.dispatcher.core.model.DocumentSnapshot;
import com.ryuqq.dispatcher.core.model.Query;
import com.ryuqq.dispatcher.core.model.QuerySnapshot;
import com.ryuqq.dispatcher.core.spi.DocumentStore;

import java.util.List;

/**
 * 저장소 직접 읽기 기반 ReadContext (읽기 전용/배치 모드).
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class DirectReadContext implements ReadContext {

    private final DocumentStore store;

    public DirectReadContext(DocumentStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    @Override
    public DocumentSnapshot get(DocumentReference reference) {
        return store.get(reference);
    }

    @Override
    public List<DocumentSnapshot> getAll(List<DocumentReference> references) {
        return store.getAll(references);
    }

    @Override
    public QuerySnapshot query(Query query) {
        return store.query(query);
    }
}

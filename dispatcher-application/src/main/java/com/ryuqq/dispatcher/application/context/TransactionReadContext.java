package com.ryuqq.dispatcher.application.context;

import com.ryuqq.dispatcher.core.context.ReadContext;
import com.ryuqq.dispatcher.core.model.DocumentReference;
import com.ryuqq.dispatcher.core.model.DocumentSnapshot;
import com.ryuqq.dispatcher.core.model.Query;
import com.ryuqq.dispatcher.core.model.QuerySnapshot;
import com.ryuqq.dispatcher.core.spi.DocumentTransaction;

import java.util.List;

/**
 * 트랜잭션 읽기 기반 ReadContext (트랜잭션 모드).
 *
 * <p>읽기는 트랜잭션 스냅샷에서 수행되며 커밋 시 충돌 검사 대상이 됩니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class TransactionReadContext implements ReadContext {

    private final DocumentTransaction transaction;

    public TransactionReadContext(DocumentTransaction transaction) {
        if (transaction == null) {
            throw new IllegalArgumentException("transaction cannot be null");
        }
        this.transaction = transaction;
    }

    @Override
    public DocumentSnapshot get(DocumentReference reference) {
        return transaction.get(reference);
    }

    @Override
    public List<DocumentSnapshot> getAll(List<DocumentReference> references) {
        return transaction.getAll(references);
    }

    @Override
    public QuerySnapshot query(Query query) {
        return transaction.query(query);
    }
}

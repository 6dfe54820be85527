package com.ryuqq.dispatcher.application.context;

import com.ryuqq.dispatcher.core.context.WriteContext;
import com.ryuqq.dispatcher.core.model.DocumentReference;
import com.ryuqq.dispatcher.core.model.Precondition;
import com.ryuqq.dispatcher.core.model.SetOptions;
import com.ryuqq.dispatcher.core.spi.DocumentTransaction;

import java.util.Map;

/**
 * 트랜잭션 기반 WriteContext (트랜잭션 모드).
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class TransactionWriteContext implements WriteContext {

    private final DocumentTransaction transaction;

    public TransactionWriteContext(DocumentTransaction transaction) {
        if (transaction == null) {
            throw new IllegalArgumentException("transaction cannot be null");
        }
        this.transaction = transaction;
    }

    @Override
    public void set(DocumentReference reference, Map<String, Object> data, SetOptions options) {
        transaction.set(reference, data, options);
    }

    @Override
    public void create(DocumentReference reference, Map<String, Object> data) {
        transaction.create(reference, data);
    }

    @Override
    public void update(DocumentReference reference, Map<String, Object> fields, Precondition precondition) {
        transaction.update(reference, fields, precondition);
    }

    @Override
    public void delete(DocumentReference reference, Precondition precondition) {
        transaction.delete(reference, precondition);
    }
}

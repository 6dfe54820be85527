package com.ryuqq.dispatcher.application.context;

import com.ryuqq.dispatcher.core.context.WriteContext;
import com.ryuqq.dispatcher.core.model.DocumentReference;
import com.ryuqq.dispatcher.core.model.Precondition;
import com.ryuqq.dispatcher.core.model.SetOptions;
import com.ryuqq.dispatcher.core.spi.DocumentWriteBatch;

import java.util.Map;

/**
 * 쓰기 배치 기반 WriteContext (배치 모드).
 *
 * <p>쓰기를 배치에 적재만 하며, 커밋은 BatchDispatchStrategy가 모든 핸들러 실행 후 한 번 수행합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class BatchWriteContext implements WriteContext {

    private final DocumentWriteBatch batch;

    public BatchWriteContext(DocumentWriteBatch batch) {
        if (batch == null) {
            throw new IllegalArgumentException("batch cannot be null");
        }
        this.batch = batch;
    }

    @Override
    public void set(DocumentReference reference, Map<String, Object> data, SetOptions options) {
        batch.set(reference, data, options);
    }

    @Override
    public void create(DocumentReference reference, Map<String, Object> data) {
        batch.create(reference, data);
    }

    @Override
    public void update(DocumentReference reference, Map<String, Object> fields, Precondition precondition) {
        batch.update(reference, fields, precondition);
    }

    @Override
    public void delete(DocumentReference reference, Precondition precondition) {
        batch.delete(reference, precondition);
    }
}

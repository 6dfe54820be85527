package com.ryuqq.dispatcher.adapter.inmemory.store;

import com.ryuqq.dispatcher.core.model.DocumentReference;
import com.ryuqq.dispatcher.core.model.Precondition;
import com.ryuqq.dispatcher.core.model.SetOptions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 배치 또는 트랜잭션에 적재된 쓰기 한 건.
 */
sealed interface WriteOperation
    permits WriteOperation.SetWrite, WriteOperation.CreateWrite, WriteOperation.UpdateWrite, WriteOperation.DeleteWrite {

    DocumentReference reference();

    record SetWrite(DocumentReference reference, Map<String, Object> data, SetOptions options) implements WriteOperation {
        public SetWrite {
            data = copyOf(data);
        }
    }

    record CreateWrite(DocumentReference reference, Map<String, Object> data) implements WriteOperation {
        public CreateWrite {
            data = copyOf(data);
        }
    }

    record UpdateWrite(DocumentReference reference, Map<String, Object> fields, Precondition precondition) implements WriteOperation {
        public UpdateWrite {
            fields = copyOf(fields);
        }
    }

    record DeleteWrite(DocumentReference reference, Precondition precondition) implements WriteOperation {
    }

    private static Map<String, Object> copyOf(Map<String, Object> data) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}

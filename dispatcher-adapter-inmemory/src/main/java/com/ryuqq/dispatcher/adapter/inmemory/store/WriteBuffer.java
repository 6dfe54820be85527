package com.ryuqq.dispatcher.adapter.inmemory.store;

import com.ryuqq.dispatcher.core.model.DocumentReference;
import com.ryuqq.dispatcher.core.model.Precondition;
import com.ryuqq.dispatcher.core.model.SetOptions;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 쓰기 적재 버퍼. 인자 검증 후 적재 순서대로 보관합니다.
 *
 * <p>배치와 트랜잭션이 공유하며 스레드 안전하지 않습니다.</p>
 */
final class WriteBuffer {

    private final List<WriteOperation> operations = new ArrayList<>();

    void set(DocumentReference reference, Map<String, Object> data, SetOptions options) {
        requireReference(reference);
        requireData(data, "data");
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        operations.add(new WriteOperation.SetWrite(reference, data, options));
    }

    void create(DocumentReference reference, Map<String, Object> data) {
        requireReference(reference);
        requireData(data, "data");
        operations.add(new WriteOperation.CreateWrite(reference, data));
    }

    void update(DocumentReference reference, Map<String, Object> fields, Precondition precondition) {
        requireReference(reference);
        requireData(fields, "fields");
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("fields cannot be empty");
        }
        operations.add(new WriteOperation.UpdateWrite(reference, fields, precondition == null ? Precondition.NONE : precondition));
    }

    void delete(DocumentReference reference, Precondition precondition) {
        requireReference(reference);
        operations.add(new WriteOperation.DeleteWrite(reference, precondition == null ? Precondition.NONE : precondition));
    }

    List<WriteOperation> operations() {
        return List.copyOf(operations);
    }

    boolean isEmpty() {
        return operations.isEmpty();
    }

    int size() {
        return operations.size();
    }

    private static void requireReference(DocumentReference reference) {
        if (reference == null) {
            throw new IllegalArgumentException("reference cannot be null");
        }
    }

    private static void requireData(Map<String, Object> data, String name) {
        if (data == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }
}

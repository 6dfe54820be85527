package com.ryuqq.dispatcher.core.context;

import com.ryuqq.dispatcher.core.model.CollectionReference;
import com.ryuqq.dispatcher.core.model.DocumentReference;
import com.ryuqq.dispatcher.core.model.FieldUpdates;
import com.ryuqq.dispatcher.core.model.Precondition;
import com.ryuqq.dispatcher.core.model.SetOptions;

import java.util.Map;

/**
 * 핸들러의 실행 단계(handleEvent)에 제공되는 쓰기 전용 뷰.
 *
 * <p>쓰기는 현재 배치 또는 트랜잭션에 적재될 뿐이며, 커밋은 publisher가 담당합니다.
 * 따라서 이 인터페이스는 커밋 수단을 노출하지 않습니다.</p>
 *
 * <p><strong>쓰기 실패 시점:</strong> ALREADY_EXISTS, NOT_FOUND, FAILED_PRECONDITION 같은
 * 쓰기 오류는 커밋 시점에 보고되며, 그 경우 같은 단위의 어떤 쓰기도 반영되지 않습니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public interface WriteContext {

    /**
     * 문서 쓰기 (모드에 따라 교체 또는 병합).
     *
     * @param reference 문서
     * @param data 문서 필드
     * @param options OVERWRITE 또는 MERGE
     */
    void set(DocumentReference reference, Map<String, Object> data, SetOptions options);

    default void set(DocumentReference reference, Map<String, Object> data) {
        set(reference, data, SetOptions.OVERWRITE);
    }

    /**
     * 저장소 생성 키로 새 문서 추가.
     *
     * @param collection 대상 컬렉션
     * @param data 문서 필드
     * @return 생성될 문서의 참조
     */
    default DocumentReference add(CollectionReference collection, Map<String, Object> data) {
        if (collection == null) {
            throw new IllegalArgumentException("collection cannot be null");
        }
        DocumentReference reference = collection.document();
        create(reference, data);
        return reference;
    }

    void create(DocumentReference reference, Map<String, Object> data);

    void update(DocumentReference reference, Map<String, Object> fields, Precondition precondition);

    default void update(DocumentReference reference, Map<String, Object> fields) {
        update(reference, fields, Precondition.NONE);
    }

    default void update(DocumentReference reference, String field, Object value, Object... moreFieldsAndValues) {
        update(reference, FieldUpdates.toMap(field, value, moreFieldsAndValues), Precondition.NONE);
    }

    void delete(DocumentReference reference, Precondition precondition);

    default void delete(DocumentReference reference) {
        delete(reference, Precondition.NONE);
    }
}

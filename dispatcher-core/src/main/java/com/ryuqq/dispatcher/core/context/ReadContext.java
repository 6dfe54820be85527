package com.ryuqq.dispatcher.core.context;

import com.ryuqq.dispatcher.core.model.DocumentReference;
import com.ryuqq.dispatcher.core.model.DocumentSnapshot;
import com.ryuqq.dispatcher.core.model.Query;
import com.ryuqq.dispatcher.core.model.QuerySnapshot;

import java.util.Arrays;
import java.util.List;

/**
 * 핸들러의 준비 단계(prepareHandleEvent)에 제공되는 읽기 전용 뷰.
 *
 * <p>배치 모드에서는 저장소의 직접 읽기로, 트랜잭션 모드에서는 트랜잭션 읽기로
 * 구현되지만 핸들러에게는 같은 형태로 보입니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public interface ReadContext {

    DocumentSnapshot get(DocumentReference reference);

    /**
     * 여러 문서 조회.
     *
     * @param references 조회할 문서
     * @return 요청 순서와 같은 순서의 스냅샷 (없는 문서 포함)
     */
    List<DocumentSnapshot> getAll(List<DocumentReference> references);

    default List<DocumentSnapshot> getAll(DocumentReference... references) {
        return getAll(Arrays.asList(references));
    }

    QuerySnapshot query(Query query);
}

package com.ryuqq.dispatcher.core.model;

import java.util.List;

/**
 * 쿼리 실행 결과.
 *
 * @param query 실행한 쿼리
 * @param documents 조건을 만족한 문서 스냅샷 (정렬/limit 적용 완료)
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public record QuerySnapshot(Query query, List<DocumentSnapshot> documents) {

    public QuerySnapshot {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        if (documents == null) {
            throw new IllegalArgumentException("documents cannot be null");
        }
        documents = List.copyOf(documents);
    }

    public int size() {
        return documents.size();
    }

    public boolean isEmpty() {
        return documents.isEmpty();
    }
}

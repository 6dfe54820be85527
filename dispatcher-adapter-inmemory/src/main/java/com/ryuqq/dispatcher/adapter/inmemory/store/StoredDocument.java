package com.ryuqq.dispatcher.adapter.inmemory.store;

import com.ryuqq.dispatcher.core.model.DocumentReference;
import com.ryuqq.dispatcher.core.model.DocumentSnapshot;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 커밋된 문서 한 건 (필드 + 커밋 버전).
 *
 * @param data 문서 필드 (수정 불가)
 * @param version 마지막으로 쓰여진 커밋의 버전
 */
record StoredDocument(Map<String, Object> data, long version) {

    StoredDocument {
        data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    static long versionOf(StoredDocument document) {
        return document == null ? 0L : document.version();
    }

    static DocumentSnapshot toSnapshot(DocumentReference reference, StoredDocument document) {
        return document == null
            ? DocumentSnapshot.missing(reference)
            : DocumentSnapshot.of(reference, document.data(), document.version());
    }
}

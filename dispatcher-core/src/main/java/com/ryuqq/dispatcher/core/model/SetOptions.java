package com.ryuqq.dispatcher.core.model;

/**
 * set 연산 모드.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public enum SetOptions {

    /**
     * 문서 전체를 주어진 데이터로 교체.
     */
    OVERWRITE,

    /**
     * 주어진 최상위 필드만 기존 문서에 병합 (부분 쓰기).
     */
    MERGE
}

package com.ryuqq.dispatcher.core.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * field/value 쌍 형태의 update 인자를 필드 맵으로 변환하는 유틸리티.
 *
 * <p>예: {@code toMap("name", "SF", "population", 800000)}
 * → {@code {name=SF, population=800000}}</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class FieldUpdates {

    private FieldUpdates() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * field/value 쌍을 순서를 유지한 필드 맵으로 변환.
     *
     * @param field 첫 번째 필드 이름
     * @param value 첫 번째 필드 값
     * @param moreFieldsAndValues 추가 field/value 쌍 (짝수 개)
     * @return 필드 맵
     * @throws IllegalArgumentException 쌍이 맞지 않거나 필드 이름이 문자열이 아닌 경우
     */
    public static Map<String, Object> toMap(String field, Object value, Object... moreFieldsAndValues) {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("field cannot be null or blank");
        }
        if (moreFieldsAndValues != null && moreFieldsAndValues.length % 2 != 0) {
            throw new IllegalArgumentException(
                "moreFieldsAndValues must contain field/value pairs (current length: " + moreFieldsAndValues.length + ")"
            );
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(field, value);
        if (moreFieldsAndValues != null) {
            for (int i = 0; i < moreFieldsAndValues.length; i += 2) {
                if (!(moreFieldsAndValues[i] instanceof String name) || name.isBlank()) {
                    throw new IllegalArgumentException("field name at index " + i + " must be a non-blank String");
                }
                fields.put(name, moreFieldsAndValues[i + 1]);
            }
        }
        return fields;
    }
}

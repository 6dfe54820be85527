package com.ryuqq.dispatcher.adapter.inmemory.store;

import com.ryuqq.dispatcher.core.model.DocumentReference;
import com.ryuqq.dispatcher.core.model.DocumentSnapshot;
import com.ryuqq.dispatcher.core.model.Query;
import com.ryuqq.dispatcher.core.model.QuerySnapshot;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.IntPredicate;

/**
 * 문서 맵에 대해 {@link Query}를 평가합니다.
 *
 * <p><strong>평가 규칙:</strong></p>
 * <ul>
 *   <li>필터 대상 필드가 없는 문서는 제외 (NOT_EQUAL 포함)</li>
 *   <li>숫자는 타입에 관계없이 값으로 비교 (Integer 5 == Long 5 == Double 5.0)</li>
 *   <li>범위 비교는 boolean, 숫자, 문자열끼리만 일치하며 타입이 다르면 불일치</li>
 *   <li>정렬은 타입 순위 null &lt; boolean &lt; 숫자 &lt; 문자열 &lt; 기타 후 값 순</li>
 *   <li>정렬 필드가 없는 문서는 제외, 동순위는 문서 ID 순</li>
 * </ul>
 */
final class QueryEvaluator {

    private QueryEvaluator() {
    }

    static QuerySnapshot evaluate(Query query, Map<DocumentReference, StoredDocument> documents) {
        String collection = query.getCollection().name();

        List<Map.Entry<DocumentReference, StoredDocument>> matches = new ArrayList<>();
        for (Map.Entry<DocumentReference, StoredDocument> entry : documents.entrySet()) {
            if (entry.getKey().collection().equals(collection)
                && matchesFilters(query, entry.getValue())
                && hasOrderFields(query, entry.getValue())) {
                matches.add(entry);
            }
        }

        matches.sort(ordering(query));

        int limit = query.getLimit() == null ? matches.size() : Math.min(query.getLimit(), matches.size());
        List<DocumentSnapshot> result = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            Map.Entry<DocumentReference, StoredDocument> entry = matches.get(i);
            result.add(StoredDocument.toSnapshot(entry.getKey(), entry.getValue()));
        }
        return new QuerySnapshot(query, result);
    }

    private static boolean matchesFilters(Query query, StoredDocument document) {
        for (Query.FieldFilter filter : query.getFilters()) {
            if (!document.data().containsKey(filter.field())) {
                return false;
            }
            if (!matches(filter, document.data().get(filter.field()))) {
                return false;
            }
        }
        return true;
    }

    private static boolean hasOrderFields(Query query, StoredDocument document) {
        for (Query.Order order : query.getOrders()) {
            if (!document.data().containsKey(order.field())) {
                return false;
            }
        }
        return true;
    }

    private static boolean matches(Query.FieldFilter filter, Object actual) {
        Object expected = filter.value();
        return switch (filter.operator()) {
            case EQUAL -> valuesEqual(actual, expected);
            case NOT_EQUAL -> !valuesEqual(actual, expected);
            case LESS_THAN -> compareMatches(actual, expected, c -> c < 0);
            case LESS_THAN_OR_EQUAL -> compareMatches(actual, expected, c -> c <= 0);
            case GREATER_THAN -> compareMatches(actual, expected, c -> c > 0);
            case GREATER_THAN_OR_EQUAL -> compareMatches(actual, expected, c -> c >= 0);
        };
    }

    private static boolean compareMatches(Object actual, Object expected, IntPredicate accept) {
        Integer comparison = compare(actual, expected);
        return comparison != null && accept.test(comparison);
    }

    private static Comparator<Map.Entry<DocumentReference, StoredDocument>> ordering(Query query) {
        Comparator<Map.Entry<DocumentReference, StoredDocument>> comparator = (a, b) -> 0;
        for (Query.Order order : query.getOrders()) {
            Comparator<Map.Entry<DocumentReference, StoredDocument>> byField = (a, b) -> orderValues(
                a.getValue().data().get(order.field()),
                b.getValue().data().get(order.field())
            );
            comparator = comparator.thenComparing(
                order.direction() == Query.Direction.DESCENDING ? byField.reversed() : byField
            );
        }
        return comparator.thenComparing(entry -> entry.getKey().id());
    }

    static boolean valuesEqual(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return compareNumbers((Number) a, (Number) b) == 0;
        }
        return Objects.equals(a, b);
    }

    /**
     * 범위 필터용 비교. 같은 타입 순위의 null 아닌 값끼리만 비교합니다.
     *
     * @return 비교 결과, 비교할 수 없는 조합이면 null
     */
    static Integer compare(Object a, Object b) {
        TypeRank rank = TypeRank.of(a);
        if (rank == TypeRank.NULL || rank == TypeRank.OTHER || rank != TypeRank.of(b)) {
            return null;
        }
        return compareWithinRank(rank, a, b);
    }

    /**
     * 정렬용 전순서 비교. 타입 순위(null &lt; boolean &lt; number &lt; string &lt; 기타)를 먼저 비교하고,
     * 같은 순위 안에서 값을 비교합니다.
     */
    static int orderValues(Object a, Object b) {
        TypeRank left = TypeRank.of(a);
        TypeRank right = TypeRank.of(b);
        if (left != right) {
            return left.compareTo(right);
        }
        return compareWithinRank(left, a, b);
    }

    private static int compareWithinRank(TypeRank rank, Object a, Object b) {
        return switch (rank) {
            case NULL -> 0;
            case BOOLEAN -> Boolean.compare((Boolean) a, (Boolean) b);
            case NUMBER -> compareNumbers((Number) a, (Number) b);
            case STRING -> ((String) a).compareTo((String) b);
            case OTHER -> {
                int byType = a.getClass().getName().compareTo(b.getClass().getName());
                yield byType != 0 ? byType : String.valueOf(a).compareTo(String.valueOf(b));
            }
        };
    }

    /**
     * 정수와 실수를 정밀도 손실 없이 비교합니다. NaN은 가장 큰 값으로 취급합니다.
     */
    static int compareNumbers(Number a, Number b) {
        boolean integralA = isIntegral(a);
        boolean integralB = isIntegral(b);
        if (integralA && integralB) {
            return Long.compare(a.longValue(), b.longValue());
        }
        if (integralA) {
            return compareLongToDouble(a.longValue(), b.doubleValue());
        }
        if (integralB) {
            return -compareLongToDouble(b.longValue(), a.doubleValue());
        }
        return Double.compare(a.doubleValue(), b.doubleValue());
    }

    private static int compareLongToDouble(long value, double other) {
        if (Double.isNaN(other) || other >= 0x1p63) {
            return -1;
        }
        if (other < -0x1p63) {
            return 1;
        }
        long truncated = (long) other;
        int comparison = Long.compare(value, truncated);
        if (comparison != 0) {
            return comparison;
        }
        return Double.compare(0.0, other - truncated);
    }

    private static boolean isIntegral(Number number) {
        return number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte;
    }

    private enum TypeRank {
        NULL,
        BOOLEAN,
        NUMBER,
        STRING,
        OTHER;

        static TypeRank of(Object value) {
            if (value == null) {
                return NULL;
            }
            if (value instanceof Boolean) {
                return BOOLEAN;
            }
            if (value instanceof Number) {
                return NUMBER;
            }
            if (value instanceof String) {
                return STRING;
            }
            return OTHER;
        }
    }
}

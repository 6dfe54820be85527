package com.ryuqq.dispatcher.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 단일 컬렉션에 대한 불변 쿼리.
 *
 * <p>필터/정렬/limit 메서드는 기존 쿼리를 변경하지 않고 새 인스턴스를 반환합니다.</p>
 *
 * <pre>{@code
 * Query query = Query.collection("cities")
 *     .whereEqualTo("state", "CA")
 *     .orderBy("population", Direction.DESCENDING)
 *     .limit(10);
 * }</pre>
 *
 * <p>정렬 필드가 없는 문서는 결과에서 제외됩니다. 정렬이 지정되지 않으면 문서 ID 순서입니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class Query {

    /**
     * 필터 비교 연산자.
     */
    public enum Operator {
        EQUAL,
        NOT_EQUAL,
        LESS_THAN,
        LESS_THAN_OR_EQUAL,
        GREATER_THAN,
        GREATER_THAN_OR_EQUAL
    }

    /**
     * 정렬 방향.
     */
    public enum Direction {
        ASCENDING,
        DESCENDING
    }

    /**
     * 필드 필터.
     *
     * @param field 필드 이름
     * @param operator 비교 연산자
     * @param value 비교 값
     */
    public record FieldFilter(String field, Operator operator, Object value) {

        public FieldFilter {
            if (field == null || field.isBlank()) {
                throw new IllegalArgumentException("field cannot be null or blank");
            }
            if (operator == null) {
                throw new IllegalArgumentException("operator cannot be null");
            }
        }
    }

    /**
     * 정렬 조건.
     *
     * @param field 필드 이름
     * @param direction 정렬 방향
     */
    public record Order(String field, Direction direction) {

        public Order {
            if (field == null || field.isBlank()) {
                throw new IllegalArgumentException("field cannot be null or blank");
            }
            if (direction == null) {
                throw new IllegalArgumentException("direction cannot be null");
            }
        }
    }

    private final CollectionReference collection;
    private final List<FieldFilter> filters;
    private final List<Order> orders;
    private final Integer limit;

    private Query(CollectionReference collection, List<FieldFilter> filters, List<Order> orders, Integer limit) {
        this.collection = collection;
        this.filters = Collections.unmodifiableList(filters);
        this.orders = Collections.unmodifiableList(orders);
        this.limit = limit;
    }

    public static Query collection(String name) {
        return collection(new CollectionReference(name));
    }

    public static Query collection(CollectionReference collection) {
        if (collection == null) {
            throw new IllegalArgumentException("collection cannot be null");
        }
        return new Query(collection, List.of(), List.of(), null);
    }

    public Query where(String field, Operator operator, Object value) {
        List<FieldFilter> next = new ArrayList<>(filters);
        next.add(new FieldFilter(field, operator, value));
        return new Query(collection, next, orders, limit);
    }

    public Query whereEqualTo(String field, Object value) {
        return where(field, Operator.EQUAL, value);
    }

    public Query whereNotEqualTo(String field, Object value) {
        return where(field, Operator.NOT_EQUAL, value);
    }

    public Query whereLessThan(String field, Object value) {
        return where(field, Operator.LESS_THAN, value);
    }

    public Query whereLessThanOrEqualTo(String field, Object value) {
        return where(field, Operator.LESS_THAN_OR_EQUAL, value);
    }

    public Query whereGreaterThan(String field, Object value) {
        return where(field, Operator.GREATER_THAN, value);
    }

    public Query whereGreaterThanOrEqualTo(String field, Object value) {
        return where(field, Operator.GREATER_THAN_OR_EQUAL, value);
    }

    public Query orderBy(String field) {
        return orderBy(field, Direction.ASCENDING);
    }

    public Query orderBy(String field, Direction direction) {
        List<Order> next = new ArrayList<>(orders);
        next.add(new Order(field, direction));
        return new Query(collection, filters, next, limit);
    }

    /**
     * 결과 개수 제한.
     *
     * @param limit 최대 결과 수 (양수)
     * @return 새 Query
     * @throws IllegalArgumentException limit이 0 이하인 경우
     */
    public Query limit(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
        return new Query(collection, filters, orders, limit);
    }

    public CollectionReference getCollection() {
        return collection;
    }

    public List<FieldFilter> getFilters() {
        return filters;
    }

    public List<Order> getOrders() {
        return orders;
    }

    /**
     * @return 결과 개수 제한, 지정하지 않았으면 null
     */
    public Integer getLimit() {
        return limit;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Query query = (Query) o;
        return collection.equals(query.collection)
            && filters.equals(query.filters)
            && orders.equals(query.orders)
            && Objects.equals(limit, query.limit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(collection, filters, orders, limit);
    }

    @Override
    public String toString() {
        return "Query{" + collection.name() + ", filters=" + filters + ", orders=" + orders + ", limit=" + limit + '}';
    }
}

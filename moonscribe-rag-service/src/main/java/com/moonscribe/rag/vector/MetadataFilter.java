package com.moonscribe.rag.vector;

import java.util.ArrayList;
import java.util.List;

/**
 * Conjunction of equality and membership constraints on payload fields.
 */
public final class MetadataFilter {

    public enum Op { EQ, IN }

    public record Condition(String field, Op op, List<Object> values) {}

    private static final MetadataFilter NONE = new MetadataFilter(List.of());

    private final List<Condition> conditions;

    private MetadataFilter(List<Condition> conditions) {
        this.conditions = List.copyOf(conditions);
    }

    public static MetadataFilter none() {
        return NONE;
    }

    public static MetadataFilter eq(String field, Object value) {
        return NONE.andEq(field, value);
    }

    public static MetadataFilter in(String field, List<?> values) {
        return NONE.andIn(field, values);
    }

    public MetadataFilter andEq(String field, Object value) {
        if (value == null) {
            throw new IllegalArgumentException("eq value for '" + field + "' must not be null");
        }
        return with(new Condition(field, Op.EQ, List.of(value)));
    }

    public MetadataFilter andIn(String field, List<?> values) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("in values for '" + field + "' must not be empty");
        }
        return with(new Condition(field, Op.IN, List.copyOf(values)));
    }

    public List<Condition> conditions() {
        return conditions;
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    private MetadataFilter with(Condition condition) {
        if (condition.field() == null || condition.field().isBlank()) {
            throw new IllegalArgumentException("filter field is required");
        }
        List<Condition> next = new ArrayList<>(conditions);
        next.add(condition);
        return new MetadataFilter(next);
    }

    @Override
    public String toString() {
        return conditions.toString();
    }
}

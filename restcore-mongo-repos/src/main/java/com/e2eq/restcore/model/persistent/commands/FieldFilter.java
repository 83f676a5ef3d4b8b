package com.e2eq.restcore.model.persistent.commands;

import com.google.common.collect.ImmutableList;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.function.Function;

/**
 * Declares one filterable field of a listable resource and how it maps to stored fields.
 *
 * <ul>
 *    <li>{@link #field(String)}: the value goes to a stored field as is,</li>
 *    <li>{@link #mapped(String, Function)}: the value goes to a stored field through a converter,</li>
 *    <li>{@link #search(Function, String...)}: the converted value is matched against several stored
 *    fields joined with {@code $or}.</li>
 * </ul>
 *
 * Filters accept query string input unless made {@link #programmaticOnly()}.
 */
@Getter
@ToString
public final class FieldFilter {

    public enum MappingKind {
        DIRECT,
        MAPPED,
        SEARCH
    }

    private final MappingKind kind;
    private final String dbField;
    private final ImmutableList<String> searchFields;
    @ToString.Exclude
    private final Function<Object, ?> converter;
    private final FilterFieldType type;
    private final Object defaultValue;
    private final boolean fromQuery;

    private FieldFilter(MappingKind kind, String dbField, List<String> searchFields, Function<Object, ?> converter,
                        FilterFieldType type, Object defaultValue, boolean fromQuery) {
        this.kind = kind;
        this.dbField = dbField;
        this.searchFields = searchFields == null ? ImmutableList.of() : ImmutableList.copyOf(searchFields);
        this.converter = converter;
        this.type = type;
        this.defaultValue = defaultValue;
        this.fromQuery = fromQuery;
    }

    public static FieldFilter field(String dbField) {
        return new FieldFilter(MappingKind.DIRECT, dbField, null, null, null, null, true);
    }

    public static FieldFilter mapped(String dbField, Function<Object, ?> converter) {
        return new FieldFilter(MappingKind.MAPPED, dbField, null, converter, null, null, true);
    }

    public static FieldFilter search(Function<Object, ?> converter, String... fields) {
        if (fields.length == 0) {
            throw new IllegalArgumentException("search filter needs at least one field");
        }
        return new FieldFilter(MappingKind.SEARCH, null, List.of(fields), converter, null, null, true);
    }

    public FieldFilter ofType(FilterFieldType fieldType) {
        return new FieldFilter(kind, dbField, searchFields, converter, fieldType, defaultValue, fromQuery);
    }

    public FieldFilter withDefault(Object value) {
        return new FieldFilter(kind, dbField, searchFields, converter, type, value, fromQuery);
    }

    /**
     * Only settable through {@link ListBuilder#withFiltering}, never from request parameters.
     */
    public FieldFilter programmaticOnly() {
        return new FieldFilter(kind, dbField, searchFields, converter, type, defaultValue, false);
    }
}

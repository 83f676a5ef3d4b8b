package com.e2eq.restcore.model.persistent.commands;

import com.e2eq.restcore.util.ParseUtils;
import io.smallrye.mutiny.Uni;
import org.apache.commons.lang3.StringUtils;
import org.bson.Document;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Collects the filtering, sorting, pagination, projection and serialization of one list request and
 * runs it through the owning {@link AbstractListCommand}.
 *
 * <p>Every step is optional and may be called in any order. Malformed caller input never raises,
 * it falls back to the command defaults. A builder belongs to a single request and is not thread safe.</p>
 *
 * @param <E> entity type of the underlying repository
 */
public class ListBuilder<E> {

    public static final int DEFAULT_PER_PAGE = 50;
    public static final int DEFAULT_MAX_PER_PAGE = 100;

    private final AbstractListCommand<E> command;

    private final Document filtering = new Document();
    private ListPagination pagination;
    private ListSort sorting;
    private ListSerialization serialization;
    private Map<String, Boolean> projection;

    public ListBuilder(AbstractListCommand<E> command) {
        this.command = command;
    }

    /**
     * Applies request parameters. Only filters accepting query input are considered and the last value
     * of a repeated parameter wins.
     */
    public ListBuilder<E> withQuery(@Nullable Map<String, List<String>> queryParams) {
        if (queryParams == null || queryParams.isEmpty()) {
            return this;
        }
        Map<String, Object> lastValues = new LinkedHashMap<>();
        queryParams.forEach((name, values) -> {
            if (values != null && !values.isEmpty()) {
                lastValues.put(name, values.get(values.size() - 1));
            }
        });
        processFilters(lastValues, true);
        return this;
    }

    /**
     * Applies trusted, already typed filters. Filters marked programmatic only are accepted here.
     */
    public ListBuilder<E> withFiltering(@Nullable Map<String, ?> filters) {
        processFilters(filters, false);
        return this;
    }

    private void processFilters(@Nullable Map<String, ?> data, boolean onlyQuery) {
        Map<String, FieldFilter> available = command.getAvailableFiltering();
        if (available == null || available.isEmpty() || data == null || data.isEmpty()) {
            return;
        }
        // walk the declared filters, unknown input keys are ignored
        for (Map.Entry<String, FieldFilter> entry : available.entrySet()) {
            FieldFilter filter = entry.getValue();
            if ((onlyQuery && !filter.isFromQuery()) || !data.containsKey(entry.getKey())) {
                continue;
            }
            Object value = data.get(entry.getKey());
            if (filter.getType() != null) {
                value = filter.getType().convert(value, filter.getDefaultValue());
            }
            switch (filter.getKind()) {
                case DIRECT:
                    directFilter(filter.getDbField(), value, null, filter.getDefaultValue());
                    break;
                case MAPPED:
                    directFilter(filter.getDbField(), value, filter.getConverter(), filter.getDefaultValue());
                    break;
                case SEARCH:
                    searchFilter(filter.getSearchFields(),
                            isPresent(value) ? filter.getConverter().apply(value) : filter.getDefaultValue());
                    break;
                default:
                    throw new IllegalStateException("Unsupported filter kind " + filter.getKind());
            }
        }
    }

    private void directFilter(String dbField, @Nullable Object value, @Nullable Function<Object, ?> converter,
                              @Nullable Object defaultValue) {
        if (value == null) {
            filtering.put(dbField, defaultValue);
        } else {
            filtering.put(dbField, converter != null ? converter.apply(value) : value);
        }
    }

    private void searchFilter(List<String> fields, @Nullable Object value) {
        if (value == null) {
            return;
        }
        List<Document> alternatives = new ArrayList<>(fields.size());
        for (String field : fields) {
            alternatives.add(new Document(field, value));
        }
        filtering.put("$or", alternatives);
    }

    static boolean isPresent(@Nullable Object value) {
        if (value == null || Boolean.FALSE.equals(value)) {
            return false;
        }
        if (value instanceof CharSequence) {
            return ((CharSequence) value).length() > 0;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0d;
        }
        return true;
    }

    public ListBuilder<E> withPagination(@Nullable Object page, @Nullable Object limit) {
        return withPagination(page, limit, DEFAULT_PER_PAGE, DEFAULT_MAX_PER_PAGE);
    }

    /**
     * Pages are 1-based. A missing, zero or unparsable page is the first page, a missing limit is
     * {@code perPage} and any limit is clamped into {@code [1, maxPerPage]}.
     */
    public ListBuilder<E> withPagination(@Nullable Object page, @Nullable Object limit, int perPage, int maxPerPage) {
        long pageNo = isPresent(page) ? toLong(page, 1L) : 0L;
        long requested = isPresent(limit) ? toLong(limit, (long) perPage) : perPage;

        int clamped = (int) Math.min(maxPerPage, Math.max(1L, requested));
        long pageIndex = Math.min(Math.max(1L, pageNo), Integer.MAX_VALUE) - 1L;
        long offset = Math.min(Integer.MAX_VALUE, clamped * pageIndex);
        this.pagination = new ListPagination(clamped, (int) offset);
        return this;
    }

    private static long toLong(Object value, long defaultValue) {
        Long parsed = ParseUtils.parseLong(value, defaultValue);
        return parsed == null ? defaultValue : parsed;
    }

    public ListBuilder<E> withSorting(@Nullable String field) {
        return withSorting(field, SortDirection.ASC.getLabel());
    }

    /**
     * Unknown fields and directions are replaced with the command default sort.
     */
    public ListBuilder<E> withSorting(@Nullable String field, @Nullable String direction) {
        ListSort defaultSort = command.getDefaultSorting();
        SortDirection resolved = SortDirection.fromLabel(direction);
        if (resolved == null) {
            resolved = defaultSort.direction;
        }
        String resolvedField = field;
        if (StringUtils.isBlank(resolvedField) || !command.getAvailableSorting().contains(resolvedField)) {
            resolvedField = defaultSort.field;
        }
        this.sorting = new ListSort(resolvedField, resolved);
        return this;
    }

    public ListBuilder<E> withProjection(@Nullable Map<String, Boolean> projection) {
        this.projection = projection;
        return this;
    }

    public ListBuilder<E> withSerialization(@Nullable Function<Object, ?> serializer) {
        return withSerialization(serializer, false, false);
    }

    public ListBuilder<E> withSerialization(@Nullable Function<Object, ?> serializer, boolean rowAsDict, boolean asMap) {
        this.serialization = new ListSerialization(serializer, rowAsDict, asMap);
        return this;
    }

    public Document getFiltering() {
        return filtering;
    }

    @Nullable
    public ListPagination getPagination() {
        return pagination;
    }

    @Nullable
    public ListSort getSorting() {
        return sorting;
    }

    @Nullable
    public Map<String, Boolean> getProjection() {
        return projection;
    }

    @Nullable
    public Function<Object, ?> getSerializer() {
        return serialization == null ? null : serialization.serializer;
    }

    public boolean isRowAsDict() {
        return serialization != null && serialization.rowAsDict;
    }

    public boolean isReturnAsMap() {
        return serialization != null && serialization.asMap;
    }

    public Uni<ListResult> fetchData() {
        return command.execute(this);
    }

    public Uni<CountedListResult> fetchWithCount() {
        return command.executeWithCount(this);
    }
}

package com.e2eq.restcore.rest;

import com.e2eq.restcore.config.RestCoreConfig;
import com.e2eq.restcore.model.persistent.commands.ListBuilder;
import lombok.Getter;
import lombok.ToString;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * The {@code page}, {@code limit}, {@code sort} and {@code order} parameters of a list request.
 * Values are passed to the builder untouched, it applies the defaults.
 */
@Getter
@ToString
public class ListQueryParams {
    public static final String PAGE = "page";
    public static final String LIMIT = "limit";
    public static final String SORT = "sort";
    public static final String ORDER = "order";

    private final String page;
    private final String limit;
    private final String sort;
    private final String order;

    public ListQueryParams(@Nullable String page, @Nullable String limit, @Nullable String sort, @Nullable String order) {
        this.page = page;
        this.limit = limit;
        this.sort = sort;
        this.order = order;
    }

    /**
     * @param params query parameters, usually {@code UriInfo.getQueryParameters()}
     */
    public static ListQueryParams from(@Nullable Map<String, List<String>> params) {
        return new ListQueryParams(
                RequestUtils.lastValue(params, PAGE),
                RequestUtils.lastValue(params, LIMIT),
                RequestUtils.lastValue(params, SORT),
                RequestUtils.lastValue(params, ORDER));
    }

    public <E> ListBuilder<E> applyTo(ListBuilder<E> builder) {
        return builder.withPagination(page, limit).withSorting(sort, order);
    }

    public <E> ListBuilder<E> applyTo(ListBuilder<E> builder, RestCoreConfig.Listing listing) {
        return builder.withPagination(page, limit, listing.perPage(), listing.maxPerPage()).withSorting(sort, order);
    }
}

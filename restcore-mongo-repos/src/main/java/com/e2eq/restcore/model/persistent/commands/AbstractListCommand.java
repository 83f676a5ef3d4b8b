package com.e2eq.restcore.model.persistent.commands;

import com.e2eq.restcore.model.persistent.mongo.DocumentRepository;
import io.quarkus.logging.Log;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * A listable resource: the repository it reads from, the filters and sort fields it accepts and its
 * default order. Subclasses are stateless and shared between requests; each request gets its own
 * {@link ListBuilder} from {@link #newBuilder()}.
 *
 * @param <E> entity type of the repository
 */
public abstract class AbstractListCommand<E> {

    public abstract DocumentRepository<E> getRepository();

    /**
     * Filters keyed by request parameter name.
     */
    public abstract Map<String, FieldFilter> getAvailableFiltering();

    public abstract Set<String> getAvailableSorting();

    public abstract ListSort getDefaultSorting();

    /**
     * Last chance to adjust the assembled filter before it reaches the repository.
     */
    protected Document postProcessFiltering(Document filtering) {
        return filtering;
    }

    public ListBuilder<E> newBuilder() {
        return new ListBuilder<>(this);
    }

    protected Function<Document, Object> getSerializer(@Nullable Function<Object, ?> serializer, boolean rowAsDict) {
        DocumentRepository<E> repository = getRepository();
        if (serializer != null) {
            if (rowAsDict) {
                return serializer::apply;
            }
            return row -> serializer.apply(repository.unserialize(row));
        }
        if (rowAsDict) {
            return row -> row;
        }
        return repository::unserialize;
    }

    @Nullable
    protected Bson buildFilter(ListBuilder<E> builder) {
        Document filtering = builder.getFiltering();
        if (filtering == null || filtering.isEmpty()) {
            return null;
        }
        return postProcessFiltering(filtering);
    }

    public Uni<ListResult> execute(ListBuilder<E> builder) {
        return fetch(builder, buildFilter(builder));
    }

    private Uni<ListResult> fetch(ListBuilder<E> builder, @Nullable Bson filter) {
        DocumentRepository<E> repository = getRepository();
        Bson sort = builder.getSorting() == null ? null : builder.getSorting().toSortDocument();
        int limit = builder.getPagination() == null ? 0 : builder.getPagination().limit;
        int skip = builder.getPagination() == null ? 0 : builder.getPagination().offset;
        Bson projection = builder.getProjection() == null ? null : new Document(new LinkedHashMap<>(builder.getProjection()));

        Function<Document, Object> serializer = getSerializer(builder.getSerializer(), builder.isRowAsDict());
        Multi<Document> rows = repository.stream(filter, sort, limit, skip, projection);

        if (builder.isReturnAsMap()) {
            String idName = repository.getIdName();
            return rows.collect()
                    .<Map<Object, Object>>in(LinkedHashMap::new, (map, row) -> map.put(row.get(idName), serializer.apply(row)))
                    .map(ListResult::ofMap);
        }
        // serializers may map a row to null, which Multi.map rejects
        return rows.collect()
                .<List<Object>>in(ArrayList::new, (list, row) -> list.add(serializer.apply(row)))
                .map(ListResult::ofList);
    }

    /**
     * Fetches the page and a total count. The count query runs only when more rows may exist than
     * were fetched: a non-first page, a completely filled page, or an empty page past the first one.
     */
    public Uni<CountedListResult> executeWithCount(ListBuilder<E> builder) {
        Bson filter = buildFilter(builder);
        ListPagination pagination = builder.getPagination();
        return fetch(builder, filter).flatMap(result -> {
            int size = result.size();
            boolean countNeeded;
            if (size > 0) {
                countNeeded = pagination != null && (pagination.offset != 0 || size >= pagination.limit);
            } else {
                countNeeded = pagination != null && pagination.offset > 0;
            }
            if (!countNeeded) {
                return Uni.createFrom().item(new CountedListResult(result, size));
            }
            Log.debugf("Counting %s for page of %d rows", getRepository().getCollectionName(), size);
            return getRepository().countAsync(filter).map(total -> new CountedListResult(result, total));
        });
    }
}

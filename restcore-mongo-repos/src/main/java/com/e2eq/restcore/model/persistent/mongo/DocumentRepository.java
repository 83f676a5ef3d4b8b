package com.e2eq.restcore.model.persistent.mongo;

import com.mongodb.client.AggregateIterable;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.InsertOneResult;
import com.mongodb.client.result.UpdateResult;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * CRUD and cursor access to one collection, bound to an entity type and its mapper.
 * Implementations hold no entity state; every read goes to the store and through the mapper.
 *
 * <p>Methods taking a plain {@code Map} of changes wrap it in {@code $set}; the {@code *Ex}
 * variants take a complete update document.</p>
 *
 * @param <E> entity type
 */
public interface DocumentRepository<E> {

    String getCollectionName();

    /**
     * Identifier key of stored records, {@code _id} for the default mapper.
     */
    String getIdName();

    Document serialize(E entity);

    E unserialize(Document record);

    @Nullable
    E findOne(@Nullable Bson filter, @Nullable Bson sort, @Nullable Bson projection);

    @Nullable
    E findById(Object id);

    @Nullable
    E findById(Object id, @Nullable Bson projection);

    /**
     * Raw records. A {@code limit} or {@code skip} of 0 means unset. The caller closes the iterator.
     */
    CloseableIterator<Document> find(@Nullable Bson filter, @Nullable Bson sort, int limit, int skip, @Nullable Bson projection);

    /**
     * Same as {@link #find} without blocking the caller: the cursor is iterated on the worker pool
     * and closed when the stream terminates or is cancelled.
     */
    Multi<Document> stream(@Nullable Bson filter, @Nullable Bson sort, int limit, int skip, @Nullable Bson projection);

    Multi<Document> findByIds(Collection<?> ids, @Nullable Document filter, @Nullable Bson sort, int limit, int offset);

    @Nullable
    E findByIdAndUpdate(Object id, Map<String, ?> changes, boolean returnFirst);

    @Nullable
    E findByIdAndUpdateEx(Object id, Bson update, boolean returnFirst);

    @Nullable
    E findOneAndUpdate(Bson filter, Map<String, ?> changes, boolean returnFirst);

    /**
     * @param returnFirst return the record as it was before the update
     */
    @Nullable
    E findOneAndUpdateEx(Bson filter, Bson update, boolean returnFirst, boolean upsert);

    @Nullable
    E findOneOrInsert(Bson filter, Bson update, boolean returnFirst);

    long count(@Nullable Bson filter);

    Uni<Long> countAsync(@Nullable Bson filter);

    /**
     * @param enforceId keep the entity identifier, otherwise the store assigns one
     */
    InsertOneResult insert(E entity, boolean enforceId);

    UpdateResult update(Object id, Map<String, ?> changes);

    UpdateResult updateEx(Object id, Bson update);

    UpdateResult updateOne(Bson filter, Map<String, ?> changes);

    UpdateResult updateOneEx(Bson filter, Bson update);

    UpdateResult updateMany(Bson filter, Map<String, ?> changes);

    UpdateResult updateManyEx(Bson filter, Bson update);

    UpdateResult updateOrInsert(Bson filter, Map<String, ?> changes, @Nullable Map<String, ?> setOnInsert);

    UpdateResult updateOrInsertEx(Bson filter, Document update, @Nullable Map<String, ?> setOnInsert);

    DeleteResult delete(Object id);

    DeleteResult deleteOne(Bson filter);

    DeleteResult deleteKeys(Collection<?> ids);

    DeleteResult deleteManyEx(Bson filter);

    DeleteResult purge();

    AggregateIterable<Document> aggregate(List<? extends Bson> pipeline);

    void dropCollection();
}

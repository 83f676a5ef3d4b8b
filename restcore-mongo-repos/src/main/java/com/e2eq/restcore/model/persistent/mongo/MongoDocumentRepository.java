package com.e2eq.restcore.model.persistent.mongo;

import com.e2eq.restcore.util.ExceptionLoggingUtils;
import com.mongodb.MongoException;
import com.mongodb.client.AggregateIterable;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Collation;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.ReturnDocument;
import com.mongodb.client.model.UpdateOptions;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.InsertOneResult;
import com.mongodb.client.result.UpdateResult;
import io.quarkus.logging.Log;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link DocumentRepository} over the synchronous Mongo driver.
 */
public class MongoDocumentRepository<E> implements DocumentRepository<E> {

    protected final MongoConnection connection;
    protected final String collectionName;
    protected final DocumentMapper<E> mapper;

    public MongoDocumentRepository(MongoConnection connection, String collectionName, DocumentMapper<E> mapper) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.collectionName = Objects.requireNonNull(collectionName, "collectionName");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public MongoCollection<Document> getCollection() {
        return connection.getDatabase().getCollection(collectionName);
    }

    /**
     * Collation applied to {@link #find}, none by default.
     */
    @Nullable
    protected Collation getCollation() {
        return null;
    }

    @Override
    public String getCollectionName() {
        return collectionName;
    }

    @Override
    public String getIdName() {
        return mapper.getIdKey();
    }

    @Override
    public Document serialize(E entity) {
        return mapper.serialize(entity);
    }

    @Override
    public E unserialize(Document record) {
        return record == null ? null : mapper.deserialize(record);
    }

    protected static Document set(Map<String, ?> changes) {
        return new Document("$set", new Document(changes));
    }

    protected static Document in(Collection<?> values) {
        return new Document("$in", new ArrayList<>(values));
    }

    protected Document byId(Object id) {
        return new Document(getIdName(), id);
    }

    private static Bson orEmpty(@Nullable Bson filter) {
        return filter == null ? new Document() : filter;
    }

    // find

    @Override
    public E findOne(@Nullable Bson filter, @Nullable Bson sort, @Nullable Bson projection) {
        FindIterable<Document> it = getCollection().find(orEmpty(filter));
        if (sort != null) {
            it = it.sort(sort);
        }
        if (projection != null) {
            it = it.projection(projection);
        }
        return unserialize(it.first());
    }

    @Override
    public E findById(Object id) {
        return findById(id, null);
    }

    @Override
    public E findById(Object id, @Nullable Bson projection) {
        return findOne(byId(id), null, projection);
    }

    @Override
    public CloseableIterator<Document> find(@Nullable Bson filter, @Nullable Bson sort, int limit, int skip, @Nullable Bson projection) {
        FindIterable<Document> it = getCollection().find(orEmpty(filter));
        if (projection != null) {
            it = it.projection(projection);
        }
        if (limit > 0) {
            it = it.limit(limit);
        }
        if (skip > 0) {
            it = it.skip(skip);
        }
        Collation collation = getCollation();
        if (collation != null) {
            it = it.collation(collation);
        }
        if (sort != null) {
            it = it.sort(sort);
        }
        if (Log.isDebugEnabled()) {
            Log.debugf("find on %s filter:%s sort:%s limit:%d skip:%d", collectionName, filter, sort, limit, skip);
        }
        return new MongoCursorIterator<>(it.iterator());
    }

    @Override
    public Multi<Document> stream(@Nullable Bson filter, @Nullable Bson sort, int limit, int skip, @Nullable Bson projection) {
        return Multi.createFrom().resource(
                        () -> find(filter, sort, limit, skip, projection),
                        cursor -> Multi.createFrom().<Document>iterable(() -> cursor))
                .withFinalizer(cursor -> {
                    cursor.close();
                })
                .onFailure(MongoException.class).invoke(e ->
                        ExceptionLoggingUtils.logWarn(e, "Streaming %s failed", collectionName))
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    @Override
    public Multi<Document> findByIds(Collection<?> ids, @Nullable Document filter, @Nullable Bson sort, int limit, int offset) {
        Document query = filter == null ? new Document() : new Document(filter);
        if (ids != null && ids.stream().anyMatch(Objects::nonNull)) {
            query.put(getIdName(), in(ids));
        }
        return stream(query, sort, limit, offset, null);
    }

    @Override
    public E findByIdAndUpdate(Object id, Map<String, ?> changes, boolean returnFirst) {
        return findOneAndUpdateEx(byId(id), set(changes), returnFirst, false);
    }

    @Override
    public E findByIdAndUpdateEx(Object id, Bson update, boolean returnFirst) {
        return findOneAndUpdateEx(byId(id), update, returnFirst, false);
    }

    @Override
    public E findOneAndUpdate(Bson filter, Map<String, ?> changes, boolean returnFirst) {
        return findOneAndUpdateEx(filter, set(changes), returnFirst, false);
    }

    @Override
    public E findOneAndUpdateEx(Bson filter, Bson update, boolean returnFirst, boolean upsert) {
        FindOneAndUpdateOptions options = new FindOneAndUpdateOptions()
                .returnDocument(returnFirst ? ReturnDocument.BEFORE : ReturnDocument.AFTER)
                .upsert(upsert);
        return unserialize(getCollection().findOneAndUpdate(filter, update, options));
    }

    @Override
    public E findOneOrInsert(Bson filter, Bson update, boolean returnFirst) {
        return findOneAndUpdateEx(filter, update, returnFirst, true);
    }

    // count

    @Override
    public long count(@Nullable Bson filter) {
        return getCollection().countDocuments(orEmpty(filter));
    }

    @Override
    public Uni<Long> countAsync(@Nullable Bson filter) {
        return Uni.createFrom().item(() -> count(filter))
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    // insert

    @Override
    public InsertOneResult insert(E entity, boolean enforceId) {
        Document record = serialize(entity);
        if (!enforceId) {
            record.remove(getIdName());
        }
        return getCollection().insertOne(record);
    }

    @Override
    public UpdateResult updateOrInsert(Bson filter, Map<String, ?> changes, @Nullable Map<String, ?> setOnInsert) {
        return updateOrInsertEx(filter, set(changes), setOnInsert);
    }

    @Override
    public UpdateResult updateOrInsertEx(Bson filter, Document update, @Nullable Map<String, ?> setOnInsert) {
        Document changes = new Document(update);
        if (setOnInsert != null && !setOnInsert.isEmpty()) {
            changes.put("$setOnInsert", new Document(setOnInsert));
        }
        return getCollection().updateOne(filter, changes, new UpdateOptions().upsert(true));
    }

    // update

    @Override
    public UpdateResult update(Object id, Map<String, ?> changes) {
        return updateEx(id, set(changes));
    }

    @Override
    public UpdateResult updateEx(Object id, Bson update) {
        return updateOneEx(byId(id), update);
    }

    @Override
    public UpdateResult updateOne(Bson filter, Map<String, ?> changes) {
        return updateOneEx(filter, set(changes));
    }

    @Override
    public UpdateResult updateOneEx(Bson filter, Bson update) {
        return getCollection().updateOne(filter, update);
    }

    @Override
    public UpdateResult updateMany(Bson filter, Map<String, ?> changes) {
        return updateManyEx(filter, set(changes));
    }

    @Override
    public UpdateResult updateManyEx(Bson filter, Bson update) {
        return getCollection().updateMany(filter, update);
    }

    // delete

    @Override
    public DeleteResult delete(Object id) {
        return getCollection().deleteOne(byId(id));
    }

    @Override
    public DeleteResult deleteOne(Bson filter) {
        return getCollection().deleteOne(filter);
    }

    @Override
    public DeleteResult deleteKeys(Collection<?> ids) {
        return getCollection().deleteMany(new Document(getIdName(), in(ids)));
    }

    @Override
    public DeleteResult deleteManyEx(Bson filter) {
        return getCollection().deleteMany(filter);
    }

    @Override
    public DeleteResult purge() {
        Log.warnf("Purging all records of %s", collectionName);
        return getCollection().deleteMany(new Document());
    }

    @Override
    public AggregateIterable<Document> aggregate(List<? extends Bson> pipeline) {
        return getCollection().aggregate(pipeline);
    }

    @Override
    public void dropCollection() {
        Log.warnf("Dropping collection %s", collectionName);
        getCollection().drop();
    }
}

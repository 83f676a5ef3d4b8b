package com.e2eq.restcore.model.persistent.mongo;

import com.mongodb.client.MongoDatabase;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.bson.Document;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Small helpers for building query fragments, plus collection maintenance.
 */
@ApplicationScoped
public class MongoUtils {

    private final MongoConnection connection;

    @Inject
    public MongoUtils(MongoConnection connection) {
        this.connection = connection;
    }

    public static Document inMatch(Collection<?> values) {
        return new Document("$in", new ArrayList<>(values));
    }

    /**
     * Range over epoch seconds taken from {@code data}. Only whole number values are used, so the
     * result is empty when neither bound is present.
     */
    public static Document matchDateRange(Map<String, ?> data, String fieldFrom, String fieldTo) {
        Document range = new Document();
        if (fieldFrom != null && isWholeNumber(data.get(fieldFrom))) {
            range.put("$gte", data.get(fieldFrom));
        }
        if (fieldTo != null && isWholeNumber(data.get(fieldTo))) {
            range.put("$lte", data.get(fieldTo));
        }
        return range;
    }

    /**
     * Regex match. {@code matching} is used as a regular expression, quote it when it comes from
     * user input.
     */
    public static Document matchString(String matching, String options, boolean matchFromStart) {
        Document res = new Document("$regex", matchFromStart ? "^" + matching : matching);
        if (options != null && !options.isEmpty()) {
            res.put("$options", options);
        }
        return res;
    }

    public static Document matchString(String matching) {
        return matchString(matching, "i", true);
    }

    /**
     * Drops the given collections, or every collection of the database when none are given.
     */
    public void dropCollections(Collection<String> collections) {
        MongoDatabase db = connection.getDatabase();
        List<String> names = new ArrayList<>();
        if (collections != null && !collections.isEmpty()) {
            names.addAll(collections);
        } else {
            db.listCollectionNames().into(names);
        }
        for (String name : names) {
            Log.infof("Dropping collection %s", name);
            db.getCollection(name).drop();
        }
    }

    private static boolean isWholeNumber(Object value) {
        return value instanceof Integer || value instanceof Long;
    }
}

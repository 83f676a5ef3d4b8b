package com.e2eq.restcore.model.persistent.mongo;

import com.e2eq.restcore.model.BaseDocument;
import com.e2eq.restcore.model.ValueObject;
import com.e2eq.restcore.util.ParseUtils;
import org.bson.Document;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Stores the entity {@code uuid} as the record {@code _id} and maps it back on read.
 */
public class DocumentMongoMapper<E extends BaseDocument> implements DocumentMapper<E> {
    public static final String DB_KEY = "_id";
    public static final String OBJ_KEY = "uuid";

    private final Supplier<E> factory;

    public DocumentMongoMapper(Supplier<E> factory) {
        this.factory = factory;
    }

    @Override
    public Document serialize(E entity) {
        Document doc = new Document(DB_KEY, entity.getUuid());
        for (Map.Entry<String, Object> e : entity.toMap().entrySet()) {
            if (!OBJ_KEY.equals(e.getKey())) {
                doc.put(e.getKey(), e.getValue());
            }
        }
        return doc;
    }

    @Override
    public E deserialize(Document record) {
        E entity = ValueObject.fromMap(factory, record);
        if (record.containsKey(DB_KEY)) {
            entity.setUuid(ParseUtils.parseUuid(record.get(DB_KEY)));
        }
        return entity;
    }

    @Override
    public String getIdKey() {
        return DB_KEY;
    }
}

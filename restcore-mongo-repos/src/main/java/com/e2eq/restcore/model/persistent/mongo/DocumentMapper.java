package com.e2eq.restcore.model.persistent.mongo;

import org.bson.Document;

/**
 * Translates between stored records and in-memory entities.
 *
 * @param <E> entity type
 */
public interface DocumentMapper<E> {

    Document serialize(E entity);

    E deserialize(Document record);

    /**
     * Name of the identifier key in stored records.
     */
    String getIdKey();
}

package com.e2eq.restcore.model.persistent.mongo;

import java.util.Iterator;

public interface CloseableIterator<T> extends Iterator<T>, AutoCloseable {
    /**
     * Releases the underlying cursor. Safe to call more than once.
     */
    @Override
    void close();
}

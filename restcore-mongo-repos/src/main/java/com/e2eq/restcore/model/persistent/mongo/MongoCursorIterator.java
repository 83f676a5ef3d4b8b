package com.e2eq.restcore.model.persistent.mongo;

import com.mongodb.client.MongoCursor;

import java.util.NoSuchElementException;

/**
 * {@link CloseableIterator} over a driver cursor. The cursor is closed once exhausted.
 */
class MongoCursorIterator<T> implements CloseableIterator<T> {
    private final MongoCursor<T> cursor;
    private boolean closed;

    MongoCursorIterator(MongoCursor<T> cursor) {
        this.cursor = cursor;
    }

    @Override
    public boolean hasNext() {
        if (closed) {
            return false;
        }
        boolean next = cursor.hasNext();
        if (!next) {
            close();
        }
        return next;
    }

    @Override
    public T next() {
        if (closed) {
            throw new NoSuchElementException("cursor closed");
        }
        return cursor.next();
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            cursor.close();
        }
    }
}

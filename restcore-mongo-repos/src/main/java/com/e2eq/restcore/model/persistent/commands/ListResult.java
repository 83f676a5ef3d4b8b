package com.e2eq.restcore.model.persistent.commands;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Rows of one fetch, either as an ordered list or keyed by record id.
 */
public class ListResult {
    private final List<Object> rows;
    private final Map<Object, Object> rowsById;

    protected ListResult(List<Object> rows, Map<Object, Object> rowsById) {
        this.rows = rows;
        this.rowsById = rowsById;
    }

    public static ListResult ofList(List<Object> rows) {
        return new ListResult(Collections.unmodifiableList(rows), null);
    }

    public static ListResult ofMap(Map<Object, Object> rowsById) {
        return new ListResult(null, Collections.unmodifiableMap(rowsById));
    }

    public boolean isMap() {
        return rowsById != null;
    }

    /**
     * @throws IllegalStateException when the result was collected as a map
     */
    public List<Object> getRows() {
        if (rows == null) {
            throw new IllegalStateException("result was collected as a map");
        }
        return rows;
    }

    public Map<Object, Object> getRowsById() {
        if (rowsById == null) {
            throw new IllegalStateException("result was collected as a list");
        }
        return rowsById;
    }

    /**
     * The list or the map, whichever was collected.
     */
    public Object getData() {
        return isMap() ? rowsById : rows;
    }

    public int size() {
        return isMap() ? rowsById.size() : rows.size();
    }

    @Override
    public String toString() {
        return "ListResult(" + getData() + ")";
    }
}

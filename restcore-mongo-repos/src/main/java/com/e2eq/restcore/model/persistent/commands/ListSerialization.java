package com.e2eq.restcore.model.persistent.commands;

import lombok.ToString;

import java.util.function.Function;

/**
 * How fetched rows are turned into results.
 * <ul>
 *    <li>{@code serializer} applied to each row, may be null,</li>
 *    <li>{@code rowAsDict} hands the serializer the raw record instead of the mapped entity,</li>
 *    <li>{@code asMap} collects an id keyed map instead of a list.</li>
 * </ul>
 */
@ToString
public final class ListSerialization {
    public final Function<Object, ?> serializer;
    public final boolean rowAsDict;
    public final boolean asMap;

    public ListSerialization(Function<Object, ?> serializer, boolean rowAsDict, boolean asMap) {
        this.serializer = serializer;
        this.rowAsDict = rowAsDict;
        this.asMap = asMap;
    }
}

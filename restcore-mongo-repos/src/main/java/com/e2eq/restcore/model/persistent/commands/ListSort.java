package com.e2eq.restcore.model.persistent.commands;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.bson.Document;

@EqualsAndHashCode
@ToString
public final class ListSort {
    public final String field;
    public final SortDirection direction;

    public ListSort(String field, SortDirection direction) {
        this.field = field;
        this.direction = direction;
    }

    public Document toSortDocument() {
        return new Document(field, direction.getOrder());
    }
}

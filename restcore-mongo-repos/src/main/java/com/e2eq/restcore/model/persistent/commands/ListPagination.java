package com.e2eq.restcore.model.persistent.commands;

import lombok.EqualsAndHashCode;
import lombok.ToString;

@EqualsAndHashCode
@ToString
public final class ListPagination {
    public final int limit;
    public final int offset;

    public ListPagination(int limit, int offset) {
        this.limit = limit;
        this.offset = offset;
    }
}

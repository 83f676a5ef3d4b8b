package com.e2eq.restcore.model.persistent.commands;

import lombok.Getter;

@Getter
public class CountedListResult {
    private final ListResult result;
    private final long totalCount;

    public CountedListResult(ListResult result, long totalCount) {
        this.result = result;
        this.totalCount = totalCount;
    }

    @Override
    public String toString() {
        return "CountedListResult(totalCount=" + totalCount + ", result=" + result + ")";
    }
}

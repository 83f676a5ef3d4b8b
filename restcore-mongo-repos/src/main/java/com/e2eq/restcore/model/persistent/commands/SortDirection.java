package com.e2eq.restcore.model.persistent.commands;

public enum SortDirection {
    ASC("asc", 1),
    DESC("desc", -1);

    private final String label;
    private final int order;

    SortDirection(String label, int order) {
        this.label = label;
        this.order = order;
    }

    public String getLabel() {
        return label;
    }

    public int getOrder() {
        return order;
    }

    /**
     * @return the direction for "asc" or "desc", null for anything else
     */
    public static SortDirection fromLabel(String label) {
        for (SortDirection d : values()) {
            if (d.label.equals(label)) {
                return d;
            }
        }
        return null;
    }
}

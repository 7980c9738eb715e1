package com.jobbergate.cli;

import java.util.Map;

/** Ordering requested on a list command. UNSORTED leaves ordering to the API. */
public enum SortOrder {
    ASCENDING,
    DESCENDING,
    UNSORTED;

    /** Adds {@code sort_ascending} (when sorted) and {@code sort_field} (when given) to the query. */
    public void applyTo(Map<String, Object> params, String sortField) {
        if (this != UNSORTED) {
            params.put("sort_ascending", this == ASCENDING);
        }
        if (sortField != null) {
            params.put("sort_field", sortField);
        }
    }
}

package com.jobbergate.api.service;

/**
 * Filters shared by the list endpoints.
 *
 * @param all           include rows without an identifier (ignored by job scripts)
 * @param owner         restrict to rows owned by this email; null for everyone's
 * @param search        case-insensitive substring over name, identifier and description
 * @param sortField     JSON name of the column to order by; null for id order
 * @param sortAscending direction of {@code sortField}
 */
public record ListQuery(boolean all, String owner, String search, String sortField, boolean sortAscending) {

    public static ListQuery everything() {
        return new ListQuery(true, null, null, null, true);
    }
}

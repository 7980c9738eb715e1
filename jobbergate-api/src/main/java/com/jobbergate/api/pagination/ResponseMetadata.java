package com.jobbergate.api.pagination;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Metadata attached to every list response.
 *
 * {@code page} and {@code perPage} are absent from the JSON when the request
 * was not paginated.
 *
 * @param total row count of the unpaginated query
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResponseMetadata(long total, Integer page, Integer perPage) {}

package com.jobbergate.api.pagination;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Page number and page size requested by a list call.
 *
 * Both components are null when the caller did not ask for pagination; the
 * packaged response then carries every row and no page metadata.
 *
 * @param page    zero-based page number, or null
 * @param perPage page size, or null
 */
public record Pagination(Integer page, Integer perPage) {

    public Pagination {
        if (page != null && page < 0) {
            throw new IllegalArgumentException("page parameter must be greater than or equal to zero");
        }
        if (perPage != null && perPage <= 0) {
            throw new IllegalArgumentException("per_page parameter must be greater than zero");
        }
        if ((page == null) != (perPage == null)) {
            throw new IllegalArgumentException("page and per_page must be given together");
        }
    }

    /** No pagination: every row is returned. */
    public static Pagination none() {
        return new Pagination(null, null);
    }

    /**
     * Build from raw query parameters.
     *
     * Pagination counts as requested when either parameter is present; the
     * missing one is filled with page 0 or {@code defaultPerPage}.
     */
    public static Pagination fromRequest(Integer page, Integer perPage, int defaultPerPage) {
        if (page == null && perPage == null) {
            return none();
        }
        return new Pagination(page == null ? 0 : page, perPage == null ? defaultPerPage : perPage);
    }

    public boolean isRequested() {
        return page != null;
    }

    public Pageable toPageable(Sort sort) {
        return isRequested() ? PageRequest.of(page, perPage, sort) : Pageable.unpaged(sort);
    }

    public Map<String, Integer> toMap() {
        Map<String, Integer> map = new LinkedHashMap<>();
        map.put("page", page);
        map.put("per_page", perPage);
        return map;
    }

    @Override
    public String toString() {
        return "page=" + page + ", per_page=" + perPage;
    }
}

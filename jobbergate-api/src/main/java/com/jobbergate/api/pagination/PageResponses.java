package com.jobbergate.api.pagination;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.List;

/**
 * Runs an ordered query and packages its result as a {@link ListResponseEnvelope}.
 */
public final class PageResponses {

    private PageResponses() {}

    /**
     * Execute {@code spec} ordered by {@code sort}.
     *
     * With pagination: the slice for the requested page and the total count of
     * the unpaginated query (a page past the end is an empty slice). Without:
     * every matching row, and its count as the total.
     */
    public static <E> ListResponseEnvelope<E> packageResponse(JpaSpecificationExecutor<E> executor,
                                                              Specification<E> spec,
                                                              Sort sort,
                                                              Pagination pagination) {
        if (!pagination.isRequested()) {
            List<E> all = executor.findAll(spec, sort);
            return new ListResponseEnvelope<>(all, new ResponseMetadata(all.size(), null, null));
        }
        Page<E> page = executor.findAll(spec, pagination.toPageable(sort));
        return new ListResponseEnvelope<>(
                page.getContent(),
                new ResponseMetadata(page.getTotalElements(), pagination.page(), pagination.perPage()));
    }
}

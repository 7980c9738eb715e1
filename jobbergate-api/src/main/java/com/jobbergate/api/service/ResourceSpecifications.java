package com.jobbergate.api.service;

import jakarta.persistence.criteria.Predicate;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;

/**
 * Specification and Sort builders used by every resource's list query.
 */
final class ResourceSpecifications {

    private static final char LIKE_ESCAPE = '\\';

    private ResourceSpecifications() {}

    static <E> Specification<E> isNotNull(String attribute) {
        return (root, query, cb) -> cb.isNotNull(root.get(attribute));
    }

    static <E> Specification<E> equalTo(String attribute, Object value) {
        return (root, query, cb) -> cb.equal(root.get(attribute), value);
    }

    /** Substring match; {@code %} and {@code _} in {@code search} are literal. */
    static <E> Specification<E> containsIgnoreCase(String search, String... attributes) {
        String pattern = "%" + escapeLike(search.toLowerCase(Locale.ROOT)) + "%";
        return (root, query, cb) -> cb.or(Arrays.stream(attributes)
                .map(attribute -> cb.like(cb.lower(root.<String>get(attribute)), pattern, LIKE_ESCAPE))
                .toArray(Predicate[]::new));
    }

    static String escapeLike(String text) {
        return text.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }

    /**
     * Translate the requested sort column through {@code sortable}
     * (JSON field name to entity attribute). Ties and the default order use id.
     *
     * @throws IllegalArgumentException if the column is not sortable
     */
    static Sort sortFor(ListQuery query, Map<String, String> sortable) {
        if (query.sortField() == null || query.sortField().isBlank()) {
            return Sort.by(Sort.Direction.ASC, "id");
        }
        String attribute = sortable.get(query.sortField());
        if (attribute == null) {
            throw new IllegalArgumentException("Invalid sorting column: " + query.sortField());
        }
        Sort.Direction direction = query.sortAscending() ? Sort.Direction.ASC : Sort.Direction.DESC;
        Sort sort = Sort.by(direction, attribute);
        return attribute.equals("id") ? sort : sort.and(Sort.by(Sort.Direction.ASC, "id"));
    }

    static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}

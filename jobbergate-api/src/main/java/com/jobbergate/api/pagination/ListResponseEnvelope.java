package com.jobbergate.api.pagination;

import java.util.List;
import java.util.function.Function;

/**
 * Body of every list endpoint: one slice of results plus its metadata.
 */
public record ListResponseEnvelope<T>(List<T> results, ResponseMetadata metadata) {

    public <R> ListResponseEnvelope<R> map(Function<? super T, ? extends R> mapper) {
        List<R> mapped = results.stream().<R>map(mapper).toList();
        return new ListResponseEnvelope<>(mapped, metadata);
    }
}

package com.jobbergate.api.service;

/**
 * A keyed lookup found no row. Mapped to HTTP 404.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String resource, Object key) {
        super(resource + " not found: " + key);
    }
}

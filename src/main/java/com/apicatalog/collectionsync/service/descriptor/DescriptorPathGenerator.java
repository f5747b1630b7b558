package com.apicatalog.collectionsync.service.descriptor;

import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Generates stable, collision-free path templates for descriptors.
 *
 * Format Rules:
 * - Collection: /api/resource/{owner}
 * - Item:       /api/resource/{owner}/{id}
 * - Method:     /api/method/{owner}/{method}
 *
 * Owner and method names are percent-encoded as URI path segments, so "Sales Invoice" always
 * becomes "Sales%20Invoice" and two distinct names never share a segment.
 */
@Component
public class DescriptorPathGenerator {

    public static final String RESOURCE_PREFIX = "/api/resource/";
    public static final String METHOD_PREFIX = "/api/method/";
    public static final String ID_PLACEHOLDER = "{id}";

    public String collectionPath(String ownerType) {
        return RESOURCE_PREFIX + encode(ownerType);
    }

    public String itemPath(String ownerType) {
        return collectionPath(ownerType) + "/" + ID_PLACEHOLDER;
    }

    public String methodPath(String ownerType, String methodName) {
        return METHOD_PREFIX + encode(ownerType) + "/" + encode(methodName);
    }

    /**
     * Owner type a generated path belongs to, if the path follows the generator's convention.
     */
    public Optional<String> ownerTypeOf(String path) {
        if (path == null) {
            return Optional.empty();
        }
        String rest;
        if (path.startsWith(RESOURCE_PREFIX)) {
            rest = path.substring(RESOURCE_PREFIX.length());
        } else if (path.startsWith(METHOD_PREFIX)) {
            rest = path.substring(METHOD_PREFIX.length());
        } else {
            return Optional.empty();
        }
        int slash = rest.indexOf('/');
        String segment = slash >= 0 ? rest.substring(0, slash) : rest;
        if (segment.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UriUtils.decode(segment, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            // malformed escape, not one of ours
            return Optional.empty();
        }
    }

    private String encode(String segment) {
        if (segment == null || segment.isBlank()) {
            throw new IllegalArgumentException("Path segment must not be blank");
        }
        return UriUtils.encodePathSegment(segment, StandardCharsets.UTF_8);
    }
}

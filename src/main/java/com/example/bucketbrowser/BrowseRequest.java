package com.example.bucketbrowser;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A browse request: the path after the site root and its query parameters. Valueless parameters such as
 * {@code ?view} map to the empty string.
 */
public record BrowseRequest(
        String path,
        Map<String, String> query
) {
    public BrowseRequest {
        path = path == null ? "" : path;
        query = query == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(query));
    }

    public static BrowseRequest of(String path) {
        return new BrowseRequest(path, Map.of());
    }

    /**
     * Splits a request target like {@code a/b.json?view} into path and decoded query parameters.
     *
     * @throws IllegalArgumentException if a query parameter holds a malformed percent escape
     */
    public static BrowseRequest parse(String target) {
        int question = target.indexOf('?');
        if (question < 0) {
            return of(target);
        }
        Map<String, String> query = new LinkedHashMap<>();
        for (String pair : target.substring(question + 1).split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int equals = pair.indexOf('=');
            String name = equals < 0 ? pair : pair.substring(0, equals);
            String value = equals < 0 ? "" : pair.substring(equals + 1);
            query.putIfAbsent(decode(name), decode(value));
        }
        return new BrowseRequest(target.substring(0, question), query);
    }

    public boolean hasParameter(String name) {
        return query.containsKey(name);
    }

    private static String decode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Malformed query parameter: " + value, ex);
        }
    }
}

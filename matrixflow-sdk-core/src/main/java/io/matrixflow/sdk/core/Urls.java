package io.matrixflow.sdk.core;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Utility to normalize the service base URL and build request URLs with
 * lexicographically sorted query parameter keys.
 */
public final class Urls {
    private Urls() {}

    /**
     * Normalizes a base URL: scheme and host are required, query and fragment are dropped
     * and trailing slashes are trimmed.
     *
     * @throws IllegalArgumentException if the URL cannot be parsed or lacks scheme or host
     */
    public static String normalizeBaseUrl(String baseUrl) {
        String trimmed = baseUrl == null ? "" : baseUrl.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("baseUrl is required");
        }
        URI parsed;
        try {
            parsed = new URI(trimmed);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("invalid baseUrl: " + trimmed, e);
        }
        if (parsed.getScheme() == null || parsed.getHost() == null) {
            throw new IllegalArgumentException("baseUrl must include scheme and host");
        }
        String s;
        try {
            s = new URI(parsed.getScheme(), parsed.getRawUserInfo(), parsed.getHost(), parsed.getPort(),
                    parsed.getPath(), null, null).toString();
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("invalid baseUrl: " + trimmed, e);
        }
        int end = s.length();
        while (end > 0 && s.charAt(end - 1) == '/') end--;
        return s.substring(0, end);
    }

    public static URI resolve(String baseUrl, String path, Map<String, String> params) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("request path cannot be empty");
        }
        String p = path.startsWith("/") ? path : "/" + path;
        return withQuery(URI.create(baseUrl + p), params);
    }

    public static URI withQuery(URI base, Map<String, String> params) {
        Objects.requireNonNull(base, "base");
        if (params == null || params.isEmpty()) return base;

        TreeMap<String, String> sorted = new TreeMap<>(params);
        StringBuilder sb = new StringBuilder(base.toString());
        sb.append(base.getQuery() == null ? "?" : "&");

        boolean first = true;
        for (Map.Entry<String, String> e : sorted.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            if (!first) sb.append("&");
            first = false;
            sb.append(encode(e.getKey())).append("=").append(encode(e.getValue()));
        }
        return URI.create(sb.toString());
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}

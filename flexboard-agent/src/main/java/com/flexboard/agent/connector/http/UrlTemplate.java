package com.flexboard.agent.connector.http;

import com.flexboard.agent.error.ValidationException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands {@code {name}} placeholders in a URL template.
 *
 * <p>Placeholder values are percent-encoded. Parameters the template does not use are appended
 * as query string pairs (lists as repeated pairs, nulls skipped).
 */
public final class UrlTemplate {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_.-]*)}");

    private UrlTemplate() {
    }

    /**
     * Expand a template into an absolute URI.
     *
     * @param baseUrl backend base url, may be null when templates are absolute
     * @param template absolute URL or path relative to {@code baseUrl}
     * @param params parameters in insertion order
     * @return expanded uri
     * @throws ValidationException on missing or non-scalar values or an invalid result
     */
    public static URI expand(String baseUrl, String template, Map<String, Object> params) {
        Map<String, Object> unused = new LinkedHashMap<>(params);
        Matcher m = PLACEHOLDER.matcher(template.trim());
        StringBuilder expanded = new StringBuilder();
        while (m.find()) {
            String name = m.group(1);
            if (!params.containsKey(name) || params.get(name) == null) {
                throw new ValidationException("Missing value for URL placeholder {" + name + "}");
            }
            unused.remove(name);
            m.appendReplacement(expanded, Matcher.quoteReplacement(encode(scalar(name, params.get(name)))));
        }
        m.appendTail(expanded);

        String url = resolve(baseUrl, expanded.toString());
        String query = queryString(unused);
        if (!query.isEmpty()) {
            url = url + (url.indexOf('?') == -1 ? "?" : "&") + query;
        }
        try {
            return new URI(url);
        } catch (URISyntaxException e) {
            throw new ValidationException("Invalid URL after expansion: " + e.getMessage(), e);
        }
    }

    static String resolve(String baseUrl, String path) {
        boolean hasBase = baseUrl != null && !baseUrl.isBlank();
        String lower = path.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            if (hasBase && !sameOrigin(toUri(baseUrl), toUri(path))) {
                throw new ValidationException("Absolute URL must stay on the configured host " + origin(toUri(baseUrl)));
            }
            return path;
        }
        if (!hasBase) {
            throw new ValidationException("Relative URL " + path + " needs a configured baseUrl");
        }
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        if (path.isEmpty()) {
            return base;
        }
        return path.startsWith("/") || path.startsWith("?") ? base + path : base + "/" + path;
    }

    /**
     * Whether two URIs share scheme, host and effective port.
     */
    static boolean sameOrigin(URI a, URI b) {
        return origin(a).equals(origin(b));
    }

    static String origin(URI uri) {
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        if (port == -1) {
            port = "https".equals(scheme) ? 443 : 80;
        }
        return scheme + "://" + host + ":" + port;
    }

    private static URI toUri(String url) {
        try {
            return new URI(url);
        } catch (URISyntaxException e) {
            throw new ValidationException("Invalid URL " + url + ": " + e.getMessage(), e);
        }
    }

    private static String queryString(Map<String, Object> params) {
        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, Object> entry : params.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof List<?> list) {
                for (Object element : list) {
                    if (element != null) {
                        joiner.add(encode(entry.getKey()) + "=" + encode(scalar(entry.getKey(), element)));
                    }
                }
            } else if (value != null) {
                joiner.add(encode(entry.getKey()) + "=" + encode(scalar(entry.getKey(), value)));
            }
        }
        return joiner.toString();
    }

    private static String scalar(String name, Object value) {
        if (value instanceof String
                || value instanceof Boolean
                || value instanceof Integer
                || value instanceof Long
                || value instanceof Short
                || value instanceof Double
                || value instanceof Float
                || value instanceof BigDecimal
                || value instanceof BigInteger) {
            return String.valueOf(value);
        }
        throw new ValidationException("Parameter " + name + " must be a scalar value, got " + value.getClass().getSimpleName());
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }
}

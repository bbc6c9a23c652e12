package tech.cfbd.mcp.upstream;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * A GET against the upstream API in canonical form.
 *
 * <p>Two requests with the same path and the same non-null parameters produce
 * the same canonical URL regardless of parameter order, and therefore the same
 * cache key. Canonical form:
 * <ul>
 *   <li>path with a leading slash and no trailing slash</li>
 *   <li>null-valued parameters dropped, keys sorted lexicographically</li>
 *   <li>keys and values percent-encoded as UTF-8, space as {@code %20}</li>
 *   <li>booleans as {@code true}/{@code false}, integral numbers without decimals</li>
 * </ul>
 *
 * @param path     normalized endpoint path, e.g. {@code /games}
 * @param params   the retained parameters in key order, rendered as strings
 * @param uri      the full canonical URL
 * @param cacheKey lowercase hex SHA-256 of the canonical URL
 */
public record UpstreamRequest(String path, Map<String, String> params, URI uri, String cacheKey) {

    public static UpstreamRequest of(String baseUrl, String path, Map<String, ?> params) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        String normalizedPath = normalizePath(path);

        TreeMap<String, String> sorted = new TreeMap<>();
        if (params != null) {
            params.forEach((key, value) -> {
                if (key != null && value != null) {
                    sorted.put(key, render(value));
                }
            });
        }

        StringBuilder url = new StringBuilder(stripTrailingSlash(baseUrl)).append(normalizedPath);
        if (!sorted.isEmpty()) {
            StringJoiner query = new StringJoiner("&", "?", "");
            sorted.forEach((key, value) -> query.add(encode(key) + "=" + encode(value)));
            url.append(query);
        }

        String canonical = url.toString();
        return new UpstreamRequest(normalizedPath, Map.copyOf(sorted), URI.create(canonical), sha256Hex(canonical));
    }

    static String normalizePath(String path) {
        String p = path == null ? "" : path.trim();
        if (!p.startsWith("/")) {
            p = "/" + p;
        }
        while (p.length() > 1 && p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        return p;
    }

    static String render(Object value) {
        if (value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return value.toString();
        }
        if (value instanceof Number) {
            BigDecimal decimal = new BigDecimal(value.toString()).stripTrailingZeros();
            return decimal.scale() <= 0 ? decimal.toBigInteger().toString() : decimal.toPlainString();
        }
        return value.toString();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String stripTrailingSlash(String baseUrl) {
        String b = baseUrl.trim();
        while (b.endsWith("/")) {
            b = b.substring(0, b.length() - 1);
        }
        return b;
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}

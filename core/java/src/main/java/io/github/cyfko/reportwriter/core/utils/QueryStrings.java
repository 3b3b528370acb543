package io.github.cyfko.reportwriter.core.utils;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Encodes link parameters as an {@code application/x-www-form-urlencoded} query string.
 */
public final class QueryStrings {

    private QueryStrings() {}

    /**
     * @param parameters link parameters, in the order they should appear
     * @return {@code name=value} pairs joined with {@code &}, without a leading {@code ?}
     */
    public static String encode(Map<String, String> parameters) {
        return parameters.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}

package io.github.cyfko.reportwriter.core.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QueryStrings Tests")
class QueryStringsTest {

    @Test
    @DisplayName("Should encode parameters in order")
    void shouldEncodeInOrder() {
        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("sort", "age");
        parameters.put("order", "desc");
        parameters.put("q", "a b&c");

        assertEquals("sort=age&order=desc&q=a+b%26c", QueryStrings.encode(parameters));
    }

    @Test
    @DisplayName("Should encode nothing for no parameters")
    void shouldEncodeEmpty() {
        assertEquals("", QueryStrings.encode(Map.of()));
    }
}

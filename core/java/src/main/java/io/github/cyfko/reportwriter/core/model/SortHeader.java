package io.github.cyfko.reportwriter.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Table header entry for one column.
 *
 * @param key column key
 * @param label header text
 * @param fieldName display-safe field name of the column
 * @param sortable whether the header links to a new sort
 * @param active whether the column drives the current order
 * @param activeDirection current direction when active, {@code null} otherwise
 * @param indicator configured direction marker when active, empty otherwise
 * @param linkDirection direction requested by the header link, {@code null} when not sortable
 * @param parameters request parameters to encode in the link, empty when not sortable
 */
public record SortHeader(
        String key,
        String label,
        String fieldName,
        boolean sortable,
        boolean active,
        SortDirection activeDirection,
        String indicator,
        SortDirection linkDirection,
        Map<String, String> parameters
) {
    public SortHeader {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(label, "label is required");
        indicator = indicator == null ? "" : indicator;
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }
}

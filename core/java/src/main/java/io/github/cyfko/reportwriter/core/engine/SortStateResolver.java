package io.github.cyfko.reportwriter.core.engine;

import io.github.cyfko.reportwriter.core.model.ColumnSpec;
import io.github.cyfko.reportwriter.core.model.SortDirection;
import io.github.cyfko.reportwriter.core.model.SortState;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Resolves the requested sort column and direction against the declared columns.
 * <p>
 * Pure function of its inputs. Malformed input never fails:
 * </p>
 * <ul>
 *   <li>an absent, blank, unknown or non-sortable key falls back to the default key</li>
 *   <li>any direction other than {@code asc}/{@code desc} (case-insensitive) means ascending</li>
 * </ul>
 * <p>
 * The default key itself is validated when the report definition is built; it is trusted here.
 * </p>
 */
public final class SortStateResolver {

    private static final Logger logger = Logger.getLogger(SortStateResolver.class.getName());

    private SortStateResolver() {}

    /**
     * @param requestedKey raw sort key from the request, may be {@code null}
     * @param requestedDirection raw direction from the request, may be {@code null}
     * @param columns declared columns
     * @param defaultKey configured default sort key
     * @return the resolved sort state
     */
    public static SortState resolve(String requestedKey, String requestedDirection, List<ColumnSpec> columns, String defaultKey) {
        Objects.requireNonNull(columns, "columns cannot be null");
        Objects.requireNonNull(defaultKey, "defaultKey cannot be null");

        String key = defaultKey;
        if (requestedKey != null && !requestedKey.isBlank()) {
            String candidate = requestedKey.trim();
            if (isSortable(candidate, columns)) {
                key = candidate;
            } else {
                logger.fine(() -> String.format("Ignoring sort key '%s', falling back to '%s'", requestedKey, defaultKey));
            }
        }

        return new SortState(key, SortDirection.parse(requestedDirection));
    }

    private static boolean isSortable(String key, List<ColumnSpec> columns) {
        for (ColumnSpec column : columns) {
            if (column.key().equals(key)) {
                return column.sortable();
            }
        }
        return false;
    }
}

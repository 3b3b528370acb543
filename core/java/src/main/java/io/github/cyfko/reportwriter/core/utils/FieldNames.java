package io.github.cyfko.reportwriter.core.utils;

import io.github.cyfko.reportwriter.core.model.ColumnSpec;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives display-safe field names from column query fragments.
 * <p>
 * The field name is what a result row is keyed by once the database has evaluated the select
 * expression:
 * </p>
 * <ul>
 *   <li>{@code DATE_FORMAT(l.created, '%m/%e/%Y') AS date} → {@code date}</li>
 *   <li>{@code p.name} → {@code name}</li>
 *   <li>{@code age} → {@code age}</li>
 * </ul>
 */
public final class FieldNames {

    private static final Pattern ALIAS = Pattern.compile("^.+\\s+AS\\s+(.+)$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern QUALIFIER = Pattern.compile("^[a-zA-Z0-9_]+\\.");

    private FieldNames() {}

    /**
     * @param queryFragment select expression
     * @return the alias if present, else the expression without its table qualifier
     */
    public static String displayName(String queryFragment) {
        String fragment = queryFragment.trim();
        Matcher alias = ALIAS.matcher(fragment);
        if (alias.matches()) {
            return alias.group(1).trim();
        }
        Matcher qualifier = QUALIFIER.matcher(fragment);
        if (qualifier.lookingAt()) {
            return fragment.substring(qualifier.end());
        }
        return fragment;
    }

    /**
     * @param columns declared columns
     * @return field names in declared order
     */
    public static List<String> of(List<ColumnSpec> columns) {
        return columns.stream()
                .map(column -> displayName(column.queryFragment()))
                .toList();
    }
}

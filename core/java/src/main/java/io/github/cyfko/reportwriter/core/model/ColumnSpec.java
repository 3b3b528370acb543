package io.github.cyfko.reportwriter.core.model;

import io.github.cyfko.reportwriter.core.exception.ReportConfigurationException;

import java.util.Objects;

/**
 * Immutable description of one reportable column.
 *
 * <h2>Component Details</h2>
 * <dl>
 *   <dt><strong>{@code key}</strong></dt>
 *   <dd>Stable identifier used in request parameters to select the sort column.</dd>
 *
 *   <dt><strong>{@code queryFragment}</strong></dt>
 *   <dd>SQL select expression, e.g. {@code DATE_FORMAT(l.created, '%m/%e/%Y') AS date}.</dd>
 *
 *   <dt><strong>{@code orderFragment}</strong></dt>
 *   <dd>SQL expression used in {@code ORDER BY}. Defaults to the query fragment; set it when the
 *       selected value is formatted text whose lexical order differs from the raw value
 *       (e.g. {@code l.created} for a formatted date).</dd>
 *
 *   <dt><strong>{@code displayLabel}</strong></dt>
 *   <dd>Header text shown to the user.</dd>
 *
 *   <dt><strong>{@code sortable}</strong></dt>
 *   <dd>Whether a sort link is offered for the column.</dd>
 * </dl>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * // Simplified definition: key, query and label all derived from the name
 * ColumnSpec name = ColumnSpec.simple("name", true);
 *
 * // Detailed definition
 * ColumnSpec date = ColumnSpec.builder("date")
 *     .query("DATE_FORMAT(l.created, '%m/%e/%Y') AS date")
 *     .order("l.created")
 *     .label("Date")
 *     .sortable(true)
 *     .build();
 * }</pre>
 *
 * @param key request-facing identifier, never blank
 * @param queryFragment select expression, never blank
 * @param orderFragment order-by expression, never blank
 * @param displayLabel header label, never {@code null}
 * @param sortable whether sorting is offered for this column
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ColumnSpec(String key, String queryFragment, String orderFragment, String displayLabel, boolean sortable) {

    /**
     * Canonical constructor with validation and defaulting of the optional components.
     *
     * @throws ReportConfigurationException if key or query fragment is blank
     */
    public ColumnSpec {
        if (key == null || key.isBlank()) {
            throw new ReportConfigurationException("Column key must not be blank");
        }
        if (queryFragment == null || queryFragment.isBlank()) {
            throw new ReportConfigurationException("Column '" + key + "' has a blank query fragment");
        }
        if (orderFragment == null || orderFragment.isBlank()) {
            orderFragment = queryFragment;
        }
        if (displayLabel == null) {
            displayLabel = capitalize(key);
        }
    }

    /**
     * Normalizes a simplified column definition (a bare column name).
     *
     * @param name column name, used as key and query fragment
     * @param sortable whether the column is sortable
     * @return the canonical column spec, labelled with the capitalized name
     */
    public static ColumnSpec simple(String name, boolean sortable) {
        return new ColumnSpec(name, name, name, capitalize(name), sortable);
    }

    /**
     * Starts a detailed column definition.
     *
     * @param key request-facing identifier
     * @return a new builder whose query fragment defaults to the key
     */
    public static Builder builder(String key) {
        return new Builder(key);
    }

    private static String capitalize(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }

    /**
     * Fluent builder for detailed column definitions.
     */
    public static final class Builder {
        private final String key;
        private String query;
        private String order;
        private String label;
        private boolean sortable = true;

        private Builder(String key) {
            this.key = key;
        }

        public Builder query(String query) {
            this.query = Objects.requireNonNull(query, "query");
            return this;
        }

        public Builder order(String order) {
            this.order = Objects.requireNonNull(order, "order");
            return this;
        }

        public Builder label(String label) {
            this.label = Objects.requireNonNull(label, "label");
            return this;
        }

        public Builder sortable(boolean sortable) {
            this.sortable = sortable;
            return this;
        }

        public ColumnSpec build() {
            String effectiveQuery = query != null ? query : key;
            return new ColumnSpec(key, effectiveQuery, order, label, sortable);
        }
    }
}

package io.github.cyfko.reportwriter.core.config;

import io.github.cyfko.reportwriter.core.exception.ReportConfigurationException;
import io.github.cyfko.reportwriter.core.model.ColumnSpec;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Immutable, validated configuration of a report: its ordered columns, its default sort key
 * and its {@link PagingConfig}.
 * <p>
 * Simplified column names and detailed {@link ColumnSpec}s may be mixed; simplified names are
 * normalized through {@link ColumnSpec#simple(String, boolean)} using the
 * {@code columnSortDefault} flag, so no later component ever sees anything but a
 * {@link ColumnSpec}.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ReportDefinition definition = ReportDefinition.builder()
 *     .column("name")
 *     .column("age")
 *     .column(ColumnSpec.builder("birthday")
 *         .query("DATE_FORMAT(birthday, '%m/%e/%Y') AS birthday")
 *         .order("birthday")
 *         .label("Birthday")
 *         .build())
 *     .defaultSort("name")
 *     .paging(PagingConfig.builder().resultsPerPage(10).build())
 *     .build();
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ReportDefinition {

    private final List<ColumnSpec> columns;
    private final String defaultSortKey;
    private final PagingConfig paging;

    private ReportDefinition(List<ColumnSpec> columns, String defaultSortKey, PagingConfig paging) {
        this.columns = List.copyOf(columns);
        this.defaultSortKey = defaultSortKey;
        this.paging = paging;
    }

    public static Builder builder() { return new Builder(); }

    public List<ColumnSpec> getColumns() { return columns; }
    public String getDefaultSortKey() { return defaultSortKey; }
    public PagingConfig getPaging() { return paging; }

    /**
     * @param key column key
     * @return the column declared with {@code key}, if any
     */
    public Optional<ColumnSpec> findColumn(String key) {
        return columns.stream().filter(c -> c.key().equals(key)).findFirst();
    }

    /**
     * Builder for {@link ReportDefinition}.
     */
    public static final class Builder {
        private final List<Function<Boolean, ColumnSpec>> declarations = new ArrayList<>();
        private boolean columnSortDefault = true;
        private String defaultSortKey;
        private PagingConfig paging = PagingConfig.defaults();

        /**
         * Declares a simplified column. Its sortability follows {@link #columnSortDefault(boolean)},
         * whenever that flag is set.
         */
        public Builder column(String name) {
            Objects.requireNonNull(name, "column name");
            declarations.add(sortDefault -> ColumnSpec.simple(name, sortDefault));
            return this;
        }

        public Builder column(ColumnSpec column) {
            Objects.requireNonNull(column, "column");
            declarations.add(sortDefault -> column);
            return this;
        }

        public Builder columns(List<ColumnSpec> columns) {
            columns.forEach(this::column);
            return this;
        }

        /**
         * Sortability of every simplified column. Ignored for detailed columns. Defaults to {@code true}.
         */
        public Builder columnSortDefault(boolean columnSortDefault) {
            this.columnSortDefault = columnSortDefault;
            return this;
        }

        public Builder defaultSort(String key) {
            this.defaultSortKey = key;
            return this;
        }

        public Builder paging(PagingConfig paging) {
            this.paging = Objects.requireNonNull(paging, "paging");
            return this;
        }

        /**
         * @return the validated definition
         * @throws ReportConfigurationException if no column is declared, keys are duplicated, or the
         *                                      default sort key is missing, unknown or not sortable
         */
        public ReportDefinition build() {
            if (declarations.isEmpty()) {
                throw new ReportConfigurationException("A report requires at least one column");
            }

            List<ColumnSpec> columns = new ArrayList<>(declarations.size());
            Set<String> keys = new HashSet<>();
            for (Function<Boolean, ColumnSpec> declaration : declarations) {
                ColumnSpec column = declaration.apply(columnSortDefault);
                if (!keys.add(column.key())) {
                    throw new ReportConfigurationException("Duplicate column key '" + column.key() + "'");
                }
                columns.add(column);
            }

            if (defaultSortKey == null || defaultSortKey.isBlank()) {
                throw new ReportConfigurationException("A default sort key is required");
            }
            ColumnSpec defaultColumn = columns.stream()
                    .filter(c -> c.key().equals(defaultSortKey))
                    .findFirst()
                    .orElseThrow(() -> new ReportConfigurationException(
                            "Default sort key '" + defaultSortKey + "' does not name a declared column"));
            if (!defaultColumn.sortable()) {
                throw new ReportConfigurationException(
                        "Default sort key '" + defaultSortKey + "' names a column that is not sortable");
            }

            return new ReportDefinition(columns, defaultSortKey, paging);
        }
    }
}

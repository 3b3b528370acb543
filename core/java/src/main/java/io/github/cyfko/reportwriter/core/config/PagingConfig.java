package io.github.cyfko.reportwriter.core.config;

import io.github.cyfko.reportwriter.core.exception.ReportConfigurationException;

import java.util.Objects;

/**
 * Paging and sorting knobs of a report: page size, size of the page window, request variable
 * names and the labels emitted in the paging bar and sort headers.
 * <p>
 * Validated once at {@link Builder#build()}; an instance is immutable and may be shared by every
 * report of an application.
 * </p>
 *
 * <h2>Defaults</h2>
 * <ul>
 *   <li>{@code resultsPerPage}: 25</li>
 *   <li>{@code pagesInList}: 5</li>
 *   <li>request variables: {@code page}, {@code sort}, {@code order}</li>
 *   <li>labels: {@code «}, {@code ‹}, {@code ›}, {@code »}; indicators {@code ▲} and {@code ▼}</li>
 * </ul>
 */
public final class PagingConfig {

    public static final int DEFAULT_RESULTS_PER_PAGE = 25;
    public static final int DEFAULT_PAGES_IN_LIST = 5;
    public static final String DEFAULT_PAGE_VARIABLE = "page";
    public static final String DEFAULT_SORT_VARIABLE = "sort";
    public static final String DEFAULT_DIRECTION_VARIABLE = "order";
    public static final String DEFAULT_FIRST_LABEL = "«";
    public static final String DEFAULT_PREVIOUS_LABEL = "‹";
    public static final String DEFAULT_NEXT_LABEL = "›";
    public static final String DEFAULT_LAST_LABEL = "»";
    public static final String DEFAULT_ASC_INDICATOR = "▲";
    public static final String DEFAULT_DESC_INDICATOR = "▼";

    private final int resultsPerPage;
    private final int pagesInList;
    private final String pageVariable;
    private final String sortVariable;
    private final String directionVariable;
    private final String firstLabel;
    private final String previousLabel;
    private final String nextLabel;
    private final String lastLabel;
    private final String ascIndicator;
    private final String descIndicator;

    private PagingConfig(Builder builder) {
        this.resultsPerPage = builder.resultsPerPage;
        this.pagesInList = builder.pagesInList;
        this.pageVariable = builder.pageVariable;
        this.sortVariable = builder.sortVariable;
        this.directionVariable = builder.directionVariable;
        this.firstLabel = builder.firstLabel;
        this.previousLabel = builder.previousLabel;
        this.nextLabel = builder.nextLabel;
        this.lastLabel = builder.lastLabel;
        this.ascIndicator = builder.ascIndicator;
        this.descIndicator = builder.descIndicator;
    }

    public static Builder builder() { return new Builder(); }

    public static PagingConfig defaults() { return builder().build(); }

    public int getResultsPerPage() { return resultsPerPage; }
    public int getPagesInList() { return pagesInList; }
    public String getPageVariable() { return pageVariable; }
    public String getSortVariable() { return sortVariable; }
    public String getDirectionVariable() { return directionVariable; }
    public String getFirstLabel() { return firstLabel; }
    public String getPreviousLabel() { return previousLabel; }
    public String getNextLabel() { return nextLabel; }
    public String getLastLabel() { return lastLabel; }
    public String getAscIndicator() { return ascIndicator; }
    public String getDescIndicator() { return descIndicator; }

    @Override
    public String toString() {
        return String.format("PagingConfig{resultsPerPage=%d, pagesInList=%d, variables=[%s, %s, %s]}",
                resultsPerPage, pagesInList, pageVariable, sortVariable, directionVariable);
    }

    /**
     * Builder for {@link PagingConfig}. Every knob has a default.
     */
    public static final class Builder {
        private int resultsPerPage = DEFAULT_RESULTS_PER_PAGE;
        private int pagesInList = DEFAULT_PAGES_IN_LIST;
        private String pageVariable = DEFAULT_PAGE_VARIABLE;
        private String sortVariable = DEFAULT_SORT_VARIABLE;
        private String directionVariable = DEFAULT_DIRECTION_VARIABLE;
        private String firstLabel = DEFAULT_FIRST_LABEL;
        private String previousLabel = DEFAULT_PREVIOUS_LABEL;
        private String nextLabel = DEFAULT_NEXT_LABEL;
        private String lastLabel = DEFAULT_LAST_LABEL;
        private String ascIndicator = DEFAULT_ASC_INDICATOR;
        private String descIndicator = DEFAULT_DESC_INDICATOR;

        public Builder resultsPerPage(int resultsPerPage) {
            this.resultsPerPage = resultsPerPage;
            return this;
        }

        public Builder pagesInList(int pagesInList) {
            this.pagesInList = pagesInList;
            return this;
        }

        public Builder pageVariable(String pageVariable) {
            this.pageVariable = Objects.requireNonNull(pageVariable, "pageVariable");
            return this;
        }

        public Builder sortVariable(String sortVariable) {
            this.sortVariable = Objects.requireNonNull(sortVariable, "sortVariable");
            return this;
        }

        public Builder directionVariable(String directionVariable) {
            this.directionVariable = Objects.requireNonNull(directionVariable, "directionVariable");
            return this;
        }

        public Builder firstLabel(String firstLabel) {
            this.firstLabel = Objects.requireNonNull(firstLabel, "firstLabel");
            return this;
        }

        public Builder previousLabel(String previousLabel) {
            this.previousLabel = Objects.requireNonNull(previousLabel, "previousLabel");
            return this;
        }

        public Builder nextLabel(String nextLabel) {
            this.nextLabel = Objects.requireNonNull(nextLabel, "nextLabel");
            return this;
        }

        public Builder lastLabel(String lastLabel) {
            this.lastLabel = Objects.requireNonNull(lastLabel, "lastLabel");
            return this;
        }

        public Builder ascIndicator(String ascIndicator) {
            this.ascIndicator = Objects.requireNonNull(ascIndicator, "ascIndicator");
            return this;
        }

        public Builder descIndicator(String descIndicator) {
            this.descIndicator = Objects.requireNonNull(descIndicator, "descIndicator");
            return this;
        }

        /**
         * @return the validated configuration
         * @throws ReportConfigurationException if a size is not positive, a variable name is blank,
         *                                      or two variables share a name
         */
        public PagingConfig build() {
            if (resultsPerPage <= 0) {
                throw new ReportConfigurationException("Results per page must be positive. Provided: " + resultsPerPage);
            }
            if (pagesInList <= 0) {
                throw new ReportConfigurationException("Pages in list must be positive. Provided: " + pagesInList);
            }
            requireName("page", pageVariable);
            requireName("sort", sortVariable);
            requireName("direction", directionVariable);
            if (pageVariable.equals(sortVariable) || pageVariable.equals(directionVariable)
                    || sortVariable.equals(directionVariable)) {
                throw new ReportConfigurationException(String.format(
                        "Request variables must be distinct. Provided: page=%s, sort=%s, direction=%s",
                        pageVariable, sortVariable, directionVariable));
            }
            return new PagingConfig(this);
        }

        private static void requireName(String role, String name) {
            if (name.isBlank()) {
                throw new ReportConfigurationException("The " + role + " request variable must not be blank");
            }
        }
    }
}

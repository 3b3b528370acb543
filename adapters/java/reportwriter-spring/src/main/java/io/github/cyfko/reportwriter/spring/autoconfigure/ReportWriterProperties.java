package io.github.cyfko.reportwriter.spring.autoconfigure;

import io.github.cyfko.reportwriter.core.config.PagingConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Report paging settings bound from {@code reportwriter.paging.*}.
 *
 * <pre>
 * reportwriter.paging.results-per-page=50
 * reportwriter.paging.pages-in-list=9
 * reportwriter.paging.page-variable=p
 * </pre>
 */
@ConfigurationProperties(prefix = "reportwriter")
public class ReportWriterProperties {
    private Paging paging = new Paging();

    public Paging getPaging() { return paging; }
    public void setPaging(Paging paging) { this.paging = paging; }

    public static class Paging {
        private int resultsPerPage = PagingConfig.DEFAULT_RESULTS_PER_PAGE;
        private int pagesInList = PagingConfig.DEFAULT_PAGES_IN_LIST;
        private String pageVariable = PagingConfig.DEFAULT_PAGE_VARIABLE;
        private String sortVariable = PagingConfig.DEFAULT_SORT_VARIABLE;
        private String directionVariable = PagingConfig.DEFAULT_DIRECTION_VARIABLE;
        private String firstLabel = PagingConfig.DEFAULT_FIRST_LABEL;
        private String previousLabel = PagingConfig.DEFAULT_PREVIOUS_LABEL;
        private String nextLabel = PagingConfig.DEFAULT_NEXT_LABEL;
        private String lastLabel = PagingConfig.DEFAULT_LAST_LABEL;
        private String ascIndicator = PagingConfig.DEFAULT_ASC_INDICATOR;
        private String descIndicator = PagingConfig.DEFAULT_DESC_INDICATOR;

        public int getResultsPerPage() { return resultsPerPage; }
        public void setResultsPerPage(int resultsPerPage) { this.resultsPerPage = resultsPerPage; }
        public int getPagesInList() { return pagesInList; }
        public void setPagesInList(int pagesInList) { this.pagesInList = pagesInList; }
        public String getPageVariable() { return pageVariable; }
        public void setPageVariable(String pageVariable) { this.pageVariable = pageVariable; }
        public String getSortVariable() { return sortVariable; }
        public void setSortVariable(String sortVariable) { this.sortVariable = sortVariable; }
        public String getDirectionVariable() { return directionVariable; }
        public void setDirectionVariable(String directionVariable) { this.directionVariable = directionVariable; }
        public String getFirstLabel() { return firstLabel; }
        public void setFirstLabel(String firstLabel) { this.firstLabel = firstLabel; }
        public String getPreviousLabel() { return previousLabel; }
        public void setPreviousLabel(String previousLabel) { this.previousLabel = previousLabel; }
        public String getNextLabel() { return nextLabel; }
        public void setNextLabel(String nextLabel) { this.nextLabel = nextLabel; }
        public String getLastLabel() { return lastLabel; }
        public void setLastLabel(String lastLabel) { this.lastLabel = lastLabel; }
        public String getAscIndicator() { return ascIndicator; }
        public void setAscIndicator(String ascIndicator) { this.ascIndicator = ascIndicator; }
        public String getDescIndicator() { return descIndicator; }
        public void setDescIndicator(String descIndicator) { this.descIndicator = descIndicator; }

        /**
         * @return the validated core configuration
         */
        public PagingConfig toPagingConfig() {
            return PagingConfig.builder()
                    .resultsPerPage(resultsPerPage)
                    .pagesInList(pagesInList)
                    .pageVariable(pageVariable)
                    .sortVariable(sortVariable)
                    .directionVariable(directionVariable)
                    .firstLabel(firstLabel)
                    .previousLabel(previousLabel)
                    .nextLabel(nextLabel)
                    .lastLabel(lastLabel)
                    .ascIndicator(ascIndicator)
                    .descIndicator(descIndicator)
                    .build();
        }
    }
}

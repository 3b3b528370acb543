package io.github.cyfko.reportwriter.core.model;

import java.util.List;

/**
 * Paging bar of a report page, in display order.
 *
 * @param pageLinks first/previous entries, the page window, then next/last entries
 * @param hasPrevious whether a previous page exists
 * @param hasNext whether a next page exists
 * @param firstIndex first page index, {@code 0} when there is no page
 * @param lastIndex last page index, {@code 0} when there is no page
 */
public record PageList(List<PageLink> pageLinks, boolean hasPrevious, boolean hasNext, int firstIndex, int lastIndex) {

    public PageList {
        pageLinks = List.copyOf(pageLinks);
    }

    /**
     * @return the numbered entries only
     */
    public List<PageLink> pages() {
        return pageLinks.stream()
                .filter(link -> link.kind() == PageLink.Kind.PAGE)
                .toList();
    }
}

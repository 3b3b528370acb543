package io.github.cyfko.reportwriter.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of the paging bar.
 *
 * @param kind role of the entry in the bar
 * @param label text to display
 * @param targetIndex one-based page the entry points to
 * @param current {@code true} for the entry of the page being displayed
 * @param parameters request parameters to encode in the link
 */
public record PageLink(Kind kind, String label, int targetIndex, boolean current, Map<String, String> parameters) {

    public PageLink {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(label, "label is required");
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /**
     * Role of a {@link PageLink} in the paging bar.
     */
    public enum Kind {
        FIRST,
        PREVIOUS,
        PAGE,
        NEXT,
        LAST
    }
}

package io.github.cyfko.reportwriter.core.model;

import java.util.Objects;

/**
 * Resolved sort state of a single request.
 *
 * @param activeKey key of the sortable column driving the order
 * @param direction sort direction
 */
public record SortState(String activeKey, SortDirection direction) {

    public SortState {
        Objects.requireNonNull(activeKey, "activeKey is required");
        Objects.requireNonNull(direction, "direction is required");
    }

    /**
     * Direction a sort link for {@code key} should request: the toggled direction when
     * {@code key} is already active, otherwise {@link SortDirection#ASC}.
     *
     * @param key column key of the header link
     * @return direction to encode in the link
     */
    public SortDirection nextDirectionFor(String key) {
        return activeKey.equals(key) ? direction.toggle() : SortDirection.ASC;
    }

    /**
     * @param key column key
     * @return {@code true} if {@code key} is the active sort column
     */
    public boolean isActive(String key) {
        return activeKey.equals(key);
    }
}

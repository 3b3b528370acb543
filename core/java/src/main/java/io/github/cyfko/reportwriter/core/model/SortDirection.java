package io.github.cyfko.reportwriter.core.model;

/**
 * Sort direction of the active report column.
 */
public enum SortDirection {
    /** Ascending order, the default for any column. */
    ASC,
    /** Descending order. */
    DESC;

    /**
     * Parses a raw request token into a direction.
     * <p>
     * Only {@code asc} and {@code desc} are recognized, case-insensitively and ignoring
     * surrounding whitespace. Any other value, {@code null} included, yields {@link #ASC}.
     * </p>
     *
     * @param raw untrusted request value, may be {@code null}
     * @return the parsed direction, never {@code null}
     */
    public static SortDirection parse(String raw) {
        if (raw == null) {
            return ASC;
        }
        return "desc".equalsIgnoreCase(raw.trim()) ? DESC : ASC;
    }

    /**
     * @return the opposite direction
     */
    public SortDirection toggle() {
        return this == ASC ? DESC : ASC;
    }

    /**
     * @return lower-case token used in request parameters ({@code asc} or {@code desc})
     */
    public String token() {
        return name().toLowerCase();
    }
}

package io.github.cyfko.reportwriter.core.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view over the parameters of the incoming request.
 * <p>
 * Every value is untrusted: it may be missing, blank or malformed. The resolvers normalize
 * such values to safe defaults; they never fail because of them.
 * </p>
 *
 * <p>{@link #asMap()} exposes all parameters so that generated links can carry along the ones
 * the report does not own (filters, date ranges, ...).</p>
 */
public interface RequestParameters {

    /**
     * @param name parameter name
     * @return the raw value, empty when absent
     */
    Optional<String> get(String name);

    /**
     * @return every parameter, in request order when the source keeps one
     */
    Map<String, String> asMap();

    /**
     * @return parameters of a request carrying none
     */
    static RequestParameters empty() {
        return of(Map.of());
    }

    /**
     * @param parameters single-valued parameters; {@code null} values are dropped
     * @return an immutable snapshot of {@code parameters}
     */
    static RequestParameters of(Map<String, String> parameters) {
        Objects.requireNonNull(parameters, "parameters cannot be null (use Map.of() for empty)");
        Map<String, String> copy = new LinkedHashMap<>();
        parameters.forEach((name, value) -> {
            if (name != null && value != null) {
                copy.put(name, value);
            }
        });
        return new MapRequestParameters(Collections.unmodifiableMap(copy));
    }

    /**
     * Adapts a servlet-style parameter map. Only the first value of each parameter is kept.
     *
     * @param parameters multi-valued parameters
     * @return an immutable snapshot
     */
    static RequestParameters ofMultiValued(Map<String, String[]> parameters) {
        Objects.requireNonNull(parameters, "parameters cannot be null");
        Map<String, String> firstValues = new LinkedHashMap<>();
        parameters.forEach((name, values) -> {
            if (values != null && values.length > 0) {
                firstValues.put(name, values[0]);
            }
        });
        return of(firstValues);
    }

    /**
     * Map-backed implementation.
     */
    record MapRequestParameters(Map<String, String> asMap) implements RequestParameters {
        @Override
        public Optional<String> get(String name) {
            return Optional.ofNullable(asMap.get(name));
        }
    }
}

package io.github.cyfko.reportwriter.core.render;

import io.github.cyfko.reportwriter.core.api.RequestParameters;
import io.github.cyfko.reportwriter.core.config.PagingConfig;
import io.github.cyfko.reportwriter.core.model.ColumnSpec;
import io.github.cyfko.reportwriter.core.model.SortDirection;
import io.github.cyfko.reportwriter.core.model.SortHeader;
import io.github.cyfko.reportwriter.core.model.SortState;
import io.github.cyfko.reportwriter.core.utils.FieldNames;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the table header entries of a report page.
 * <p>
 * A sortable column links to a sort on its own key. The link requests the opposite direction
 * when the column is already active and ascending order otherwise. Sort links drop the page
 * variable, so a new order starts on page 1, and keep every other incoming parameter.
 * The active column carries the configured direction indicator.
 * </p>
 */
public final class SortHeaderRenderer {

    private SortHeaderRenderer() {}

    /**
     * @param columns declared columns
     * @param sortState sort state of the current request
     * @param config variable names and indicators
     * @param request incoming parameters to carry along in each link
     * @return one header per column, in declared order
     */
    public static List<SortHeader> render(List<ColumnSpec> columns, SortState sortState, PagingConfig config,
                                          RequestParameters request) {
        Objects.requireNonNull(columns, "columns cannot be null");
        Objects.requireNonNull(sortState, "sortState cannot be null");
        Objects.requireNonNull(config, "config cannot be null");
        Objects.requireNonNull(request, "request cannot be null");

        List<SortHeader> headers = new ArrayList<>(columns.size());
        for (ColumnSpec column : columns) {
            String fieldName = FieldNames.displayName(column.queryFragment());
            boolean active = column.sortable() && sortState.isActive(column.key());
            SortDirection activeDirection = active ? sortState.direction() : null;
            String indicator = !active ? "" :
                    activeDirection == SortDirection.ASC ? config.getAscIndicator() : config.getDescIndicator();

            if (!column.sortable()) {
                headers.add(new SortHeader(column.key(), column.displayLabel(), fieldName, false,
                        false, null, indicator, null, Map.of()));
                continue;
            }

            SortDirection linkDirection = sortState.nextDirectionFor(column.key());
            Map<String, String> parameters = new LinkedHashMap<>(request.asMap());
            parameters.remove(config.getPageVariable());
            parameters.put(config.getSortVariable(), column.key());
            parameters.put(config.getDirectionVariable(), linkDirection.token());

            headers.add(new SortHeader(column.key(), column.displayLabel(), fieldName, true,
                    active, activeDirection, indicator, linkDirection, parameters));
        }
        return headers;
    }
}

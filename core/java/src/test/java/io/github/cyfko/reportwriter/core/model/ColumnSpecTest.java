package io.github.cyfko.reportwriter.core.model;

import io.github.cyfko.reportwriter.core.exception.ReportConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ColumnSpec Tests")
class ColumnSpecTest {

    @Test
    @DisplayName("Should normalize a simplified column")
    void shouldNormalizeSimplifiedColumn() {
        ColumnSpec column = ColumnSpec.simple("address1", true);

        assertEquals("address1", column.key());
        assertEquals("address1", column.queryFragment());
        assertEquals("address1", column.orderFragment());
        assertEquals("Address1", column.displayLabel());
        assertTrue(column.sortable());
    }

    @Test
    @DisplayName("Should default the order fragment to the query fragment")
    void shouldDefaultOrderFragment() {
        ColumnSpec column = ColumnSpec.builder("phone").query("phone_number").label("Phone Number").sortable(false).build();

        assertEquals("phone_number", column.orderFragment());
        assertEquals("Phone Number", column.displayLabel());
        assertFalse(column.sortable());
    }

    @Test
    @DisplayName("Should default the query fragment to the key and the label to the capitalized key")
    void shouldDefaultQueryAndLabel() {
        ColumnSpec column = ColumnSpec.builder("city").build();

        assertEquals("city", column.queryFragment());
        assertEquals("City", column.displayLabel());
        assertTrue(column.sortable());
    }

    @Test
    @DisplayName("Should keep a distinct order fragment")
    void shouldKeepOrderFragment() {
        ColumnSpec column = ColumnSpec.builder("date")
                .query("DATE_FORMAT(l.created, '%m/%e/%Y') AS date")
                .order("l.created")
                .build();

        assertEquals("l.created", column.orderFragment());
    }

    @Test
    @DisplayName("Should reject blank keys and query fragments")
    void shouldRejectBlankParts() {
        assertThrows(ReportConfigurationException.class, () -> ColumnSpec.simple(" ", true));
        assertThrows(ReportConfigurationException.class, () -> new ColumnSpec("k", "", null, null, true));
        assertThrows(ReportConfigurationException.class, () -> new ColumnSpec(null, "q", null, null, true));
    }
}

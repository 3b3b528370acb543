package io.github.cyfko.reportwriter.core.render;

import io.github.cyfko.reportwriter.core.api.RequestParameters;
import io.github.cyfko.reportwriter.core.config.PagingConfig;
import io.github.cyfko.reportwriter.core.model.ColumnSpec;
import io.github.cyfko.reportwriter.core.model.SortDirection;
import io.github.cyfko.reportwriter.core.model.SortHeader;
import io.github.cyfko.reportwriter.core.model.SortState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SortHeaderRenderer Tests")
class SortHeaderRendererTest {

    private static final List<ColumnSpec> COLUMNS = List.of(
            ColumnSpec.simple("name", true),
            ColumnSpec.builder("age").query("p.age").build(),
            ColumnSpec.builder("phone").query("phone_number AS phone").label("Phone Number").sortable(false).build()
    );

    private static RequestParameters request() {
        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("page", "4");
        parameters.put("sort", "age");
        parameters.put("order", "asc");
        parameters.put("date1", "20050101000000");
        return RequestParameters.of(parameters);
    }

    @Test
    @DisplayName("Should toggle the direction of the active column")
    void shouldToggleActiveColumn() {
        List<SortHeader> headers = SortHeaderRenderer.render(COLUMNS, new SortState("age", SortDirection.ASC),
                PagingConfig.defaults(), request());

        SortHeader age = headers.get(1);
        assertTrue(age.active());
        assertEquals(SortDirection.ASC, age.activeDirection());
        assertEquals("▲", age.indicator());
        assertEquals(SortDirection.DESC, age.linkDirection());
        assertEquals("age", age.parameters().get("sort"));
        assertEquals("desc", age.parameters().get("order"));
        assertEquals("age", age.fieldName());
    }

    @Test
    @DisplayName("Should request ascending order for inactive columns")
    void shouldRequestAscendingForInactiveColumns() {
        List<SortHeader> headers = SortHeaderRenderer.render(COLUMNS, new SortState("age", SortDirection.DESC),
                PagingConfig.defaults(), request());

        SortHeader name = headers.get(0);
        assertFalse(name.active());
        assertNull(name.activeDirection());
        assertEquals("", name.indicator());
        assertEquals(SortDirection.ASC, name.linkDirection());
        assertEquals("name", name.parameters().get("sort"));
        assertEquals("asc", name.parameters().get("order"));
        assertEquals("▼", headers.get(1).indicator());
    }

    @Test
    @DisplayName("Should drop the page variable and keep unrelated parameters")
    void shouldResetPageAndKeepOtherParameters() {
        SortHeader name = SortHeaderRenderer.render(COLUMNS, new SortState("age", SortDirection.ASC),
                PagingConfig.defaults(), request()).get(0);

        assertFalse(name.parameters().containsKey("page"));
        assertEquals("20050101000000", name.parameters().get("date1"));
    }

    @Test
    @DisplayName("Should emit no link for non-sortable columns")
    void shouldNotLinkNonSortableColumns() {
        SortHeader phone = SortHeaderRenderer.render(COLUMNS, new SortState("name", SortDirection.ASC),
                PagingConfig.defaults(), request()).get(2);

        assertFalse(phone.sortable());
        assertFalse(phone.active());
        assertNull(phone.linkDirection());
        assertTrue(phone.parameters().isEmpty());
        assertEquals("Phone Number", phone.label());
        assertEquals("phone", phone.fieldName());
    }

    @Test
    @DisplayName("Should honor configured variables and indicators")
    void shouldHonorConfiguration() {
        PagingConfig config = PagingConfig.builder()
                .sortVariable("s")
                .directionVariable("d")
                .descIndicator("(desc)")
                .build();

        SortHeader name = SortHeaderRenderer.render(COLUMNS, new SortState("name", SortDirection.DESC),
                config, RequestParameters.empty()).get(0);

        assertEquals("(desc)", name.indicator());
        assertEquals(Map.of("s", "name", "d", "asc"), name.parameters());
    }
}

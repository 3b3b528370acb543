package io.github.cyfko.reportwriter.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResultWindow Tests")
class ResultWindowTest {

    @ParameterizedTest
    @CsvSource({"0,10,0", "1,10,1", "9,10,1", "10,10,1", "11,10,2", "25,10,3", "30,10,3", "31,10,4"})
    @DisplayName("Should compute ceil(total / pageSize) pages")
    void shouldComputePageCount(long total, int pageSize, int expected) {
        assertEquals(expected, ResultWindow.of(total, pageSize, 1).pageCount());
    }

    @Test
    @DisplayName("Should saturate the page count for huge totals")
    void shouldSaturatePageCount() {
        assertEquals(Integer.MAX_VALUE, ResultWindow.pageCount(Long.MAX_VALUE / 2, 1));
    }

    @Test
    @DisplayName("Should treat page 1 of an empty set as valid")
    void shouldTreatEmptySetAsValid() {
        ResultWindow window = ResultWindow.of(0, 10, 1);

        assertTrue(window.valid());
        assertFalse(window.hasPrevious());
        assertFalse(window.hasNext());
        assertEquals(1, window.correctedIndex());
    }

    @Test
    @DisplayName("Should correct to the last page, then page 1 when no page exists")
    void shouldCorrectIndex() {
        assertEquals(3, ResultWindow.of(25, 10, 9).correctedIndex());
        assertEquals(2, ResultWindow.of(25, 10, 2).correctedIndex());
    }

    @Test
    @DisplayName("Should report previous and next pages")
    void shouldReportNeighbours() {
        ResultWindow middle = ResultWindow.of(50, 10, 3);

        assertTrue(middle.hasPrevious());
        assertTrue(middle.hasNext());
        assertFalse(ResultWindow.of(50, 10, 5).hasNext());
        assertFalse(ResultWindow.of(50, 10, 1).hasPrevious());
    }

    @Test
    @DisplayName("Should count the rows of full and partial pages")
    void shouldCountRowsOnCurrentPage() {
        assertEquals(10, ResultWindow.of(25, 10, 1).rowsOnCurrentPage());
        assertEquals(5, ResultWindow.of(25, 10, 3).rowsOnCurrentPage());
        assertEquals(0, ResultWindow.of(25, 10, 4).rowsOnCurrentPage());
    }

    @Test
    @DisplayName("Should reject invalid inputs")
    void shouldRejectInvalidInputs() {
        assertThrows(IllegalArgumentException.class, () -> ResultWindow.of(-5, 10, 1));
        assertThrows(IllegalArgumentException.class, () -> ResultWindow.of(5, 0, 1));
    }

    @Test
    @DisplayName("Should accept components that agree with the rules")
    void shouldAcceptConsistentComponents() {
        ResultWindow window = new ResultWindow(25, 3, 2, 10, true);

        assertEquals(ResultWindow.of(25, 10, 2), window);
        assertFalse(new ResultWindow(25, 3, 9, 10, false).valid());
        assertTrue(new ResultWindow(0, 0, 5, 10, true).valid());
    }

    @ParameterizedTest
    @CsvSource({
            "25, 7, 9, 10, true",
            "25, 2, 1, 10, true",
            "0, 1, 1, 10, true",
            "25, 3, 9, 10, true",
            "25, 3, 2, 10, false",
            "0, 0, 5, 10, false"
    })
    @DisplayName("Should reject a page count or validity that contradicts the totals")
    void shouldRejectInconsistentComponents(long total, int pageCount, int current, int pageSize, boolean valid) {
        assertThrows(IllegalArgumentException.class,
                () -> new ResultWindow(total, pageCount, current, pageSize, valid));
    }
}

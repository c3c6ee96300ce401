package eu.virtualparadox.lobbymap.query.citation.pageinterval;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PageIntervalMergerTest {

    private final PageIntervalMerger merger = new PageIntervalMerger();

    @Test
    @DisplayName("Null or empty input yields an empty list")
    void testNullAndEmptyInput() {
        assertTrue(merger.merge(null).isEmpty());
        assertTrue(merger.merge(Collections.emptyList()).isEmpty());
    }

    @Test
    @DisplayName("Disjoint chunk spans stay separate and come out sorted")
    void testDisjointSpans() {
        List<PageInterval> input = Arrays.asList(new PageInterval(12, 14), new PageInterval(2, 2));
        assertEquals(List.of(new PageInterval(2, 2), new PageInterval(12, 14)), merger.merge(input));
    }

    @Test
    @DisplayName("Chunks on consecutive pages merge into one span")
    void testConsecutivePagesMerge() {
        List<PageInterval> input = Arrays.asList(
                new PageInterval(3, 3),
                new PageInterval(4, 5),
                new PageInterval(5, 5),
                new PageInterval(9, 9)
        );
        assertEquals(List.of(new PageInterval(3, 5), new PageInterval(9, 9)), merger.merge(input));
    }

    @Test
    @DisplayName("A span contained in another disappears")
    void testContainedSpan() {
        List<PageInterval> input = Arrays.asList(new PageInterval(1, 10), new PageInterval(4, 6));
        assertEquals(List.of(new PageInterval(1, 10)), merger.merge(input));
    }

    @Test
    @DisplayName("Reversed interval is rejected")
    void testReversedInterval() {
        assertThrows(IllegalArgumentException.class, () -> merger.merge(List.of(new PageInterval(5, 3))));
    }

    @Test
    @DisplayName("Null element is rejected")
    void testNullElement() {
        assertThrows(NullPointerException.class, () -> merger.merge(Arrays.asList(new PageInterval(1, 2), null)));
    }

    @Test
    @DisplayName("Single page renders without a range")
    void testAsString() {
        assertEquals("7", new PageInterval(7, 7).asString());
        assertEquals("7-9", new PageInterval(7, 9).asString());
    }
}

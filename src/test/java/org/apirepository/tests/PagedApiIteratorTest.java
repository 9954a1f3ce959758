package org.apirepository.tests;

import org.apirepository.iterator.PagedApiIterator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Page buffering and follow-up fetches of the paged greedy cursor.
 */
public class PagedApiIteratorTest {

    /** Remote data set of the integers 0..total-1, recording each fetch as "offset/pageSize". */
    private static class NumbersSource {
        final int total;
        final List<String> fetches = new ArrayList<>();

        NumbersSource(int total) {
            this.total = total;
        }

        List<Integer> fetch(int offset, int pageSize) {
            fetches.add(offset + "/" + pageSize);
            return IntStream.range(offset, Math.min(total, offset + pageSize)).boxed().collect(Collectors.toList());
        }

        PagedApiIterator<Integer> open(int pageSize) {
            return new PagedApiIterator<>(fetch(0, pageSize), pageSize, this::fetch);
        }
    }

    private static List<Integer> drain(PagedApiIterator<Integer> iterator) {
        List<Integer> result = new ArrayList<>();
        Integer current;
        do {
            current = iterator.current();
            if (current != null) {
                result.add(current);
            }
        } while (current != null && iterator.moveNext());
        return result;
    }

    @Test
    @DisplayName("Cursor starts on the first element of the initial page")
    public void testStartsOnFirstElement() {
        PagedApiIterator<Integer> iterator = new NumbersSource(5).open(2);

        assertEquals(0, iterator.current());
        assertEquals(0, iterator.getFetchCount());
    }

    @Test
    @DisplayName("Traversal fetches follow-up pages until a short page")
    public void testTraversesAllPages() {
        NumbersSource source = new NumbersSource(5);
        PagedApiIterator<Integer> iterator = source.open(2);

        assertEquals(List.of(0, 1, 2, 3, 4), drain(iterator));
        assertEquals(List.of("0/2", "2/2", "4/2"), source.fetches);
        assertNull(iterator.current());
    }

    @Test
    @DisplayName("An exact multiple of the page size ends with one empty fetch")
    public void testEndsOnEmptyPage() {
        NumbersSource source = new NumbersSource(4);
        PagedApiIterator<Integer> iterator = source.open(2);

        assertEquals(List.of(0, 1, 2, 3), drain(iterator));
        assertEquals(List.of("0/2", "2/2", "4/2"), source.fetches);
        assertFalse(iterator.moveNext());
        assertEquals(3, source.fetches.size());
    }

    @Test
    @DisplayName("Growing the page size mid-traversal requests aligned pages and drops records already returned")
    public void testPageSizeGrowsMidTraversal() {
        NumbersSource source = new NumbersSource(10);
        PagedApiIterator<Integer> iterator = source.open(3);

        assertTrue(iterator.moveNext());
        iterator.setPageSize(5);

        assertEquals(List.of(1, 2, 3, 4, 5, 6, 7, 8, 9), drain(iterator));
        assertEquals(List.of("0/3", "0/5", "5/5", "10/5"), source.fetches);
    }

    @Test
    @DisplayName("Shrinking the page size mid-traversal keeps every record exactly once")
    public void testPageSizeShrinksMidTraversal() {
        NumbersSource source = new NumbersSource(7);
        PagedApiIterator<Integer> iterator = source.open(3);
        iterator.setPageSize(2);

        assertEquals(List.of(0, 1, 2, 3, 4, 5, 6), drain(iterator));
        assertEquals(List.of("0/3", "2/2", "4/2", "6/2"), source.fetches);
    }

    @Test
    @DisplayName("An aligned page ending before the next position ends the traversal")
    public void testAlignedPageWithoutNewRecords() {
        List<String> fetches = new ArrayList<>();
        PagedApiIterator<String> iterator = new PagedApiIterator<>(List.of("a", "b"), 2,
                (offset, pageSize) -> {
                    fetches.add(offset + "/" + pageSize);
                    return List.of("a", "b");
                });
        iterator.setPageSize(3);

        assertTrue(iterator.moveNext());
        assertFalse(iterator.moveNext());
        assertNull(iterator.current());
        assertEquals(List.of("0/3"), fetches);
    }

    @Test
    @DisplayName("Empty first page: nothing positioned, nothing fetched")
    public void testEmptyFirstPage() {
        List<String> fetches = new ArrayList<>();
        PagedApiIterator<String> iterator = new PagedApiIterator<>(Collections.emptyList(), 10,
                (offset, pageSize) -> {
                    fetches.add(offset + "/" + pageSize);
                    return List.of("unexpected");
                });

        assertNull(iterator.current());
        assertFalse(iterator.moveNext());
        assertTrue(fetches.isEmpty());
    }

    @Test
    @DisplayName("A failing fetch propagates and leaves the cursor on the last element")
    public void testFetchFaultPropagates() {
        PagedApiIterator<String> iterator = new PagedApiIterator<>(List.of("a", "b"), 2,
                (offset, pageSize) -> {
                    throw new IllegalStateException("HTTP 503");
                });

        assertTrue(iterator.moveNext());
        assertThrows(IllegalStateException.class, iterator::moveNext);
        assertEquals("b", iterator.current());
    }
}

package com.banking.scd.api;

import com.banking.scd.core.model.DimensionId;
import com.banking.scd.core.model.DimensionVersion;
import com.banking.scd.store.DimensionStore;
import com.banking.scd.store.InMemoryDimensionStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

@DisplayName("VersionHistory Tests")
class VersionHistoryTest {

    private static InMemoryDimensionStore chainOf(int versions) {
        InMemoryDimensionStore store = new InMemoryDimensionStore();
        LocalDate from = LocalDate.of(2020, 1, 1);
        for (int i = 1; i <= versions; i++) {
            LocalDate to = i < versions ? from.plusMonths(1) : null;
            store.seed(DimensionVersion.builder()
                    .surrogateKey(i)
                    .dimension(DimensionId.EMPLOYEE)
                    .naturalKey("E1")
                    .effectiveFrom(from)
                    .effectiveTo(to)
                    .build());
            from = from.plusMonths(1);
        }
        return store;
    }

    @Test
    @DisplayName("Nothing is read before iteration starts")
    void lazy() {
        DimensionStore store = mock(DimensionStore.class);

        VersionHistory history = new VersionHistory(store, DimensionId.EMPLOYEE, "E1");

        verifyNoInteractions(store);
        assertEquals(DimensionId.EMPLOYEE, history.getDimension());
        assertEquals("E1", history.getNaturalKey());
    }

    @Test
    @DisplayName("Pages are fetched as the iteration advances")
    void pagesOnDemand() {
        DimensionStore store = spy(chainOf(5));
        VersionHistory history = new VersionHistory(store, DimensionId.EMPLOYEE, "E1", 2);

        Iterator<DimensionVersion> it = history.iterator();
        assertEquals(1, it.next().getSurrogateKey());
        assertEquals(2, it.next().getSurrogateKey());
        verify(store, times(1)).findVersionsPage(any(), any(), any(), anyInt());

        assertEquals(3, it.next().getSurrogateKey());
        verify(store, times(2)).findVersionsPage(any(), any(), any(), anyInt());
    }

    @Test
    @DisplayName("Each iteration starts again from the first version")
    void restartable() {
        VersionHistory history = new VersionHistory(chainOf(5), DimensionId.EMPLOYEE, "E1", 2);

        List<Long> first = history.stream().map(DimensionVersion::getSurrogateKey).toList();
        List<Long> second = history.stream().map(DimensionVersion::getSurrogateKey).toList();

        assertEquals(List.of(1L, 2L, 3L, 4L, 5L), first);
        assertEquals(first, second);
        assertEquals(5, history.toList().size());
    }

    @Test
    @DisplayName("An exhausted iterator throws NoSuchElementException")
    void exhausted() {
        Iterator<DimensionVersion> it = new VersionHistory(chainOf(1), DimensionId.EMPLOYEE, "E1").iterator();
        it.next();
        assertFalse(it.hasNext());
        assertThrows(NoSuchElementException.class, it::next);
    }

    @Test
    @DisplayName("Page size must be positive")
    void pageSizeValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> new VersionHistory(new InMemoryDimensionStore(), DimensionId.EMPLOYEE, "E1", 0));
    }
}

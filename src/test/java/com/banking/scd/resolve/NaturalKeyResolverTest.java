package com.banking.scd.resolve;

import com.banking.scd.cache.CurrentVersionCache;
import com.banking.scd.core.exception.AmbiguousCurrentVersionException;
import com.banking.scd.core.model.DimensionId;
import com.banking.scd.core.model.DimensionVersion;
import com.banking.scd.metrics.MetricsService;
import com.banking.scd.store.DimensionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("NaturalKeyResolver Tests")
class NaturalKeyResolverTest {

    @Mock
    private DimensionStore store;

    @Mock
    private CurrentVersionCache cache;

    @Mock
    private MetricsService metrics;

    private NaturalKeyResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new NaturalKeyResolver(store, cache, metrics);
    }

    private static DimensionVersion current(long sk) {
        return DimensionVersion.builder()
                .surrogateKey(sk)
                .dimension(DimensionId.CUSTOMER)
                .naturalKey("C001")
                .effectiveFrom(LocalDate.of(2024, 1, 1))
                .build();
    }

    @Test
    @DisplayName("Should serve cached versions without reading the store")
    void cacheHit() {
        DimensionVersion v1 = current(1);
        when(cache.get(DimensionId.CUSTOMER, "C001")).thenReturn(Optional.of(v1));

        assertEquals(Optional.of(v1), resolver.resolveCurrent(DimensionId.CUSTOMER, "C001"));

        verify(metrics).recordCacheHit();
        verifyNoInteractions(store);
    }

    @Test
    @DisplayName("Should read the store on a miss and cache the result under a stamp taken before the read")
    void cacheMiss() {
        DimensionVersion v1 = current(1);
        when(cache.get(DimensionId.CUSTOMER, "C001")).thenReturn(Optional.empty());
        when(cache.stamp(DimensionId.CUSTOMER, "C001")).thenReturn(7L);
        when(store.findCurrent(DimensionId.CUSTOMER, "C001")).thenReturn(List.of(v1));

        assertEquals(Optional.of(v1), resolver.resolveCurrent(DimensionId.CUSTOMER, "C001"));

        verify(metrics).recordCacheMiss();
        InOrder inOrder = inOrder(cache, store);
        inOrder.verify(cache).stamp(DimensionId.CUSTOMER, "C001");
        inOrder.verify(store).findCurrent(DimensionId.CUSTOMER, "C001");
        inOrder.verify(cache).put(v1, 7L);
    }

    @Test
    @DisplayName("resolveFromStore ignores cached entries")
    void resolveFromStoreSkipsCacheLookup() {
        DimensionVersion v2 = current(2);
        when(cache.stamp(DimensionId.CUSTOMER, "C001")).thenReturn(3L);
        when(store.findCurrent(DimensionId.CUSTOMER, "C001")).thenReturn(List.of(v2));

        assertEquals(Optional.of(v2), resolver.resolveFromStore(DimensionId.CUSTOMER, "C001"));

        verify(cache, never()).get(any(), any());
        verify(cache).put(v2, 3L);
        verifyNoInteractions(metrics);
    }

    @Test
    @DisplayName("Unknown natural keys resolve to empty and are not cached")
    void notFound() {
        when(cache.get(DimensionId.CUSTOMER, "C001")).thenReturn(Optional.empty());
        when(store.findCurrent(DimensionId.CUSTOMER, "C001")).thenReturn(List.of());

        assertTrue(resolver.resolveCurrent(DimensionId.CUSTOMER, "C001").isEmpty());
        verify(cache, never()).put(any(), anyLong());
    }

    @Test
    @DisplayName("Two current versions are reported with their surrogate keys")
    void ambiguous() {
        when(cache.get(DimensionId.CUSTOMER, "C001")).thenReturn(Optional.empty());
        when(store.findCurrent(DimensionId.CUSTOMER, "C001")).thenReturn(List.of(current(3), current(4)));

        AmbiguousCurrentVersionException e = assertThrows(AmbiguousCurrentVersionException.class,
                () -> resolver.resolveCurrent(DimensionId.CUSTOMER, "C001"));

        assertEquals(List.of(3L, 4L), e.getSurrogateKeys());
        assertEquals("C001", e.getNaturalKey());
        verify(cache, never()).put(any(), anyLong());
    }

    @Test
    @DisplayName("Should reject malformed natural keys before any lookup")
    void invalidKey() {
        assertThrows(IllegalArgumentException.class, () -> resolver.resolveCurrent(DimensionId.CUSTOMER, " "));
        assertThrows(IllegalArgumentException.class, () -> resolver.resolveFromStore(DimensionId.CUSTOMER, ""));
        verifyNoInteractions(store, cache);
    }
}

package com.greencover.repository;

import com.greencover.model.CacheEntry;
import com.greencover.model.CalculationType;
import com.greencover.model.result.CacheStats;
import com.greencover.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every {@link CacheStore} implementation shares
 */
public abstract class CacheStoreContract {

    protected static final Instant START = Instant.parse("2024-06-01T00:00:00Z");

    protected MutableClock clock;
    protected CacheStore store;

    protected abstract CacheStore createStore(MutableClock clock);

    @BeforeEach
    void setUpStore() {
        clock = new MutableClock(START);
        store = createStore(clock);
    }

    private void put(String key, CalculationType type, String city, Duration ttl) {
        store.put(key, type, city == null ? null : 1L, city, "{\"v\":\"" + key + "\"}", clock.instant(),
                ttl == null ? null : clock.instant().plus(ttl));
    }

    @Test
    void testPutAndGet() {
        // When
        put("k1", CalculationType.SATELLITE, "Berlin", Duration.ofHours(1));
        Optional<CacheEntry> entry = store.get("k1");

        // Then
        assertTrue(entry.isPresent());
        assertEquals("{\"v\":\"k1\"}", entry.get().getPayload());
        assertEquals(CalculationType.SATELLITE, entry.get().getCalculationType());
        assertEquals("Berlin", entry.get().getCityName());
        assertEquals(1L, entry.get().getCityId());
        assertEquals(START, entry.get().getCreatedAt());
        assertFalse(store.get("missing").isPresent());
    }

    @Test
    void testPutOverwritesWholeEntry() {
        // Given
        put("k1", CalculationType.SATELLITE, "Berlin", Duration.ofHours(1));

        // When
        store.put("k1", CalculationType.custom("ranking"), null, null, "second", clock.instant(), null);

        // Then
        CacheEntry entry = store.get("k1").orElseThrow();
        assertEquals("second", entry.getPayload());
        assertEquals(CalculationType.custom("ranking"), entry.getCalculationType());
        assertNull(entry.getCityName());
        assertNull(entry.getExpiresAt());
    }

    @Test
    void testEntryExpiresAtItsInstant() {
        // Given
        put("k1", CalculationType.SATELLITE, "Berlin", Duration.ofHours(1));
        put("forever", CalculationType.STORED, "Berlin", null);

        // When
        clock.advance(Duration.ofMinutes(59));
        boolean beforeExpiry = store.get("k1").isPresent();
        clock.advance(Duration.ofMinutes(1));

        // Then
        assertTrue(beforeExpiry);
        assertFalse(store.get("k1").isPresent());
        assertTrue(store.get("forever").isPresent());
    }

    @Test
    void testDeleteExpiredRemovesOnlyExpired() {
        // Given
        put("short", CalculationType.SATELLITE, "Berlin", Duration.ofMinutes(5));
        put("long", CalculationType.SATELLITE, "Paris", Duration.ofDays(1));
        clock.advance(Duration.ofHours(1));

        // When
        CacheStats before = store.stats();
        int removed = store.deleteExpired();

        // Then
        assertEquals(2, before.getTotalEntries());
        assertEquals(1, before.getExpiredEntries());
        assertEquals(1, removed);
        assertEquals(1, store.stats().getTotalEntries());
        assertTrue(store.get("long").isPresent());
    }

    @Test
    void testDeleteByCityIsCaseInsensitiveAndTypeScoped() {
        // Given
        put("sat", CalculationType.SATELLITE, "Berlin", Duration.ofHours(1));
        put("stored", CalculationType.STORED, "Berlin", Duration.ofHours(1));
        put("other", CalculationType.SATELLITE, "Paris", Duration.ofHours(1));

        // When
        int removed = store.deleteByCity("berlin", CalculationType.SATELLITE);

        // Then
        assertEquals(1, removed);
        assertFalse(store.get("sat").isPresent());
        assertTrue(store.get("stored").isPresent());
        assertTrue(store.get("other").isPresent());
    }

    @Test
    void testDeleteByCitySparesKeptKey() {
        // Given
        put("old", CalculationType.SATELLITE, "Berlin", Duration.ofHours(1));
        put("fresh", CalculationType.SATELLITE, "Berlin", Duration.ofHours(1));

        // When
        int removed = store.deleteByCity(" BERLIN ", Set.of(CalculationType.SATELLITE), "fresh");

        // Then
        assertEquals(1, removed);
        assertTrue(store.get("fresh").isPresent());
        assertFalse(store.get("old").isPresent());
    }

    @Test
    void testDeleteByType() {
        // Given
        put("stats", CalculationType.STATS, null, Duration.ofHours(1));
        put("sat", CalculationType.SATELLITE, "Berlin", Duration.ofHours(1));

        // When
        int removed = store.deleteByType(Set.of(CalculationType.STATS));

        // Then
        assertEquals(1, removed);
        assertTrue(store.get("sat").isPresent());
        assertTrue(store.delete("sat"));
        assertFalse(store.delete("sat"));
    }

    @Test
    void testCityNamesAndStats() {
        // Given
        put("a", CalculationType.SATELLITE, "Paris", Duration.ofHours(1));
        put("b", CalculationType.SATELLITE, "Berlin", Duration.ofHours(1));
        put("c", CalculationType.STORED, "Berlin", Duration.ofHours(1));
        put("d", CalculationType.STATS, null, Duration.ofHours(1));

        // When
        List<String> names = store.cityNames();
        CacheStats stats = store.stats();

        // Then
        assertEquals(List.of("Berlin", "Paris"), names);
        assertEquals(4, stats.getTotalEntries());
        assertEquals(4, stats.getValidEntries());
        assertEquals(2L, stats.getEntriesByType().get("satellite"));
        assertEquals(1L, stats.getEntriesByType().get("stats"));
    }

    @Test
    void testCityNamesIgnoreCase() {
        // Given
        put("a", CalculationType.SATELLITE, "Berlin", Duration.ofHours(1));
        put("b", CalculationType.STATS, "BERLIN", Duration.ofHours(1));
        put("c", CalculationType.SATELLITE, "amsterdam", Duration.ofHours(1));

        // When
        List<String> names = store.cityNames();

        // Then
        assertEquals(2, names.size());
        assertEquals("amsterdam", names.get(0));
        assertTrue(names.get(1).equalsIgnoreCase("berlin"));
    }

    @Test
    void testConcurrentPutsOfOneKeyLeaveOneConsistentEntry() throws Exception {
        // Given
        int writers = 8;
        int putsPerWriter = 100;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<CompletableFuture<Void>> done = new ArrayList<>();

        // When
        try {
            for (int w = 0; w < writers; w++) {
                int writer = w;
                done.add(CompletableFuture.runAsync(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    for (int i = 0; i < putsPerWriter; i++) {
                        int seq = writer * putsPerWriter + i;
                        store.put("k", CalculationType.SATELLITE, 1L, "Berlin", "p-" + seq,
                                START.plusSeconds(seq), null);
                    }
                }, pool));
            }
            start.countDown();
            CompletableFuture.allOf(done.toArray(new CompletableFuture[0])).get(60, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        // Then
        assertEquals(1, store.stats().getTotalEntries());
        CacheEntry winner = store.get("k").orElseThrow();
        long seq = winner.getCreatedAt().getEpochSecond() - START.getEpochSecond();
        assertEquals("p-" + seq, winner.getPayload());
    }
}

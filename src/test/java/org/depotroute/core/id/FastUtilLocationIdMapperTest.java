package org.depotroute.core.id;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class FastUtilLocationIdMapperTest {

    private static final int[] IDS = {40, 7, 1003};

    @Test
    @DisplayName("Baseline Correctness: bidirectional id to index mapping")
    void testSimpleMapping() {
        LocationIdMapper mapper = LocationIdMapper.createImmutable(IDS);

        assertEquals(0, mapper.toIndex(40));
        assertEquals(2, mapper.toIndex(1003));
        assertEquals(7, mapper.toLocationId(1));

        assertTrue(mapper.containsLocation(7));
        assertFalse(mapper.containsLocation(8));
        assertEquals(3, mapper.size());
    }

    @Test
    @DisplayName("Input Isolation: later changes to the source array are not visible")
    void testDefensiveCopy() {
        int[] ids = {1, 2, 3};
        LocationIdMapper mapper = new FastUtilLocationIdMapper(ids);
        ids[0] = 99;
        assertEquals(1, mapper.toLocationId(0));
        assertFalse(mapper.containsLocation(99));
    }

    @Test
    @DisplayName("Exception Path: unknown location id")
    void testUnknownLocationId() {
        LocationIdMapper mapper = new FastUtilLocationIdMapper(IDS);
        assertThrows(LocationIdMapper.UnknownLocationException.class, () -> mapper.toIndex(-1));
    }

    @Test
    @DisplayName("Exception Path: invalid index")
    void testInvalidIndex() {
        LocationIdMapper mapper = new FastUtilLocationIdMapper(IDS);
        assertThrows(IndexOutOfBoundsException.class, () -> mapper.toLocationId(3));
        assertThrows(IndexOutOfBoundsException.class, () -> mapper.toLocationId(-1));
    }

    @Test
    @DisplayName("Constructor Validation: duplicate and null ids are rejected")
    void testConstructorValidation() {
        Exception duplicate = assertThrows(IllegalArgumentException.class,
                () -> new FastUtilLocationIdMapper(new int[]{5, 6, 5}));
        assertTrue(duplicate.getMessage().contains("Duplicate location id"));
        assertThrows(IllegalArgumentException.class, () -> new FastUtilLocationIdMapper(null));
    }

    @Test
    @DisplayName("Concurrency: thread-safe read operations")
    void testConcurrentReads() throws InterruptedException {
        LocationIdMapper mapper = new FastUtilLocationIdMapper(IDS);
        int threads = 16;
        int iterations = 1000;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        AtomicInteger errors = new AtomicInteger(0);

        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                try {
                    for (int i = 0; i < iterations; i++) {
                        int index = mapper.toIndex(1003);
                        if (mapper.toLocationId(index) != 1003) {
                            errors.incrementAndGet();
                        }
                        mapper.containsLocation(7);
                    }
                } catch (RuntimeException e) {
                    errors.incrementAndGet();
                }
            });
        }

        executor.shutdown();
        boolean finished = executor.awaitTermination(5, TimeUnit.SECONDS);

        assertTrue(finished, "Executor did not finish in time");
        assertEquals(0, errors.get(), "Concurrent reads caused errors");
    }
}

package com.ragkit.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.jupiter.api.Test;

class BatchRunnerTest {

    private static List<Integer> numbers(int count) {
        List<Integer> out = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            out.add(i);
        }
        return out;
    }

    @Test
    void shouldPartitionIntoFixedSizeBatches() {
        List<List<Integer>> batches = new BatchRunner(100, 1).partition(numbers(250));

        assertEquals(3, batches.size());
        assertEquals(50, batches.get(2).size());
        assertEquals(200, batches.get(2).get(0));
    }

    @Test
    void shouldWriteEveryBatchOnPool() {
        List<Integer> written = new CopyOnWriteArrayList<>();

        int batches = new BatchRunner(10, 4).write(numbers(95), written::addAll);

        assertEquals(10, batches);
        assertEquals(new HashSet<>(numbers(95)), new HashSet<>(written));
    }

    @Test
    void shouldStopAfterFirstSequentialFailure() {
        List<Integer> written = new ArrayList<>();

        BatchPartialFailureException error = assertThrows(BatchPartialFailureException.class,
                () -> new BatchRunner(2, 1).write(numbers(8), batch -> {
                    if (batch.contains(2)) {
                        throw new IllegalStateException("boom");
                    }
                    written.addAll(batch);
                }));

        assertEquals(List.of(0), error.succeededBatches());
        assertEquals(List.of(1), error.failedBatches());
        assertEquals(List.of(2, 3), error.skippedBatches());
        assertEquals(List.of(0, 1), written);
        assertEquals("boom", error.getCause().getMessage());
    }

    @Test
    void shouldAccountForEveryBatchWhenParallelWriteFails() {
        BatchPartialFailureException error = assertThrows(BatchPartialFailureException.class,
                () -> new BatchRunner(1, 3).write(numbers(12), batch -> {
                    if (batch.get(0) == 5) {
                        throw new IllegalStateException("boom");
                    }
                }));

        assertTrue(error.failedBatches().contains(5));
        assertEquals(12, error.succeededBatches().size() + error.failedBatches().size() + error.skippedBatches().size());
    }

    @Test
    void shouldMergeLookupsInInputOrder() {
        Set<Integer> found = new BatchRunner(3, 2).collect(numbers(10), batch -> {
            Set<Integer> even = new HashSet<>();
            batch.stream().filter(n -> n % 2 == 0).forEach(even::add);
            return even;
        });

        assertEquals(List.of(0, 2, 4, 6, 8), new ArrayList<>(found));
    }
}

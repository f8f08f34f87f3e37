package com.ragkit.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits work into fixed-size batches and runs them on the caller thread or on a bounded pool.
 * Batches are always submitted in input order.
 */
public class BatchRunner {
    private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

    private final int batchSize;
    private final int workers;

    public BatchRunner(int batchSize, int workers) {
        this.batchSize = batchSize;
        this.workers = workers;
    }

    public <T> List<List<T>> partition(List<T> items) {
        List<List<T>> batches = new ArrayList<>();
        for (int start = 0; start < items.size(); start += batchSize) {
            batches.add(items.subList(start, Math.min(items.size(), start + batchSize)));
        }
        return batches;
    }

    /**
     * Writes every batch. The first failure stops batches that have not started yet and is
     * reported as a {@link BatchPartialFailureException}.
     */
    public <T> int write(List<T> items, Consumer<List<T>> writer) {
        List<List<T>> batches = partition(items);
        if (batches.isEmpty()) {
            return 0;
        }
        if (workers <= 1 || batches.size() == 1) {
            writeSequentially(batches, writer);
        } else {
            writeInParallel(batches, writer);
        }
        return batches.size();
    }

    /**
     * Runs a read over every batch and merges the results in input order. Read failures propagate
     * unchanged.
     */
    public <T, R> Set<R> collect(List<T> items, Function<List<T>, Set<R>> reader) {
        List<List<T>> batches = partition(items);
        Set<R> merged = new LinkedHashSet<>();
        if (workers <= 1 || batches.size() <= 1) {
            batches.forEach(batch -> merged.addAll(reader.apply(batch)));
            return merged;
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(workers, batches.size()));
        try {
            List<Future<Set<R>>> futures = new ArrayList<>();
            for (List<T> batch : batches) {
                futures.add(executor.submit(() -> reader.apply(batch)));
            }
            for (Future<Set<R>> future : futures) {
                merged.addAll(await(future));
            }
            return merged;
        } finally {
            executor.shutdownNow();
        }
    }

    private <T> void writeSequentially(List<List<T>> batches, Consumer<List<T>> writer) {
        List<Integer> succeeded = new ArrayList<>();
        for (int index = 0; index < batches.size(); index++) {
            try {
                writer.accept(batches.get(index));
                succeeded.add(index);
            } catch (RuntimeException e) {
                List<Integer> skipped = new ArrayList<>();
                for (int rest = index + 1; rest < batches.size(); rest++) {
                    skipped.add(rest);
                }
                log.warn("batch.write.failed batch={} succeeded={} skipped={} reason={}", index, succeeded, skipped, e.getMessage());
                throw new BatchPartialFailureException(succeeded, List.of(index), skipped, e);
            }
        }
    }

    private <T> void writeInParallel(List<List<T>> batches, Consumer<List<T>> writer) {
        AtomicBoolean aborted = new AtomicBoolean(false);
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(workers, batches.size()));
        List<Future<Boolean>> futures = new ArrayList<>();
        try {
            for (List<T> batch : batches) {
                Callable<Boolean> task = () -> {
                    if (aborted.get()) {
                        return false;
                    }
                    try {
                        writer.accept(batch);
                        return true;
                    } catch (RuntimeException e) {
                        aborted.set(true);
                        throw e;
                    }
                };
                futures.add(executor.submit(task));
            }

            List<Integer> succeeded = new ArrayList<>();
            List<Integer> failed = new ArrayList<>();
            List<Integer> skipped = new ArrayList<>();
            Throwable firstFailure = null;
            for (int index = 0; index < futures.size(); index++) {
                try {
                    if (futures.get(index).get()) {
                        succeeded.add(index);
                    } else {
                        skipped.add(index);
                    }
                } catch (ExecutionException e) {
                    failed.add(index);
                    if (firstFailure == null) {
                        firstFailure = e.getCause();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new BackendUnavailableException("Interrupted while waiting for batch " + index, e);
                }
            }
            if (!failed.isEmpty()) {
                Collections.sort(succeeded);
                log.warn("batch.write.failed failed={} succeeded={} skipped={}", failed, succeeded, skipped);
                throw new BatchPartialFailureException(succeeded, failed, skipped, firstFailure);
            }
        } finally {
            executor.shutdown();
        }
    }

    private static <R> R await(Future<R> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendUnavailableException("Interrupted while waiting for batch lookup", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new BackendUnavailableException("Batch lookup failed", e.getCause());
        }
    }
}

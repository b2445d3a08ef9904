package io.kestra.plugin.groupby.util;

import io.kestra.plugin.groupby.GroupByException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinWorkerThread;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fans indexed tasks out over one JVM-wide pool. Each task writes its result into its own
 * slot; results are returned in index order whatever the completion order was.
 */
public final class ParallelExecutor {
    private static final AtomicLong THREAD_COUNT = new AtomicLong();

    private static final ForkJoinPool POOL = new ForkJoinPool(
        Runtime.getRuntime().availableProcessors(),
        pool -> {
            ForkJoinWorkerThread thread = ForkJoinPool.defaultForkJoinWorkerThreadFactory.newThread(pool);
            thread.setName(String.format("groupby-worker-%d", THREAD_COUNT.getAndIncrement()));
            return thread;
        },
        null,
        false
    );

    private ParallelExecutor() {
    }

    public static int poolSize() {
        return POOL.getParallelism();
    }

    @FunctionalInterface
    public interface IndexedTask<T> {
        T apply(int index) throws GroupByException;
    }

    /**
     * Runs {@code task} for every index in {@code [0, count)} using at most {@code workers}
     * workers, each owning a contiguous range of indexes. With one worker everything runs on the
     * calling thread.
     */
    public static <T> List<T> map(int count, int workers, IndexedTask<T> task) throws GroupByException {
        List<T> results = new ArrayList<>(Collections.nCopies(count, null));
        int effectiveWorkers = Math.min(Math.min(workers, count), POOL.getParallelism());
        if (effectiveWorkers <= 1) {
            for (int i = 0; i < count; i++) {
                results.set(i, task.apply(i));
            }
            return results;
        }

        int range = (count + effectiveWorkers - 1) / effectiveWorkers;
        List<Future<Void>> futures = new ArrayList<>(effectiveWorkers);
        for (int worker = 0; worker < effectiveWorkers; worker++) {
            int start = worker * range;
            int end = Math.min(start + range, count);
            if (start >= end) {
                break;
            }
            futures.add(POOL.submit(() -> {
                for (int i = start; i < end; i++) {
                    results.set(i, task.apply(i));
                }
                return null;
            }));
        }
        await(futures);
        return results;
    }

    private static void await(List<Future<Void>> futures) throws GroupByException {
        try {
            for (Future<Void> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            futures.forEach(future -> future.cancel(true));
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for parallel group work", e);
        } catch (ExecutionException e) {
            futures.forEach(future -> future.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof GroupByException groupByException) {
                throw groupByException;
            }
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Parallel group work failed", cause);
        }
    }
}

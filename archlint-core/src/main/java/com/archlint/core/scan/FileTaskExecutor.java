package com.archlint.core.scan;

import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Runs one task per file on a bounded worker pool and collects results in input order.
 *
 * <p>Each task sees only its own file, so results do not depend on scheduling. A task that
 * fails contributes its fallback value; the failure is logged and the remaining files are
 * still processed.
 */
final class FileTaskExecutor {

    private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

    private final int parallelism;
    private final Logger log;

    FileTaskExecutor(int parallelism, Logger log) {
        this.parallelism = parallelism;
        this.log = log;
    }

    /**
     * Applies {@code task} to every file.
     *
     * @param files files to process
     * @param task per-file task
     * @param fallback result used for a file whose task failed
     * @return one result per file, in input order
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    <T> List<T> run(List<String> files, Function<String, T> task, T fallback) throws InterruptedException {
        if (files.isEmpty()) {
            return List.of();
        }
        int threads = Math.min(parallelism, files.size());
        ExecutorService executor = Executors.newFixedThreadPool(threads, threadFactory());
        try {
            List<Future<T>> futures = new ArrayList<>(files.size());
            for (String file : files) {
                futures.add(executor.submit(() -> task.apply(file)));
            }

            List<T> results = new ArrayList<>(files.size());
            for (int i = 0; i < futures.size(); i++) {
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    log.error("Failed to process {}: {}", files.get(i), e.getCause().getMessage(), e.getCause());
                    results.add(fallback);
                }
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private static ThreadFactory threadFactory() {
        int pool = POOL_COUNTER.incrementAndGet();
        AtomicInteger worker = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "archlint-" + pool + "-worker-" + worker.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

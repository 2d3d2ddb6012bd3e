package com.mimecast.wren.validation;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.mimecast.wren.error.ErrorKind;
import com.mimecast.wren.error.ValidationError;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

/**
 * Batch fan-out and fan-in.
 * <p>One task per address on a fixed pool of at most the configured concurrency.
 * <br>Results are collected in completion order, one per input.
 * <p>A runtime failure validating one address yields an {@link ErrorKind#UNEXPECTED} result for that address only.
 */
public class ConcurrentDispatcher {
    private static final Logger log = LogManager.getLogger(ConcurrentDispatcher.class);

    private final int concurrency;

    /**
     * Constructs a new ConcurrentDispatcher instance.
     *
     * @param concurrency Maximum parallel tasks.
     */
    public ConcurrentDispatcher(int concurrency) {
        Preconditions.checkArgument(concurrency > 0, "concurrency must be positive: %s", concurrency);
        this.concurrency = concurrency;
    }

    /**
     * Runs the task for every address and waits for all to complete.
     *
     * @param addresses Address strings.
     * @param task      Single address validation.
     * @return List of ValidationResult instances.
     */
    public List<ValidationResult> dispatch(Collection<String> addresses, Function<String, ValidationResult> task) {
        if (addresses == null || addresses.isEmpty()) {
            return Collections.emptyList();
        }

        BlockingQueue<ValidationResult> results = new ArrayBlockingQueue<>(addresses.size());
        ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(addresses.size(), concurrency),
                new ThreadFactoryBuilder().setNameFormat("wren-batch-%d").setDaemon(true).build()
        );

        try {
            List<CompletableFuture<Void>> futures = new ArrayList<>(addresses.size());
            for (String address : addresses) {
                futures.add(CompletableFuture.runAsync(() -> results.add(run(address, task)), executor));
            }

            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } finally {
            executor.shutdown();
        }

        List<ValidationResult> list = new ArrayList<>(results.size());
        results.drainTo(list);
        return list;
    }

    /**
     * Runs the task for one address isolating runtime failures.
     *
     * @param address Address string.
     * @param task    Single address validation.
     * @return ValidationResult instance.
     */
    private ValidationResult run(String address, Function<String, ValidationResult> task) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        try {
            return task.apply(address);
        } catch (RuntimeException e) {
            log.error("Unexpected error validating address: {}", address, e);
            return ValidationResult.builder(address)
                    .withValid(false)
                    .withValidationTime(stopwatch.stop().elapsed())
                    .withError(new ValidationError(ErrorKind.UNEXPECTED, address,
                            "unexpected error: " + e.getMessage()))
                    .build();
        }
    }
}

package com.datapipe.orchestrator.runner.stage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.function.UnaryOperator;

/**
 * Scatter/gather over fixed-size chunks of a list. Chunks run on the given
 * executor; the result keeps the input order.
 */
public class BatchProcessor {

    private static final Logger log = LoggerFactory.getLogger(BatchProcessor.class);

    private final Executor executor;
    private final int      batchSize;

    public BatchProcessor(Executor executor, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        this.executor  = executor;
        this.batchSize = batchSize;
    }

    /**
     * Apply {@code fn} to every chunk and concatenate the results.
     *
     * @throws Exception the first chunk failure, unwrapped
     */
    public <T> List<T> process(List<T> items, UnaryOperator<List<T>> fn) throws Exception {
        List<CompletableFuture<List<T>>> futures = new ArrayList<>();
        for (int from = 0; from < items.size(); from += batchSize) {
            List<T> chunk = items.subList(from, Math.min(from + batchSize, items.size()));
            futures.add(CompletableFuture.supplyAsync(() -> fn.apply(chunk), executor));
        }
        log.debug("Processing {} items in {} batches of up to {}", items.size(), futures.size(), batchSize);

        List<T> result = new ArrayList<>(items.size());
        try {
            for (CompletableFuture<List<T>> future : futures) {
                result.addAll(future.get());
            }
        } catch (ExecutionException | CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof Exception ex) {
                throw ex;
            }
            throw e;
        }
        return result;
    }
}

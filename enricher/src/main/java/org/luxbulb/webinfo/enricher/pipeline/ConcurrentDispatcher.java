package org.luxbulb.webinfo.enricher.pipeline;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.jetbrains.annotations.NotNull;
import org.luxbulb.webinfo.Common;
import org.luxbulb.webinfo.models.ResultCodes;
import org.luxbulb.webinfo.models.results.EnrichmentResult;
import org.luxbulb.webinfo.serialization.InputRow;

import java.util.Iterator;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;

/**
 * Runs the enrichment of input rows with a bounded number of records in flight.
 * <p>
 * The rows are read in order. Each valid row takes a permit from a semaphore (the reading blocks while
 * all permits are taken), and the permit is returned after the record's result has been put into
 * the result channel. Every row, including the invalid ones, produces exactly one result.
 */
public class ConcurrentDispatcher {
    public static final String COMPONENT_NAME = "dispatcher";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(ConcurrentDispatcher.class);

    /**
     * The outcome of a dispatch run.
     *
     * @param submitted    The number of records passed to the enricher.
     * @param invalidInput The number of rows reported as invalid without being enriched.
     */
    public record DispatchSummary(long submitted, long invalidInput) {
        public long total() {
            return submitted + invalidInput;
        }
    }

    private final RecordEnricher _enricher;
    private final ResultChannel _channel;
    private final int _maxConcurrency;
    private final Semaphore _permits;

    public ConcurrentDispatcher(@NotNull RecordEnricher enricher, @NotNull ResultChannel channel,
                                int maxConcurrency) {
        if (maxConcurrency < 1)
            throw new IllegalArgumentException("The concurrency limit must be at least 1");

        _enricher = enricher;
        _channel = channel;
        _maxConcurrency = maxConcurrency;
        _permits = new Semaphore(maxConcurrency);
    }

    /**
     * Enriches all the rows and closes the channel when every result has been put into it.
     *
     * @param rows The input rows.
     * @return The summary of the run.
     * @throws InterruptedException If the calling thread is interrupted while waiting.
     */
    public DispatchSummary dispatch(@NotNull Iterator<InputRow> rows) throws InterruptedException {
        // Results are delivered from a single thread so that a full channel never blocks the lookup threads
        final ExecutorService delivery = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setNameFormat("result-delivery-%d")
                .setDaemon(true)
                .build());

        long submitted = 0, invalid = 0;
        try {
            while (rows.hasNext()) {
                final var row = rows.next();
                if (!row.isValid()) {
                    invalid++;
                    Logger.warn("Line {}: Invalid input row: {}", row.lineNumber(), row.error());
                    _channel.put(EnrichmentResult.errorResult(null, ResultCodes.INVALID_INPUT,
                            "Line %d: %s".formatted(row.lineNumber(), row.error())));
                    continue;
                }

                _permits.acquire();
                submitted++;

                final var origin = row.record();
                CompletableFuture<EnrichmentResult> future;
                try {
                    future = _enricher.enrich(origin);
                } catch (RuntimeException e) {
                    future = CompletableFuture.failedFuture(e);
                }

                future.handleAsync((result, error) -> {
                    if (error != null || result == null) {
                        if (error instanceof CompletionException && error.getCause() != null)
                            error = error.getCause();

                        Logger.error("{}: Unexpected enrichment failure", origin.origin(), error);
                        result = EnrichmentResult.errorResult(origin, ResultCodes.INTERNAL_ERROR,
                                "Internal error: " + (error == null ? "no result" : error.getMessage()));
                    }

                    try {
                        _channel.put(result);
                    } catch (InterruptedException e) {
                        Logger.error("{}: Interrupted while delivering the result", origin.origin());
                        Thread.currentThread().interrupt();
                    } finally {
                        _permits.release();
                    }
                    return null;
                }, delivery);
            }
        } finally {
            // Wait for all the records in flight
            _permits.acquire(_maxConcurrency);
            _permits.release(_maxConcurrency);
            delivery.shutdown();
            _channel.close();
        }

        Logger.debug("Dispatched {} records, {} invalid rows", submitted, invalid);
        return new DispatchSummary(submitted, invalid);
    }
}

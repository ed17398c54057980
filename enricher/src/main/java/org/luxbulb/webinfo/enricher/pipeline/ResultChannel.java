package org.luxbulb.webinfo.enricher.pipeline;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.luxbulb.webinfo.models.results.EnrichmentResult;

import java.time.Instant;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * A bounded multi-producer, single-consumer channel of enrichment results. Producers block when the channel
 * is full. Closing the channel enqueues an end marker after which the consumer receives {@code null}.
 */
public class ResultChannel {
    private static final EnrichmentResult END_OF_STREAM =
            new EnrichmentResult(-1, "End of stream", Instant.EPOCH, null, null);

    private final BlockingQueue<EnrichmentResult> _queue;
    private volatile boolean _closed = false;

    public ResultChannel(int capacity) {
        _queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Adds a result, waiting for free space if necessary.
     *
     * @throws IllegalStateException If the channel has been closed.
     */
    public void put(@NotNull EnrichmentResult result) throws InterruptedException {
        if (_closed)
            throw new IllegalStateException("The channel is closed");

        _queue.put(result);
    }

    /**
     * Closes the channel. The results already in the channel can still be taken.
     */
    public void close() throws InterruptedException {
        if (_closed)
            return;

        _closed = true;
        _queue.put(END_OF_STREAM);
    }

    /**
     * Waits for the next result.
     *
     * @return The result, or null if the channel has been closed and all the results have been taken.
     */
    @Nullable
    public EnrichmentResult take() throws InterruptedException {
        final var result = _queue.take();
        if (result == END_OF_STREAM) {
            // Leave the marker for any other caller
            _queue.put(END_OF_STREAM);
            return null;
        }

        return result;
    }
}

package org.luxbulb.webinfo.enricher.sink;

import org.jetbrains.annotations.NotNull;
import org.luxbulb.webinfo.models.results.EnrichmentResult;

import java.io.IOException;

/**
 * Receives the results drained from the result channel, one at a time, from the sink thread.
 */
public interface ResultConsumer {
    void consume(@NotNull EnrichmentResult result) throws IOException;

    default void flush() throws IOException {
    }
}

package org.luxbulb.webinfo.enricher.pipeline;

import org.jetbrains.annotations.NotNull;
import org.luxbulb.webinfo.models.OriginRecord;
import org.luxbulb.webinfo.models.results.EnrichmentResult;

import java.util.concurrent.CompletableFuture;

/**
 * Produces the enrichment result of a single origin record.
 */
@FunctionalInterface
public interface RecordEnricher {
    /**
     * Starts enriching a record.
     *
     * @param origin The record.
     * @return A future completed with the result. Failures should be expressed as error results rather than
     * by completing the future exceptionally.
     */
    @NotNull
    CompletableFuture<EnrichmentResult> enrich(@NotNull OriginRecord origin);
}

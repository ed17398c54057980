package org.luxbulb.webinfo.models.results;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.luxbulb.webinfo.models.EnrichedRecord;
import org.luxbulb.webinfo.models.OriginRecord;
import org.luxbulb.webinfo.models.ResultCodes;

import java.time.Instant;

/**
 * The outcome of enriching one input row, as passed from the pipelines to the result sink.
 *
 * @param origin The input record. Null only if the input row could not be read at all.
 * @param record The enriched record. Non-null iff the status code is {@link ResultCodes#OK}.
 */
@JsonPropertyOrder({"origin", "status_code", "error", "last_attempt", "record"})
public record EnrichmentResult(int statusCode,
                               @Nullable String error,
                               @NotNull Instant lastAttempt,
                               @Nullable OriginRecord origin,
                               @Nullable EnrichedRecord record
) implements Result {

    public static EnrichmentResult successResult(@NotNull EnrichedRecord record) {
        return new EnrichmentResult(ResultCodes.OK, null, Instant.now(), record.origin(), record);
    }

    public static EnrichmentResult errorResult(@Nullable OriginRecord origin, int code, @NotNull String message) {
        return new EnrichmentResult(code, message, Instant.now(), origin, null);
    }

    /**
     * Returns a short description of the input this result belongs to, for use in log messages.
     */
    @JsonIgnore
    public @NotNull String originIdentity() {
        return origin == null ? "<unreadable row>" : origin.origin();
    }
}

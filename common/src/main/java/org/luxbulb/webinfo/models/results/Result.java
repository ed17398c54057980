package org.luxbulb.webinfo.models.results;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.luxbulb.webinfo.models.ResultCodes;

import java.time.Instant;

/**
 * The base interface for records representing a result of an enrichment operation.
 */
public interface Result {
    /**
     * An integer representing the status of the performed operation.
     * The value is one of the constants defined in <code>{@link ResultCodes}</code>.
     */
    int statusCode();

    /**
     * A human-readable error message. Null iff <code>{@link #statusCode()}</code> is 0.
     */
    @Nullable
    String error();

    /**
     * A timestamp of when the operation was finished.
     */
    @NotNull
    Instant lastAttempt();

    /**
     * Returns true if the operation was successful, that is, when {@link #statusCode()} is zero.
     */
    default boolean success() {
        return this.statusCode() == ResultCodes.OK;
    }
}

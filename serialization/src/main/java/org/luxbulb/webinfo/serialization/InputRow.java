package org.luxbulb.webinfo.serialization;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.luxbulb.webinfo.models.OriginRecord;

/**
 * A single row read from the input source: either a valid origin record, or a description of why
 * the row could not be read.
 *
 * @param lineNumber The line the row was read from (1-based, including the header), or -1 if unknown.
 * @param record     The parsed record. Null iff {@code error} is set.
 * @param error      The reason the row is invalid.
 */
public record InputRow(long lineNumber, @Nullable OriginRecord record, @Nullable String error) {

    public static InputRow valid(long lineNumber, @NotNull OriginRecord record) {
        return new InputRow(lineNumber, record, null);
    }

    public static InputRow invalid(long lineNumber, @NotNull String error) {
        return new InputRow(lineNumber, null, error);
    }

    public boolean isValid() {
        return record != null;
    }
}

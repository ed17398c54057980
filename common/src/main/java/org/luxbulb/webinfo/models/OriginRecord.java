package org.luxbulb.webinfo.models;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jetbrains.annotations.NotNull;

/**
 * A single row of the input popularity list.
 *
 * @param origin     The origin URL, commonly {@code scheme://host}.
 * @param popularity The popularity rank or score of the origin.
 * @param date       The date of the popularity measurement.
 * @param country    The country the measurement relates to.
 */
@JsonPropertyOrder({"origin", "popularity", "date", "country"})
public record OriginRecord(@NotNull String origin,
                           long popularity,
                           @NotNull String date,
                           @NotNull String country) {
}

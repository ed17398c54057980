package org.luxbulb.webinfo.models.ip;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jetbrains.annotations.NotNull;

import java.util.Set;

/**
 * An autonomous system and the networks of it that matched a set of looked-up addresses.
 *
 * @param networks     The matched CIDR blocks, without duplicates.
 * @param asn          The AS number (unsigned 32-bit).
 * @param organization The organization the AS is registered to.
 * @param countryCode  The country code of the AS registration.
 */
@JsonPropertyOrder({"networks", "asn", "organization", "country_code"})
public record AsnInfo(@NotNull Set<IpNetwork> networks,
                      long asn,
                      @NotNull String organization,
                      @NotNull String countryCode) {
}

package org.luxbulb.webinfo.enricher.asn;

import org.jetbrains.annotations.NotNull;
import org.luxbulb.webinfo.models.ip.IpNetwork;

/**
 * A match returned by an {@link AsnLookupTable}.
 *
 * @param network      The CIDR block that contains the looked-up address.
 * @param asn          The AS number announcing the block.
 * @param organization The AS description.
 * @param countryCode  The country code of the AS registration.
 */
public record AsnTableEntry(@NotNull IpNetwork network, long asn,
                            @NotNull String organization, @NotNull String countryCode) {
}

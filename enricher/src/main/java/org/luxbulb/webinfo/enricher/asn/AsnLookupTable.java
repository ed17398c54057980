package org.luxbulb.webinfo.enricher.asn;

import org.jetbrains.annotations.NotNull;

import java.net.InetAddress;
import java.util.Optional;

/**
 * A read-only mapping of IP addresses to the autonomous systems that announce them.
 * Implementations must be safe to query from multiple threads.
 */
public interface AsnLookupTable {
    /**
     * Finds the entry covering an address.
     *
     * @param address The IPv4 or IPv6 address.
     * @return The covering entry, or an empty optional if the address is not routed.
     */
    @NotNull
    Optional<AsnTableEntry> lookup(@NotNull InetAddress address);
}

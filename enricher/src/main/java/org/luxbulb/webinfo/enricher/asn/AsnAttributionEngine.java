package org.luxbulb.webinfo.enricher.asn;

import com.google.common.net.InetAddresses;
import org.jetbrains.annotations.NotNull;
import org.luxbulb.webinfo.Common;
import org.luxbulb.webinfo.models.ip.AsnInfo;
import org.luxbulb.webinfo.models.ip.IpNetwork;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Attributes sets of IP addresses to autonomous systems.
 * <p>
 * The result contains one {@link AsnInfo} per distinct AS number. The networks of an AS are the union of
 * the CIDR blocks matched for all the addresses announced by it, in the order they were first matched.
 */
public final class AsnAttributionEngine {
    public static final String COMPONENT_NAME = "asn-attribution";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(AsnAttributionEngine.class);

    private static final class Accumulator {
        final AsnTableEntry first;
        final Set<IpNetwork> networks = new LinkedHashSet<>();

        Accumulator(AsnTableEntry first) {
            this.first = first;
        }
    }

    private AsnAttributionEngine() {
    }

    /**
     * Looks up each address and merges the matches by AS number.
     *
     * @param ips   The textual IP addresses. Strings that are not IP literals are skipped.
     * @param table The lookup table.
     * @return The attributed autonomous systems, or an empty optional if no address was matched.
     */
    @NotNull
    public static Optional<Set<AsnInfo>> attribute(@NotNull Collection<String> ips, @NotNull AsnLookupTable table) {
        final var byAsn = new LinkedHashMap<Long, Accumulator>();

        for (var ip : ips) {
            if (ip == null || !InetAddresses.isInetAddress(ip)) {
                Logger.debug("Skipping an invalid IP address: {}", ip);
                continue;
            }

            final var entry = table.lookup(InetAddresses.forString(ip));
            if (entry.isEmpty()) {
                Logger.trace("No AS found for {}", ip);
                continue;
            }

            final var match = entry.get();
            byAsn.computeIfAbsent(match.asn(), asn -> new Accumulator(match))
                    .networks.add(match.network());
        }

        if (byAsn.isEmpty())
            return Optional.empty();

        final var result = new LinkedHashSet<AsnInfo>();
        for (var acc : byAsn.values()) {
            result.add(new AsnInfo(Collections.unmodifiableSet(acc.networks), acc.first.asn(),
                    acc.first.organization(), acc.first.countryCode()));
        }

        return Optional.of(Collections.unmodifiableSet(result));
    }
}

package org.luxbulb.webinfo.enricher.asn;

import com.google.common.net.InetAddresses;
import org.junit.jupiter.api.Test;
import org.luxbulb.webinfo.models.ip.AsnInfo;
import org.luxbulb.webinfo.models.ip.IpNetwork;

import java.net.InetAddress;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class AsnAttributionEngineTest {

    /**
     * A table with a fixed set of networks.
     */
    private static final class FakeTable implements AsnLookupTable {
        private final Map<IpNetwork, AsnTableEntry> _entries;

        FakeTable(AsnTableEntry... entries) {
            _entries = new LinkedHashMap<>();
            for (var entry : entries) {
                _entries.put(entry.network(), entry);
            }
        }

        @Override
        public Optional<AsnTableEntry> lookup(InetAddress address) {
            return _entries.values().stream()
                    .filter(entry -> entry.network().contains(address))
                    .findFirst();
        }
    }

    private static AsnTableEntry entry(String cidr, long asn, String organization) {
        return new AsnTableEntry(IpNetwork.of(cidr), asn, organization, "FR");
    }

    private static final FakeTable TABLE = new FakeTable(
            entry("212.27.32.0/19", 12322, "PROXAD Free SAS"),
            entry("212.27.60.0/24", 12322, "PROXAD Free SAS"),
            entry("2a01:e00::/26", 12322, "PROXAD Free SAS"),
            entry("104.16.0.0/13", 13335, "CLOUDFLARENET"),
            entry("142.250.0.0/15", 15169, "GOOGLE"));

    @Test
    void mergesAddressesOfTheSameAs() {
        final var result = AsnAttributionEngine.attribute(
                List.of("212.27.48.10", "212.27.48.11", "2a01:e0c:1::1"), TABLE).orElseThrow();

        assertEquals(1, result.size());
        final var info = result.iterator().next();
        assertEquals(12322, info.asn());
        assertEquals("PROXAD Free SAS", info.organization());
        assertEquals(List.of(IpNetwork.of("212.27.32.0/19"), IpNetwork.of("2a01:e00::/26")),
                new ArrayList<>(info.networks()));
    }

    @Test
    void keepsOneEntryPerAs() {
        final var result = AsnAttributionEngine.attribute(
                List.of("104.16.1.1", "212.27.48.10", "142.250.1.1", "104.17.2.2"), TABLE).orElseThrow();

        assertEquals(List.of(13335L, 12322L, 15169L),
                result.stream().map(AsnInfo::asn).collect(Collectors.toList()));
    }

    @Test
    void skipsUnmatchedAndInvalidAddresses() {
        final var result = AsnAttributionEngine.attribute(
                List.of("not-an-ip", "192.0.2.1", "104.16.1.1"), TABLE).orElseThrow();

        assertEquals(1, result.size());
        assertEquals(13335, result.iterator().next().asn());
    }

    @Test
    void returnsEmptyWhenNothingMatches() {
        assertTrue(AsnAttributionEngine.attribute(List.of(), TABLE).isEmpty());
        assertTrue(AsnAttributionEngine.attribute(List.of("192.0.2.1", "2001:db8::1"), TABLE).isEmpty());
    }

    @Test
    void attributionIsIdempotent() {
        final var ips = List.of("212.27.48.10", "104.16.1.1", "212.27.60.19");

        final var once = AsnAttributionEngine.attribute(ips, TABLE).orElseThrow();
        final var doubled = new ArrayList<>(ips);
        doubled.addAll(ips);
        final var twice = AsnAttributionEngine.attribute(doubled, TABLE).orElseThrow();

        assertEquals(once, twice);
    }

    @Test
    void outputMatchesTheDistinctAsesOfRandomInputs() {
        final var random = new Random(42);
        final var pool = List.of("212.27.48.10", "212.27.60.19", "2a01:e0c:1::1", "104.16.1.1", "104.20.0.1",
                "142.250.1.1", "142.251.2.2", "192.0.2.1", "198.51.100.7");

        for (int round = 0; round < 200; round++) {
            final var ips = new ArrayList<String>();
            final var count = random.nextInt(12);
            for (int i = 0; i < count; i++) {
                ips.add(pool.get(random.nextInt(pool.size())));
            }

            final var expectedAses = new HashSet<Long>();
            final var expectedNetworks = new HashSet<IpNetwork>();
            for (var ip : ips) {
                TABLE.lookup(InetAddresses.forString(ip)).ifPresent(entry -> {
                    expectedAses.add(entry.asn());
                    expectedNetworks.add(entry.network());
                });
            }

            final var result = AsnAttributionEngine.attribute(ips, TABLE);
            if (expectedAses.isEmpty()) {
                assertTrue(result.isEmpty(), "round " + round);
                continue;
            }

            final Set<AsnInfo> infos = result.orElseThrow();
            assertEquals(expectedAses, infos.stream().map(AsnInfo::asn).collect(Collectors.toSet()),
                    "round " + round);
            assertEquals(expectedAses.size(), infos.size(), "round " + round);

            final var networkCount = infos.stream().mapToInt(info -> info.networks().size()).sum();
            final var allNetworks = infos.stream().flatMap(info -> info.networks().stream())
                    .collect(Collectors.toSet());
            assertEquals(expectedNetworks, allNetworks, "round " + round);
            assertEquals(allNetworks.size(), networkCount, "round " + round);
        }
    }
}

package org.luxbulb.webinfo.enricher.dns;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.luxbulb.webinfo.enricher.asn.AsnLookupTable;
import org.luxbulb.webinfo.enricher.asn.AsnTableEntry;
import org.luxbulb.webinfo.models.ip.IpNetwork;
import org.xbill.DNS.Message;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DnsLookupServiceTest {
    private static final long TIMEOUT_S = 10;

    private static final AsnLookupTable ASN_TABLE = address -> {
        final var network = IpNetwork.of("212.27.32.0/19");
        return network.contains(address)
                ? Optional.of(new AsnTableEntry(network, 12322, "PROXAD Free SAS", "FR"))
                : Optional.empty();
    };

    private static final FakeResolvers.Zone ZONE = FakeResolvers.zone()
            .a("www.free.fr", "212.27.48.10")
            .aaaa("www.free.fr", "2a01:e0c:1::1")
            .ns("free.fr", "freens1-g20.free.fr", "freens2-g20.free.fr")
            .a("freens1-g20.free.fr", "212.27.60.19")
            .aaaa("freens1-g20.free.fr", "2a01:e0c:1:1599::22")
            .a("freens2-g20.free.fr", "212.27.60.20")
            .cname("shop.example.net", "shops.myshopify.com")
            .a("shops.myshopify.com", "23.227.38.74")
            .ns("lame.example.org", "ns.lame.example.org");

    private ExecutorService _executor;
    private DnsLookupService _dns;

    @BeforeEach
    void setUp() {
        _executor = Executors.newFixedThreadPool(4);
        _dns = new DnsLookupService(FakeResolvers.resolver(ZONE), _executor, ASN_TABLE);
    }

    @AfterEach
    void tearDown() {
        _executor.shutdownNow();
    }

    @Test
    void resolvesIpv4AndIpv6Addresses() throws Exception {
        final var ips = _dns.queryAddresses("www.free.fr").get(TIMEOUT_S, TimeUnit.SECONDS).orElseThrow();

        assertEquals(List.of("212.27.48.10", "2a01:e0c:1::1"), List.copyOf(ips));
    }

    @Test
    void returnsEmptyForNonExistentNames() throws Exception {
        assertEquals(Optional.empty(), _dns.queryAddresses("nothing.free.fr").get(TIMEOUT_S, TimeUnit.SECONDS));
        assertEquals(Optional.empty(), _dns.queryCname("www.free.fr").get(TIMEOUT_S, TimeUnit.SECONDS));
        assertEquals(Optional.empty(), _dns.queryNameServers("nothing.fr").get(TIMEOUT_S, TimeUnit.SECONDS));
    }

    @Test
    void returnsCnameTargets() throws Exception {
        final var cname = _dns.queryCname("shop.example.net").get(TIMEOUT_S, TimeUnit.SECONDS);

        assertEquals(Optional.of(List.of("shops.myshopify.com")), cname);
    }

    @Test
    void resolvesAndAttributesNameServers() throws Exception {
        final var info = _dns.queryNameServers("free.fr").get(TIMEOUT_S, TimeUnit.SECONDS).orElseThrow();

        assertEquals(List.of("freens1-g20.free.fr", "freens2-g20.free.fr"), info.names());
        assertEquals(Set.of("212.27.60.19", "2a01:e0c:1:1599::22", "212.27.60.20"), info.ips());
        assertNotNull(info.asn());
        assertEquals(1, info.asn().size());
        final var asn = info.asn().iterator().next();
        assertEquals(12322, asn.asn());
        assertEquals(Set.of(IpNetwork.of("212.27.32.0/19")), asn.networks());
    }

    @Test
    void keepsNameServersWithoutAddresses() throws Exception {
        final var info = _dns.queryNameServers("lame.example.org").get(TIMEOUT_S, TimeUnit.SECONDS)
                .orElseThrow();

        assertEquals(List.of("ns.lame.example.org"), info.names());
        assertNull(info.ips());
        assertNull(info.asn());
    }

    @Test
    void absorbsResolverFailures() throws Exception {
        final var dns = new DnsLookupService(FakeResolvers.failingResolver(new IOException("Timed out")),
                _executor, ASN_TABLE);

        assertEquals(Optional.empty(), dns.queryAddresses("www.free.fr").get(TIMEOUT_S, TimeUnit.SECONDS));
        assertEquals(Optional.empty(), dns.queryCname("www.free.fr").get(TIMEOUT_S, TimeUnit.SECONDS));
        assertEquals(Optional.empty(), dns.queryNameServers("free.fr").get(TIMEOUT_S, TimeUnit.SECONDS));
    }

    @Test
    void rejectsInvalidNames() throws Exception {
        assertEquals(Optional.empty(), _dns.queryAddresses("a..b").get(TIMEOUT_S, TimeUnit.SECONDS));
        assertEquals(Optional.empty(), _dns.queryNameServers("a..b").get(TIMEOUT_S, TimeUnit.SECONDS));
    }

    @Test
    void cancellingALookupCancelsItsQueries() throws Exception {
        final var sent = new ConcurrentLinkedQueue<CompletableFuture<Message>>();
        final var dns = new DnsLookupService(FakeResolvers.silentResolver(sent), _executor, ASN_TABLE);

        final var addresses = dns.queryAddresses("www.free.fr");
        final var nameservers = dns.queryNameServers("free.fr");
        FakeResolvers.awaitQueries(sent, 3);

        assertTrue(addresses.cancel(true));
        assertTrue(nameservers.cancel(true));

        assertEquals(3, sent.size());
        FakeResolvers.awaitCancelled(sent);
    }
}

package org.luxbulb.webinfo.enricher.tls;

import com.google.common.net.InetAddresses;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.luxbulb.webinfo.EnricherConfig;
import org.luxbulb.webinfo.PropertiesBuilder;
import org.luxbulb.webinfo.enricher.tls.TlsProbeException.ProbeFailure;
import org.luxbulb.webinfo.models.tls.CertificateIssuerInfo;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.security.KeyStore;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TlsCertificateProbeTest {
    private static final List<String> LOOPBACK = List.of("127.0.0.1");
    private static final CertificateIssuerInfo TEST_ROOT = new CertificateIssuerInfo("WebInfo Test Root", "CZ");

    private LocalTlsServer _server;

    @BeforeEach
    void setUp() throws Exception {
        _server = new LocalTlsServer();
    }

    @AfterEach
    void tearDown() throws Exception {
        _server.close();
    }

    private static X509Certificate loadCertificate(String name) throws Exception {
        try (var in = TlsCertificateProbeTest.class.getResourceAsStream("/tls/" + name)) {
            return (X509Certificate) CertificateFactory.getInstance("X.509").generateCertificate(in);
        }
    }

    private static SSLContext trustingTestRoot() throws Exception {
        final var trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
        trustStore.load(null, null);
        trustStore.setCertificateEntry("root", loadCertificate("root.pem"));

        final var trustManagerFactory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        trustManagerFactory.init(trustStore);
        final var context = SSLContext.getInstance("TLS");
        context.init(null, trustManagerFactory.getTrustManagers(), null);
        return context;
    }

    private TlsCertificateProbe probe(SSLContext context, int readTimeoutMs) {
        return new TlsCertificateProbe(context, _server.port(), 1000, readTimeoutMs, 2);
    }

    @Test
    void readsIssuerOfTheLastCertificate() throws Exception {
        try (var probe = probe(TlsCertificateProbe.makeContext(true), 5000)) {
            assertEquals(TEST_ROOT, probe.probe("localhost", LOOPBACK));
            assertEquals(1, _server.requests());
        }
    }

    @Test
    void completesHandshakeWithTrustedChain() throws Exception {
        try (var probe = probe(trustingTestRoot(), 5000)) {
            assertEquals(TEST_ROOT, probe.probe("localhost", List.of("2001:db8::1", "127.0.0.1")));
        }
    }

    @Test
    void failsHandshakeWithUntrustedChain() throws Exception {
        try (var probe = probe(TlsCertificateProbe.makeContext(false), 5000)) {
            final var e = assertThrows(TlsProbeException.class, () -> probe.probe("localhost", LOOPBACK));
            assertEquals(ProbeFailure.HANDSHAKE_FAILURE, e.getFailure());
        }
    }

    @Test
    void buildsFromProperties() throws Exception {
        final var properties = new PropertiesBuilder()
                .add(EnricherConfig.TLS_PORT_CONFIG, Integer.toString(_server.port()))
                .add(EnricherConfig.TLS_TRUST_ALL_CONFIG, "true")
                .get();

        try (var probe = new TlsCertificateProbe(properties)) {
            assertEquals(TEST_ROOT, probe.probeAsync("localhost", LOOPBACK).get(10, TimeUnit.SECONDS));
        }
    }

    @Test
    void failsWithoutAddresses() throws Exception {
        try (var probe = probe(TlsCertificateProbe.makeContext(true), 5000)) {
            assertEquals(ProbeFailure.NO_ADDRESS_AVAILABLE,
                    assertThrows(TlsProbeException.class, () -> probe.probe("localhost", List.of())).getFailure());
            assertEquals(ProbeFailure.NO_ADDRESS_AVAILABLE,
                    assertThrows(TlsProbeException.class, () -> probe.probe("localhost", List.of("x"))).getFailure());

            final var future = probe.probeAsync("localhost", List.of());
            final var e = assertThrows(ExecutionException.class, () -> future.get(10, TimeUnit.SECONDS));
            assertEquals(ProbeFailure.NO_ADDRESS_AVAILABLE, ((TlsProbeException) e.getCause()).getFailure());
        }
    }

    @Test
    void failsToConnectToClosedPort() throws Exception {
        final int closedPort;
        try (var socket = new ServerSocket(0, 1, InetAddress.getByName("127.0.0.1"))) {
            closedPort = socket.getLocalPort();
        }

        try (var probe = new TlsCertificateProbe(TlsCertificateProbe.makeContext(true), closedPort, 1000, 1000, 1)) {
            final var e = assertThrows(TlsProbeException.class, () -> probe.probe("localhost", LOOPBACK));
            assertEquals(ProbeFailure.CONNECT_FAILURE, e.getFailure());
        }
    }

    @Test
    void timesOutOnSilentServers() throws Exception {
        try (var silent = new ServerSocket(0, 1, InetAddress.getByName("127.0.0.1"));
             var probe = new TlsCertificateProbe(TlsCertificateProbe.makeContext(true), silent.getLocalPort(),
                     1000, 300, 1)) {
            final var e = assertThrows(TlsProbeException.class, () -> probe.probe("localhost", LOOPBACK));
            assertEquals(ProbeFailure.TIMEOUT, e.getFailure());
        }
    }

    @Test
    void cancellationClosesTheSocket() throws Exception {
        try (var silent = new ServerSocket(0, 1, InetAddress.getByName("127.0.0.1"));
             var probe = new TlsCertificateProbe(TlsCertificateProbe.makeContext(true), silent.getLocalPort(),
                     1000, 30000, 1)) {
            final var future = probe.probeAsync("localhost", LOOPBACK);

            try (var accepted = silent.accept()) {
                final var closed = new CountDownLatch(1);
                final var reader = new Thread(() -> {
                    try {
                        final var in = accepted.getInputStream();
                        while (in.read() != -1) {
                            // Discard the client hello
                        }
                    } catch (IOException e) {
                        // A reset also means the socket was closed
                    }
                    closed.countDown();
                });
                reader.start();

                assertTrue(future.cancel(true));
                assertTrue(closed.await(10, TimeUnit.SECONDS));
            }

            assertThrows(CancellationException.class, future::join);
        }
    }

    @Test
    void parsesLastIssuerAttributes() throws Exception {
        assertEquals(new CertificateIssuerInfo("Beta", "FR"),
                TlsCertificateProbe.parseIssuer(loadCertificate("multi-issuer.pem")));
        assertEquals(new CertificateIssuerInfo("Only Org, Inc.", null),
                TlsCertificateProbe.parseIssuer(loadCertificate("no-country.pem")));
        assertEquals(new CertificateIssuerInfo("WebInfo Test Root", "CZ"),
                TlsCertificateProbe.parseIssuer(loadCertificate("inter.pem")));
    }

    @Test
    void requiresIssuerOrganization() throws Exception {
        final var certificate = loadCertificate("no-organization.pem");

        final var e = assertThrows(TlsProbeException.class, () -> TlsCertificateProbe.parseIssuer(certificate));
        assertEquals(ProbeFailure.MISSING_ISSUER_ORGANIZATION, e.getFailure());
    }

    @Test
    void prefersTheFirstIpv4Address() {
        assertEquals(Optional.of(InetAddresses.forString("212.27.48.10")),
                TlsCertificateProbe.selectAddress(List.of("2a01:e0c:1::1", "212.27.48.10", "1.2.3.4")));
        assertEquals(Optional.of(InetAddresses.forString("2a01:e0c:1::2")),
                TlsCertificateProbe.selectAddress(List.of("2a01:e0c:1::2", "2a01:e0c:1::1")));
        assertEquals(Optional.of(InetAddresses.forString("1.2.3.4")),
                TlsCertificateProbe.selectAddress(List.of("not-an-ip", "1.2.3.4")));
        assertEquals(Optional.empty(), TlsCertificateProbe.selectAddress(List.of("not-an-ip")));
    }
}

package org.luxbulb.webinfo.enricher.tls;

import com.google.common.net.InetAddresses;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.jetbrains.annotations.NotNull;
import org.luxbulb.webinfo.Common;
import org.luxbulb.webinfo.EnricherConfig;
import org.luxbulb.webinfo.enricher.tls.TlsProbeException.ProbeFailure;
import org.luxbulb.webinfo.models.tls.CertificateIssuerInfo;

import javax.naming.InvalidNameException;
import javax.naming.ldap.LdapName;
import javax.naming.ldap.Rdn;
import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLPeerUnverifiedException;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManager;
import javax.security.auth.x500.X500Principal;
import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Connects to a host over TLS and reads the issuer of the certificate chain it presents.
 * <p>
 * The probe connects to one of the host's addresses (IPv4 preferred), performs the handshake with SNI set
 * to the host name, sends a minimal HTTP request and takes the <b>last</b> certificate of the peer chain.
 * The organization and country of that certificate's issuer are returned.
 */
public class TlsCertificateProbe implements Closeable {
    public static final String COMPONENT_NAME = "tls-probe";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(TlsCertificateProbe.class);

    private static final String HTTP_HEADERS =
            "Accept: text/html, application/xhtml+xml, application/xml\r\n" +
                    "Accept-Encoding: identity\r\n" +
                    "User-Agent: webinfo\r\n" +
                    "Connection: close\r\n\r\n";

    private final SSLSocketFactory _socketFactory;
    private final int _port;
    private final int _connectTimeout;
    private final int _readTimeout;
    private final ExecutorService _executor;

    /**
     * Creates a probe configured by the {@code webinfo.tls.*} properties. The probes run on a fixed pool
     * sized to the maximum number of concurrently enriched records.
     *
     * @throws GeneralSecurityException If the TLS context cannot be created.
     */
    public TlsCertificateProbe(@NotNull Properties properties) throws GeneralSecurityException {
        this(makeContext(Boolean.parseBoolean(properties.getProperty(EnricherConfig.TLS_TRUST_ALL_CONFIG,
                        EnricherConfig.TLS_TRUST_ALL_DEFAULT))),
                Integer.parseInt(properties.getProperty(EnricherConfig.TLS_PORT_CONFIG,
                        EnricherConfig.TLS_PORT_DEFAULT)),
                Integer.parseInt(properties.getProperty(EnricherConfig.TLS_CONNECT_TIMEOUT_MS_CONFIG,
                        EnricherConfig.TLS_CONNECT_TIMEOUT_MS_DEFAULT)),
                Integer.parseInt(properties.getProperty(EnricherConfig.TLS_READ_TIMEOUT_MS_CONFIG,
                        EnricherConfig.TLS_READ_TIMEOUT_MS_DEFAULT)),
                Integer.parseInt(properties.getProperty(EnricherConfig.MAX_CONCURRENCY_CONFIG,
                        EnricherConfig.MAX_CONCURRENCY_DEFAULT)));
    }

    public TlsCertificateProbe(@NotNull SSLContext context, int port, int connectTimeoutMs, int readTimeoutMs,
                               int threads) {
        _socketFactory = context.getSocketFactory();
        _port = port;
        _connectTimeout = connectTimeoutMs;
        _readTimeout = readTimeoutMs;
        _executor = Executors.newFixedThreadPool(Math.max(1, threads), new ThreadFactoryBuilder()
                .setNameFormat("tls-probe-%d")
                .setDaemon(true)
                .build());

        final var sslEngine = context.createSSLEngine();
        Logger.debug("TLS enabled protocols: {}", Arrays.toString(sslEngine.getEnabledProtocols()));
        Logger.trace("TLS enabled ciphers: {}", Arrays.toString(sslEngine.getEnabledCipherSuites()));
    }

    /**
     * Creates the TLS context for the probe.
     *
     * @param trustAll If true, the context accepts any certificate chain. Otherwise, the JVM default context
     *                 is used and untrusted chains fail the handshake.
     */
    public static SSLContext makeContext(boolean trustAll) throws GeneralSecurityException {
        if (!trustAll)
            return SSLContext.getDefault();

        final var context = SSLContext.getInstance("TLS");
        context.init(null, new TrustManager[]{new NaiveTrustManager()}, null);
        return context;
    }

    /**
     * Runs the probe on the probe pool. Cancelling the returned future closes the probe's socket.
     *
     * @see #probe(String, Collection)
     */
    public CompletableFuture<CertificateIssuerInfo> probeAsync(@NotNull String hostname,
                                                               @NotNull Collection<String> candidateIps) {
        final var socketRef = new AtomicReference<Socket>();
        final var future = new CompletableFuture<CertificateIssuerInfo>();

        final var task = _executor.submit(() -> {
            try {
                future.complete(probe(hostname, candidateIps, socketRef));
            } catch (TlsProbeException | RuntimeException e) {
                future.completeExceptionally(e);
            }
        });

        future.whenComplete((result, error) -> {
            if (future.isCancelled()) {
                Logger.trace("{}: Probe cancelled", hostname);
                task.cancel(true);
                closeQuietly(socketRef.get());
            }
        });

        return future;
    }

    /**
     * Probes the host in the calling thread.
     *
     * @param hostname     The host name, used for SNI and in the HTTP request.
     * @param candidateIps The addresses of the host.
     * @return The issuer of the last certificate in the chain presented by the host.
     * @throws TlsProbeException If no address can be used, the connection or handshake fails, or the issuer
     *                           has no organization.
     */
    public CertificateIssuerInfo probe(@NotNull String hostname, @NotNull Collection<String> candidateIps)
            throws TlsProbeException {
        return probe(hostname, candidateIps, new AtomicReference<>());
    }

    private CertificateIssuerInfo probe(String hostname, Collection<String> candidateIps,
                                        AtomicReference<Socket> socketRef) throws TlsProbeException {
        final var address = selectAddress(candidateIps)
                .orElseThrow(() -> new TlsProbeException(ProbeFailure.NO_ADDRESS_AVAILABLE,
                        "No IP address to connect to"));
        final var targetIp = InetAddresses.toAddrString(address);

        try (var rawSocket = new Socket()) {
            socketRef.set(rawSocket);
            if (Thread.currentThread().isInterrupted())
                throw new TlsProbeException(ProbeFailure.TIMEOUT, "Probe cancelled");

            try {
                rawSocket.connect(new InetSocketAddress(address, _port), _connectTimeout);
                rawSocket.setSoTimeout(_readTimeout);
            } catch (SocketTimeoutException e) {
                Logger.debug("{}: Connection to {} timed out", hostname, targetIp);
                throw new TlsProbeException(ProbeFailure.TIMEOUT,
                        "Connection timed out (%d ms)".formatted(_connectTimeout), e);
            } catch (IOException | IllegalArgumentException e) {
                Logger.debug("{}: Cannot connect to {}: {}", hostname, targetIp, e.getMessage());
                throw new TlsProbeException(ProbeFailure.CONNECT_FAILURE,
                        "Cannot connect to %s: %s".formatted(targetIp, e.getMessage()), e);
            }

            try (var socket = (SSLSocket) _socketFactory.createSocket(rawSocket, hostname, _port, true)) {
                // Enable SNI, which is not allowed for IP literals
                if (!InetAddresses.isInetAddress(hostname)) {
                    final var sslParams = socket.getSSLParameters();
                    sslParams.setServerNames(List.of(new SNIHostName(hostname)));
                    socket.setSSLParameters(sslParams);
                }

                Logger.trace("{}: Starting TLS handshake with {}", hostname, targetIp);
                socket.startHandshake();

                final Certificate[] chain;
                try {
                    chain = socket.getSession().getPeerCertificates();
                } catch (SSLPeerUnverifiedException e) {
                    throw new TlsProbeException(ProbeFailure.MISSING_PEER_CERTIFICATES,
                            "The peer did not present certificates", e);
                }

                if (chain == null || chain.length == 0 || !(chain[chain.length - 1] instanceof X509Certificate))
                    throw new TlsProbeException(ProbeFailure.MISSING_PEER_CERTIFICATES,
                            "The peer did not present X.509 certificates");

                sendRequest(hostname, socket);
                return parseIssuer((X509Certificate) chain[chain.length - 1]);
            } catch (SocketTimeoutException e) {
                Logger.debug("{}: Socket read timed out", hostname);
                throw new TlsProbeException(ProbeFailure.TIMEOUT,
                        "Socket read timed out (%d ms)".formatted(_readTimeout), e);
            } catch (SSLException e) {
                Logger.debug("{}: TLS handshake error: {}", hostname, e.getMessage());
                throw new TlsProbeException(ProbeFailure.HANDSHAKE_FAILURE,
                        "TLS handshake error: " + e.getMessage(), e);
            } catch (IOException | IllegalArgumentException e) {
                if (Thread.currentThread().isInterrupted())
                    throw new TlsProbeException(ProbeFailure.TIMEOUT, "Probe cancelled", e);

                Logger.debug("{}: TLS error: {}", hostname, e.getMessage());
                throw new TlsProbeException(ProbeFailure.HANDSHAKE_FAILURE, "TLS error: " + e.getMessage(), e);
            }
        } catch (IOException e) {
            throw new TlsProbeException(ProbeFailure.CONNECT_FAILURE, "Socket error: " + e.getMessage(), e);
        } finally {
            socketRef.set(null);
        }
    }

    /**
     * Sends {@code GET /} and reads the status line of the response. The response itself is not used,
     * so errors are only logged.
     */
    private static void sendRequest(String hostname, SSLSocket socket) {
        try {
            final var writer = new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.US_ASCII);
            writer.write("GET / HTTP/1.1\r\nHost: ");
            writer.write(hostname);
            writer.write("\r\n");
            writer.write(HTTP_HEADERS);
            writer.flush();

            final var reader = new BufferedReader(new InputStreamReader(socket.getInputStream(),
                    StandardCharsets.US_ASCII));
            Logger.trace("{}: HTTP status line: {}", hostname, reader.readLine());
        } catch (IOException e) {
            Logger.trace("{}: HTTP request failed: {}", hostname, e.getMessage());
        }
    }

    /**
     * Chooses the address to connect to: the first IPv4 address in the given order if there is one,
     * otherwise the first address. Strings that are not IP literals are ignored.
     */
    static Optional<InetAddress> selectAddress(@NotNull Collection<String> candidateIps) {
        final var addresses = candidateIps.stream()
                .filter(Objects::nonNull)
                .filter(InetAddresses::isInetAddress)
                .map(InetAddresses::forString)
                .toList();

        return addresses.stream()
                .filter(address -> address instanceof Inet4Address)
                .findFirst()
                .or(() -> addresses.stream().findFirst());
    }

    /**
     * Extracts the organization and country of a certificate's issuer. When the issuer name contains
     * an attribute several times, the last occurrence in the encoded name is used.
     *
     * @throws TlsProbeException If the issuer name has no organization.
     */
    static CertificateIssuerInfo parseIssuer(@NotNull X509Certificate certificate) throws TlsProbeException {
        final LdapName name;
        try {
            name = new LdapName(certificate.getIssuerX500Principal().getName(X500Principal.RFC2253));
        } catch (InvalidNameException e) {
            throw new TlsProbeException(ProbeFailure.MISSING_ISSUER_ORGANIZATION,
                    "Cannot parse the issuer name", e);
        }

        String organization = null, country = null;
        // getRdns() lists the RDNs in the order of the encoded name
        for (Rdn rdn : name.getRdns()) {
            if ("O".equalsIgnoreCase(rdn.getType())) {
                organization = rdn.getValue().toString();
            } else if ("C".equalsIgnoreCase(rdn.getType())) {
                country = rdn.getValue().toString();
            }
        }

        if (organization == null)
            throw new TlsProbeException(ProbeFailure.MISSING_ISSUER_ORGANIZATION,
                    "The issuer has no organization: " + name);

        return new CertificateIssuerInfo(organization, country);
    }

    private static void closeQuietly(Socket socket) {
        if (socket == null)
            return;

        try {
            socket.close();
        } catch (IOException e) {
            Logger.trace("Cannot close a cancelled probe socket", e);
        }
    }

    @Override
    public void close() {
        _executor.shutdownNow();
    }
}

package org.luxbulb.webinfo.enricher.pipeline;

import org.jetbrains.annotations.NotNull;
import org.luxbulb.webinfo.Common;
import org.luxbulb.webinfo.EnricherConfig;
import org.luxbulb.webinfo.enricher.asn.AsnAttributionEngine;
import org.luxbulb.webinfo.enricher.asn.AsnLookupTable;
import org.luxbulb.webinfo.enricher.dns.DnsLookupService;
import org.luxbulb.webinfo.enricher.domain.DomainParser;
import org.luxbulb.webinfo.enricher.domain.InvalidOriginException;
import org.luxbulb.webinfo.enricher.tls.TlsCertificateProbe;
import org.luxbulb.webinfo.enricher.tls.TlsProbeException;
import org.luxbulb.webinfo.models.OriginRecord;
import org.luxbulb.webinfo.models.ResultCodes;
import org.luxbulb.webinfo.models.dns.NameServerInfo;
import org.luxbulb.webinfo.models.results.EnrichmentResult;

import java.util.Locale;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Enriches a single origin record: parses its host name and domain, resolves the host's addresses, CNAME
 * and the domain's name servers, attributes the addresses to autonomous systems and finally probes the
 * host's TLS certificate.
 * <p>
 * The DNS lookups run concurrently. Lookup and probe failures only leave the corresponding fields empty;
 * the record fails as a whole only when its origin is not a valid URL or host name, or when the
 * enrichment exceeds the configured time limit.
 */
public class RecordEnrichmentPipeline implements RecordEnricher {
    public static final String COMPONENT_NAME = "pipeline";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(RecordEnrichmentPipeline.class);

    private final DnsLookupService _dns;
    private final AsnLookupTable _asnTable;
    private final TlsCertificateProbe _probe;
    private final long _timeoutMs;
    private final boolean _probeAlways;

    public RecordEnrichmentPipeline(@NotNull DnsLookupService dns, @NotNull AsnLookupTable asnTable,
                                    @NotNull TlsCertificateProbe probe, @NotNull Properties properties) {
        _dns = dns;
        _asnTable = asnTable;
        _probe = probe;
        _timeoutMs = Long.parseLong(properties.getProperty(EnricherConfig.PIPELINE_TIMEOUT_MS_CONFIG,
                EnricherConfig.PIPELINE_TIMEOUT_MS_DEFAULT));
        _probeAlways = Boolean.parseBoolean(properties.getProperty(EnricherConfig.TLS_PROBE_ALWAYS_CONFIG,
                EnricherConfig.TLS_PROBE_ALWAYS_DEFAULT));
    }

    @Override
    public @NotNull CompletableFuture<EnrichmentResult> enrich(@NotNull OriginRecord origin) {
        // Parse
        final String hostname;
        try {
            hostname = DomainParser.extractHostname(origin.origin());
        } catch (InvalidOriginException e) {
            Logger.debug("{}: {}", origin.origin(), e.getMessage());
            return CompletableFuture.completedFuture(
                    EnrichmentResult.errorResult(origin, e.getCode(), e.getMessage()));
        }

        final var context = new EnrichmentContext(origin, hostname);
        final var domain = DomainParser.extractDomain(hostname);
        if (domain.isPresent()) {
            context.domain(domain.get());
        } else {
            Logger.debug("{}: Cannot determine the registrable domain, skipping name servers", hostname);
        }

        // Resolve
        Logger.trace("{}: Starting DNS lookups", hostname);
        final var addresses = context.track(_dns.queryAddresses(hostname));
        final var cname = context.track(_dns.queryCname(hostname));
        final CompletableFuture<Optional<NameServerInfo>> nameservers = domain.isPresent()
                ? context.track(_dns.queryNameServers(domain.get()))
                : CompletableFuture.completedFuture(Optional.empty());

        final var resultFuture = CompletableFuture.allOf(addresses, cname, nameservers)
                .thenCompose(unused -> {
                    cname.join().ifPresent(context::cname);
                    nameservers.join().ifPresent(context::nameservers);

                    final var ips = addresses.join();
                    if (ips.isEmpty()) {
                        Logger.trace("{}: No addresses resolved", hostname);
                        return CompletableFuture.completedFuture(context);
                    }

                    // Attribute
                    context.ips(ips.get());
                    AsnAttributionEngine.attribute(ips.get(), _asnTable).ifPresent(context::asn);

                    // Probe
                    if (!shouldProbe(origin)) {
                        return CompletableFuture.completedFuture(context);
                    }

                    Logger.trace("{}: Starting TLS probe", hostname);
                    return context.track(_probe.probeAsync(hostname, ips.get()))
                            .handle((issuer, error) -> {
                                if (error == null) {
                                    context.tls(issuer);
                                } else {
                                    logProbeFailure(hostname, error);
                                }
                                return context;
                            });
                })
                .thenApply(ctx -> EnrichmentResult.successResult(ctx.freeze()));

        return resultFuture
                .orTimeout(_timeoutMs, TimeUnit.MILLISECONDS)
                .exceptionally(e -> {
                    if (e instanceof CompletionException && e.getCause() != null)
                        e = e.getCause();

                    if (e instanceof TimeoutException) {
                        final var cancelled = context.cancelAll();
                        Logger.warn("{}: Enrichment timed out ({} lookups cancelled)", hostname, cancelled);
                        return EnrichmentResult.errorResult(origin, ResultCodes.TIMEOUT,
                                "Enrichment timed out (%d ms)".formatted(_timeoutMs));
                    }

                    Logger.warn("{}: Unexpected error", hostname, e);
                    context.cancelAll();
                    return EnrichmentResult.errorResult(origin, ResultCodes.INTERNAL_ERROR,
                            "Internal error: " + e.getMessage());
                });
    }

    private boolean shouldProbe(OriginRecord origin) {
        return _probeAlways || origin.origin().trim().toLowerCase(Locale.ROOT).startsWith("https://");
    }

    private static void logProbeFailure(String hostname, Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null)
            error = error.getCause();

        if (error instanceof TlsProbeException) {
            Logger.warn("{}: TLS probe failed ({}): {}", hostname,
                    ((TlsProbeException) error).getFailure(), error.getMessage());
        } else {
            Logger.warn("{}: TLS probe failed", hostname, error);
        }
    }
}

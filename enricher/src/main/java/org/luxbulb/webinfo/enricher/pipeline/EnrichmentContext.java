package org.luxbulb.webinfo.enricher.pipeline;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.luxbulb.webinfo.models.EnrichedRecord;
import org.luxbulb.webinfo.models.OriginRecord;
import org.luxbulb.webinfo.models.dns.NameServerInfo;
import org.luxbulb.webinfo.models.ip.AsnInfo;
import org.luxbulb.webinfo.models.tls.CertificateIssuerInfo;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Collects the data of one record while it is being enriched, together with the futures of the lookups
 * that are still running for it.
 */
public final class EnrichmentContext {
    private final OriginRecord _origin;
    private final String _hostname;
    private final Queue<CompletableFuture<?>> _inFlight = new ConcurrentLinkedQueue<>();
    private volatile boolean _cancelled = false;

    private String _domain;
    private List<String> _cname;
    private NameServerInfo _nameservers;
    private Set<String> _ips;
    private Set<AsnInfo> _asn;
    private CertificateIssuerInfo _tls;

    public EnrichmentContext(@NotNull OriginRecord origin, @NotNull String hostname) {
        _origin = origin;
        _hostname = hostname;
    }

    public EnrichmentContext domain(@Nullable String domain) {
        _domain = domain;
        return this;
    }

    public EnrichmentContext cname(@Nullable List<String> cname) {
        _cname = cname;
        return this;
    }

    public EnrichmentContext nameservers(@Nullable NameServerInfo nameservers) {
        _nameservers = nameservers;
        return this;
    }

    public EnrichmentContext ips(@Nullable Set<String> ips) {
        _ips = ips;
        return this;
    }

    public EnrichmentContext asn(@Nullable Set<AsnInfo> asn) {
        _asn = asn;
        return this;
    }

    public EnrichmentContext tls(@Nullable CertificateIssuerInfo tls) {
        _tls = tls;
        return this;
    }

    /**
     * Registers a running lookup so that it can be cancelled with the record. A lookup registered after
     * the record has been cancelled is cancelled immediately.
     */
    public <T> CompletableFuture<T> track(@NotNull CompletableFuture<T> future) {
        _inFlight.add(future);
        if (_cancelled)
            future.cancel(true);

        return future;
    }

    /**
     * Cancels all the registered lookups that have not finished yet.
     *
     * @return The number of lookups that were cancelled.
     */
    public int cancelAll() {
        _cancelled = true;
        var count = 0;
        CompletableFuture<?> future;
        while ((future = _inFlight.poll()) != null) {
            if (future.cancel(true))
                count++;
        }
        return count;
    }

    /**
     * Creates the immutable record from the collected data.
     */
    public EnrichedRecord freeze() {
        return new EnrichedRecord(_origin, _hostname, _domain,
                _cname == null ? null : List.copyOf(_cname),
                _nameservers,
                _ips == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(_ips)),
                _asn == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(_asn)),
                _tls);
    }
}

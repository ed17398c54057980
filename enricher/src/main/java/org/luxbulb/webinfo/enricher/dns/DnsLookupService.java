package org.luxbulb.webinfo.enricher.dns;

import com.google.common.net.InetAddresses;
import org.jetbrains.annotations.NotNull;
import org.luxbulb.webinfo.Common;
import org.luxbulb.webinfo.enricher.asn.AsnAttributionEngine;
import org.luxbulb.webinfo.enricher.asn.AsnLookupTable;
import org.luxbulb.webinfo.models.dns.NameServerInfo;
import org.xbill.DNS.AAAARecord;
import org.xbill.DNS.ARecord;
import org.xbill.DNS.CNAMERecord;
import org.xbill.DNS.NSRecord;
import org.xbill.DNS.Name;
import org.xbill.DNS.Record;
import org.xbill.DNS.Resolver;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;
import org.xbill.DNS.lookup.LookupResult;
import org.xbill.DNS.lookup.NoSuchDomainException;
import org.xbill.DNS.lookup.NoSuchRRSetException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Performs the DNS lookups of the enrichment pipeline.
 * <p>
 * All the operations are asynchronous and never complete exceptionally: when a lookup fails
 * (non-existent name, no records of the type, timeout or I/O error), the returned future completes
 * with an empty optional. Cancelling a returned future cancels the queries sent for it.
 */
public class DnsLookupService {
    public static final String COMPONENT_NAME = "dns";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(DnsLookupService.class);

    private final Resolver _resolver;
    private final Executor _executor;
    private final AsnLookupTable _asnTable;

    /**
     * @param resolver The resolver to send the queries with.
     * @param executor The executor to run the lookup callbacks on.
     * @param asnTable The table used to attribute the addresses of name servers.
     */
    public DnsLookupService(@NotNull Resolver resolver, @NotNull Executor executor,
                            @NotNull AsnLookupTable asnTable) {
        _resolver = resolver;
        _executor = executor;
        _asnTable = asnTable;
    }

    /**
     * Resolves the A and AAAA records of a host name. Both queries run concurrently.
     *
     * @param hostname The host name.
     * @return The union of the IPv4 and IPv6 addresses (IPv4 first), or an empty optional if no address
     * was found.
     */
    public CompletableFuture<Optional<Set<String>>> queryAddresses(@NotNull String hostname) {
        final Name name;
        try {
            name = toName(hostname);
        } catch (TextParseException e) {
            Logger.debug("Invalid DNS name: {}", hostname);
            return CompletableFuture.completedFuture(Optional.empty());
        }

        final var scope = new QueryScope(_resolver, _executor);
        final CompletableFuture<Optional<Set<String>>> result = resolveAddresses(scope, name)
                .thenApply(ips -> ips.isEmpty() ? Optional.empty() : Optional.of(ips));
        return scope.bind(result);
    }

    /**
     * Resolves the CNAME records of a host name.
     *
     * @param hostname The host name.
     * @return The CNAME targets in the order of the answer, or an empty optional if the name has no CNAME.
     */
    public CompletableFuture<Optional<List<String>>> queryCname(@NotNull String hostname) {
        final Name name;
        try {
            name = toName(hostname);
        } catch (TextParseException e) {
            Logger.debug("Invalid DNS name: {}", hostname);
            return CompletableFuture.completedFuture(Optional.empty());
        }

        final var scope = new QueryScope(_resolver, _executor);
        final CompletableFuture<Optional<List<String>>> result = lookup(scope, name, Type.CNAME)
                .thenApply(records -> {
                    final var targets = records.stream()
                            .filter(record -> record instanceof CNAMERecord)
                            .map(record -> ((CNAMERecord) record).getTarget().toString(true))
                            .toList();

                    return targets.isEmpty() ? Optional.empty() : Optional.of(targets);
                });
        return scope.bind(result);
    }

    /**
     * Finds the name servers of a domain, resolves their addresses and attributes the addresses
     * to autonomous systems.
     *
     * @param domain The domain name.
     * @return The name server information, or an empty optional if the domain has no NS records.
     * The {@code ips} and {@code asn} fields are null when no name server address was resolved or matched.
     */
    public CompletableFuture<Optional<NameServerInfo>> queryNameServers(@NotNull String domain) {
        final Name name;
        try {
            name = toName(domain);
        } catch (TextParseException e) {
            Logger.debug("Invalid DNS name: {}", domain);
            return CompletableFuture.completedFuture(Optional.empty());
        }

        final var scope = new QueryScope(_resolver, _executor);
        final CompletableFuture<Optional<NameServerInfo>> result = lookup(scope, name, Type.NS)
                .thenCompose(records -> {
                    final var targets = records.stream()
                            .filter(record -> record instanceof NSRecord)
                            .map(record -> ((NSRecord) record).getTarget())
                            .distinct()
                            .toList();

                    if (targets.isEmpty())
                        return CompletableFuture.completedFuture(Optional.empty());

                    final var names = targets.stream().map(target -> target.toString(true)).toList();

                    // Resolve the addresses of all the name servers concurrently
                    final var stages = targets.stream()
                            .map(target -> resolveAddresses(scope, target))
                            .toList();

                    return CompletableFuture.allOf(stages.toArray(CompletableFuture[]::new))
                            .thenApply(unused -> {
                                final var allIps = new LinkedHashSet<String>();
                                for (var stage : stages) {
                                    allIps.addAll(stage.join());
                                }

                                if (allIps.isEmpty()) {
                                    Logger.trace("{}: No name server address resolved", domain);
                                    return Optional.of(new NameServerInfo(names, null, null));
                                }

                                final var asn = AsnAttributionEngine.attribute(allIps, _asnTable).orElse(null);
                                return Optional.of(new NameServerInfo(names, allIps, asn));
                            });
                });
        return scope.bind(result);
    }

    private CompletableFuture<Set<String>> resolveAddresses(QueryScope scope, Name name) {
        final var a = lookup(scope, name, Type.A);
        final var aaaa = lookup(scope, name, Type.AAAA);

        return a.thenCombine(aaaa, (aRecords, aaaaRecords) -> {
            final var result = new LinkedHashSet<String>();
            for (var record : aRecords) {
                if (record instanceof ARecord)
                    result.add(InetAddresses.toAddrString(((ARecord) record).getAddress()));
            }
            for (var record : aaaaRecords) {
                if (record instanceof AAAARecord)
                    result.add(InetAddresses.toAddrString(((AAAARecord) record).getAddress()));
            }
            return result;
        });
    }

    private static CompletableFuture<List<Record>> lookup(QueryScope scope, Name name, int type) {
        return scope.session().lookupAsync(name, type)
                .toCompletableFuture()
                .thenApply(LookupResult::getRecords)
                .exceptionally(e -> {
                    if (e instanceof CompletionException && e.getCause() != null)
                        e = e.getCause();

                    if (e instanceof NoSuchDomainException || e instanceof NoSuchRRSetException) {
                        Logger.trace("{} {}: no records", name, Type.string(type));
                    } else {
                        Logger.debug("{} {} lookup failed: {}", name, Type.string(type), e.toString());
                    }
                    return new ArrayList<>();
                });
    }

    private static Name toName(String hostname) throws TextParseException {
        return Name.fromString(hostname, Name.root);
    }
}

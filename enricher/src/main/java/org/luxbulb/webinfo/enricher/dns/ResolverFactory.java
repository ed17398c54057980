package org.luxbulb.webinfo.enricher.dns;

import com.google.common.base.Splitter;
import com.google.common.net.InetAddresses;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.luxbulb.webinfo.Common;
import org.luxbulb.webinfo.EnricherConfig;
import org.xbill.DNS.ExtendedResolver;
import org.xbill.DNS.Resolver;
import org.xbill.DNS.SimpleResolver;

import java.net.InetAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Builds the process-wide DNS resolver from the configuration.
 */
public final class ResolverFactory {
    public static final String COMPONENT_NAME = "resolver-factory";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(ResolverFactory.class);

    private ResolverFactory() {
    }

    /**
     * Parses a comma-separated list of resolver IP addresses. Entries that are not IP literals are skipped.
     * If no entry is valid, the default resolver ({@value EnricherConfig#DNS_SERVERS_DEFAULT}) is returned.
     *
     * @param servers The list, e.g. {@code 8.8.8.8, 9.9.9.9}. May be null.
     * @return A non-empty list of resolver addresses.
     */
    @NotNull
    public static List<InetAddress> parseServers(@Nullable String servers) {
        final var result = new ArrayList<InetAddress>();
        if (servers != null) {
            for (var entry : Splitter.on(',').trimResults().omitEmptyStrings().split(servers)) {
                if (InetAddresses.isInetAddress(entry)) {
                    result.add(InetAddresses.forString(entry));
                } else {
                    Logger.warn("Ignoring an invalid DNS server address: {}", entry);
                }
            }
        }

        if (result.isEmpty()) {
            if (servers != null && !servers.isBlank())
                Logger.warn("No valid DNS server address given, using {}", EnricherConfig.DNS_SERVERS_DEFAULT);
            result.add(InetAddresses.forString(EnricherConfig.DNS_SERVERS_DEFAULT));
        }

        return result;
    }

    /**
     * Creates an {@link ExtendedResolver} over the configured servers, using UDP on port 53.
     *
     * @param properties The configuration.
     * @return The resolver.
     */
    @NotNull
    public static Resolver makeResolver(@NotNull Properties properties) {
        final var servers = parseServers(properties.getProperty(EnricherConfig.DNS_SERVERS_CONFIG));
        final var timeout = Integer.parseInt(properties.getProperty(EnricherConfig.DNS_TIMEOUT_PER_NS_MS_CONFIG,
                EnricherConfig.DNS_TIMEOUT_PER_NS_MS_DEFAULT));
        final var retries = Integer.parseInt(properties.getProperty(EnricherConfig.DNS_RETRIES_CONFIG,
                EnricherConfig.DNS_RETRIES_DEFAULT));

        final var resolvers = new ArrayList<Resolver>();
        for (var server : servers) {
            resolvers.add(new SimpleResolver(server));
        }

        final var resolver = new ExtendedResolver(resolvers);
        resolver.setRetries(retries);
        resolver.setTimeout(Duration.ofMillis(timeout));
        resolver.setLoadBalance(servers.size() > 1);
        resolver.setTCP(false);

        Logger.info("Using DNS servers: {} (timeout {} ms, {} retries)", servers, timeout, retries);
        return resolver;
    }
}

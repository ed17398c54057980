package org.luxbulb.webinfo.enricher.domain;

import com.google.common.base.CharMatcher;
import com.google.common.net.InetAddresses;
import com.google.common.net.InternetDomainName;
import org.jetbrains.annotations.NotNull;
import org.luxbulb.webinfo.Common;
import org.luxbulb.webinfo.models.ResultCodes;

import java.net.IDN;
import java.net.MalformedURLException;
import java.net.URL;
import java.util.Locale;
import java.util.Optional;

/**
 * Extracts host names and registrable domains from origin URLs.
 * <p>
 * The public suffix data comes from Guava's bundled copy of the Public Suffix List. Only the ICANN section
 * of the list is used for registrable domains, so private suffixes such as {@code s3.amazonaws.com} are not
 * treated as registries.
 */
public final class DomainParser {
    public static final String COMPONENT_NAME = "domain-parser";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(DomainParser.class);

    // The WHATWG forbidden host code points
    private static final CharMatcher FORBIDDEN_HOST_CHARS = CharMatcher.anyOf(" #%/:<>?@[\\]^|")
            .or(CharMatcher.javaIsoControl());

    private DomainParser() {
    }

    /**
     * Extracts the host part of an origin URL. Underscores in the host and unescaped characters in the path
     * and query are accepted. Internationalized host names are converted to their ASCII (punycode) form.
     *
     * @param origin The origin, e.g. {@code https://www.example.com/path?q=1}.
     * @return The lower-cased host name without the port, e.g. {@code www.example.com}. IPv6 literals are
     * returned without the brackets.
     * @throws InvalidOriginException With {@link ResultCodes#INVALID_URL} if the origin is not a URL with
     *                                a host, or with {@link ResultCodes#INVALID_HOSTNAME} if the host does not
     *                                end in a known public suffix.
     */
    @NotNull
    public static String extractHostname(@NotNull String origin) throws InvalidOriginException {
        final URL url;
        try {
            url = new URL(origin.trim());
        } catch (MalformedURLException e) {
            throw new InvalidOriginException(ResultCodes.INVALID_URL, "Invalid URL: " + e.getMessage(), e);
        }

        var host = url.getHost();
        if (host == null || host.isEmpty())
            throw new InvalidOriginException(ResultCodes.INVALID_URL, "Invalid URL: no host in " + origin);

        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
            if (!InetAddresses.isInetAddress(host))
                throw new InvalidOriginException(ResultCodes.INVALID_URL, "Invalid URL: bad IPv6 address in "
                        + origin);
            return InetAddresses.toAddrString(InetAddresses.forString(host));
        }

        if (FORBIDDEN_HOST_CHARS.matchesAnyOf(host))
            throw new InvalidOriginException(ResultCodes.INVALID_URL, "Invalid URL: forbidden character in host "
                    + host);

        try {
            host = IDN.toASCII(host, IDN.ALLOW_UNASSIGNED).toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            throw new InvalidOriginException(ResultCodes.INVALID_HOSTNAME, "Invalid hostname: " + host, e);
        }

        if (host.endsWith("."))
            host = host.substring(0, host.length() - 1);

        if (InetAddresses.isInetAddress(host))
            return host;

        try {
            if (!InternetDomainName.from(host).hasPublicSuffix())
                throw new InvalidOriginException(ResultCodes.INVALID_HOSTNAME,
                        "Invalid hostname: unknown public suffix in " + host);
        } catch (IllegalArgumentException e) {
            throw new InvalidOriginException(ResultCodes.INVALID_HOSTNAME, "Invalid hostname: " + host, e);
        }

        return host;
    }

    /**
     * Determines the registrable domain of a host name, i.e. the name one level below its ICANN registry suffix.
     *
     * @param hostname The host name, e.g. {@code phpmyadmin.hosting.ovh.net}.
     * @return The registrable domain, e.g. {@code ovh.net}. Empty for IP literals and for names that have
     * no part below a registry suffix.
     */
    @NotNull
    public static Optional<String> extractDomain(@NotNull String hostname) {
        if (InetAddresses.isInetAddress(hostname)) {
            Logger.debug("No registrable domain for an IP literal: {}", hostname);
            return Optional.empty();
        }

        final InternetDomainName name;
        try {
            name = InternetDomainName.from(hostname);
        } catch (IllegalArgumentException e) {
            Logger.debug("Invalid domain name: {}", hostname);
            return Optional.empty();
        }

        // A bare suffix such as co.uk is not registrable
        if (!name.isUnderRegistrySuffix()) {
            Logger.debug("Domain name is not under a registry suffix: {}", hostname);
            return Optional.empty();
        }

        return Optional.of(name.topDomainUnderRegistrySuffix().toString());
    }
}

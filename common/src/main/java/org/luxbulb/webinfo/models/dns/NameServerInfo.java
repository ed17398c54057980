package org.luxbulb.webinfo.models.dns;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.luxbulb.webinfo.models.ip.AsnInfo;

import java.util.List;
import java.util.Set;

/**
 * The authoritative name servers of a domain.
 *
 * @param names The NS host names, in the order of the DNS answer.
 * @param ips   The addresses of all the name servers.
 * @param asn   The autonomous systems the name server addresses belong to.
 */
public record NameServerInfo(@NotNull List<String> names,
                             @Nullable Set<String> ips,
                             @Nullable Set<AsnInfo> asn) {
}

package org.luxbulb.webinfo.models;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.luxbulb.webinfo.models.dns.NameServerInfo;
import org.luxbulb.webinfo.models.ip.AsnInfo;
import org.luxbulb.webinfo.models.tls.CertificateIssuerInfo;

import java.util.List;
import java.util.Set;

/**
 * The network-identity metadata collected for one origin.
 *
 * @param origin      The input record.
 * @param hostname    The host part of the origin URL.
 * @param domain      The registrable domain of the host, if it could be determined.
 * @param cname       The CNAME targets of the host.
 * @param nameservers The authoritative name servers of the domain.
 * @param ip          The A and AAAA addresses of the host.
 * @param asn         The autonomous systems the addresses belong to.
 * @param tls         The issuer of the certificate chain served by the host.
 */
@JsonPropertyOrder({"origin", "hostname", "domain", "cname", "nameservers", "ip", "asn", "tls"})
public record EnrichedRecord(@NotNull OriginRecord origin,
                             @NotNull String hostname,
                             @Nullable String domain,
                             @Nullable List<String> cname,
                             @Nullable NameServerInfo nameservers,
                             @Nullable Set<String> ip,
                             @Nullable Set<AsnInfo> asn,
                             @Nullable CertificateIssuerInfo tls) {
}

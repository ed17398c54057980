package org.luxbulb.webinfo.models.tls;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The identity of the issuer of the most upstream certificate a server presented.
 *
 * @param organization The Organization (O) attribute of the issuer DN.
 * @param country      The Country (C) attribute of the issuer DN, if present.
 */
public record CertificateIssuerInfo(@NotNull String organization,
                                    @Nullable String country) {
}

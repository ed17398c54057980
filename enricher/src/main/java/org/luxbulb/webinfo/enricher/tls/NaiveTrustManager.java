package org.luxbulb.webinfo.enricher.tls;

import javax.net.ssl.X509TrustManager;
import java.security.cert.X509Certificate;

/**
 * A trust manager that accepts every server certificate chain. Used by the probe when issuer data should
 * be collected from hosts with self-signed or otherwise untrusted chains.
 */
public class NaiveTrustManager implements X509TrustManager {
    @Override
    public X509Certificate[] getAcceptedIssuers() {
        return new X509Certificate[0];
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) {
        // Only the issuer is read from the chain, it is never used to authenticate the peer
    }

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) {
        throw new UnsupportedOperationException("The probe never acts as a TLS server");
    }
}

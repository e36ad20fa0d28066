package io.github.hotbrkm.mailclient.email.send.transport.smtp;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocketFactory;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

public record SmtpTlsConfig(SmtpTlsPolicy policy, SSLContext sslContext, String[] enabledTlsProtocols,
                            int maxAttempts, long retryDelayMillis, boolean verifyHostname) {

    public static final String[] DEFAULT_TLS_PROTOCOLS = {"TLSv1.3", "TLSv1.2"};

    public SmtpTlsConfig {
        Objects.requireNonNull(policy, "policy must not be null");
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
        }
    }

    /**
     * Default settings for the given policy: the JVM default SSL context, TLS 1.2 or newer,
     * a single handshake attempt and host name verification.
     */
    public static SmtpTlsConfig of(SmtpTlsPolicy policy) {
        return new SmtpTlsConfig(policy, null, DEFAULT_TLS_PROTOCOLS, 1, 1000L, true);
    }

    public boolean usesTls() {
        return policy != SmtpTlsPolicy.NONE;
    }

    public SSLSocketFactory sslSocketFactory() {
        if (sslContext != null) {
            return sslContext.getSocketFactory();
        }
        try {
            return SSLContext.getDefault().getSocketFactory();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("No default SSLContext available", e);
        }
    }
}

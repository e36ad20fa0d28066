package io.github.hotbrkm.mailclient.email.send.transport.smtp.auth;

import lombok.AccessLevel;
import lombok.Getter;
import org.apache.commons.codec.digest.HmacAlgorithms;

import java.util.Locale;
import java.util.function.Function;

/**
 * Supported SASL mechanisms, strongest first. Automatic selection picks the first one the server offers.
 */
@Getter
public enum SaslMechanism {
    SCRAM_SHA_256_PLUS("SCRAM-SHA-256-PLUS", true,
            context -> new ScramAuthenticator(context, HmacAlgorithms.HMAC_SHA_256, "SHA-256", true)),
    SCRAM_SHA_256("SCRAM-SHA-256", false,
            context -> new ScramAuthenticator(context, HmacAlgorithms.HMAC_SHA_256, "SHA-256", false)),
    SCRAM_SHA_1_PLUS("SCRAM-SHA-1-PLUS", true,
            context -> new ScramAuthenticator(context, HmacAlgorithms.HMAC_SHA_1, "SHA-1", true)),
    SCRAM_SHA_1("SCRAM-SHA-1", false,
            context -> new ScramAuthenticator(context, HmacAlgorithms.HMAC_SHA_1, "SHA-1", false)),
    DIGEST_MD5("DIGEST-MD5", false, DigestMd5Authenticator::new),
    CRAM_MD5("CRAM-MD5", false, CramMd5Authenticator::new),
    XOAUTH2("XOAUTH2", false, XOAuth2Authenticator::new),
    NTLM("NTLM", false, NtlmAuthenticator::new),
    LOGIN("LOGIN", false, LoginAuthenticator::new),
    PLAIN("PLAIN", false, PlainAuthenticator::new);

    private final String wireName;
    private final boolean channelBindingRequired;
    @Getter(AccessLevel.NONE)
    private final Function<AuthContext, SmtpAuthenticator> factory;

    SaslMechanism(String wireName, boolean channelBindingRequired, Function<AuthContext, SmtpAuthenticator> factory) {
        this.wireName = wireName;
        this.channelBindingRequired = channelBindingRequired;
        this.factory = factory;
    }

    public SmtpAuthenticator createAuthenticator(AuthContext context) {
        return factory.apply(context);
    }

    /**
     * Resolves a mechanism by its wire name, e.g. {@code SCRAM-SHA-256}, case-insensitively.
     *
     * @throws IllegalArgumentException if the name is not supported
     */
    public static SaslMechanism fromWireName(String name) {
        String normalized = name == null ? "" : name.trim().toUpperCase(Locale.ROOT);
        for (SaslMechanism mechanism : values()) {
            if (mechanism.wireName.equals(normalized) || mechanism.name().equals(normalized)) {
                return mechanism;
            }
        }
        throw new IllegalArgumentException("unsupported SASL mechanism: " + name);
    }

    @Override
    public String toString() {
        return wireName;
    }
}

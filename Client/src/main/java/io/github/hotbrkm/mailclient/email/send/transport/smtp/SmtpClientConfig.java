package io.github.hotbrkm.mailclient.email.send.transport.smtp;

import io.github.hotbrkm.mailclient.email.send.transport.network.SocketConfig;
import io.github.hotbrkm.mailclient.email.send.transport.network.SocketDialer;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.auth.SaslMechanism;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Objects;

/**
 * Settings of one {@link SmtpClient}. Instances are immutable; there is no global state.
 */
@Slf4j
@Getter
@Builder(toBuilder = true)
public class SmtpClientConfig {

    public static final int DEFAULT_PORT = 25;
    public static final int DEFAULT_IMPLICIT_TLS_PORT = 465;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(15);
    public static final Duration DEFAULT_KEEP_ALIVE_IDLE = Duration.ofSeconds(30);
    private static final String FALLBACK_LOCAL_NAME = "localhost";

    private final String host;
    /** 0 selects the default port of the TLS policy */
    private final int port;
    @Builder.Default
    private final SmtpTlsConfig tlsConfig = SmtpTlsConfig.of(SmtpTlsPolicy.MANDATORY);
    /** HELO/EHLO name; the local host name when not set */
    private final String localName;
    private final String username;
    private final String password;
    /** Mechanism to use instead of the strongest one the server offers */
    private final SaslMechanism authMechanism;
    @Builder.Default
    private final Duration connectTimeout = DEFAULT_TIMEOUT;
    @Builder.Default
    private final Duration readTimeout = DEFAULT_TIMEOUT;
    /** Deadline of a whole connect or send call when the caller passes no token; null for none */
    private final Duration operationTimeout;
    @Builder.Default
    private final Duration keepAliveIdle = DEFAULT_KEEP_ALIVE_IDLE;
    @Builder.Default
    private final RecipientPolicy recipientPolicy = RecipientPolicy.STRICT;
    private final DsnOptions dsn;
    private final boolean traceLog;
    private final SocketDialer dialer;
    private final String bindIp;
    @Builder.Default
    private final SmtpErrorHandlerRegistry errorHandlerRegistry = new SmtpErrorHandlerRegistry();

    /**
     * Checks the settings and throws {@link IllegalArgumentException} for the first invalid one.
     */
    public SmtpClientConfig validate() {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host must not be empty");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535: " + port);
        }
        Objects.requireNonNull(tlsConfig, "tlsConfig must not be null");
        Objects.requireNonNull(recipientPolicy, "recipientPolicy must not be null");
        Objects.requireNonNull(errorHandlerRegistry, "errorHandlerRegistry must not be null");
        requirePositive("connectTimeout", connectTimeout);
        requirePositive("readTimeout", readTimeout);
        requirePositive("keepAliveIdle", keepAliveIdle);
        if (operationTimeout != null) {
            requirePositive("operationTimeout", operationTimeout);
        }
        if (localName != null && localName.isBlank()) {
            throw new IllegalArgumentException("HELO name must not be empty");
        }
        if ((username == null) != (password == null)) {
            throw new IllegalArgumentException("username and password must be set together");
        }
        return this;
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }

    public int getEffectivePort() {
        if (port > 0) {
            return port;
        }
        return tlsConfig.policy() == SmtpTlsPolicy.IMPLICIT ? DEFAULT_IMPLICIT_TLS_PORT : DEFAULT_PORT;
    }

    public String getEffectiveLocalName() {
        if (localName != null) {
            return localName;
        }
        try {
            return InetAddress.getLocalHost().getCanonicalHostName();
        } catch (UnknownHostException e) {
            log.debug("Failed to resolve local host name, using '{}'", FALLBACK_LOCAL_NAME, e);
            return FALLBACK_LOCAL_NAME;
        }
    }

    public boolean hasCredentials() {
        return username != null && password != null;
    }

    public SocketConfig toSocketConfig() {
        return new SocketConfig(host, getEffectivePort(), connectTimeout, readTimeout, bindIp);
    }

    @Override
    public String toString() {
        return "SmtpClientConfig{host=" + host + ", port=" + getEffectivePort() + ", tls=" + tlsConfig.policy()
                + ", username=" + username + ", authMechanism=" + authMechanism + "}";
    }
}

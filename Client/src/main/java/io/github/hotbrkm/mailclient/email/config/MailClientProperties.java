package io.github.hotbrkm.mailclient.email.config;

import io.github.hotbrkm.mailclient.email.send.sendmail.SendmailSender;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.DsnNotify;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.DsnOptions;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.DsnReturn;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.RecipientPolicy;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.SmtpClientConfig;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.SmtpTlsConfig;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.SmtpTlsPolicy;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.auth.SaslMechanism;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "mail.client")
public class MailClientProperties {

    private boolean enabled;

    private Smtp smtp = new Smtp();
    private Tls tls = new Tls();
    private Auth auth = new Auth();
    private Dsn dsn = new Dsn();
    private Sendmail sendmail = new Sendmail();

    @Data
    public static class Smtp {
        private String host;
        private int port;
        private String helo;
        private String bindIp;
        private Duration connectTimeout;
        private Duration readTimeout;
        private Duration operationTimeout;
        private Duration keepAliveIdle;
        private RecipientPolicy recipientPolicy = RecipientPolicy.STRICT;
        private boolean traceLog;

        public Duration resolveConnectTimeout() {
            return positiveOrDefault(connectTimeout, SmtpClientConfig.DEFAULT_TIMEOUT);
        }

        public Duration resolveReadTimeout() {
            return positiveOrDefault(readTimeout, SmtpClientConfig.DEFAULT_TIMEOUT);
        }

        public Duration resolveKeepAliveIdle() {
            return positiveOrDefault(keepAliveIdle, SmtpClientConfig.DEFAULT_KEEP_ALIVE_IDLE);
        }

        /**
         * Returns null when no per-operation deadline is configured.
         */
        public Duration resolveOperationTimeout() {
            return operationTimeout == null || operationTimeout.isNegative() || operationTimeout.isZero()
                    ? null : operationTimeout;
        }
    }

    @Data
    public static class Tls {
        public static final int DEFAULT_MAX_ATTEMPTS = 1;
        public static final long DEFAULT_RETRY_DELAY_MS = 1000L;

        private SmtpTlsPolicy policy = SmtpTlsPolicy.MANDATORY;
        private List<String> enabledProtocols;
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private long retryDelayMs = DEFAULT_RETRY_DELAY_MS;
        private boolean verifyHostname = true;

        public int resolveMaxAttempts() {
            return maxAttempts > 0 ? maxAttempts : DEFAULT_MAX_ATTEMPTS;
        }

        public long resolveRetryDelayMs() {
            return retryDelayMs >= 0 ? retryDelayMs : DEFAULT_RETRY_DELAY_MS;
        }

        public String[] resolveEnabledProtocols() {
            if (enabledProtocols == null || enabledProtocols.isEmpty()) {
                return SmtpTlsConfig.DEFAULT_TLS_PROTOCOLS;
            }
            return enabledProtocols.toArray(new String[0]);
        }

        public SmtpTlsConfig toTlsConfig() {
            return new SmtpTlsConfig(policy, null, resolveEnabledProtocols(), resolveMaxAttempts(),
                    resolveRetryDelayMs(), verifyHostname);
        }
    }

    @Data
    public static class Auth {
        private String username;
        private String password;
        /** SASL mechanism name such as SCRAM-SHA-256; empty for automatic selection */
        private String mechanism;

        public SaslMechanism resolveMechanism() {
            return mechanism == null || mechanism.isBlank() ? null : SaslMechanism.fromWireName(mechanism);
        }
    }

    @Data
    public static class Dsn {
        private boolean enabled;
        private DsnReturn returnType;
        private List<DsnNotify> notify = new ArrayList<>();

        public DsnOptions resolveOptions() {
            if (!enabled) {
                return null;
            }
            return DsnOptions.of(returnType, notify.toArray(new DsnNotify[0]));
        }
    }

    @Data
    public static class Sendmail {
        private boolean enabled;
        private String path = SendmailSender.DEFAULT_PATH;
        private Duration timeout;
        private List<String> arguments = new ArrayList<>();

        public Duration resolveTimeout() {
            return positiveOrDefault(timeout, SendmailSender.DEFAULT_TIMEOUT);
        }
    }

    private static Duration positiveOrDefault(Duration value, Duration defaultValue) {
        return value == null || value.isNegative() || value.isZero() ? defaultValue : value;
    }
}

package io.github.hotbrkm.mailclient.email.config;

import io.github.hotbrkm.mailclient.email.send.sendmail.SendmailSender;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.DsnNotify;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.DsnReturn;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.RecipientPolicy;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.SmtpClient;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.SmtpClientConfig;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.SmtpTlsPolicy;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.auth.SaslMechanism;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MailClientConfig Test")
class MailClientConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(MailClientConfig.class);

    @Test
    @DisplayName("No beans are created unless the client is enabled")
    void testDisabledByDefault() {
        // When // Then
        contextRunner.run(context -> assertThat(context).doesNotHaveBean(SmtpClient.class));
    }

    @Test
    @DisplayName("Properties are bound into the SMTP client settings")
    void testBindProperties() {
        // Given
        var runner = contextRunner.withPropertyValues(
                "mail.client.enabled=true",
                "mail.client.smtp.host=mx.example.com",
                "mail.client.smtp.port=587",
                "mail.client.smtp.helo=client.example.com",
                "mail.client.smtp.read-timeout=20s",
                "mail.client.smtp.recipient-policy=LENIENT",
                "mail.client.tls.policy=OPPORTUNISTIC",
                "mail.client.tls.enabled-protocols=TLSv1.3",
                "mail.client.auth.username=user",
                "mail.client.auth.password=secret",
                "mail.client.auth.mechanism=scram-sha-256",
                "mail.client.dsn.enabled=true",
                "mail.client.dsn.return-type=HDRS",
                "mail.client.dsn.notify=FAILURE,DELAY");

        // When // Then
        runner.run(context -> {
            assertThat(context).hasSingleBean(SmtpClient.class);
            assertThat(context).doesNotHaveBean(SendmailSender.class);

            SmtpClientConfig config = context.getBean(SmtpClientConfig.class);
            assertThat(config.getHost()).isEqualTo("mx.example.com");
            assertThat(config.getEffectivePort()).isEqualTo(587);
            assertThat(config.getEffectiveLocalName()).isEqualTo("client.example.com");
            assertThat(config.getReadTimeout()).isEqualTo(Duration.ofSeconds(20));
            assertThat(config.getConnectTimeout()).isEqualTo(SmtpClientConfig.DEFAULT_TIMEOUT);
            assertThat(config.getOperationTimeout()).isNull();
            assertThat(config.getRecipientPolicy()).isEqualTo(RecipientPolicy.LENIENT);
            assertThat(config.getTlsConfig().policy()).isEqualTo(SmtpTlsPolicy.OPPORTUNISTIC);
            assertThat(config.getTlsConfig().enabledTlsProtocols()).containsExactly("TLSv1.3");
            assertThat(config.getAuthMechanism()).isEqualTo(SaslMechanism.SCRAM_SHA_256);
            assertThat(config.getDsn().returnType()).isEqualTo(DsnReturn.HDRS);
            assertThat(config.getDsn().notifyTypes()).containsExactlyInAnyOrder(DsnNotify.FAILURE, DsnNotify.DELAY);
        });
    }

    @Test
    @DisplayName("Defaults apply when only the host is configured")
    void testDefaults() {
        // Given
        var runner = contextRunner.withPropertyValues(
                "mail.client.enabled=true",
                "mail.client.smtp.host=mx.example.com");

        // When // Then
        runner.run(context -> {
            SmtpClientConfig config = context.getBean(SmtpClientConfig.class);
            assertThat(config.getEffectivePort()).isEqualTo(SmtpClientConfig.DEFAULT_PORT);
            assertThat(config.getTlsConfig().policy()).isEqualTo(SmtpTlsPolicy.MANDATORY);
            assertThat(config.getKeepAliveIdle()).isEqualTo(SmtpClientConfig.DEFAULT_KEEP_ALIVE_IDLE);
            assertThat(config.hasCredentials()).isFalse();
            assertThat(config.getAuthMechanism()).isNull();
            assertThat(config.getDsn()).isNull();
        });
    }

    @Test
    @DisplayName("A missing host fails the context")
    void testMissingHost() {
        // When // Then
        contextRunner.withPropertyValues("mail.client.enabled=true")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("The sendmail sender is created when enabled")
    void testSendmailSender() {
        // Given
        var runner = contextRunner.withPropertyValues(
                "mail.client.enabled=true",
                "mail.client.smtp.host=mx.example.com",
                "mail.client.sendmail.enabled=true",
                "mail.client.sendmail.path=/opt/bin/sendmail",
                "mail.client.sendmail.arguments=-fbounce@example.com");

        // When // Then
        runner.run(context -> {
            SendmailSender sender = context.getBean(SendmailSender.class);
            assertThat(sender.getPath()).isEqualTo("/opt/bin/sendmail");
            assertThat(sender.getTimeout()).isEqualTo(SendmailSender.DEFAULT_TIMEOUT);
            assertThat(sender.getArguments()).containsExactly("-fbounce@example.com");
        });
    }
}

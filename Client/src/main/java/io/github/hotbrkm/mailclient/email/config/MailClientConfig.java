package io.github.hotbrkm.mailclient.email.config;

import io.github.hotbrkm.mailclient.email.send.sendmail.SendmailSender;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.SmtpClient;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.SmtpClientConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(MailClientProperties.class)
@ConditionalOnProperty(prefix = "mail.client", name = "enabled", havingValue = "true")
public class MailClientConfig {

    @Bean
    public SmtpClientConfig smtpClientConfig(MailClientProperties properties) {
        MailClientProperties.Smtp smtp = properties.getSmtp();
        MailClientProperties.Auth auth = properties.getAuth();

        return SmtpClientConfig.builder()
                .host(smtp.getHost())
                .port(smtp.getPort())
                .localName(smtp.getHelo())
                .bindIp(smtp.getBindIp())
                .connectTimeout(smtp.resolveConnectTimeout())
                .readTimeout(smtp.resolveReadTimeout())
                .operationTimeout(smtp.resolveOperationTimeout())
                .keepAliveIdle(smtp.resolveKeepAliveIdle())
                .recipientPolicy(smtp.getRecipientPolicy())
                .traceLog(smtp.isTraceLog())
                .tlsConfig(properties.getTls().toTlsConfig())
                .username(auth.getUsername())
                .password(auth.getPassword())
                .authMechanism(auth.resolveMechanism())
                .dsn(properties.getDsn().resolveOptions())
                .build()
                .validate();
    }

    /**
     * SmtpClient Bean.
     * Connects lazily on the first send and sends QUIT on termination.
     */
    @Bean(destroyMethod = "close")
    public SmtpClient smtpClient(SmtpClientConfig smtpClientConfig) {
        return new SmtpClient(smtpClientConfig);
    }

    @Bean
    @ConditionalOnProperty(prefix = "mail.client.sendmail", name = "enabled", havingValue = "true")
    public SendmailSender sendmailSender(MailClientProperties properties) {
        MailClientProperties.Sendmail sendmail = properties.getSendmail();
        return new SendmailSender(sendmail.getPath(), sendmail.resolveTimeout(), sendmail.getArguments());
    }
}

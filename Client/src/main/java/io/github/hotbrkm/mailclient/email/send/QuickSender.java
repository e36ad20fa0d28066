package io.github.hotbrkm.mailclient.email.send;

import io.github.hotbrkm.mailclient.email.message.BodyWriter;
import io.github.hotbrkm.mailclient.email.message.ContentTypes;
import io.github.hotbrkm.mailclient.email.message.Message;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.SmtpClient;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.SmtpClientConfig;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.SmtpTlsConfig;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.SmtpTlsPolicy;
import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.Objects;

/**
 * One-shot sending of a plain text message: opportunistic TLS and, with credentials, the strongest
 * authentication mechanism the server offers.
 */
@UtilityClass
public class QuickSender {

    /**
     * Connects to {@code host:port}, sends one text/plain message and disconnects.
     *
     * @param address  server address as {@code host:port}
     * @param username user name, or null to send without authentication
     * @return the sent message
     * @throws IllegalArgumentException if the address or an email address is invalid
     * @throws SendException            if the message was not delivered
     */
    public static Message quickSend(String address, String username, String password, String from,
                                    List<String> recipients, String subject, byte[] content) {
        return quickSend(address, username, password, from, recipients, subject, content,
                SmtpTlsConfig.of(SmtpTlsPolicy.OPPORTUNISTIC));
    }

    public static Message quickSend(String address, String username, String password, String from,
                                    List<String> recipients, String subject, byte[] content,
                                    SmtpTlsConfig tlsConfig) {
        Objects.requireNonNull(address, "address must not be null");
        Objects.requireNonNull(content, "content must not be null");
        int separator = address.lastIndexOf(':');
        if (separator <= 0 || separator == address.length() - 1) {
            throw new IllegalArgumentException("address must be host:port: " + address);
        }
        String host = address.substring(0, separator);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        int port;
        try {
            port = Integer.parseInt(address.substring(separator + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid port in address: " + address, e);
        }

        SmtpClientConfig config = SmtpClientConfig.builder()
                .host(host)
                .port(port)
                .tlsConfig(tlsConfig)
                .username(username)
                .password(username == null ? null : password)
                .build();

        Message message = new Message();
        message.from(from);
        message.to(recipients.toArray(new String[0]));
        message.subject(subject);
        message.setBodyWriter(ContentTypes.TEXT_PLAIN, BodyWriter.ofBytes(content));

        try (SmtpClient client = new SmtpClient(config)) {
            client.dialAndSend(message);
        }
        return message;
    }
}

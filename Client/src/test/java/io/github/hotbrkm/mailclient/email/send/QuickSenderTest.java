package io.github.hotbrkm.mailclient.email.send;

import io.github.hotbrkm.mailclient.email.message.Message;
import io.github.hotbrkm.mailclient.email.testsupport.ScriptedSmtpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("QuickSender Test")
class QuickSenderTest {

    private ScriptedSmtpServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.close();
        }
    }

    private static byte[] body(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("A text message is sent and the connection closed")
    void testQuickSend() throws IOException {
        // Given
        server = ScriptedSmtpServer.start();
        String address = server.getHost() + ":" + server.getPort();

        // When
        Message message = QuickSender.quickSend(address, null, null, "sender@example.com",
                List.of("a@example.com", "b@example.com"), "Quick", body("Quick body"));

        // Then
        assertThat(message.isDelivered()).isTrue();
        assertThat(server.getCommands("RCPT TO")).containsExactly("RCPT TO:<a@example.com>", "RCPT TO:<b@example.com>");
        assertThat(server.getCommands("QUIT")).hasSize(1);
        assertThat(server.getMessages().get(0))
                .contains("Subject: Quick\r\n")
                .contains("Content-Type: text/plain")
                .contains("Quick body");
    }

    @Test
    @DisplayName("Credentials enable authentication")
    void testQuickSendWithCredentials() throws IOException {
        // Given
        server = ScriptedSmtpServer.start("AUTH PLAIN").credentials("user", "secret");
        String address = server.getHost() + ":" + server.getPort();

        // When
        Message message = QuickSender.quickSend(address, "user", "secret", "sender@example.com",
                List.of("a@example.com"), "Quick", body("Quick body"));

        // Then
        assertThat(message.isDelivered()).isTrue();
        assertThat(server.getCommands("AUTH PLAIN")).hasSize(1);
    }

    @Test
    @DisplayName("An address without a port is rejected")
    void testInvalidAddress() {
        // When // Then
        assertThatThrownBy(() -> QuickSender.quickSend("mail.example.com", null, null, "sender@example.com",
                List.of("a@example.com"), "s", body("b")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> QuickSender.quickSend("mail.example.com:smtp", null, null, "sender@example.com",
                List.of("a@example.com"), "s", body("b")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("An invalid sender address is rejected before connecting")
    void testInvalidSender() throws IOException {
        // Given
        server = ScriptedSmtpServer.start();
        String address = server.getHost() + ":" + server.getPort();

        // When // Then
        assertThatThrownBy(() -> QuickSender.quickSend(address, null, null, "not an address",
                List.of("a@example.com"), "s", body("b")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(server.getConnectionCount()).isZero();
    }
}

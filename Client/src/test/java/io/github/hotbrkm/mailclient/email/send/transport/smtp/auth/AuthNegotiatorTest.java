package io.github.hotbrkm.mailclient.email.send.transport.smtp.auth;

import io.github.hotbrkm.mailclient.email.send.transport.smtp.SmtpCapabilities;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.SmtpCommand;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.SmtpCommandHandler;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.SmtpCommandResponse;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.SmtpTimeoutException;
import org.apache.commons.codec.binary.Base64;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("AuthNegotiator Test")
class AuthNegotiatorTest {

    private SmtpCommandHandler commandHandler;
    private AuthNegotiator negotiator;

    @BeforeEach
    void setUp() {
        commandHandler = mock(SmtpCommandHandler.class);
        negotiator = new AuthNegotiator(commandHandler);
    }

    private static SmtpCapabilities capabilities(String authLine) {
        return SmtpCapabilities.fromEhloResponse(new SmtpCommandResponse(SmtpCommand.EHLO,
                List.of("250-mx.example.com", "250 " + authLine)));
    }

    private static SmtpCommandResponse reply(String line) {
        return new SmtpCommandResponse(SmtpCommand.AUTH, List.of(line));
    }

    private static String base64(String value) {
        return Base64.encodeBase64String(value.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("The strongest offered mechanism is selected")
    void testSelectStrongest() {
        // Given
        var capabilities = capabilities("AUTH PLAIN LOGIN CRAM-MD5 SCRAM-SHA-1 SCRAM-SHA-256");

        // When
        SaslMechanism selected = AuthNegotiator.select(capabilities, null, false);

        // Then
        assertThat(selected).isEqualTo(SaslMechanism.SCRAM_SHA_256);
    }

    @Test
    @DisplayName("PLUS mechanisms are only selected when channel binding is available")
    void testSelectPlusNeedsChannelBinding() {
        // Given
        var capabilities = capabilities("AUTH PLAIN CRAM-MD5 SCRAM-SHA-256-PLUS SCRAM-SHA-256");

        // When // Then
        assertThat(AuthNegotiator.select(capabilities, null, false)).isEqualTo(SaslMechanism.SCRAM_SHA_256);
        assertThat(AuthNegotiator.select(capabilities, null, true)).isEqualTo(SaslMechanism.SCRAM_SHA_256_PLUS);
    }

    @Test
    @DisplayName("A pinned mechanism is used even if a stronger one is offered")
    void testSelectPinned() {
        // Given
        var capabilities = capabilities("AUTH SCRAM-SHA-256 LOGIN");

        // When // Then
        assertThat(AuthNegotiator.select(capabilities, SaslMechanism.LOGIN, false)).isEqualTo(SaslMechanism.LOGIN);
    }

    @Test
    @DisplayName("A pinned mechanism the server does not offer is an error")
    void testSelectPinnedNotOffered() {
        // Given
        var capabilities = capabilities("AUTH LOGIN");

        // When // Then
        assertThatThrownBy(() -> AuthNegotiator.select(capabilities, SaslMechanism.CRAM_MD5, false))
                .isInstanceOf(SmtpAuthenticationException.class)
                .hasMessageContaining("CRAM-MD5");
        assertThatThrownBy(() -> AuthNegotiator.select(capabilities("AUTH SCRAM-SHA-1-PLUS"),
                SaslMechanism.SCRAM_SHA_1_PLUS, false))
                .isInstanceOf(SmtpAuthenticationException.class);
    }

    @Test
    @DisplayName("No supported mechanism is an error")
    void testSelectNothingSupported() {
        // When // Then
        assertThatThrownBy(() -> AuthNegotiator.select(capabilities("AUTH GSSAPI KERBEROS_V4"), null, true))
                .isInstanceOf(SmtpAuthenticationException.class);
        assertThatThrownBy(() -> AuthNegotiator.select(SmtpCapabilities.none(), null, false))
                .isInstanceOf(SmtpAuthenticationException.class);
    }

    @Test
    @DisplayName("PLAIN sends the credentials with the AUTH command")
    void testPlain() {
        // Given
        when(commandHandler.sendAuth("PLAIN", base64("\0user\0secret"))).thenReturn(reply("235 2.7.0 Authentication successful"));

        // When
        negotiator.authenticate(SaslMechanism.PLAIN, new AuthContext("user", "secret", "mx", null));

        // Then
        verify(commandHandler).sendAuth("PLAIN", base64("\0user\0secret"));
        verify(commandHandler, never()).sendAuthResponse(anyString());
    }

    @Test
    @DisplayName("LOGIN answers both prompts")
    void testLogin() {
        // Given
        when(commandHandler.sendAuth(any(), isNull())).thenReturn(reply("334 " + base64("Username:")));
        when(commandHandler.sendAuthResponse(base64("user"))).thenReturn(reply("334 " + base64("Password:")));
        when(commandHandler.sendAuthResponse(base64("secret"))).thenReturn(reply("235 2.7.0 Accepted"));

        // When
        negotiator.authenticate(SaslMechanism.LOGIN, new AuthContext("user", "secret", "mx", null));

        // Then
        verify(commandHandler).sendAuth("LOGIN", null);
        verify(commandHandler).sendAuthResponse(base64("user"));
        verify(commandHandler).sendAuthResponse(base64("secret"));
    }

    @Test
    @DisplayName("CRAM-MD5 answers the challenge with the keyed digest")
    void testCramMd5() {
        // Given
        when(commandHandler.sendAuth("CRAM-MD5", null))
                .thenReturn(reply("334 " + base64("<1896.697170952@postoffice.reston.mci.net>")));
        when(commandHandler.sendAuthResponse(base64("tim b913a602c7eda7a495b4e6e7334d3890")))
                .thenReturn(reply("235 Ok"));

        // When
        negotiator.authenticate(SaslMechanism.CRAM_MD5, new AuthContext("tim", "tanstaaftanstaaf", "mx", null));

        // Then
        verify(commandHandler).sendAuthResponse(base64("tim b913a602c7eda7a495b4e6e7334d3890"));
    }

    @Test
    @DisplayName("Rejected credentials raise an authentication error with the server reply")
    void testRejected() {
        // Given
        when(commandHandler.sendAuth(any(), any())).thenReturn(reply("535 5.7.8 Authentication credentials invalid"));

        // When // Then
        assertThatThrownBy(() -> negotiator.authenticate(SaslMechanism.PLAIN, new AuthContext("u", "p", "mx", null)))
                .isInstanceOfSatisfying(SmtpAuthenticationException.class, e -> {
                    assertThat(e.getMechanism()).isEqualTo(SaslMechanism.PLAIN);
                    assertThat(e.getStatusCode()).isEqualTo(535);
                    assertThat(e.isPermanent()).isTrue();
                });
    }

    @Test
    @DisplayName("A timeout during AUTH raises a timeout error")
    void testTimeout() {
        // Given
        when(commandHandler.sendAuth(any(), any())).thenReturn(reply("704 SMTP java.net.SocketTimeoutException: Read timed out"));

        // When // Then
        assertThatThrownBy(() -> negotiator.authenticate(SaslMechanism.PLAIN, new AuthContext("u", "p", "mx", null)))
                .isInstanceOf(SmtpTimeoutException.class);
    }

    @Test
    @DisplayName("A SCRAM server error cancels the exchange")
    void testScramServerErrorCancels() {
        // Given
        when(commandHandler.sendAuth(any(), anyString())).thenReturn(reply("334 " + base64("e=unknown-user")));
        when(commandHandler.sendAuthCancel()).thenReturn(reply("501 5.7.0 Authentication aborted"));

        // When // Then
        assertThatThrownBy(() -> negotiator.authenticate(SaslMechanism.SCRAM_SHA_256, new AuthContext("u", "p", "mx", null)))
                .isInstanceOf(SmtpAuthenticationException.class)
                .hasMessageContaining("unknown-user");
        verify(commandHandler).sendAuthCancel();
    }

    @Test
    @DisplayName("Success before the SCRAM server signature was verified is an error")
    void testScramUnverifiedSuccess() {
        // Given
        when(commandHandler.sendAuth(any(), anyString())).thenReturn(reply("235 2.7.0 Ok"));

        // When // Then
        assertThatThrownBy(() -> negotiator.authenticate(SaslMechanism.SCRAM_SHA_1, new AuthContext("u", "p", "mx", null)))
                .isInstanceOf(SmtpAuthenticationException.class)
                .hasMessageContaining("verified");
    }

    @Test
    @DisplayName("Mechanism wire names resolve case-insensitively")
    void testFromWireName() {
        // When // Then
        assertThat(SaslMechanism.fromWireName("scram-sha-256-plus")).isEqualTo(SaslMechanism.SCRAM_SHA_256_PLUS);
        assertThat(SaslMechanism.fromWireName("CRAM_MD5")).isEqualTo(SaslMechanism.CRAM_MD5);
        assertThatThrownBy(() -> SaslMechanism.fromWireName("GSSAPI")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Channel binding hashes follow the certificate signature algorithm")
    void testChannelBindingHashAlgorithm() {
        // When // Then
        assertThat(ChannelBinding.hashAlgorithm("SHA256withRSA")).isEqualTo("SHA-256");
        assertThat(ChannelBinding.hashAlgorithm("SHA384withECDSA")).isEqualTo("SHA-384");
        assertThat(ChannelBinding.hashAlgorithm("SHA512withRSA")).isEqualTo("SHA-512");
        assertThat(ChannelBinding.hashAlgorithm("MD5withRSA")).isEqualTo("SHA-256");
        assertThat(ChannelBinding.hashAlgorithm("SHA1withRSA")).isEqualTo("SHA-256");
    }
}

package io.github.hotbrkm.mailclient.email.send.transport.smtp.auth;

import io.github.hotbrkm.mailclient.email.send.transport.smtp.SmtpCapabilities;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.SmtpCommandException;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.SmtpCommandHandler;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.SmtpCommandResponse;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.SmtpStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.binary.Base64;

import javax.security.sasl.SaslException;

/**
 * Picks a SASL mechanism from the server's capabilities and runs the AUTH exchange.
 * There is no fallback to a weaker mechanism after a failure.
 */
@Slf4j
@RequiredArgsConstructor
public class AuthNegotiator {

    private static final int MAX_CHALLENGES = 10;

    private final SmtpCommandHandler commandHandler;

    /**
     * Selects the mechanism to use.
     *
     * @param pinned                  mechanism requested by the caller, or null to pick the strongest offered one
     * @param channelBindingAvailable whether the connection is TLS and channel binding data could be obtained
     * @throws SmtpAuthenticationException if no usable mechanism is offered
     */
    public static SaslMechanism select(SmtpCapabilities capabilities, SaslMechanism pinned, boolean channelBindingAvailable) {
        if (pinned != null) {
            if (!capabilities.getAuthMechanisms().contains(pinned.getWireName())) {
                throw new SmtpAuthenticationException("server does not offer AUTH " + pinned.getWireName()
                        + ", offered: " + capabilities.getAuthMechanisms());
            }
            if (pinned.isChannelBindingRequired() && !channelBindingAvailable) {
                throw new SmtpAuthenticationException(pinned.getWireName() + " requires a TLS connection with channel binding");
            }
            return pinned;
        }

        for (SaslMechanism mechanism : SaslMechanism.values()) {
            if (mechanism.isChannelBindingRequired() && !channelBindingAvailable) {
                continue;
            }
            if (capabilities.getAuthMechanisms().contains(mechanism.getWireName())) {
                return mechanism;
            }
        }
        throw new SmtpAuthenticationException("no supported authentication mechanism offered: "
                + capabilities.getAuthMechanisms());
    }

    /**
     * Runs AUTH with the given mechanism.
     *
     * @throws SmtpAuthenticationException if the server rejects the credentials or the exchange cannot be completed
     * @throws SmtpCommandException        if the connection fails or times out
     */
    public void authenticate(SaslMechanism mechanism, AuthContext context) {
        SmtpAuthenticator authenticator = mechanism.createAuthenticator(context);

        byte[] initial;
        try {
            initial = authenticator.initialResponse();
        } catch (SaslException e) {
            throw new SmtpAuthenticationException(mechanism, "AUTH " + mechanism + " failed: " + e.getMessage(), e);
        }

        SmtpCommandResponse response = commandHandler.sendAuth(mechanism.getWireName(), initial == null ? null : encode(initial));
        int challenges = 0;
        while (response.isContinuation()) {
            if (++challenges > MAX_CHALLENGES) {
                commandHandler.sendAuthCancel();
                throw new SmtpAuthenticationException(mechanism, "AUTH " + mechanism + " exceeded " + MAX_CHALLENGES + " challenges", null);
            }
            byte[] reply;
            try {
                reply = authenticator.evaluateChallenge(Base64.decodeBase64(response.getMessage()));
            } catch (SaslException e) {
                commandHandler.sendAuthCancel();
                throw new SmtpAuthenticationException(mechanism, "AUTH " + mechanism + " failed: " + e.getMessage(), e);
            }
            response = commandHandler.sendAuthResponse(reply == null || reply.length == 0 ? "" : Base64.encodeBase64String(reply));
        }

        if (response.getStatusCode() == SmtpStatus.AUTH_SUCCESS) {
            verifyCompletion(mechanism, authenticator, response);
            log.debug("Authenticated with {}", mechanism);
            return;
        }
        if (response.isNetworkFailure()) {
            throw SmtpCommandException.from(response);
        }
        throw new SmtpAuthenticationException(mechanism, response);
    }

    /**
     * Some servers send the final server message as additional data of the 235 reply.
     */
    private static void verifyCompletion(SaslMechanism mechanism, SmtpAuthenticator authenticator, SmtpCommandResponse response) {
        if (authenticator.isComplete()) {
            return;
        }
        String additionalData = response.getMessage();
        if (additionalData != null && !additionalData.isEmpty() && Base64.isBase64(additionalData)) {
            try {
                authenticator.evaluateChallenge(Base64.decodeBase64(additionalData));
            } catch (SaslException e) {
                throw new SmtpAuthenticationException(mechanism, "AUTH " + mechanism + " failed: " + e.getMessage(), e);
            }
        }
        if (!authenticator.isComplete()) {
            throw new SmtpAuthenticationException(mechanism, "AUTH " + mechanism
                    + " succeeded before the server was verified", null);
        }
    }

    /**
     * An empty initial response is sent as a single "=".
     */
    private static String encode(byte[] data) {
        return data.length == 0 ? "=" : Base64.encodeBase64String(data);
    }
}

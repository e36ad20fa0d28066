package io.github.hotbrkm.mailclient.email.send.transport.smtp.auth;

import javax.security.sasl.SaslException;

/**
 * Client side of one SASL mechanism for one AUTH exchange.
 */
public interface SmtpAuthenticator {

    /**
     * Returns the initial response sent with the AUTH command, or null to wait for the first challenge.
     */
    byte[] initialResponse() throws SaslException;

    /**
     * Answers a decoded 334 challenge.
     *
     * @throws SaslException if the challenge is malformed or the server failed verification
     */
    byte[] evaluateChallenge(byte[] challenge) throws SaslException;

    /**
     * Returns true once the client has sent its last message and, for mutual mechanisms,
     * verified the server.
     */
    boolean isComplete();
}

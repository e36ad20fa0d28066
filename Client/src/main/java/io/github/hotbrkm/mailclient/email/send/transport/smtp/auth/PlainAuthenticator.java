package io.github.hotbrkm.mailclient.email.send.transport.smtp.auth;

import javax.security.sasl.SaslException;
import java.nio.charset.StandardCharsets;

/**
 * PLAIN (RFC 4616): {@code authzid NUL authcid NUL passwd} as the initial response.
 */
class PlainAuthenticator implements SmtpAuthenticator {

    private final AuthContext context;
    private boolean complete;

    PlainAuthenticator(AuthContext context) {
        this.context = context;
    }

    @Override
    public byte[] initialResponse() {
        complete = true;
        return ("\0" + context.username() + "\0" + context.password()).getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public byte[] evaluateChallenge(byte[] challenge) throws SaslException {
        throw new SaslException("PLAIN does not expect a server challenge");
    }

    @Override
    public boolean isComplete() {
        return complete;
    }
}

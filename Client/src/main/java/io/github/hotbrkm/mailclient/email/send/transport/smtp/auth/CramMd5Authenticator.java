package io.github.hotbrkm.mailclient.email.send.transport.smtp.auth;

import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;

import javax.security.sasl.SaslException;
import java.nio.charset.StandardCharsets;

/**
 * CRAM-MD5 (RFC 2195): {@code user SP hex(HMAC-MD5(password, challenge))}.
 */
class CramMd5Authenticator implements SmtpAuthenticator {

    private final AuthContext context;
    private boolean complete;

    CramMd5Authenticator(AuthContext context) {
        this.context = context;
    }

    @Override
    public byte[] initialResponse() {
        return null;
    }

    @Override
    public byte[] evaluateChallenge(byte[] challenge) throws SaslException {
        if (complete) {
            throw new SaslException("CRAM-MD5 received a second challenge");
        }
        if (challenge.length == 0) {
            throw new SaslException("CRAM-MD5 challenge is empty");
        }
        String digest = new HmacUtils(HmacAlgorithms.HMAC_MD5, context.password().getBytes(StandardCharsets.UTF_8))
                .hmacHex(challenge);
        complete = true;
        return (context.username() + " " + digest).getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public boolean isComplete() {
        return complete;
    }
}

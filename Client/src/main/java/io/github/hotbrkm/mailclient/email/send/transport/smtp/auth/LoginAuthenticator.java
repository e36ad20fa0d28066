package io.github.hotbrkm.mailclient.email.send.transport.smtp.auth;

import javax.security.sasl.SaslException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * LOGIN: answers the username and password prompts in turn.
 */
class LoginAuthenticator implements SmtpAuthenticator {

    private final AuthContext context;
    private boolean usernameSent;
    private boolean complete;

    LoginAuthenticator(AuthContext context) {
        this.context = context;
    }

    @Override
    public byte[] initialResponse() {
        return null;
    }

    @Override
    public byte[] evaluateChallenge(byte[] challenge) throws SaslException {
        String prompt = normalize(challenge);
        if (prompt.equals("username:") || prompt.equals("user name")) {
            usernameSent = true;
            return context.username().getBytes(StandardCharsets.UTF_8);
        }
        if (prompt.equals("password:") || prompt.equals("password")) {
            if (!usernameSent) {
                throw new SaslException("LOGIN password prompt before username prompt");
            }
            complete = true;
            return context.password().getBytes(StandardCharsets.UTF_8);
        }
        throw new SaslException("unexpected LOGIN prompt: " + prompt);
    }

    private static String normalize(byte[] challenge) {
        String prompt = new String(challenge, StandardCharsets.UTF_8);
        int nul = prompt.indexOf('\0');
        if (nul >= 0) {
            prompt = prompt.substring(0, nul);
        }
        return prompt.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean isComplete() {
        return complete;
    }
}

package io.github.hotbrkm.mailclient.email.send.transport.smtp.auth;

import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;

/**
 * XOAUTH2: sends the bearer token as the initial response. The password of the context is the access token.
 */
@Slf4j
class XOAuth2Authenticator implements SmtpAuthenticator {

    private static final byte[] EMPTY = new byte[0];

    private final AuthContext context;
    private boolean complete;

    XOAuth2Authenticator(AuthContext context) {
        this.context = context;
    }

    @Override
    public byte[] initialResponse() {
        complete = true;
        return ("user=" + context.username() + "\u0001auth=Bearer " + context.password() + "\u0001\u0001")
                .getBytes(StandardCharsets.UTF_8);
    }

    /**
     * The server reports a rejected token as a JSON challenge that must be answered with an empty response.
     */
    @Override
    public byte[] evaluateChallenge(byte[] challenge) {
        log.debug("XOAUTH2 error challenge: {}", new String(challenge, StandardCharsets.UTF_8));
        return EMPTY;
    }

    @Override
    public boolean isComplete() {
        return complete;
    }
}

package io.github.hotbrkm.mailclient.email.send.transport.smtp.auth;

import io.github.hotbrkm.mailclient.email.send.transport.smtp.SmtpCommand;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.SmtpCommandException;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.SmtpCommandResponse;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.SmtpStatus;
import lombok.Getter;

/**
 * Authentication was rejected by the server or could not be completed by the client.
 */
@Getter
public class SmtpAuthenticationException extends SmtpCommandException {

    private final SaslMechanism mechanism;

    public SmtpAuthenticationException(SaslMechanism mechanism, SmtpCommandResponse response) {
        super(response.getCommand(), response.getStatusCode(), response.getOriginalMessage());
        this.mechanism = mechanism;
    }

    public SmtpAuthenticationException(SaslMechanism mechanism, String message, Throwable cause) {
        super(SmtpCommand.AUTH, SmtpStatus.UNKNOWN_ERROR, message, cause);
        this.mechanism = mechanism;
    }

    public SmtpAuthenticationException(String message) {
        this(null, message, null);
    }
}

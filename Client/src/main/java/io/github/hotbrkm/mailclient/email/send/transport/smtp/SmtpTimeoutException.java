package io.github.hotbrkm.mailclient.email.send.transport.smtp;

/**
 * An operation exceeded its timeout or deadline, or was cancelled.
 */
public class SmtpTimeoutException extends SmtpCommandException {

    public SmtpTimeoutException(SmtpCommand command, String originalMessage) {
        super(command, SmtpStatus.NETWORK_TIMEOUT, originalMessage);
    }
}

package io.github.hotbrkm.mailclient.email.send.transport.smtp;

import lombok.Getter;

/**
 * A command was answered with an unexpected reply, or failed on the connection.
 */
@Getter
public class SmtpCommandException extends RuntimeException {
    private final SmtpCommand command;
    private final int statusCode;
    private final String originalMessage;

    public SmtpCommandException(SmtpCommand command, int statusCode, String originalMessage) {
        super(command + " failed: " + originalMessage);
        this.command = command;
        this.statusCode = statusCode;
        this.originalMessage = originalMessage;
    }

    public SmtpCommandException(SmtpCommand command, int statusCode, String originalMessage, Throwable cause) {
        super(command + " failed: " + originalMessage, cause);
        this.command = command;
        this.statusCode = statusCode;
        this.originalMessage = originalMessage;
    }

    public SmtpCommandException(SmtpCommandResponse response) {
        this(response.getCommand(), response.getStatusCode(), response.getOriginalMessage());
    }

    /**
     * Creates the exception matching a failed response: a {@link SmtpTimeoutException} for timeouts.
     */
    public static SmtpCommandException from(SmtpCommandResponse response) {
        if (response.getStatusCode() == SmtpStatus.NETWORK_TIMEOUT) {
            return new SmtpTimeoutException(response.getCommand(), response.getOriginalMessage());
        }
        return new SmtpCommandException(response);
    }

    public boolean isTemporary() {
        return SmtpStatus.isTemporary(statusCode);
    }

    public boolean isPermanent() {
        return SmtpStatus.isPermanent(statusCode);
    }
}

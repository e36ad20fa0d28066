package io.github.hotbrkm.mailclient.email.send.transport.smtp;

import lombok.Getter;

/**
 * Exception to preserve cause code/message when SMTP session open fails.
 */
@Getter
public class SmtpSessionOpenException extends RuntimeException {
    private final int statusCode;
    private final String originalMessage;
    private final String serverAddress;

    public SmtpSessionOpenException(int statusCode, String originalMessage, String serverAddress) {
        this(statusCode, originalMessage, serverAddress, null);
    }

    public SmtpSessionOpenException(int statusCode, String originalMessage, String serverAddress, Throwable cause) {
        super("failed to open SMTP session to " + serverAddress + ": " + originalMessage, cause);
        this.statusCode = statusCode;
        this.originalMessage = originalMessage;
        this.serverAddress = serverAddress;
    }

    public boolean isTemporary() {
        return SmtpStatus.isTemporary(statusCode);
    }
}

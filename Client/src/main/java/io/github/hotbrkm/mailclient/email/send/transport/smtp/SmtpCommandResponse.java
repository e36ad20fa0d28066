package io.github.hotbrkm.mailclient.email.send.transport.smtp;

import lombok.Getter;

import java.util.List;

/**
 * A reply together with the step that caused it, which decides what counts as success.
 */
public class SmtpCommandResponse {

    @Getter
    private final SmtpCommand command;
    private final SmtpResponse response;

    public SmtpCommandResponse(SmtpCommand command, List<String> rawLines) {
        this.command = command;
        this.response = SmtpResponseParser.parse(rawLines);
    }

    public boolean isSuccess() {
        return command.accepts(response.getStatusCode());
    }

    /** 334, a challenge inside an AUTH exchange */
    public boolean isContinuation() {
        return response.getStatusCode() == SmtpStatus.AUTH_CONTINUE;
    }

    public boolean isTemporaryFailure() {
        return !isSuccess() && SmtpStatus.isTemporary(getStatusCode());
    }

    public boolean isPermanentFailure() {
        return !isSuccess() && SmtpStatus.isPermanent(getStatusCode());
    }

    /**
     * True for the client-side pseudo codes that mean the connection itself failed.
     */
    public boolean isNetworkFailure() {
        int statusCode = getStatusCode();
        return statusCode == SmtpStatus.NETWORK_ERROR || statusCode == SmtpStatus.NETWORK_TIMEOUT
                || statusCode == SmtpStatus.UNKNOWN_ERROR;
    }

    public int getStatusCode() {
        return response.getStatusCode();
    }

    public String getMessage() {
        return response.getMessage();
    }

    public String getOriginalMessage() {
        return response.getOriginalMessage();
    }

    public List<String> getLines() {
        return response.getLines();
    }

    @Override
    public String toString() {
        return command + " -> " + response;
    }
}

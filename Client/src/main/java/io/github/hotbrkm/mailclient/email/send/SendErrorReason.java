package io.github.hotbrkm.mailclient.email.send;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Step of a send operation that failed.
 */
@RequiredArgsConstructor
@Getter
public enum SendErrorReason {
    GET_SENDER("getting sender address"),
    GET_RCPTS("getting recipient addresses"),
    SMTP_MAIL_FROM("sending SMTP MAIL FROM command"),
    SMTP_RCPT_TO("sending SMTP RCPT TO command"),
    SMTP_DATA("sending SMTP DATA command"),
    SMTP_DATA_CLOSE("closing SMTP DATA writer"),
    SMTP_RESET("sending SMTP RESET command"),
    WRITE_CONTENT("sending message content"),
    CONN_CHECK("checking SMTP connection"),
    NO_UNENCODED("message is 8bit but server does not support 8BITMIME"),
    SENDMAIL("piping message to sendmail"),
    AMBIGUOUS("ambiguous reason, check Base error");

    private final String description;

    @Override
    public String toString() {
        return description;
    }
}

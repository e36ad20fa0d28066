package io.github.hotbrkm.mailclient.email.send.transport.smtp;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Steps of an SMTP conversation and the reply code each one expects.
 * <p>
 * {@link #INIT}, {@link #AUTH_RESPONSE} and {@link #DATA_END} are not verbs of their own: they stand
 * for the greeting, an answer to a 334 challenge and the end-of-data dot.
 * <p>
 * RCPT TO also succeeds with 251 (forwarded) and 252 (cannot verify, will try), so any 25x reply
 * accepts a recipient.
 */
@RequiredArgsConstructor
@Getter
public enum SmtpCommand {
    INIT(null, SmtpStatus.SERVICE_READY),
    HELO("HELO", SmtpStatus.OK),
    EHLO("EHLO", SmtpStatus.OK),
    STARTTLS("STARTTLS", SmtpStatus.SERVICE_READY),
    AUTH("AUTH", SmtpStatus.AUTH_SUCCESS),
    AUTH_RESPONSE(null, SmtpStatus.AUTH_SUCCESS),
    MAIL_FROM("MAIL FROM:", SmtpStatus.OK),
    RCPT_TO("RCPT TO:", SmtpStatus.OK, true),
    DATA("DATA", SmtpStatus.START_MAIL_INPUT),
    DATA_END(null, SmtpStatus.OK),
    RSET("RSET", SmtpStatus.OK),
    NOOP("NOOP", SmtpStatus.OK),
    QUIT("QUIT", SmtpStatus.CLOSING);

    /** Wire verb, null for steps that are not a command line */
    private final String verb;
    private final int successCode;
    /** Whether every 25x reply counts as success, not only {@link #successCode} */
    private final boolean anyCompletion;

    SmtpCommand(String verb, int successCode) {
        this(verb, successCode, false);
    }

    public boolean accepts(int statusCode) {
        if (anyCompletion) {
            return statusCode / 10 == successCode / 10;
        }
        return statusCode == successCode;
    }

    public boolean hasVerb() {
        return verb != null;
    }

    /**
     * Builds the command line without CRLF. Verbs ending in a colon take their argument without a space.
     */
    public String line(String argument) {
        if (verb == null) {
            throw new IllegalStateException(name() + " is not sent as a command line");
        }
        if (argument == null || argument.isEmpty()) {
            return verb;
        }
        return verb.endsWith(":") ? verb + argument : verb + " " + argument;
    }

    public String line() {
        return line(null);
    }

    @Override
    public String toString() {
        return verb != null ? verb : name();
    }
}

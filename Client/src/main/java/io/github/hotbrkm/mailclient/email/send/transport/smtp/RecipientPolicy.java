package io.github.hotbrkm.mailclient.email.send.transport.smtp;

/**
 * How rejected RCPT TO commands affect a transaction.
 */
public enum RecipientPolicy {
    /** The first rejected recipient aborts the message before DATA */
    STRICT,
    /** Rejected recipients are recorded and the message goes to the accepted ones */
    LENIENT
}

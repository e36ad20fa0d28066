package io.github.hotbrkm.mailclient.email.send.transport.smtp;

public enum SmtpTlsPolicy {
    /** STARTTLS is required; a server without it, or a failed handshake, aborts the connection */
    MANDATORY,
    /** STARTTLS is used when offered, otherwise the session continues in plaintext */
    OPPORTUNISTIC,
    /** Never use TLS */
    NONE,
    /** TLS from the first byte (SMTPS, usually port 465) */
    IMPLICIT
}

package io.github.hotbrkm.mailclient.email.send.transport.smtp;

/**
 * Events that trigger a delivery status notification (RFC 3461 NOTIFY).
 */
public enum DsnNotify {
    NEVER,
    SUCCESS,
    FAILURE,
    DELAY
}

package io.github.hotbrkm.mailclient.email.send.transport.smtp;

/**
 * Which part of the message a delivery status notification returns (RFC 3461 RET).
 */
public enum DsnReturn {
    FULL,
    HDRS
}

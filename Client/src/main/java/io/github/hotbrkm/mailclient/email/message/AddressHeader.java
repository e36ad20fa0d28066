package io.github.hotbrkm.mailclient.email.message;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
@Getter
public enum AddressHeader {
    FROM("From", true),
    TO("To", false),
    CC("Cc", false),
    BCC("Bcc", false),
    REPLY_TO("Reply-To", false),
    // Envelope sender, never written as a header
    ENVELOPE_FROM("EnvelopeFrom", true),
    DISPOSITION_NOTIFICATION_TO("Disposition-Notification-To", false);

    private final String headerName;
    private final boolean singleAddress;

    @Override
    public String toString() {
        return headerName;
    }
}

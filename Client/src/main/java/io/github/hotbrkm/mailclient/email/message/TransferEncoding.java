package io.github.hotbrkm.mailclient.email.message;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
@Getter
public enum TransferEncoding {
    QUOTED_PRINTABLE("quoted-printable"),
    BASE64("base64"),
    SEVEN_BIT("7bit"),
    // Bytes are passed through unmodified; the server must advertise 8BITMIME
    EIGHT_BIT("8bit");

    private final String value;

    /**
     * Returns the RFC 2047 encoded-word form ("B" or "Q") used for header values
     * of a message with this body encoding.
     */
    public String headerWordEncoding() {
        return this == BASE64 ? "B" : "Q";
    }

    public boolean isUnencoded() {
        return this == EIGHT_BIT;
    }

    @Override
    public String toString() {
        return value;
    }
}

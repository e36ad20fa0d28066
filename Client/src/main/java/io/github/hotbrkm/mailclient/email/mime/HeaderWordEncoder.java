package io.github.hotbrkm.mailclient.email.mime;

import jakarta.mail.internet.MimeUtility;

import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;

/**
 * RFC 2047 encoded-word encoding of header values.
 */
public final class HeaderWordEncoder {

    private HeaderWordEncoder() {
    }

    /**
     * Encodes the value as one or more encoded words if it contains non-ASCII characters,
     * otherwise returns it unchanged.
     *
     * @param wordEncoding "Q" for the quoted-printable word form, "B" for the base64 word form
     */
    public static String encode(String value, Charset charset, String wordEncoding) {
        if (value == null) {
            return "";
        }
        if (isAscii(value)) {
            return value;
        }
        try {
            return MimeUtility.encodeText(value, charset.name(), wordEncoding);
        } catch (UnsupportedEncodingException e) {
            throw new IllegalArgumentException("unsupported charset for header encoding: " + charset, e);
        }
    }

    public static boolean isAscii(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) > 0x7F) {
                return false;
            }
        }
        return true;
    }
}

package io.github.hotbrkm.mailclient.email.mime;

import lombok.experimental.UtilityClass;
import org.apache.commons.codec.binary.Hex;

import java.security.SecureRandom;

@UtilityClass
public class BoundaryGenerator {
    private static final SecureRandom RANDOM = new SecureRandom();

    /**
     * Returns a random multipart boundary of 60 hex characters.
     */
    public static String next() {
        byte[] bytes = new byte[30];
        RANDOM.nextBytes(bytes);
        return Hex.encodeHexString(bytes);
    }
}

package io.github.hotbrkm.mailclient.email.mime;

import java.net.InetAddress;
import java.security.SecureRandom;

import lombok.experimental.UtilityClass;

@UtilityClass
public class MessageIdGenerator {
    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int RANDOM_STRING_LENGTH = 17;
    private static final SecureRandom RANDOM = new SecureRandom();
    private static volatile String hostName;

    /**
     * Returns a new Message-ID of the form {@code <pid.random1random2.randomString@hostname>}.
     */
    public static String next() {
        long pid = ProcessHandle.current().pid();
        int first = RANDOM.nextInt(100_000);
        int second = RANDOM.nextInt(100_000);
        return "<" + pid + "." + first + second + "." + randomString() + "@" + getHostName() + ">";
    }

    private static String randomString() {
        StringBuilder builder = new StringBuilder(RANDOM_STRING_LENGTH);
        for (int i = 0; i < RANDOM_STRING_LENGTH; i++) {
            builder.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return builder.toString();
    }

    static String getHostName() {
        String cached = hostName;
        if (cached != null) {
            return cached;
        }
        synchronized (MessageIdGenerator.class) {
            if (hostName != null) {
                return hostName;
            }
            try {
                hostName = InetAddress.getLocalHost().getHostName();
            } catch (Exception e) {
                hostName = "localhost.localdomain";
            }
            return hostName;
        }
    }
}

package io.github.hotbrkm.mailclient.email.send.transport.smtp;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Service extensions advertised in an EHLO reply.
 * <p>
 * Keywords are stored upper-case with their parameter string. A HELO reply yields no extensions.
 */
public class SmtpCapabilities {

    public static final String STARTTLS = "STARTTLS";
    public static final String AUTH = "AUTH";
    public static final String EIGHT_BIT_MIME = "8BITMIME";
    public static final String SMTP_UTF8 = "SMTPUTF8";
    public static final String DSN = "DSN";
    public static final String SIZE = "SIZE";
    public static final String PIPELINING = "PIPELINING";

    private static final SmtpCapabilities NONE = new SmtpCapabilities(Map.of(), Set.of());

    private final Map<String, String> extensions;
    private final Set<String> authMechanisms;

    private SmtpCapabilities(Map<String, String> extensions, Set<String> authMechanisms) {
        this.extensions = Collections.unmodifiableMap(extensions);
        this.authMechanisms = Collections.unmodifiableSet(authMechanisms);
    }

    public static SmtpCapabilities none() {
        return NONE;
    }

    /**
     * Parses the reply to EHLO. The first line is the server greeting and carries no extension.
     * Lines are the reply texts without their status code.
     */
    public static SmtpCapabilities fromEhloResponse(SmtpCommandResponse response) {
        if (response == null || response.getCommand() != SmtpCommand.EHLO || !response.isSuccess()) {
            return NONE;
        }
        return parse(response.getLines());
    }

    static SmtpCapabilities parse(List<String> lines) {
        Map<String, String> extensions = new LinkedHashMap<>();
        Set<String> authMechanisms = new LinkedHashSet<>();

        for (int i = 1; i < lines.size(); i++) {
            String text = lines.get(i).trim();
            if (text.isEmpty()) {
                continue;
            }

            int space = indexOfSeparator(text);
            String keyword = (space < 0 ? text : text.substring(0, space)).toUpperCase(Locale.ROOT);
            String parameters = space < 0 ? "" : text.substring(space + 1).trim();

            // old servers announce "AUTH=LOGIN PLAIN"
            if (keyword.equals(AUTH) || keyword.startsWith(AUTH + "=")) {
                String mechanisms = keyword.startsWith(AUTH + "=")
                        ? text.substring(AUTH.length() + 1)
                        : parameters;
                for (String mechanism : mechanisms.trim().split("\\s+")) {
                    if (!mechanism.isEmpty()) {
                        authMechanisms.add(mechanism.toUpperCase(Locale.ROOT));
                    }
                }
                extensions.putIfAbsent(AUTH, parameters);
                continue;
            }
            extensions.put(keyword, parameters);
        }
        return new SmtpCapabilities(extensions, authMechanisms);
    }

    private static int indexOfSeparator(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    public boolean supports(String extension) {
        return extensions.containsKey(extension.toUpperCase(Locale.ROOT));
    }

    /**
     * Returns the parameters of an extension, an empty string if it has none, or null if it is not advertised.
     */
    public String getParameters(String extension) {
        return extensions.get(extension.toUpperCase(Locale.ROOT));
    }

    public Map<String, String> getExtensions() {
        return extensions;
    }

    public Set<String> getAuthMechanisms() {
        return authMechanisms;
    }

    public boolean isStartTls() {
        return supports(STARTTLS);
    }

    public boolean is8BitMime() {
        return supports(EIGHT_BIT_MIME);
    }

    public boolean isSmtpUtf8() {
        return supports(SMTP_UTF8);
    }

    public boolean isDsn() {
        return supports(DSN);
    }

    public boolean isPipelining() {
        return supports(PIPELINING);
    }

    /**
     * Returns the advertised SIZE limit, or 0 if the server sets none.
     */
    public long getMaxSize() {
        String size = getParameters(SIZE);
        if (size == null || size.isEmpty()) {
            return 0;
        }
        try {
            return Long.parseLong(size.split("\\s+")[0]);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    @Override
    public String toString() {
        return "SmtpCapabilities" + extensions.keySet() + ", auth=" + authMechanisms;
    }
}

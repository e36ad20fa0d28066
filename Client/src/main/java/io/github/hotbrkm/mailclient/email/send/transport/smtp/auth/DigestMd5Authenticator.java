package io.github.hotbrkm.mailclient.email.send.transport.smtp.auth;

import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;

import javax.security.sasl.SaslException;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * DIGEST-MD5 (RFC 2831) with {@code qop=auth} and {@code md5-sess}. The server's {@code rspauth} is
 * verified before the exchange counts as complete.
 */
class DigestMd5Authenticator implements SmtpAuthenticator {

    private static final String NONCE_COUNT = "00000001";
    private static final String QOP_AUTH = "auth";
    private static final SecureRandom RANDOM = new SecureRandom();

    private final AuthContext context;
    private final String digestUri;
    private final String clientNonce;
    private String expectedRspAuth;
    private boolean complete;

    DigestMd5Authenticator(AuthContext context) {
        this(context, "smtp", generateClientNonce());
    }

    DigestMd5Authenticator(AuthContext context, String service, String clientNonce) {
        this.context = context;
        this.digestUri = service + "/" + context.host();
        this.clientNonce = clientNonce;
    }

    private static String generateClientNonce() {
        byte[] bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        return Hex.encodeHexString(bytes);
    }

    @Override
    public byte[] initialResponse() {
        return null;
    }

    @Override
    public byte[] evaluateChallenge(byte[] challenge) throws SaslException {
        Map<String, String> directives = parseDirectives(new String(challenge, StandardCharsets.UTF_8));

        if (expectedRspAuth != null) {
            String rspAuth = directives.get("rspauth");
            if (rspAuth == null || !MessageDigest.isEqual(rspAuth.getBytes(StandardCharsets.US_ASCII),
                    expectedRspAuth.getBytes(StandardCharsets.US_ASCII))) {
                throw new SaslException("DIGEST-MD5 server response verification failed");
            }
            complete = true;
            return new byte[0];
        }

        String nonce = directives.get("nonce");
        if (nonce == null || nonce.isEmpty()) {
            throw new SaslException("DIGEST-MD5 challenge has no nonce");
        }
        String qop = directives.getOrDefault("qop", QOP_AUTH);
        if (Arrays.stream(qop.split(",")).map(String::trim).noneMatch(QOP_AUTH::equals)) {
            throw new SaslException("DIGEST-MD5 server does not offer qop=auth: " + qop);
        }
        String algorithm = directives.get("algorithm");
        if (algorithm != null && !algorithm.equalsIgnoreCase("md5-sess")) {
            throw new SaslException("unsupported DIGEST-MD5 algorithm: " + algorithm);
        }
        String realm = directives.getOrDefault("realm", "");

        String response = computeResponse(realm, nonce, "AUTHENTICATE:" + digestUri);
        expectedRspAuth = computeResponse(realm, nonce, ":" + digestUri);

        StringBuilder builder = new StringBuilder();
        if ("utf-8".equalsIgnoreCase(directives.get("charset"))) {
            builder.append("charset=utf-8,");
        }
        builder.append("username=").append(quote(context.username()));
        if (!realm.isEmpty()) {
            builder.append(",realm=").append(quote(realm));
        }
        builder.append(",nonce=").append(quote(nonce))
                .append(",nc=").append(NONCE_COUNT)
                .append(",cnonce=").append(quote(clientNonce))
                .append(",digest-uri=").append(quote(digestUri))
                .append(",response=").append(response)
                .append(",qop=").append(QOP_AUTH);
        return builder.toString().getBytes(StandardCharsets.UTF_8);
    }

    private String computeResponse(String realm, String nonce, String a2) {
        byte[] userHash = DigestUtils.md5((context.username() + ":" + realm + ":" + context.password())
                .getBytes(StandardCharsets.UTF_8));
        ByteArrayOutputStream a1 = new ByteArrayOutputStream();
        a1.writeBytes(userHash);
        a1.writeBytes((":" + nonce + ":" + clientNonce).getBytes(StandardCharsets.UTF_8));

        String ha1 = DigestUtils.md5Hex(a1.toByteArray());
        String ha2 = DigestUtils.md5Hex(a2.getBytes(StandardCharsets.UTF_8));
        return DigestUtils.md5Hex(ha1 + ":" + nonce + ":" + NONCE_COUNT + ":" + clientNonce + ":" + QOP_AUTH + ":" + ha2);
    }

    private static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    /**
     * Parses {@code key=value} and {@code key="quoted value"} pairs separated by commas.
     */
    static Map<String, String> parseDirectives(String challenge) {
        Map<String, String> directives = new LinkedHashMap<>();
        StringBuilder key = new StringBuilder();
        StringBuilder value = new StringBuilder();
        boolean inQuote = false;
        boolean inValue = false;

        for (int i = 0; i < challenge.length(); i++) {
            char c = challenge.charAt(i);
            if (inQuote) {
                if (c == '"') {
                    inQuote = false;
                } else if (c == '\\' && i + 1 < challenge.length()) {
                    value.append(challenge.charAt(++i));
                } else {
                    value.append(c);
                }
            } else if (c == '"') {
                inQuote = true;
            } else if (c == '=' && !inValue) {
                inValue = true;
            } else if (c == ',') {
                putDirective(directives, key, value);
                inValue = false;
            } else if (inValue) {
                value.append(c);
            } else {
                key.append(c);
            }
        }
        putDirective(directives, key, value);
        return directives;
    }

    private static void putDirective(Map<String, String> directives, StringBuilder key, StringBuilder value) {
        String name = key.toString().trim().toLowerCase(Locale.ROOT);
        if (!name.isEmpty()) {
            directives.putIfAbsent(name, value.toString().trim());
        }
        key.setLength(0);
        value.setLength(0);
    }

    @Override
    public boolean isComplete() {
        return complete;
    }
}

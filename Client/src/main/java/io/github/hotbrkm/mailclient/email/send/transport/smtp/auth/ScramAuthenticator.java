package io.github.hotbrkm.mailclient.email.send.transport.smtp.auth;

import org.apache.commons.codec.binary.Base64;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;

import javax.security.sasl.SaslException;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.HashMap;
import java.util.Map;

/**
 * SCRAM-SHA-1 and SCRAM-SHA-256 (RFC 5802, RFC 7677), optionally with tls-server-end-point channel binding.
 * <p>
 * The exchange is complete only after the server signature in the server-final message was verified.
 * Passwords are used as UTF-8 without SASLprep normalization.
 */
class ScramAuthenticator implements SmtpAuthenticator {

    private static final SecureRandom RANDOM = new SecureRandom();

    private enum State { INITIAL, CLIENT_FIRST_SENT, CLIENT_FINAL_SENT, COMPLETE }

    private final AuthContext context;
    private final HmacAlgorithms hmacAlgorithm;
    private final String digestAlgorithm;
    private final boolean channelBinding;
    private final String clientNonce;

    private State state = State.INITIAL;
    private String gs2Header;
    private String clientFirstBare;
    private byte[] serverSignature;

    ScramAuthenticator(AuthContext context, HmacAlgorithms hmacAlgorithm, String digestAlgorithm, boolean channelBinding) {
        this(context, hmacAlgorithm, digestAlgorithm, channelBinding, generateClientNonce());
    }

    ScramAuthenticator(AuthContext context, HmacAlgorithms hmacAlgorithm, String digestAlgorithm,
                       boolean channelBinding, String clientNonce) {
        this.context = context;
        this.hmacAlgorithm = hmacAlgorithm;
        this.digestAlgorithm = digestAlgorithm;
        this.channelBinding = channelBinding;
        this.clientNonce = clientNonce;
    }

    private static String generateClientNonce() {
        byte[] bytes = new byte[24];
        RANDOM.nextBytes(bytes);
        return Base64.encodeBase64String(bytes);
    }

    @Override
    public byte[] initialResponse() throws SaslException {
        if (state != State.INITIAL) {
            throw new SaslException("SCRAM exchange already started");
        }
        if (channelBinding) {
            if (context.channelBinding() == null) {
                throw new SaslException("SCRAM-PLUS requires TLS channel binding data");
            }
            gs2Header = "p=" + context.channelBinding().type() + ",,";
        } else {
            gs2Header = "n,,";
        }
        clientFirstBare = "n=" + escapeUsername(context.username()) + ",r=" + clientNonce;
        state = State.CLIENT_FIRST_SENT;
        return (gs2Header + clientFirstBare).getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public byte[] evaluateChallenge(byte[] challenge) throws SaslException {
        String message = new String(challenge, StandardCharsets.UTF_8);
        switch (state) {
            case CLIENT_FIRST_SENT:
                return clientFinal(message);
            case CLIENT_FINAL_SENT:
                verifyServerFinal(message);
                return new byte[0];
            default:
                throw new SaslException("unexpected SCRAM challenge in state " + state);
        }
    }

    private byte[] clientFinal(String serverFirst) throws SaslException {
        Map<String, String> attributes = parseAttributes(serverFirst);
        if (attributes.containsKey("e")) {
            throw new SaslException("SCRAM server error: " + attributes.get("e"));
        }
        String nonce = attributes.get("r");
        String salt = attributes.get("s");
        String iterationCount = attributes.get("i");
        if (nonce == null || salt == null || iterationCount == null) {
            throw new SaslException("malformed SCRAM server-first message: " + serverFirst);
        }
        if (!nonce.startsWith(clientNonce) || nonce.length() == clientNonce.length()) {
            throw new SaslException("SCRAM server nonce does not extend the client nonce");
        }
        int iterations;
        try {
            iterations = Integer.parseInt(iterationCount);
        } catch (NumberFormatException e) {
            throw new SaslException("invalid SCRAM iteration count: " + iterationCount, e);
        }
        if (iterations <= 0) {
            throw new SaslException("invalid SCRAM iteration count: " + iterations);
        }

        byte[] saltedPassword = hi(context.password().getBytes(StandardCharsets.UTF_8), Base64.decodeBase64(salt), iterations);
        byte[] clientKey = hmac(saltedPassword, "Client Key".getBytes(StandardCharsets.UTF_8));
        byte[] storedKey = new DigestUtils(digestAlgorithm).digest(clientKey);

        String clientFinalWithoutProof = "c=" + Base64.encodeBase64String(channelBindingInput()) + ",r=" + nonce;
        byte[] authMessage = (clientFirstBare + "," + serverFirst + "," + clientFinalWithoutProof)
                .getBytes(StandardCharsets.UTF_8);

        byte[] clientSignature = hmac(storedKey, authMessage);
        byte[] proof = new byte[clientKey.length];
        for (int i = 0; i < proof.length; i++) {
            proof[i] = (byte) (clientKey[i] ^ clientSignature[i]);
        }
        byte[] serverKey = hmac(saltedPassword, "Server Key".getBytes(StandardCharsets.UTF_8));
        serverSignature = hmac(serverKey, authMessage);

        state = State.CLIENT_FINAL_SENT;
        return (clientFinalWithoutProof + ",p=" + Base64.encodeBase64String(proof)).getBytes(StandardCharsets.UTF_8);
    }

    private byte[] channelBindingInput() {
        ByteArrayOutputStream input = new ByteArrayOutputStream();
        input.writeBytes(gs2Header.getBytes(StandardCharsets.UTF_8));
        if (channelBinding) {
            input.writeBytes(context.channelBinding().data());
        }
        return input.toByteArray();
    }

    private void verifyServerFinal(String serverFinal) throws SaslException {
        Map<String, String> attributes = parseAttributes(serverFinal);
        if (attributes.containsKey("e")) {
            throw new SaslException("SCRAM server error: " + attributes.get("e"));
        }
        String verifier = attributes.get("v");
        if (verifier == null || !MessageDigest.isEqual(Base64.decodeBase64(verifier), serverSignature)) {
            throw new SaslException("SCRAM server signature verification failed");
        }
        state = State.COMPLETE;
    }

    private byte[] hi(byte[] password, byte[] salt, int iterations) {
        HmacUtils mac = new HmacUtils(hmacAlgorithm, password);
        byte[] block = new byte[salt.length + 4];
        System.arraycopy(salt, 0, block, 0, salt.length);
        block[block.length - 1] = 1;

        byte[] u = mac.hmac(block);
        byte[] result = u.clone();
        for (int i = 1; i < iterations; i++) {
            u = mac.hmac(u);
            for (int j = 0; j < result.length; j++) {
                result[j] ^= u[j];
            }
        }
        return result;
    }

    private byte[] hmac(byte[] key, byte[] data) {
        return new HmacUtils(hmacAlgorithm, key).hmac(data);
    }

    static String escapeUsername(String username) {
        return username.replace("=", "=3D").replace(",", "=2C");
    }

    private static Map<String, String> parseAttributes(String message) {
        Map<String, String> attributes = new HashMap<>();
        for (String attribute : message.split(",")) {
            if (attribute.length() >= 2 && attribute.charAt(1) == '=') {
                attributes.putIfAbsent(attribute.substring(0, 1), attribute.substring(2));
            }
        }
        return attributes;
    }

    @Override
    public boolean isComplete() {
        return state == State.COMPLETE;
    }
}

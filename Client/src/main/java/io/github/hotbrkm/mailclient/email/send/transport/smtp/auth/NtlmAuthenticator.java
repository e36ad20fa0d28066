package io.github.hotbrkm.mailclient.email.send.transport.smtp.auth;

import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;
import org.bouncycastle.crypto.digests.MD4Digest;

import javax.security.sasl.SaslException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Locale;

/**
 * NTLM with NTLMv2 responses: negotiate, challenge, authenticate.
 * <p>
 * A username of the form {@code DOMAIN\\user} selects the domain, otherwise the domain is empty.
 */
class NtlmAuthenticator implements SmtpAuthenticator {

    private static final byte[] SIGNATURE = "NTLMSSP\0".getBytes(StandardCharsets.US_ASCII);
    private static final int NEGOTIATE_UNICODE = 0x00000001;
    private static final int REQUEST_TARGET = 0x00000004;
    private static final int NEGOTIATE_NTLM = 0x00000200;
    private static final int NEGOTIATE_ALWAYS_SIGN = 0x00008000;
    private static final int NEGOTIATE_EXTENDED_SESSION_SECURITY = 0x00080000;
    private static final int NEGOTIATE_128 = 0x20000000;
    private static final int NEGOTIATE_56 = 0x80000000;
    private static final int NEGOTIATE_FLAGS = NEGOTIATE_UNICODE | REQUEST_TARGET | NEGOTIATE_NTLM
            | NEGOTIATE_ALWAYS_SIGN | NEGOTIATE_EXTENDED_SESSION_SECURITY | NEGOTIATE_128 | NEGOTIATE_56;
    private static final int AUTHENTICATE_HEADER_LENGTH = 64;
    /** Milliseconds between 1601-01-01 and 1970-01-01 */
    private static final long WINDOWS_EPOCH_OFFSET_MILLIS = 11644473600000L;
    private static final SecureRandom RANDOM = new SecureRandom();

    private final String domain;
    private final String user;
    private final String password;
    private final String workstation;
    private boolean negotiateSent;
    private boolean complete;

    NtlmAuthenticator(AuthContext context) {
        String username = context.username();
        int separator = username.indexOf('\\');
        this.domain = separator > 0 ? username.substring(0, separator) : "";
        this.user = separator > 0 ? username.substring(separator + 1) : username;
        this.password = context.password();
        this.workstation = "";
    }

    @Override
    public byte[] initialResponse() {
        negotiateSent = true;
        ByteBuffer buffer = littleEndian(32);
        buffer.put(SIGNATURE);
        buffer.putInt(1);
        buffer.putInt(NEGOTIATE_FLAGS);
        // empty domain and workstation buffers
        buffer.putLong(0);
        buffer.putLong(0);
        return buffer.array();
    }

    @Override
    public byte[] evaluateChallenge(byte[] challenge) throws SaslException {
        if (!negotiateSent || complete) {
            throw new SaslException("unexpected NTLM challenge");
        }
        if (challenge.length < 32 || !Arrays.equals(Arrays.copyOf(challenge, SIGNATURE.length), SIGNATURE)) {
            throw new SaslException("malformed NTLM challenge message");
        }
        ByteBuffer buffer = ByteBuffer.wrap(challenge).order(ByteOrder.LITTLE_ENDIAN);
        if (buffer.getInt(8) != 2) {
            throw new SaslException("NTLM message is not a challenge message");
        }
        int flags = buffer.getInt(20);
        byte[] serverChallenge = Arrays.copyOfRange(challenge, 24, 32);
        byte[] targetInfo = new byte[0];
        if (challenge.length >= 48) {
            int length = Short.toUnsignedInt(buffer.getShort(40));
            int offset = buffer.getInt(44);
            if (length > 0) {
                if (offset < 0 || offset + length > challenge.length) {
                    throw new SaslException("NTLM target info exceeds the challenge message");
                }
                targetInfo = Arrays.copyOfRange(challenge, offset, offset + length);
            }
        }

        byte[] clientChallenge = new byte[8];
        RANDOM.nextBytes(clientChallenge);
        long timestamp = (System.currentTimeMillis() + WINDOWS_EPOCH_OFFSET_MILLIS) * 10000L;

        complete = true;
        return authenticateMessage(flags, serverChallenge, clientChallenge, timestamp, targetInfo);
    }

    byte[] authenticateMessage(int flags, byte[] serverChallenge, byte[] clientChallenge, long timestamp,
                               byte[] targetInfo) {
        byte[] ntlmv2Hash = ntowfV2(user, domain, password);
        byte[] lmResponse = lmV2Response(ntlmv2Hash, serverChallenge, clientChallenge);
        byte[] ntResponse = ntV2Response(ntlmv2Hash, serverChallenge, clientChallenge, timestamp, targetInfo);

        byte[] domainBytes = domain.getBytes(StandardCharsets.UTF_16LE);
        byte[] userBytes = user.getBytes(StandardCharsets.UTF_16LE);
        byte[] workstationBytes = workstation.getBytes(StandardCharsets.UTF_16LE);

        int length = AUTHENTICATE_HEADER_LENGTH + lmResponse.length + ntResponse.length
                + domainBytes.length + userBytes.length + workstationBytes.length;
        ByteBuffer buffer = littleEndian(length);
        buffer.put(SIGNATURE);
        buffer.putInt(3);

        int offset = AUTHENTICATE_HEADER_LENGTH;
        offset = putSecurityBuffer(buffer, lmResponse.length, offset);
        offset = putSecurityBuffer(buffer, ntResponse.length, offset);
        offset = putSecurityBuffer(buffer, domainBytes.length, offset);
        offset = putSecurityBuffer(buffer, userBytes.length, offset);
        offset = putSecurityBuffer(buffer, workstationBytes.length, offset);
        putSecurityBuffer(buffer, 0, offset);
        buffer.putInt((flags & NEGOTIATE_FLAGS) | NEGOTIATE_UNICODE | NEGOTIATE_NTLM);

        buffer.put(lmResponse);
        buffer.put(ntResponse);
        buffer.put(domainBytes);
        buffer.put(userBytes);
        buffer.put(workstationBytes);
        return buffer.array();
    }

    private static int putSecurityBuffer(ByteBuffer buffer, int length, int offset) {
        buffer.putShort((short) length);
        buffer.putShort((short) length);
        buffer.putInt(offset);
        return offset + length;
    }

    static byte[] ntHash(String password) {
        byte[] input = password.getBytes(StandardCharsets.UTF_16LE);
        MD4Digest md4 = new MD4Digest();
        md4.update(input, 0, input.length);
        byte[] hash = new byte[md4.getDigestSize()];
        md4.doFinal(hash, 0);
        return hash;
    }

    static byte[] ntowfV2(String user, String domain, String password) {
        byte[] identity = (user.toUpperCase(Locale.ROOT) + domain).getBytes(StandardCharsets.UTF_16LE);
        return new HmacUtils(HmacAlgorithms.HMAC_MD5, ntHash(password)).hmac(identity);
    }

    static byte[] lmV2Response(byte[] ntlmv2Hash, byte[] serverChallenge, byte[] clientChallenge) {
        byte[] proof = new HmacUtils(HmacAlgorithms.HMAC_MD5, ntlmv2Hash).hmac(concat(serverChallenge, clientChallenge));
        return concat(proof, clientChallenge);
    }

    static byte[] ntV2Response(byte[] ntlmv2Hash, byte[] serverChallenge, byte[] clientChallenge, long timestamp,
                               byte[] targetInfo) {
        ByteBuffer blob = littleEndian(28 + targetInfo.length + 4);
        blob.put((byte) 1).put((byte) 1).putShort((short) 0);
        blob.putInt(0);
        blob.putLong(timestamp);
        blob.put(clientChallenge);
        blob.putInt(0);
        blob.put(targetInfo);
        blob.putInt(0);

        byte[] proof = new HmacUtils(HmacAlgorithms.HMAC_MD5, ntlmv2Hash).hmac(concat(serverChallenge, blob.array()));
        return concat(proof, blob.array());
    }

    private static ByteBuffer littleEndian(int length) {
        return ByteBuffer.allocate(length).order(ByteOrder.LITTLE_ENDIAN);
    }

    private static byte[] concat(byte[] first, byte[] second) {
        byte[] result = Arrays.copyOf(first, first.length + second.length);
        System.arraycopy(second, 0, result, first.length, second.length);
        return result;
    }

    @Override
    public boolean isComplete() {
        return complete;
    }
}

package io.github.hotbrkm.mailclient.email.send.transport.smtp.auth;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;

import javax.net.ssl.SSLPeerUnverifiedException;
import javax.net.ssl.SSLSession;
import java.security.cert.Certificate;
import java.security.cert.CertificateEncodingException;
import java.security.cert.X509Certificate;
import java.util.Locale;

/**
 * TLS channel binding data for the SCRAM -PLUS mechanisms.
 *
 * @param type name used in the GS2 header, e.g. {@code tls-server-end-point}
 * @param data binding bytes appended to the GS2 header in the client-final message
 */
@Slf4j
public record ChannelBinding(String type, byte[] data) {

    public static final String TLS_SERVER_END_POINT = "tls-server-end-point";

    /**
     * Builds {@code tls-server-end-point} data (RFC 5929): the hash of the server certificate, using the
     * hash of its signature algorithm, with MD5 and SHA-1 replaced by SHA-256.
     *
     * @return the binding, or null if the session has no X.509 peer certificate
     */
    public static ChannelBinding tlsServerEndPoint(SSLSession session) {
        if (session == null) {
            return null;
        }
        try {
            Certificate[] certificates = session.getPeerCertificates();
            if (certificates.length == 0 || !(certificates[0] instanceof X509Certificate)) {
                return null;
            }
            X509Certificate certificate = (X509Certificate) certificates[0];
            String algorithm = hashAlgorithm(certificate.getSigAlgName());
            return new ChannelBinding(TLS_SERVER_END_POINT, new DigestUtils(algorithm).digest(certificate.getEncoded()));
        } catch (SSLPeerUnverifiedException | CertificateEncodingException e) {
            log.debug("No channel binding available", e);
            return null;
        }
    }

    static String hashAlgorithm(String signatureAlgorithm) {
        String name = signatureAlgorithm == null ? "" : signatureAlgorithm.toUpperCase(Locale.ROOT);
        int with = name.indexOf("WITH");
        String hash = with > 0 ? name.substring(0, with) : "";
        switch (hash) {
            case "SHA384":
            case "SHA-384":
                return "SHA-384";
            case "SHA512":
            case "SHA-512":
                return "SHA-512";
            default:
                return "SHA-256";
        }
    }
}

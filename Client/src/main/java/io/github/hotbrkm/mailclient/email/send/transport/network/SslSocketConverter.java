package io.github.hotbrkm.mailclient.email.send.transport.network;

import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.Socket;
import java.net.UnknownHostException;
import java.util.Objects;

@Slf4j
public class SslSocketConverter {

    private final SSLSocketFactory sslSocketFactory;
    private final int maxAttempts;
    private final long retryDelayMillis;

    public SslSocketConverter(SSLSocketFactory sslSocketFactory, int maxAttempts, long retryDelayMillis) {
        this.sslSocketFactory = Objects.requireNonNull(sslSocketFactory, "sslSocketFactory must not be null");
        this.maxAttempts = Math.max(1, maxAttempts);
        this.retryDelayMillis = retryDelayMillis;
    }

    /**
     * Layers TLS over an already connected socket and performs the handshake.
     * Handshake failures reported as {@link SSLException} are not retried.
     */
    public SSLSocket upgradeToSslSocket(Socket socket, String host, String[] enabledTlsProtocols,
                                        boolean verifyHostname) throws IOException {
        int attemptCount = 0;

        while (true) {
            try {
                SSLSocket sslSocket = createSslSocket(socket, host, enabledTlsProtocols, verifyHostname);
                sslSocket.startHandshake();
                return sslSocket;
            } catch (SSLException | UnknownHostException e) {
                throw e;
            } catch (IOException e) {
                attemptCount++;
                if (attemptCount >= maxAttempts) {
                    throw new IOException("Failed to convert socket to SSLSocket after " + maxAttempts + " attempts", e);
                }
                log.debug("TLS handshake attempt {} of {} failed, retrying", attemptCount, maxAttempts, e);
                sleepBeforeRetry();
            }
        }
    }

    private void sleepBeforeRetry() throws InterruptedIOException {
        try {
            Thread.sleep(retryDelayMillis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while waiting to retry TLS handshake");
        }
    }

    private SSLSocket createSslSocket(Socket socket, String host, String[] tlsVersions, boolean verifyHostname)
            throws IOException {
        SSLSocket sslSocket = (SSLSocket) sslSocketFactory.createSocket(socket, host, socket.getPort(), true);
        sslSocket.setUseClientMode(true);

        if (tlsVersions != null && tlsVersions.length > 0) {
            sslSocket.setEnabledProtocols(tlsVersions);
        }
        if (verifyHostname) {
            SSLParameters parameters = sslSocket.getSSLParameters();
            parameters.setEndpointIdentificationAlgorithm("HTTPS");
            sslSocket.setSSLParameters(parameters);
        }

        return sslSocket;
    }
}

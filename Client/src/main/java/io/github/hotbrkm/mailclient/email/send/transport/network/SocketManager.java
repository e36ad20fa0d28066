package io.github.hotbrkm.mailclient.email.send.transport.network;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;

/**
 * Owns the socket of one SMTP connection: dials it, optionally through a {@link SocketDialer},
 * and layers TLS over it.
 */
@Slf4j
public class SocketManager {

    @Getter
    private final SocketConfig config;
    private final SocketDialer dialer;
    private Socket socket;

    public SocketManager(SocketConfig config) {
        this(config, null);
    }

    public SocketManager(SocketConfig config, SocketDialer dialer) {
        this.config = config;
        this.dialer = dialer;
    }

    /**
     * Opens a new connection. The connect timeout may be shorter than the configured one when a
     * deadline is close.
     */
    public Socket createSocket(int connectTimeoutMillis) throws IOException {
        Socket newSocket = dialer != null
                ? dialer.dial(config.host(), config.port(), connectTimeoutMillis)
                : dialDirect(connectTimeoutMillis);
        newSocket.setSoTimeout(config.readTimeoutMillis());
        this.socket = newSocket;
        log.debug("Connected to {} from {}", config.address(), newSocket.getLocalSocketAddress());
        return newSocket;
    }

    private Socket dialDirect(int connectTimeoutMillis) throws IOException {
        Socket newSocket = new Socket();
        try {
            if (config.hasBindIp()) {
                newSocket.bind(new InetSocketAddress(config.bindIp(), 0));
            }
            newSocket.connect(new InetSocketAddress(config.host(), config.port()), connectTimeoutMillis);
            return newSocket;
        } catch (IOException e) {
            closeQuietly(newSocket);
            throw e;
        }
    }

    /**
     * Drops the current socket, TLS or not, and dials again in plaintext.
     */
    public Socket recreateSocket(int connectTimeoutMillis) throws IOException {
        closeQuietly(socket);
        return createSocket(connectTimeoutMillis);
    }

    /**
     * Wraps the current socket in TLS and completes the handshake.
     */
    public SSLSocket upgradeToSslSocket(SSLSocketFactory sslSocketFactory, String[] enabledTlsProtocols,
                                        boolean verifyHostname, int maxAttempts, long retryDelayMillis)
            throws IOException {
        SslSocketConverter sslSocketConverter = new SslSocketConverter(sslSocketFactory, maxAttempts, retryDelayMillis);
        SSLSocket sslSocket = sslSocketConverter.upgradeToSslSocket(socket, config.host(), enabledTlsProtocols,
                verifyHostname);
        this.socket = sslSocket;
        return sslSocket;
    }

    public String getServerAddress() {
        return config.address();
    }

    public void close() {
        closeQuietly(socket);
        socket = null;
    }

    private static void closeQuietly(Socket socket) {
        if (socket != null) {
            try {
                socket.close();
            } catch (IOException e) {
                log.debug("Failed to close socket", e);
            }
        }
    }
}

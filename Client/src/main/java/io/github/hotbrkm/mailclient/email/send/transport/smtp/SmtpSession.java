package io.github.hotbrkm.mailclient.email.send.transport.smtp;

import io.github.hotbrkm.mailclient.email.send.CancellationToken;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLSocket;
import java.io.BufferedOutputStream;
import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;

/**
 * Class that manages SMTP session network connections.
 * Handles socket connections and network I/O.
 */
@Getter
@Slf4j
public class SmtpSession implements AutoCloseable {

    private Socket socket;
    private SSLSocket sslSocket;
    private BufferedReader reader;
    private OutputStream writer;
    private final int readTimeout;
    private volatile boolean closed;

    @Setter
    private volatile CancellationToken cancellationToken;

    public SmtpSession(int readTimeout) {
        this.readTimeout = readTimeout;
    }

    public void writeMessage(String message) throws IOException {
        if (writer == null) {
            throw new IOException("SMTP session is not connected");
        }

        writer.write(message.getBytes(StandardCharsets.UTF_8));
        writer.write('\r');
        writer.write('\n');
        writer.flush();
    }

    /**
     * Reads one reply line, waiting no longer than the read timeout or the remaining time of the
     * current cancellation token.
     */
    public String readLine() throws IOException {
        if (reader == null) {
            throw new IOException("SMTP session is not connected");
        }

        applyReadTimeout();
        return reader.readLine();
    }

    private void applyReadTimeout() throws IOException {
        CancellationToken token = cancellationToken;
        if (token == null) {
            return;
        }
        long remaining = token.remainingMillis();
        if (remaining <= 0) {
            throw new SocketTimeoutException(token.describe());
        }
        int timeout = readTimeout <= 0 ? 0 : readTimeout;
        if (remaining != Long.MAX_VALUE) {
            timeout = timeout == 0 ? (int) Math.min(Integer.MAX_VALUE, remaining)
                    : (int) Math.min(timeout, remaining);
        }
        activeSocket().setSoTimeout(timeout);
    }

    /**
     * Returns true if the current operation was cancelled or ran past its deadline.
     */
    public boolean isCancelled() {
        CancellationToken token = cancellationToken;
        return token != null && token.isCancelled();
    }

    public void changeStream(Socket socket) throws IOException {
        this.writer = new BufferedOutputStream(socket.getOutputStream());
        this.reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
    }

    public void changeSocket(Socket socket) throws IOException {
        close();
        this.closed = false;
        this.socket = socket;
        this.sslSocket = null;
        changeStream(socket);
    }

    public void setSslSocket(SSLSocket sslSocket) throws IOException {
        this.sslSocket = sslSocket;
        changeStream(sslSocket);
    }

    public boolean isTls() {
        return sslSocket != null;
    }

    public boolean isConnected() {
        Socket active = socket == null ? null : activeSocket();
        return !closed && active != null && active.isConnected() && !active.isClosed();
    }

    private Socket activeSocket() {
        return sslSocket != null ? sslSocket : socket;
    }

    @Override
    public void close() {
        closed = true;
        // sockets first so that I/O blocked in another thread fails immediately
        closeQuietly(sslSocket);
        closeQuietly(socket);
        closeQuietly(writer);
        closeQuietly(reader);
    }

    private static void closeQuietly(Closeable closeable) {
        if (closeable != null) {
            try {
                closeable.close();
            } catch (IOException e) {
                log.debug("Failed to close {}", closeable.getClass().getSimpleName(), e);
            }
        }
    }
}

package io.github.hotbrkm.mailclient.email.send.transport.network;

import java.time.Duration;
import java.util.Objects;

/**
 * Where and how to open the TCP connection to one SMTP server.
 *
 * @param bindIp local address to bind before connecting, or null for any
 */
public record SocketConfig(String host, int port, Duration connectTimeout, Duration readTimeout, String bindIp) {

    public SocketConfig {
        Objects.requireNonNull(host, "host must not be null");
        Objects.requireNonNull(connectTimeout, "connectTimeout must not be null");
        Objects.requireNonNull(readTimeout, "readTimeout must not be null");
    }

    public boolean hasBindIp() {
        return bindIp != null && !bindIp.isBlank();
    }

    public int readTimeoutMillis() {
        return (int) Math.min(Integer.MAX_VALUE, readTimeout.toMillis());
    }

    public String address() {
        return host + ":" + port;
    }
}

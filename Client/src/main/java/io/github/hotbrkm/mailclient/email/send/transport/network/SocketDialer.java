package io.github.hotbrkm.mailclient.email.send.transport.network;

import java.io.IOException;
import java.net.Socket;

/**
 * Opens the TCP connection to the SMTP server. A custom dialer can route through a proxy or resolve
 * the host differently.
 */
@FunctionalInterface
public interface SocketDialer {

    Socket dial(String host, int port, int connectTimeoutMillis) throws IOException;
}

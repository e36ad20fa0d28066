package io.github.hotbrkm.mailclient.email.send.transport.smtp.auth;

import java.util.Objects;

/**
 * Inputs of an authenticator.
 *
 * @param password       password, or the OAuth2 access token for XOAUTH2
 * @param host           server host name, used in the DIGEST-MD5 digest-uri
 * @param channelBinding TLS channel binding data, or null when the connection offers none
 */
public record AuthContext(String username, String password, String host, ChannelBinding channelBinding) {

    public AuthContext {
        Objects.requireNonNull(username, "username must not be null");
        Objects.requireNonNull(password, "password must not be null");
    }

    @Override
    public String toString() {
        return "AuthContext{username=" + username + ", host=" + host + "}";
    }
}

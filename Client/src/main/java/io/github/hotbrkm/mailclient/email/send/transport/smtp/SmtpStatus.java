package io.github.hotbrkm.mailclient.email.send.transport.smtp;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.UnknownHostException;

/**
 * SMTP reply codes and the client-side pseudo codes (6xx/7xx/8xx) used for failures that
 * never reached the server.
 */
public final class SmtpStatus {

    private SmtpStatus() {
    }

    public static final int SERVICE_READY = 220;
    public static final int CLOSING = 221;
    public static final int AUTH_SUCCESS = 235;
    /** Success */
    public static final int OK = 250;
    public static final int AUTH_CONTINUE = 334;
    public static final int START_MAIL_INPUT = 354;
    /** Temporary error (retry) */
    public static final int TEMPORARY_FAILURE = 421;

    /** Connection could not be established */
    public static final int CONNECT_FAILED = 602;
    /** Unknown error (default) */
    public static final int UNKNOWN_ERROR = 700;
    /** I/O failure on an established connection */
    public static final int NETWORK_ERROR = 703;
    /** Read timeout, deadline or cancellation */
    public static final int NETWORK_TIMEOUT = 704;
    /** Session invalid/not open */
    public static final int SESSION_INVALID = 888;

    /**
     * Maps exceptions to transport status codes.
     */
    public static int fromException(Throwable e) {
        if (e == null) {
            return UNKNOWN_ERROR;
        }
        if (e instanceof InterruptedIOException) {
            return NETWORK_TIMEOUT;
        }
        if (e instanceof ConnectException || e instanceof NoRouteToHostException || e instanceof UnknownHostException) {
            return CONNECT_FAILED;
        }
        if (e instanceof IOException) {
            return NETWORK_ERROR;
        }
        // Session state issues
        if (e instanceof IllegalStateException) {
            return SESSION_INVALID;
        }

        return UNKNOWN_ERROR;
    }

    /**
     * 4xx replies and network failures may succeed when retried later.
     */
    public static boolean isTemporary(int statusCode) {
        return (statusCode >= 400 && statusCode < 500)
                || statusCode == CONNECT_FAILED
                || statusCode == NETWORK_ERROR
                || statusCode == NETWORK_TIMEOUT;
    }

    public static boolean isPermanent(int statusCode) {
        return statusCode >= 500 && statusCode < 600;
    }
}

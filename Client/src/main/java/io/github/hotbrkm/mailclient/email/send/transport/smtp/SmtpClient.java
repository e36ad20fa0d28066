package io.github.hotbrkm.mailclient.email.send.transport.smtp;

import io.github.hotbrkm.mailclient.email.message.Message;
import io.github.hotbrkm.mailclient.email.send.CancellationToken;
import io.github.hotbrkm.mailclient.email.send.SendErrorReason;
import io.github.hotbrkm.mailclient.email.send.SendException;
import io.github.hotbrkm.mailclient.email.send.transport.network.SocketManager;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.auth.AuthContext;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.auth.AuthNegotiator;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.auth.ChannelBinding;
import io.github.hotbrkm.mailclient.email.send.transport.smtp.auth.SaslMechanism;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLSocket;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * SMTP client that keeps one connection open and sends messages over it.
 * <p>
 * Connect, send, reset, noop and close are serialized by a lock, so one client may be shared by
 * several threads while only one transaction is on the wire at a time. Every operation takes a
 * {@link CancellationToken}; cancelling it or reaching its deadline closes the socket so blocked I/O
 * fails immediately.
 */
@Slf4j
public class SmtpClient implements AutoCloseable {

    @Getter
    private final SmtpClientConfig config;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile SmtpSession session;
    private SocketManager socketManager;
    private SmtpCommandHandler commandHandler;
    private SmtpCapabilities capabilities = SmtpCapabilities.none();
    private SaslMechanism authenticatedWith;
    private long lastActivityNanos;
    private volatile boolean closed;

    public SmtpClient(SmtpClientConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null").validate();
    }

    // ========== Connection ==========

    public void connect() {
        withDefaultToken(token -> {
            connect(token);
            return null;
        });
    }

    /**
     * Opens the connection: dial, greeting, EHLO, TLS according to the policy, and authentication
     * when credentials are configured. An already open connection is replaced.
     *
     * @throws SmtpSessionOpenException    if the connection or TLS cannot be established
     * @throws SmtpCommandException        if authentication fails
     */
    public void connect(CancellationToken token) {
        Objects.requireNonNull(token, "token must not be null");
        withLock(token, () -> {
            openSession(token);
            return null;
        });
    }

    private void openSession(CancellationToken token) {
        closeSession();

        SmtpSession newSession = new SmtpSession((int) config.getReadTimeout().toMillis());
        newSession.setCancellationToken(token);
        this.session = newSession;
        this.commandHandler = new SmtpCommandHandler(newSession);
        this.commandHandler.setTraceLog(config.isTraceLog());
        this.socketManager = new SocketManager(config.toSocketConfig(), config.getDialer());
        this.capabilities = SmtpCapabilities.none();
        this.authenticatedWith = null;

        SmtpTlsConfig tlsConfig = config.getTlsConfig();
        try {
            newSession.changeSocket(socketManager.createSocket(connectTimeoutMillis(token)));
            if (tlsConfig.policy() == SmtpTlsPolicy.IMPLICIT) {
                upgradeToTls();
            }
        } catch (IOException e) {
            closeSession();
            int statusCode = token.isCancelled() ? SmtpStatus.NETWORK_TIMEOUT : SmtpStatus.fromException(e);
            throw new SmtpSessionOpenException(statusCode, "connect to " + socketManager.getServerAddress() + " " + e,
                    socketManager.getServerAddress(), e);
        }

        SmtpCommandResponse initResponse = commandHandler.readInitResponse();
        if (!initResponse.isSuccess()) {
            throw failOpen(initResponse);
        }
        applyHeloResponse(commandHandler.sendEhloOrHelo(config.getEffectiveLocalName()));

        startTlsIfRequired(tlsConfig);

        if (config.hasCredentials()) {
            authenticate();
        }
        touch();
        log.debug("Connected to {} (tls={}, {})", socketManager.getServerAddress(), newSession.isTls(), capabilities);
    }

    private int connectTimeoutMillis(CancellationToken token) {
        long timeout = config.getConnectTimeout().toMillis();
        long remaining = token.remainingMillis();
        return (int) Math.max(1, Math.min(timeout, remaining));
    }

    private void applyHeloResponse(SmtpCommandResponse heloResponse) {
        if (!heloResponse.isSuccess()) {
            throw failOpen(heloResponse);
        }
        capabilities = SmtpCapabilities.fromEhloResponse(heloResponse);
    }

    /**
     * Runs STARTTLS as the policy demands. MANDATORY fails when the server does not offer it or the
     * handshake fails; OPPORTUNISTIC continues without TLS.
     */
    private void startTlsIfRequired(SmtpTlsConfig tlsConfig) {
        SmtpTlsPolicy policy = tlsConfig.policy();
        if (policy == SmtpTlsPolicy.NONE || policy == SmtpTlsPolicy.IMPLICIT) {
            return;
        }
        String serverAddress = socketManager.getServerAddress();

        if (!capabilities.isStartTls()) {
            if (policy == SmtpTlsPolicy.MANDATORY) {
                closeSession();
                throw new SmtpSessionOpenException(SmtpStatus.UNKNOWN_ERROR,
                        "STARTTLS is required but not offered by the server", serverAddress);
            }
            log.warn("Server {} does not offer STARTTLS. Continuing without TLS.", serverAddress);
            return;
        }

        SmtpCommandResponse tlsResponse = commandHandler.sendStartTls();
        if (!tlsResponse.isSuccess()) {
            if (policy == SmtpTlsPolicy.MANDATORY || breaksSession(tlsResponse.getStatusCode())) {
                throw failOpen(tlsResponse);
            }
            log.warn("STARTTLS rejected by {}: '{}'. Continuing without TLS.", serverAddress, tlsResponse.getOriginalMessage());
            return;
        }

        processStartTls(policy, serverAddress);
    }

    /**
     * Upgrades the plain socket to TLS and repeats EHLO. Under OPPORTUNISTIC a failed handshake
     * reconnects to the server using a plain socket.
     */
    private void processStartTls(SmtpTlsPolicy policy, String serverAddress) {
        try {
            upgradeToTls();
        } catch (IOException e) {
            if (policy == SmtpTlsPolicy.MANDATORY) {
                closeSession();
                throw new SmtpSessionOpenException(SmtpStatus.fromException(e), "TLS handshake failed: " + e,
                        serverAddress, e);
            }
            log.warn("TLS handshake with {} failed. Continuing with plain socket.", serverAddress, e);
            reconnectUsingPlainSocket();
            return;
        }
        applyHeloResponse(commandHandler.sendEhlo(config.getEffectiveLocalName()));
    }

    private void upgradeToTls() throws IOException {
        SmtpTlsConfig tlsConfig = config.getTlsConfig();
        SSLSocket sslSocket = socketManager.upgradeToSslSocket(tlsConfig.sslSocketFactory(), tlsConfig.enabledTlsProtocols(),
                tlsConfig.verifyHostname(), tlsConfig.maxAttempts(), tlsConfig.retryDelayMillis());
        session.setSslSocket(sslSocket);
    }

    /**
     * Recreates a plain socket and greets the server again without attempting TLS.
     */
    private void reconnectUsingPlainSocket() {
        try {
            session.changeSocket(socketManager.recreateSocket(connectTimeoutMillis(session.getCancellationToken())));
        } catch (IOException e) {
            closeSession();
            throw new SmtpSessionOpenException(SmtpStatus.fromException(e),
                    "connect to " + socketManager.getServerAddress() + " " + e, socketManager.getServerAddress(), e);
        }
        SmtpCommandResponse initResponse = commandHandler.readInitResponse();
        if (!initResponse.isSuccess()) {
            throw failOpen(initResponse);
        }
        applyHeloResponse(commandHandler.sendEhloOrHelo(config.getEffectiveLocalName()));
    }

    private void authenticate() {
        ChannelBinding channelBinding = session.isTls()
                ? ChannelBinding.tlsServerEndPoint(session.getSslSocket().getSession())
                : null;
        try {
            SaslMechanism mechanism = AuthNegotiator.select(capabilities, config.getAuthMechanism(), channelBinding != null);
            AuthContext context = new AuthContext(config.getUsername(), config.getPassword(), config.getHost(), channelBinding);
            new AuthNegotiator(commandHandler).authenticate(mechanism, context);
            authenticatedWith = mechanism;
        } catch (RuntimeException e) {
            closeSession();
            throw e;
        }
    }

    private SmtpSessionOpenException failOpen(SmtpCommandResponse response) {
        String serverAddress = socketManager.getServerAddress();
        closeSession();
        return new SmtpSessionOpenException(response.getStatusCode(), response.getOriginalMessage(), serverAddress);
    }

    // ========== Sending ==========

    public void send(Message... messages) {
        withDefaultToken(token -> {
            send(token, messages);
            return null;
        });
    }

    /**
     * Sends each message in its own transaction over the current connection, connecting first if needed.
     * <p>
     * A failed message gets its {@link SendException} recorded and the remaining messages are still sent.
     * Afterwards the first failure is thrown with the others attached as suppressed exceptions.
     *
     * @throws SendException if any message failed or was only partially delivered
     */
    public void send(CancellationToken token, Message... messages) {
        Objects.requireNonNull(token, "token must not be null");
        Objects.requireNonNull(messages, "messages must not be null");
        withLock(token, () -> {
            List<SendException> failures = new ArrayList<>();
            for (Message message : messages) {
                Objects.requireNonNull(message, "message must not be null");
                try {
                    sendSingle(token, message);
                } catch (SendException e) {
                    message.setSendError(e);
                    failures.add(e);
                }
            }
            if (!failures.isEmpty()) {
                SendException first = failures.get(0);
                failures.stream().skip(1).forEach(first::addSuppressed);
                throw first;
            }
            return null;
        });
    }

    /**
     * Connects, sends the messages and disconnects. The client can be used again afterwards.
     */
    public void dialAndSend(Message... messages) {
        withDefaultToken(token -> {
            dialAndSend(token, messages);
            return null;
        });
    }

    public void dialAndSend(CancellationToken token, Message... messages) {
        Objects.requireNonNull(token, "token must not be null");
        withLock(token, () -> {
            try {
                openSession(token);
                send(token, messages);
            } finally {
                disconnect();
            }
            return null;
        });
    }

    private void sendSingle(CancellationToken token, Message message) {
        message.setSendError(null);
        message.setDelivered(false);

        ensureConnected(token);

        String sender;
        try {
            sender = message.getSender(false);
        } catch (IllegalStateException e) {
            throw new SendException(SendErrorReason.GET_SENDER, false, e);
        }
        List<String> recipients;
        try {
            recipients = message.getRecipients();
        } catch (IllegalStateException e) {
            throw new SendException(SendErrorReason.GET_RCPTS, false, e);
        }
        if (message.requiresEightBitTransport() && !capabilities.is8BitMime()) {
            throw new SendException(SendErrorReason.NO_UNENCODED, false,
                    new IllegalStateException("server " + config.getHost() + " does not advertise 8BITMIME"));
        }

        SmtpCommandResponse mailFromResponse = handleError(commandHandler.sendMailFrom(sender, mailParameters()));
        if (!mailFromResponse.isSuccess()) {
            throw abortTransaction(SendErrorReason.SMTP_MAIL_FROM, SmtpCommandException.from(mailFromResponse), Map.of());
        }

        Map<String, Throwable> recipientErrors = sendRecipients(recipients);

        SmtpCommandResponse dataResponse = handleError(commandHandler.sendData());
        if (!dataResponse.isSuccess()) {
            throw abortTransaction(SendErrorReason.SMTP_DATA, SmtpCommandException.from(dataResponse), Map.of());
        }

        SmtpCommandResponse dataEndResponse;
        try {
            dataEndResponse = commandHandler.sendMessage(message::writeTo);
        } catch (IOException | RuntimeException e) {
            throw contentFailure(token, e);
        }
        dataEndResponse = handleError(dataEndResponse);
        if (!dataEndResponse.isSuccess()) {
            throw abortTransaction(SendErrorReason.SMTP_DATA_CLOSE, SmtpCommandException.from(dataEndResponse), Map.of());
        }

        message.setDelivered(true);
        touch();
        log.debug("Message {} accepted by {}", message.getMessageId(), config.getHost());

        SendException partialFailure = recipientErrors.isEmpty() ? null
                : new SendException(SendErrorReason.SMTP_RCPT_TO, allTemporary(recipientErrors), List.of(), recipientErrors);

        SmtpCommandResponse resetResponse = commandHandler.sendRset();
        if (!resetResponse.isSuccess()) {
            if (breaksSession(resetResponse.getStatusCode())) {
                closeSession();
            }
            if (partialFailure == null) {
                SmtpCommandException error = SmtpCommandException.from(resetResponse);
                throw new SendException(SendErrorReason.SMTP_RESET, error.isTemporary(), error);
            }
            log.warn("RSET after delivery to {} failed: '{}'", config.getHost(), resetResponse.getOriginalMessage());
        }
        if (partialFailure != null) {
            throw partialFailure;
        }
    }

    /**
     * Sends RCPT TO for every recipient. Returns the rejected recipients of a lenient transaction.
     */
    private Map<String, Throwable> sendRecipients(List<String> recipients) {
        Map<String, Throwable> recipientErrors = new LinkedHashMap<>();
        String parameters = config.getDsn() != null && capabilities.isDsn() ? config.getDsn().rcptParameter() : "";

        for (String recipient : recipients) {
            SmtpCommandResponse rcptResponse = handleError(commandHandler.sendRcptTo(recipient, parameters));
            if (rcptResponse.isSuccess()) {
                continue;
            }
            SmtpCommandException error = SmtpCommandException.from(rcptResponse);
            recipientErrors.put(recipient, error);
            if (config.getRecipientPolicy() == RecipientPolicy.STRICT || breaksSession(rcptResponse.getStatusCode())) {
                throw abortTransaction(SendErrorReason.SMTP_RCPT_TO, error, recipientErrors);
            }
            log.info("Recipient {} rejected by {}: '{}'", recipient, config.getHost(), rcptResponse.getOriginalMessage());
        }

        if (recipientErrors.size() == recipients.size()) {
            SmtpCommandException lastError = (SmtpCommandException) recipientErrors.get(recipients.get(recipients.size() - 1));
            endTransaction(lastError);
            throw new SendException(SendErrorReason.SMTP_RCPT_TO, allTemporary(recipientErrors),
                    List.of(lastError), recipientErrors);
        }
        return recipientErrors;
    }

    private String mailParameters() {
        List<String> parameters = new ArrayList<>();
        if (capabilities.is8BitMime()) {
            parameters.add("BODY=8BITMIME");
        }
        if (capabilities.isSmtpUtf8()) {
            parameters.add("SMTPUTF8");
        }
        if (config.getDsn() != null && capabilities.isDsn() && !config.getDsn().mailParameter().isEmpty()) {
            parameters.add(config.getDsn().mailParameter());
        }
        return String.join(" ", parameters);
    }

    /**
     * Ends a failed transaction: RSET when the session is still usable, otherwise the session is closed.
     */
    private SendException abortTransaction(SendErrorReason reason, SmtpCommandException error,
                                           Map<String, Throwable> recipientErrors) {
        if (log.isDebugEnabled()) {
            log.debug("Transaction with {} aborted at {}, recent replies: {}", config.getHost(), error.getCommand(),
                    commandHandler.getResponses());
        }
        endTransaction(error);
        return new SendException(reason, error.isTemporary(), List.of(error), recipientErrors);
    }

    private void endTransaction(SmtpCommandException error) {
        if (breaksSession(error.getStatusCode())) {
            closeSession();
        } else {
            SmtpCommandResponse resetResponse = commandHandler.sendRset();
            if (!resetResponse.isSuccess()) {
                log.warn("RSET after failed {} to {} failed: '{}'", error.getCommand(), config.getHost(),
                        resetResponse.getOriginalMessage());
                if (breaksSession(resetResponse.getStatusCode())) {
                    closeSession();
                }
            }
        }
    }

    /**
     * A failure while streaming DATA leaves the connection in an unknown state, so it is closed.
     */
    private SendException contentFailure(CancellationToken token, Exception e) {
        closeSession();
        if (token.isCancelled()) {
            SmtpTimeoutException timeout = new SmtpTimeoutException(SmtpCommand.DATA_END, token.describe());
            timeout.initCause(e);
            return new SendException(SendErrorReason.WRITE_CONTENT, true, timeout);
        }
        boolean temporary = e instanceof SocketException || e instanceof InterruptedIOException;
        return new SendException(SendErrorReason.WRITE_CONTENT, temporary, e);
    }

    /**
     * Makes sure a usable connection exists. An idle connection is checked with NOOP and redialed on failure.
     */
    private void ensureConnected(CancellationToken token) {
        if (token.isCancelled()) {
            throw new SendException(SendErrorReason.CONN_CHECK, true,
                    new SmtpTimeoutException(SmtpCommand.NOOP, token.describe()));
        }
        SmtpSession current = session;
        if (current == null || !current.isConnected()) {
            redial(token);
            return;
        }
        if (System.nanoTime() - lastActivityNanos < config.getKeepAliveIdle().toNanos()) {
            return;
        }
        SmtpCommandResponse noopResponse = commandHandler.sendNoop();
        if (noopResponse.isSuccess()) {
            touch();
            return;
        }
        log.info("Idle connection to {} failed NOOP check: '{}'. Reconnecting.", config.getHost(),
                noopResponse.getOriginalMessage());
        redial(token);
    }

    private void redial(CancellationToken token) {
        try {
            openSession(token);
        } catch (SmtpSessionOpenException e) {
            throw new SendException(SendErrorReason.CONN_CHECK, e.isTemporary() || token.isCancelled(), e);
        } catch (SmtpCommandException e) {
            throw new SendException(SendErrorReason.CONN_CHECK, e.isTemporary(), e);
        }
    }

    private SmtpCommandResponse handleError(SmtpCommandResponse response) {
        return config.getErrorHandlerRegistry().handle(config.getHost(), response);
    }

    private static boolean allTemporary(Map<String, Throwable> recipientErrors) {
        return recipientErrors.values().stream()
                .allMatch(error -> error instanceof SmtpCommandException && ((SmtpCommandException) error).isTemporary());
    }

    /**
     * Client-side pseudo codes mean the connection itself is gone or out of sync.
     */
    private static boolean breaksSession(int statusCode) {
        return statusCode >= 600;
    }

    // ========== Other commands ==========

    /**
     * Sends RSET on the open connection.
     *
     * @throws IllegalStateException if not connected
     * @throws SmtpCommandException  if the server rejects the command
     */
    public void reset() {
        runCommand(() -> commandHandler.sendRset());
    }

    /**
     * Sends NOOP on the open connection.
     *
     * @throws IllegalStateException if not connected
     * @throws SmtpCommandException  if the server rejects the command
     */
    public void noop() {
        runCommand(() -> commandHandler.sendNoop());
    }

    private void runCommand(Supplier<SmtpCommandResponse> command) {
        withDefaultToken(token -> withLock(token, () -> {
            if (!isConnected()) {
                throw new IllegalStateException("SMTP client is not connected");
            }
            SmtpCommandResponse response = command.get();
            if (!response.isSuccess()) {
                if (breaksSession(response.getStatusCode())) {
                    closeSession();
                }
                throw SmtpCommandException.from(response);
            }
            touch();
            return null;
        }));
    }

    // ========== State ==========

    public boolean isConnected() {
        SmtpSession current = session;
        return !closed && current != null && current.isConnected();
    }

    public boolean isTls() {
        SmtpSession current = session;
        return current != null && current.isTls();
    }

    public SmtpCapabilities getCapabilities() {
        lock.lock();
        try {
            return capabilities;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the mechanism used by the current connection, or null if it is not authenticated.
     */
    public SaslMechanism getAuthenticatedWith() {
        lock.lock();
        try {
            return authenticatedWith;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sends QUIT and closes the connection. The client cannot be used afterwards; calling close again has no effect.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            disconnect();
        } finally {
            lock.unlock();
        }
    }

    private void disconnect() {
        SmtpSession current = session;
        if (current == null) {
            return;
        }
        if (current.isConnected()) {
            current.setCancellationToken(CancellationToken.none());
            SmtpCommandResponse quitResponse = commandHandler.sendQuit();
            if (!quitResponse.isSuccess()) {
                log.debug("QUIT to {} answered with '{}'", config.getHost(), quitResponse.getOriginalMessage());
            }
        }
        closeSession();
    }

    private void closeSession() {
        SmtpSession current = session;
        if (current != null) {
            current.close();
        }
        if (socketManager != null) {
            socketManager.close();
        }
    }

    /**
     * Closes the socket from the cancellation callback so that blocked reads and writes fail.
     */
    private void abortTransport() {
        SmtpSession current = session;
        if (current != null) {
            log.debug("Operation on {} cancelled, closing connection", config.getHost());
            current.close();
        }
    }

    private void touch() {
        lastActivityNanos = System.nanoTime();
    }

    private CancellationToken defaultToken() {
        return config.getOperationTimeout() != null
                ? CancellationToken.withTimeout(config.getOperationTimeout())
                : CancellationToken.none();
    }

    private <T> T withDefaultToken(Function<CancellationToken, T> operation) {
        CancellationToken token = defaultToken();
        try {
            return operation.apply(token);
        } finally {
            token.release();
        }
    }

    private <T> T withLock(CancellationToken token, Supplier<T> operation) {
        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("SMTP client is closed");
            }
            SmtpSession current = session;
            if (current != null) {
                current.setCancellationToken(token);
            }
            try (CancellationToken.Registration ignored = token.onCancel(this::abortTransport)) {
                return operation.get();
            }
        } finally {
            lock.unlock();
        }
    }
}

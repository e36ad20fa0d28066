package io.github.hotbrkm.mailclient.email.send.transport.smtp;

import io.github.hotbrkm.mailclient.email.message.BodyWriter;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.io.EOFException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static io.github.hotbrkm.mailclient.email.send.transport.smtp.SmtpCommand.*;

/**
 * Handler that transmits SMTP commands and manages responses.
 * Manages SMTP protocol-level logic and response history.
 * <p>
 * Failures that never produced a server reply are reported as pseudo replies:
 * 704 for timeouts and cancellation, 703 for other I/O errors and 700 for anything else.
 */
@Slf4j
public class SmtpCommandHandler {
    private static final int MAX_HISTORY = 64;
    private static final String REDACTED = "<redacted>";

    private final SmtpSession session;
    private final Deque<SmtpCommandResponse> responses = new ArrayDeque<>();

    @Setter
    @Getter
    private boolean traceLog = false;

    public SmtpCommandHandler(SmtpSession session) {
        this.session = session;
    }

    public SmtpCommandResponse readInitResponse() {
        return execute(INIT, null, null);
    }

    public List<String> sendCommand(String command) {
        return sendCommand(command, command);
    }

    /**
     * Sends a command line and reads the complete (possibly multi-line) reply.
     *
     * @param command    command line without CRLF, or null to only read a reply
     * @param logCommand form of the command written to the trace log
     */
    public List<String> sendCommand(String command, String logCommand) {
        List<String> responseLines = new ArrayList<>();

        try {
            if (session.isCancelled()) {
                throw new InterruptedIOException(session.getCancellationToken().describe());
            }
            writeMessage(command, logCommand);
            readAllMessages(responseLines);

            return responseLines;
        } catch (InterruptedIOException e) {
            responseLines.add(SmtpStatus.NETWORK_TIMEOUT + " SMTP " + e);
            return responseLines;
        } catch (IOException e) {
            int code = session.isCancelled() ? SmtpStatus.NETWORK_TIMEOUT : SmtpStatus.NETWORK_ERROR;
            responseLines.add(code + " SMTP " + e);
            return responseLines;
        } catch (RuntimeException e) {
            responseLines.add(SmtpStatus.UNKNOWN_ERROR + " SMTP " + e);
            return responseLines;
        }
    }

    private void writeMessage(String command, String logCommand) throws IOException {
        if (command != null) {
            if (traceLog) {
                log.info("[Send Message]: {}", logCommand);
            }
            session.writeMessage(command);
        }
    }

    private void readAllMessages(List<String> responseLines) throws IOException {
        String line;
        do {
            line = session.readLine();
            if (traceLog) {
                log.info("[Read Message]: {}", line);
            }

            if (line == null) {
                throw new EOFException("null reply from server");
            }

            responseLines.add(line);
        } while ((line.length() > 3) && (line.charAt(3) == '-'));
    }

    private SmtpCommandResponse execute(SmtpCommand smtpCommand, String line, String logLine) {
        SmtpCommandResponse smtpCommandResponse = new SmtpCommandResponse(smtpCommand, sendCommand(line, logLine));
        remember(smtpCommandResponse);
        return smtpCommandResponse;
    }

    private SmtpCommandResponse execute(SmtpCommand smtpCommand, String line) {
        return execute(smtpCommand, line, line);
    }

    /**
     * Sends EHLO and falls back to HELO if the server rejects EHLO with a permanent error.
     */
    public SmtpCommandResponse sendEhloOrHelo(String helo) {
        SmtpCommandResponse smtpCommandResponse = sendEhlo(helo);

        if (smtpCommandResponse.isSuccess() || !smtpCommandResponse.isPermanentFailure()) {
            return smtpCommandResponse;
        } else {
            return sendHelo(helo);
        }
    }

    public SmtpCommandResponse sendEhlo(String helo) {
        return execute(EHLO, EHLO.line(validateLine(helo)));
    }

    public SmtpCommandResponse sendHelo(String helo) {
        return execute(HELO, HELO.line(validateLine(helo)));
    }

    public SmtpCommandResponse sendStartTls() {
        return execute(STARTTLS, STARTTLS.line());
    }

    /**
     * Sends {@code AUTH <mechanism> [initial-response]}. The initial response is not traced.
     *
     * @param initialResponse base64 initial response, or null to wait for a challenge
     */
    public SmtpCommandResponse sendAuth(String mechanism, String initialResponse) {
        String line = AUTH.line(validateLine(mechanism));
        if (initialResponse == null) {
            return execute(AUTH, line);
        }
        return execute(AUTH, line + " " + validateLine(initialResponse), line + " " + REDACTED);
    }

    /**
     * Answers a 334 challenge with a base64 payload. The payload is not traced.
     */
    public SmtpCommandResponse sendAuthResponse(String response) {
        return execute(AUTH_RESPONSE, validateLine(response), REDACTED);
    }

    /**
     * Aborts a running AUTH exchange.
     */
    public SmtpCommandResponse sendAuthCancel() {
        return execute(AUTH_RESPONSE, "*");
    }

    public SmtpCommandResponse sendMailFrom(String mailFrom, String parameters) {
        return execute(MAIL_FROM, MAIL_FROM.line("<" + validateLine(mailFrom) + ">" + parameters(parameters)));
    }

    public SmtpCommandResponse sendRcptTo(String rcptTo, String parameters) {
        return execute(RCPT_TO, RCPT_TO.line("<" + validateLine(rcptTo) + ">" + parameters(parameters)));
    }

    public SmtpCommandResponse sendData() {
        return execute(DATA, DATA.line());
    }

    /**
     * Sends the mail body.
     * Must be called after receiving 354 response to DATA command.
     * The content is dot-stuffed and terminated with a single dot line; a 250 reply is expected afterwards.
     *
     * @throws IOException if the content cannot be produced or written to the connection
     */
    public SmtpCommandResponse sendMessage(BodyWriter content) throws IOException {
        DotStuffingOutputStream dataStream = new DotStuffingOutputStream(session.getWriter());
        long written = content.writeTo(dataStream);
        dataStream.close();
        if (traceLog) {
            log.info("[Send Message]: <{} bytes of message content>", written);
        }

        // Process response after message transmission as DATA_END (expect 250)
        return execute(DATA_END, null);
    }

    public SmtpCommandResponse sendRset() {
        return execute(RSET, RSET.line());
    }

    public SmtpCommandResponse sendNoop() {
        return execute(NOOP, NOOP.line());
    }

    public SmtpCommandResponse sendQuit() {
        return execute(QUIT, QUIT.line());
    }

    private static String parameters(String parameters) {
        return parameters == null || parameters.isEmpty() ? "" : " " + validateLine(parameters);
    }

    /**
     * Rejects values that would inject additional command lines.
     */
    static String validateLine(String value) {
        if (value != null && (value.indexOf('\r') >= 0 || value.indexOf('\n') >= 0)) {
            throw new IllegalArgumentException("SMTP command argument must not contain CR or LF");
        }
        return value;
    }

    private void remember(SmtpCommandResponse response) {
        if (responses.size() >= MAX_HISTORY) {
            responses.removeFirst();
        }
        responses.addLast(response);
    }

    /**
     * Returns the most recent replies of this connection, oldest first. Only the last
     * {@value #MAX_HISTORY} are kept.
     */
    public List<SmtpCommandResponse> getResponses() {
        return List.copyOf(responses);
    }
}

package io.github.hotbrkm.mailclient.email.send.sendmail;

import io.github.hotbrkm.mailclient.email.message.Message;
import io.github.hotbrkm.mailclient.email.send.CancellationToken;
import io.github.hotbrkm.mailclient.email.send.SendErrorReason;
import io.github.hotbrkm.mailclient.email.send.SendException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Delivers messages by piping them to the local sendmail binary ({@code sendmail -oi -t}).
 * <p>
 * Anything the process writes to standard error, or a non-zero exit code, counts as failure.
 */
@Slf4j
@Getter
public class SendmailSender {

    public static final String DEFAULT_PATH = "/usr/sbin/sendmail";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final String path;
    private final Duration timeout;
    private final List<String> arguments;

    public SendmailSender() {
        this(DEFAULT_PATH, DEFAULT_TIMEOUT, List.of());
    }

    public SendmailSender(String path, Duration timeout, List<String> arguments) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        this.arguments = List.copyOf(arguments);
    }

    public void send(Message message) {
        send(CancellationToken.withTimeout(timeout), message);
    }

    /**
     * Pipes the message to sendmail and waits for the process until the token is cancelled or its deadline passes.
     *
     * @throws SendException with reason {@link SendErrorReason#SENDMAIL} if sendmail fails or times out,
     *                       or {@link SendErrorReason#WRITE_CONTENT} if the message cannot be written
     */
    public void send(CancellationToken token, Message message) {
        Objects.requireNonNull(token, "token must not be null");
        Objects.requireNonNull(message, "message must not be null");
        message.setSendError(null);
        message.setDelivered(false);
        try {
            run(token, message);
            message.setDelivered(true);
        } catch (SendException e) {
            message.setSendError(e);
            throw e;
        }
    }

    private void run(CancellationToken token, Message message) {
        List<String> command = new ArrayList<>();
        command.add(path);
        command.add("-oi");
        command.add("-t");
        command.addAll(arguments);

        Path errorFile;
        try {
            errorFile = Files.createTempFile("sendmail", ".err");
        } catch (IOException e) {
            throw new SendException(SendErrorReason.SENDMAIL, false, e);
        }

        try {
            Process process = start(command, errorFile);
            try (CancellationToken.Registration ignored = token.onCancel(process::destroyForcibly)) {
                writeMessage(process, message);
                waitFor(token, process);
            }

            String stderr = Files.readString(errorFile, StandardCharsets.UTF_8).trim();
            if (!stderr.isEmpty()) {
                throw new SendException(SendErrorReason.SENDMAIL, false,
                        new IOException("sendmail command failed: " + stderr));
            }
            if (process.exitValue() != 0) {
                throw new SendException(SendErrorReason.SENDMAIL, false,
                        new IOException("sendmail command exited with status " + process.exitValue()));
            }
            log.debug("Message {} handed to {}", message.getMessageId(), path);
        } catch (IOException e) {
            throw new SendException(SendErrorReason.SENDMAIL, false, e);
        } finally {
            deleteQuietly(errorFile);
        }
    }

    private static Process start(List<String> command, Path errorFile) {
        try {
            return new ProcessBuilder(command)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .redirectError(errorFile.toFile())
                    .start();
        } catch (IOException e) {
            throw new SendException(SendErrorReason.SENDMAIL, false, e);
        }
    }

    private static void writeMessage(Process process, Message message) {
        try (OutputStream stdin = process.getOutputStream()) {
            message.writeTo(stdin);
        } catch (IOException e) {
            // a process that exits without reading stdin is judged by its stderr and exit code
            if (process.isAlive()) {
                process.destroyForcibly();
                throw new SendException(SendErrorReason.WRITE_CONTENT, false, e);
            }
            log.debug("sendmail exited before reading the whole message", e);
        }
    }

    private void waitFor(CancellationToken token, Process process) {
        try {
            long remaining = token.remainingMillis();
            boolean finished = remaining == Long.MAX_VALUE
                    ? process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    : process.waitFor(remaining, TimeUnit.MILLISECONDS);
            if (!finished || token.isCancelled()) {
                process.destroyForcibly();
                throw new SendException(SendErrorReason.SENDMAIL, true,
                        new TimeoutException("sendmail did not finish: " + (finished ? token.describe() : "timed out")));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new SendException(SendErrorReason.SENDMAIL, true, e);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Failed to delete {}", file, e);
        }
    }
}

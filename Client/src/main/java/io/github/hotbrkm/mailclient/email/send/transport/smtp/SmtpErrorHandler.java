package io.github.hotbrkm.mailclient.email.send.transport.smtp;

/**
 * Decides how a failed reply to a command is treated.
 * <p>
 * A handler may return the reply unchanged, or a substitute, for example a success reply for a
 * server known to answer a command with a non-standard code.
 */
@FunctionalInterface
public interface SmtpErrorHandler {

    SmtpErrorHandler PASS_THROUGH = (host, response) -> response;

    SmtpCommandResponse handle(String host, SmtpCommandResponse response);
}

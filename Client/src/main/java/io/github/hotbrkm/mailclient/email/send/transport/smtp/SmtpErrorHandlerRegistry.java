package io.github.hotbrkm.mailclient.email.send.transport.smtp;

import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Error handlers keyed by server host and command, with a default for everything else.
 */
@Slf4j
public class SmtpErrorHandlerRegistry {

    private final Map<String, SmtpErrorHandler> handlers = new ConcurrentHashMap<>();
    private volatile SmtpErrorHandler defaultHandler = SmtpErrorHandler.PASS_THROUGH;

    public void register(String host, SmtpCommand command, SmtpErrorHandler handler) {
        Objects.requireNonNull(host, "host must not be null");
        Objects.requireNonNull(command, "command must not be null");
        handlers.put(key(host, command), Objects.requireNonNull(handler, "handler must not be null"));
    }

    public void setDefaultHandler(SmtpErrorHandler handler) {
        this.defaultHandler = Objects.requireNonNull(handler, "handler must not be null");
    }

    public SmtpErrorHandler getHandler(String host, SmtpCommand command) {
        return handlers.getOrDefault(key(host, command), defaultHandler);
    }

    /**
     * Passes a failed reply through the matching handler. Successful replies are returned unchanged.
     */
    public SmtpCommandResponse handle(String host, SmtpCommandResponse response) {
        if (response.isSuccess()) {
            return response;
        }
        SmtpCommandResponse handled = getHandler(host, response.getCommand()).handle(host, response);
        if (handled == null) {
            return response;
        }
        if (handled != response) {
            log.debug("Error handler replaced reply to {} from {}: '{}' -> '{}'",
                    response.getCommand(), host, response.getOriginalMessage(), handled.getOriginalMessage());
        }
        return handled;
    }

    private static String key(String host, SmtpCommand command) {
        return host.toLowerCase(Locale.ROOT) + "|" + command.name();
    }
}

package io.github.hotbrkm.mailclient.email.message;

/**
 * Transforms a message right before it is serialized.
 * <p>
 * Middlewares run in the order they were added on a copy of the message, so the permanent
 * message is never modified by them.
 */
public interface Middleware {

    Message handle(Message message);

    MiddlewareType type();
}

package io.github.hotbrkm.mailclient.email.message;

import java.util.Objects;

/**
 * Tag identifying a kind of {@link Middleware}, used to skip it for a single write.
 */
public record MiddlewareType(String name) {

    public MiddlewareType {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("middleware type name must not be blank");
        }
    }
}

package io.github.hotbrkm.mailclient.email.send;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Failure of sending one message, recorded on the message so batch callers can inspect it.
 */
@Getter
public class SendException extends RuntimeException {

    private final SendErrorReason reason;
    private final boolean temporary;
    private final List<Throwable> errors;
    private final Map<String, Throwable> recipientErrors;

    public SendException(SendErrorReason reason, boolean temporary, Throwable error) {
        this(reason, temporary, error == null ? List.of() : List.of(error), Map.of());
    }

    public SendException(SendErrorReason reason, boolean temporary, List<Throwable> errors,
                         Map<String, Throwable> recipientErrors) {
        super(buildMessage(reason, errors, recipientErrors), errors.isEmpty() ? null : errors.get(0));
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
        this.temporary = temporary;
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        this.recipientErrors = Collections.unmodifiableMap(new LinkedHashMap<>(recipientErrors));
    }

    public List<String> getAffectedRecipients() {
        return List.copyOf(recipientErrors.keySet());
    }

    public Throwable getRecipientError(String address) {
        return recipientErrors.get(address);
    }

    private static String buildMessage(SendErrorReason reason, List<Throwable> errors,
                                       Map<String, Throwable> recipientErrors) {
        StringBuilder builder = new StringBuilder(reason.toString());
        List<Throwable> all = new ArrayList<>(errors);
        recipientErrors.values().stream().filter(it -> !all.contains(it)).forEach(all::add);
        if (!all.isEmpty()) {
            builder.append(": ").append(all.stream().map(Throwable::getMessage).collect(Collectors.joining(", ")));
        }
        if (!recipientErrors.isEmpty()) {
            builder.append(", affected recipient(s): ").append(String.join(", ", recipientErrors.keySet()));
        }
        return builder.toString();
    }
}

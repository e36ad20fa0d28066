package io.github.hotbrkm.mailclient.email.send.transport.smtp;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Delivery status notification parameters added to MAIL FROM and RCPT TO when the server advertises DSN.
 *
 * @param returnType  RET value, or null to let the server decide
 * @param notifyTypes NOTIFY values, empty to let the server decide
 */
public record DsnOptions(DsnReturn returnType, Set<DsnNotify> notifyTypes) {

    public DsnOptions {
        notifyTypes = notifyTypes == null || notifyTypes.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(notifyTypes));
        if (notifyTypes.contains(DsnNotify.NEVER) && notifyTypes.size() > 1) {
            throw new IllegalArgumentException("DSN notify NEVER cannot be combined with other values: " + notifyTypes);
        }
    }

    public static DsnOptions of(DsnReturn returnType, DsnNotify... notify) {
        Set<DsnNotify> values = EnumSet.noneOf(DsnNotify.class);
        Collections.addAll(values, notify);
        return new DsnOptions(returnType, values);
    }

    /**
     * Returns the MAIL FROM parameter, e.g. {@code RET=HDRS}, or an empty string.
     */
    public String mailParameter() {
        return returnType == null ? "" : "RET=" + returnType.name();
    }

    /**
     * Returns the RCPT TO parameter, e.g. {@code NOTIFY=SUCCESS,FAILURE}, or an empty string.
     */
    public String rcptParameter() {
        if (notifyTypes.isEmpty()) {
            return "";
        }
        return "NOTIFY=" + notifyTypes.stream().map(Enum::name).collect(Collectors.joining(","));
    }
}

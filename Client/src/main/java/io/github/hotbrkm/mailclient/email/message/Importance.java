package io.github.hotbrkm.mailclient.email.message;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
@Getter
public enum Importance {
    LOW("low", "0", "5"),
    NON_URGENT("non-urgent", "0", "5"),
    NORMAL("", "", ""),
    URGENT("urgent", "1", "1"),
    HIGH("high", "1", "1");

    /** Value of the Importance header */
    private final String value;
    /** Value of the Priority and X-MSMail-Priority headers */
    private final String numString;
    /** Value of the X-Priority header */
    private final String xPriorityString;

    @Override
    public String toString() {
        return value;
    }
}

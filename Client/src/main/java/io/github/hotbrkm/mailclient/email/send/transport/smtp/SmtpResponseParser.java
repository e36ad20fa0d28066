package io.github.hotbrkm.mailclient.email.send.transport.smtp;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the raw lines of a reply into an {@link SmtpResponse}. Malformed lines are skipped; a reply
 * without a well-formed final line becomes a {@link SmtpStatus#SESSION_INVALID} reply.
 */
@UtilityClass
class SmtpResponseParser {

    SmtpResponse parse(List<String> rawLines) {
        List<String> texts = new ArrayList<>(rawLines.size());
        int statusCode = -1;
        String finalLine = null;
        String firstMalformed = null;

        for (String line : rawLines) {
            if (!isWellFormed(line)) {
                if (firstMalformed == null) {
                    firstMalformed = line;
                }
                continue;
            }
            texts.add(line.length() > 4 ? line.substring(4).trim() : "");
            if (!isContinuation(line)) {
                statusCode = Integer.parseInt(line.substring(0, 3));
                finalLine = line;
            }
        }

        if (finalLine == null) {
            return SmtpResponse.invalid(firstMalformed != null || rawLines.isEmpty()
                    ? firstMalformed
                    : rawLines.get(rawLines.size() - 1));
        }
        return new SmtpResponse(statusCode, texts, finalLine);
    }

    private boolean isWellFormed(String line) {
        if (line == null || line.length() < 3) {
            return false;
        }
        for (int i = 0; i < 3; i++) {
            if (!Character.isDigit(line.charAt(i))) {
                return false;
            }
        }
        return line.length() == 3 || line.charAt(3) == ' ' || line.charAt(3) == '-';
    }

    private boolean isContinuation(String line) {
        return line.length() > 3 && line.charAt(3) == '-';
    }
}

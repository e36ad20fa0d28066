package io.github.hotbrkm.mailclient.email.send.transport.smtp;

import lombok.Getter;

import java.util.List;

/**
 * One complete server reply. {@code lines} holds the text of every line without its code, in the
 * order received; the last one is also available as {@link #getMessage()}.
 */
@Getter
class SmtpResponse {

    private final int statusCode;
    private final List<String> lines;
    /** Final reply line as received, code included */
    private final String originalMessage;

    SmtpResponse(int statusCode, List<String> lines, String originalMessage) {
        this.statusCode = statusCode;
        this.lines = List.copyOf(lines);
        this.originalMessage = originalMessage;
    }

    static SmtpResponse invalid(String line) {
        String text = "response message is invalid. [" + line + "]";
        return new SmtpResponse(SmtpStatus.SESSION_INVALID, List.of(text), SmtpStatus.SESSION_INVALID + " " + text);
    }

    public String getMessage() {
        return lines.isEmpty() ? "" : lines.get(lines.size() - 1);
    }

    @Override
    public String toString() {
        StringBuilder reply = new StringBuilder();
        for (int i = 0; i < lines.size(); i++) {
            reply.append(statusCode).append(i < lines.size() - 1 ? '-' : ' ').append(lines.get(i));
            if (i < lines.size() - 1) {
                reply.append('\n');
            }
        }
        return reply.toString();
    }
}

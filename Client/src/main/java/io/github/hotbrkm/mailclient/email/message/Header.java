package io.github.hotbrkm.mailclient.email.message;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Well-known generic header names.
 */
@RequiredArgsConstructor
@Getter
public enum Header {
    CONTENT_DESCRIPTION("Content-Description"),
    CONTENT_DISPOSITION("Content-Disposition"),
    CONTENT_ID("Content-ID"),
    CONTENT_LANGUAGE("Content-Language"),
    CONTENT_TRANSFER_ENCODING("Content-Transfer-Encoding"),
    CONTENT_TYPE("Content-Type"),
    DATE("Date"),
    IMPORTANCE("Importance"),
    IN_REPLY_TO("In-Reply-To"),
    LIST_UNSUBSCRIBE("List-Unsubscribe"),
    LIST_UNSUBSCRIBE_POST("List-Unsubscribe-Post"),
    MESSAGE_ID("Message-ID"),
    MIME_VERSION("MIME-Version"),
    ORGANIZATION("Organization"),
    PRECEDENCE("Precedence"),
    PRIORITY("Priority"),
    REFERENCES("References"),
    SUBJECT("Subject"),
    USER_AGENT("User-Agent"),
    X_AUTO_RESPONSE_SUPPRESS("X-Auto-Response-Suppress"),
    X_MAILER("X-Mailer"),
    X_MS_MAIL_PRIORITY("X-MSMail-Priority"),
    X_PRIORITY("X-Priority");

    private final String name;

    @Override
    public String toString() {
        return name;
    }
}

package io.github.hotbrkm.mailclient.email.message;

import lombok.Getter;
import lombok.Setter;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An attachment or embedded file of a message.
 */
@Getter
@Setter
public class MailFile {

    private String name;
    private String contentType;
    private String description;
    private String contentId;
    private TransferEncoding encoding = TransferEncoding.BASE64;
    private final Map<String, String> headers = new LinkedHashMap<>();
    private BodyWriter writer;

    public MailFile(String name, BodyWriter writer) {
        this(name, ContentTypes.fromFileName(name), writer);
    }

    public MailFile(String name, String contentType, BodyWriter writer) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.contentType = Objects.requireNonNull(contentType, "contentType must not be null");
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
    }

    public void setWriter(BodyWriter writer) {
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
    }

    public void setEncoding(TransferEncoding encoding) {
        this.encoding = Objects.requireNonNull(encoding, "encoding must not be null");
    }

    public void setHeader(String name, String value) {
        headers.put(name, value);
    }

    public Map<String, String> getHeaders() {
        return Collections.unmodifiableMap(headers);
    }

    public long writeTo(OutputStream out) throws IOException {
        return writer.writeTo(out);
    }

    MailFile copy() {
        MailFile copy = new MailFile(name, contentType, writer);
        copy.description = description;
        copy.contentId = contentId;
        copy.encoding = encoding;
        copy.headers.putAll(headers);
        return copy;
    }
}

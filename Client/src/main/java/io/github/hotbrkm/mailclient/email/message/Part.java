package io.github.hotbrkm.mailclient.email.message;

import lombok.Getter;
import lombok.Setter;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A body part of a message. The first part of a message is its primary body, any further parts
 * are alternative renderings of it.
 */
@Getter
public class Part {

    @Setter
    private String contentType;
    /** May be null for parts that carry no text, e.g. an opaque signed body */
    @Setter
    private Charset charset;
    @Setter
    private String description;
    private TransferEncoding encoding;
    private BodyWriter writer;
    private boolean deleted;

    public Part(String contentType, Charset charset, TransferEncoding encoding, BodyWriter writer) {
        this.contentType = Objects.requireNonNull(contentType, "contentType must not be null");
        this.charset = charset;
        this.encoding = Objects.requireNonNull(encoding, "encoding must not be null");
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
    }

    public void setEncoding(TransferEncoding encoding) {
        this.encoding = Objects.requireNonNull(encoding, "encoding must not be null");
    }

    public void setWriter(BodyWriter writer) {
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
    }

    public void setContent(String content) {
        setWriter(BodyWriter.ofString(content, charset != null ? charset : StandardCharsets.UTF_8));
    }

    /**
     * Marks the part as deleted. Deleted parts are skipped when the message is written.
     */
    public void delete() {
        this.deleted = true;
    }

    public long writeTo(OutputStream out) throws IOException {
        return writer.writeTo(out);
    }
}

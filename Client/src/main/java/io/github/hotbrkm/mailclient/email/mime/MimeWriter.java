package io.github.hotbrkm.mailclient.email.mime;

import io.github.hotbrkm.mailclient.email.message.AddressHeader;
import io.github.hotbrkm.mailclient.email.message.BodyWriter;
import io.github.hotbrkm.mailclient.email.message.ContentTypes;
import io.github.hotbrkm.mailclient.email.message.Header;
import io.github.hotbrkm.mailclient.email.message.MailFile;
import io.github.hotbrkm.mailclient.email.message.Message;
import io.github.hotbrkm.mailclient.email.message.MiddlewareType;
import io.github.hotbrkm.mailclient.email.message.Part;
import io.github.hotbrkm.mailclient.email.message.TransferEncoding;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeUtility;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Serializes a {@link Message} into an RFC 5322 / MIME byte stream.
 * <p>
 * Body framing depends on the number of parts (N), attachments (M) and embeds (K):
 * {@code multipart/mixed} when {@code (N>0 && M>0) || M>1}, {@code multipart/related} when
 * {@code (N>0 && K>0) || K>1} and {@code multipart/alternative} when {@code N>1}, nested in that order.
 * A single part or file without anything else is written as a flat message.
 */
public class MimeWriter {

    public static final String DEFAULT_USER_AGENT = "mail-client/1.0";

    private static final String CRLF = "\r\n";

    private final CountingOutputStream out;
    private final Deque<MultipartLevel> levels = new ArrayDeque<>();

    public MimeWriter(OutputStream out) {
        this.out = new CountingOutputStream(Objects.requireNonNull(out, "out must not be null"));
    }

    /**
     * Sets the default headers on the message, applies its middlewares to a copy and writes the copy.
     *
     * @param skipType middleware type to skip for this write, may be null
     * @return number of bytes written
     */
    public long writeMessage(Message message, MiddlewareType skipType) throws IOException {
        Objects.requireNonNull(message, "message must not be null");
        applyDefaultHeaders(message);
        List<String> boundaries = List.of(message.getGeneratedBoundary(0), message.getGeneratedBoundary(1),
                message.getGeneratedBoundary(2));
        return write(withDefaultUserAgent(message).applyMiddlewares(skipType), boundaries);
    }

    /**
     * Returns a copy carrying the default User-Agent and X-Mailer, or the message itself when it sets
     * its own or suppresses the default. The message is left untouched so a later suppression still applies.
     */
    static Message withDefaultUserAgent(Message message) {
        if (message.isDefaultUserAgentSuppressed()
                || message.hasGenHeader(Header.USER_AGENT) || message.hasGenHeader(Header.X_MAILER)) {
            return message;
        }
        Message copy = message.copy();
        copy.setUserAgent(DEFAULT_USER_AGENT);
        return copy;
    }

    /**
     * Sets Date and Message-ID when absent and (re)sets MIME-Version.
     */
    public static void applyDefaultHeaders(Message message) {
        if (!message.hasGenHeader(Header.DATE)) {
            message.setDate();
        }
        if (!message.hasGenHeader(Header.MESSAGE_ID)) {
            message.setMessageId();
        }
        message.setGenHeader(Header.MIME_VERSION, message.getMimeVersion());
    }

    long write(Message message, List<String> generatedBoundaries) throws IOException {
        List<Part> parts = message.getParts().stream().filter(part -> !part.isDeleted()).toList();
        List<MailFile> attachments = message.getAttachments();
        List<MailFile> embeds = message.getEmbeds();
        validateWriters(parts, attachments, embeds);

        writeHeaders(message);

        int partCount = parts.size();
        boolean mixed = (partCount > 0 && !attachments.isEmpty()) || attachments.size() > 1;
        boolean related = (partCount > 0 && !embeds.isEmpty()) || embeds.size() > 1;
        boolean alternative = partCount > 1;

        int level = 0;
        if (mixed) {
            startMultipart(ContentTypes.MULTIPART_MIXED, boundaryFor(level++, message, generatedBoundaries));
        }
        if (related) {
            startMultipart(ContentTypes.MULTIPART_RELATED, boundaryFor(level++, message, generatedBoundaries));
        }
        if (alternative) {
            startMultipart(ContentTypes.MULTIPART_ALTERNATIVE, boundaryFor(level, message, generatedBoundaries));
        }

        for (Part part : parts) {
            writePart(part);
        }
        if (alternative) {
            stopMultipart();
        }
        for (MailFile embed : embeds) {
            writeFile(embed, true, message.getCharset(), message.getEncoding());
        }
        if (related) {
            stopMultipart();
        }
        for (MailFile attachment : attachments) {
            writeFile(attachment, false, message.getCharset(), message.getEncoding());
        }
        if (mixed) {
            stopMultipart();
        }
        if (partCount == 0 && attachments.isEmpty() && embeds.isEmpty()) {
            writeString(CRLF);
        }

        out.flush();
        return out.getCount();
    }

    private static String boundaryFor(int level, Message message, List<String> generatedBoundaries) {
        if (level == 0 && message.getBoundary() != null && !message.getBoundary().isEmpty()) {
            return message.getBoundary();
        }
        return generatedBoundaries.get(level);
    }

    private static void validateWriters(List<Part> parts, List<MailFile> attachments, List<MailFile> embeds) {
        for (Part part : parts) {
            Objects.requireNonNull(part.getWriter(), "part writer must not be null");
        }
        for (MailFile file : attachments) {
            Objects.requireNonNull(file.getWriter(), "attachment writer must not be null: " + file.getName());
        }
        for (MailFile file : embeds) {
            Objects.requireNonNull(file.getWriter(), "embed writer must not be null: " + file.getName());
        }
    }

    // ========== Headers ==========

    private void writeHeaders(Message message) throws IOException {
        Charset charset = message.getCharset();
        String wordEncoding = message.getEncoding().headerWordEncoding();

        for (Map.Entry<String, List<String>> header : new TreeMap<>(message.getGenHeaders()).entrySet()) {
            writeHeader(header.getKey(), String.join(", ", header.getValue()));
        }
        for (Map.Entry<String, String> header : new TreeMap<>(message.getPreformattedHeaders()).entrySet()) {
            writeString(header.getKey() + ": " + header.getValue() + CRLF);
        }

        List<InternetAddress> from = message.getAddrHeader(AddressHeader.FROM);
        if (from.isEmpty()) {
            from = message.getAddrHeader(AddressHeader.ENVELOPE_FROM);
        }
        writeAddressHeader(AddressHeader.FROM, from, charset, wordEncoding);
        for (AddressHeader header : List.of(AddressHeader.TO, AddressHeader.CC, AddressHeader.REPLY_TO,
                AddressHeader.DISPOSITION_NOTIFICATION_TO)) {
            writeAddressHeader(header, message.getAddrHeader(header), charset, wordEncoding);
        }
    }

    private void writeAddressHeader(AddressHeader header, List<InternetAddress> addresses, Charset charset,
                                    String wordEncoding) throws IOException {
        if (addresses.isEmpty()) {
            return;
        }
        String value = addresses.stream()
                .map(address -> formatAddress(address, charset, wordEncoding))
                .collect(Collectors.joining(", "));
        writeHeader(header.getHeaderName(), value);
    }

    /**
     * Formats an address as {@code "Name" <addr>}, {@code =?cs?q?...?= <addr>} or {@code <addr>}.
     */
    static String formatAddress(InternetAddress address, Charset charset, String wordEncoding) {
        String personal = address.getPersonal();
        if (personal == null || personal.isEmpty()) {
            return "<" + address.getAddress() + ">";
        }
        if (HeaderWordEncoder.isAscii(personal)) {
            String quoted = personal.replace("\\", "\\\\").replace("\"", "\\\"");
            return "\"" + quoted + "\" <" + address.getAddress() + ">";
        }
        return HeaderWordEncoder.encode(personal, charset, wordEncoding) + " <" + address.getAddress() + ">";
    }

    private void writeHeader(String name, String value) throws IOException {
        writeString(foldHeader(name, value) + CRLF);
    }

    /**
     * Returns {@code name: value} folded at whitespace to 76 columns where possible, without a trailing CRLF.
     * A single word longer than the line, such as an encoded word, is never split.
     */
    static String foldHeader(String name, String value) {
        if (value == null || value.isEmpty()) {
            return name + ":";
        }
        return name + ": " + MimeUtility.fold(name.length() + 2, value);
    }

    // ========== Multipart framing ==========

    private void startMultipart(String subtype, String boundary) throws IOException {
        String contentType = "multipart/" + subtype + ";" + CRLF + " boundary=" + boundary;
        if (levels.isEmpty()) {
            writeString(Header.CONTENT_TYPE.getName() + ": " + contentType + CRLF + CRLF);
        } else {
            Map<String, String> headers = new TreeMap<>();
            headers.put(Header.CONTENT_TYPE.getName(), contentType);
            newPart(headers);
        }
        levels.push(new MultipartLevel(boundary));
    }

    private void stopMultipart() throws IOException {
        MultipartLevel level = levels.pop();
        writeString(CRLF + "--" + level.boundary + "--" + CRLF);
    }

    private void newPart(Map<String, String> headers) throws IOException {
        MultipartLevel level = levels.peek();
        if (level == null) {
            throw new IllegalStateException("no open multipart level");
        }
        writeString((level.firstPart ? "" : CRLF) + "--" + level.boundary + CRLF);
        level.firstPart = false;
        for (Map.Entry<String, String> header : headers.entrySet()) {
            writeString(header.getKey() + ": " + header.getValue() + CRLF);
        }
        writeString(CRLF);
    }

    // ========== Parts and files ==========

    private void writePart(Part part) throws IOException {
        String contentType = part.getCharset() == null
                ? part.getContentType()
                : part.getContentType() + "; charset=" + part.getCharset().name();

        Map<String, String> headers = new TreeMap<>();
        headers.put(Header.CONTENT_TYPE.getName(), contentType);
        headers.put(Header.CONTENT_TRANSFER_ENCODING.getName(), part.getEncoding().getValue());
        if (part.getDescription() != null && !part.getDescription().isEmpty()) {
            headers.put(Header.CONTENT_DESCRIPTION.getName(), part.getDescription());
        }
        if (levels.isEmpty()) {
            writeFlatHeaders(headers);
        } else {
            newPart(headers);
        }
        writeBody(part.getWriter(), part.getEncoding());
    }

    private void writeFile(MailFile file, boolean embed, Charset charset, TransferEncoding messageEncoding)
            throws IOException {
        String fileName = HeaderWordEncoder.encode(sanitizeFileName(file.getName()), charset,
                messageEncoding.headerWordEncoding());

        Map<String, String> headers = new TreeMap<>();
        headers.put(Header.CONTENT_TYPE.getName(), file.getContentType() + "; name=\"" + fileName + "\"");
        headers.put(Header.CONTENT_TRANSFER_ENCODING.getName(), file.getEncoding().getValue());
        if (file.getDescription() != null && !file.getDescription().isEmpty()) {
            headers.put(Header.CONTENT_DESCRIPTION.getName(),
                    HeaderWordEncoder.encode(file.getDescription(), charset, messageEncoding.headerWordEncoding()));
        }
        headers.put(Header.CONTENT_DISPOSITION.getName(),
                (embed ? "inline" : "attachment") + "; filename=\"" + fileName + "\"");
        if (embed) {
            String contentId = file.getContentId() != null ? file.getContentId() : file.getName();
            headers.put(Header.CONTENT_ID.getName(), "<" + stripAngleBrackets(contentId) + ">");
        }
        headers.putAll(file.getHeaders());

        if (levels.isEmpty()) {
            writeFlatHeaders(headers);
        } else {
            newPart(headers);
        }
        writeBody(file.getWriter(), file.getEncoding());
    }

    private void writeFlatHeaders(Map<String, String> headers) throws IOException {
        for (Map.Entry<String, String> header : headers.entrySet()) {
            writeHeader(header.getKey(), header.getValue());
        }
        writeString(CRLF);
    }

    private void writeBody(BodyWriter writer, TransferEncoding encoding) throws IOException {
        OutputStream shielded = new NonClosingOutputStream(out);
        switch (encoding) {
            case QUOTED_PRINTABLE -> {
                try (OutputStream qp = encoderStream(shielded, "quoted-printable")) {
                    writer.writeTo(qp);
                }
            }
            case BASE64 -> {
                try (OutputStream base64 = Base64.getEncoder().wrap(new Base64LineBreaker(shielded))) {
                    writer.writeTo(base64);
                }
            }
            case SEVEN_BIT, EIGHT_BIT -> writer.writeTo(shielded);
            default -> throw new IllegalStateException("unsupported transfer encoding: " + encoding);
        }
    }

    private static OutputStream encoderStream(OutputStream out, String encoding) throws IOException {
        try {
            return MimeUtility.encode(out, encoding);
        } catch (MessagingException e) {
            throw new IOException("unsupported transfer encoding: " + encoding, e);
        }
    }

    /**
     * Replaces characters that are unsafe in a MIME file name parameter with an underscore.
     */
    static String sanitizeFileName(String name) {
        StringBuilder builder = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c < 32 || c == 127 || "\"/:<>?\\|".indexOf(c) >= 0) {
                builder.append('_');
            } else {
                builder.append(c);
            }
        }
        return builder.toString();
    }

    private static String stripAngleBrackets(String value) {
        String result = value;
        if (result.startsWith("<")) {
            result = result.substring(1);
        }
        if (result.endsWith(">")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private void writeString(String value) throws IOException {
        out.write(value.getBytes(StandardCharsets.UTF_8));
    }

    private static final class MultipartLevel {
        private final String boundary;
        private boolean firstPart = true;

        private MultipartLevel(String boundary) {
            this.boundary = boundary;
        }
    }

    private static final class CountingOutputStream extends FilterOutputStream {
        private long count;

        private CountingOutputStream(OutputStream out) {
            super(out);
        }

        @Override
        public void write(int b) throws IOException {
            out.write(b);
            count++;
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            out.write(b, off, len);
            count += len;
        }

        private long getCount() {
            return count;
        }
    }

    private static final class NonClosingOutputStream extends FilterOutputStream {

        private NonClosingOutputStream(OutputStream out) {
            super(out);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            out.write(b, off, len);
        }

        @Override
        public void close() throws IOException {
            flush();
        }
    }
}

package io.github.hotbrkm.mailclient.email.message;

import io.github.hotbrkm.mailclient.email.mime.BoundaryGenerator;
import io.github.hotbrkm.mailclient.email.mime.HeaderWordEncoder;
import io.github.hotbrkm.mailclient.email.mime.MessageIdGenerator;
import io.github.hotbrkm.mailclient.email.mime.MimeWriter;
import io.github.hotbrkm.mailclient.email.send.SendException;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A mail message: headers, addresses, body parts, attachments and embeds.
 * <p>
 * Addresses are validated as soon as they are set. Header values are encoded with the charset and
 * encoding active at the time they are set. A message can be written any number of times; the Date and
 * Message-ID headers are generated on the first write and reused afterwards.
 * <p>
 * Instances are not thread-safe.
 */
@Slf4j
public class Message {

    public static final String DEFAULT_MIME_VERSION = "1.0";

    static final DateTimeFormatter RFC_1123_Z_FORMATTER =
            DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss Z", Locale.US);

    private final Map<String, List<String>> genHeaders = new LinkedHashMap<>();
    private final Map<String, String> preformattedHeaders = new LinkedHashMap<>();
    private final Map<AddressHeader, List<InternetAddress>> addrHeaders = new EnumMap<>(AddressHeader.class);
    private final List<Part> parts = new ArrayList<>();
    private final List<MailFile> attachments = new ArrayList<>();
    private final List<MailFile> embeds = new ArrayList<>();
    private final List<Middleware> middlewares = new ArrayList<>();
    private final List<String> generatedBoundaries = new ArrayList<>();

    @Getter
    private Charset charset = StandardCharsets.UTF_8;
    @Getter
    private TransferEncoding encoding = TransferEncoding.QUOTED_PRINTABLE;
    @Getter
    private String mimeVersion = DEFAULT_MIME_VERSION;
    @Getter
    private String boundary;
    @Getter
    private boolean defaultUserAgentSuppressed;

    @Getter
    private SendException sendError;
    @Getter
    private boolean delivered;

    public Message() {
    }

    public Message(Charset charset, TransferEncoding encoding) {
        setCharset(charset);
        setEncoding(encoding);
    }

    // ========== Configuration ==========

    public void setCharset(Charset charset) {
        this.charset = Objects.requireNonNull(charset, "charset must not be null");
    }

    public void setEncoding(TransferEncoding encoding) {
        this.encoding = Objects.requireNonNull(encoding, "encoding must not be null");
    }

    public void setMimeVersion(String mimeVersion) {
        this.mimeVersion = Objects.requireNonNull(mimeVersion, "mimeVersion must not be null");
    }

    /**
     * Sets the boundary of the outermost multipart level. Nested levels always use random boundaries.
     */
    public void setBoundary(String boundary) {
        this.boundary = boundary;
    }

    /**
     * Returns the random boundary of the given multipart nesting level, generating it on first use
     * so repeated writes of the message produce identical bytes.
     */
    public String getGeneratedBoundary(int level) {
        while (generatedBoundaries.size() <= level) {
            generatedBoundaries.add(BoundaryGenerator.next());
        }
        return generatedBoundaries.get(level);
    }

    /**
     * Disables the default User-Agent and X-Mailer headers.
     */
    public void suppressDefaultUserAgent() {
        this.defaultUserAgentSuppressed = true;
    }

    public void addMiddleware(Middleware middleware) {
        middlewares.add(Objects.requireNonNull(middleware, "middleware must not be null"));
    }

    public List<Middleware> getMiddlewares() {
        return Collections.unmodifiableList(middlewares);
    }

    // ========== Address headers ==========

    /**
     * Sets the addresses of the given header, replacing any existing ones.
     * Headers that only allow a single address keep the first one.
     *
     * @throws InvalidAddressException if any address cannot be parsed
     */
    public void setAddrHeader(AddressHeader header, String... addresses) {
        Objects.requireNonNull(header, "header must not be null");
        List<InternetAddress> parsed = new ArrayList<>();
        for (String address : addresses) {
            parsed.add(parseAddress(header, address));
            if (header.isSingleAddress()) {
                break;
            }
        }
        addrHeaders.put(header, parsed);
    }

    /**
     * Like {@link #setAddrHeader(AddressHeader, String...)} but skips addresses that cannot be parsed.
     */
    public void setAddrHeaderIgnoreInvalid(AddressHeader header, String... addresses) {
        Objects.requireNonNull(header, "header must not be null");
        List<InternetAddress> parsed = new ArrayList<>();
        for (String address : addresses) {
            try {
                parsed.add(parseAddress(header, address));
            } catch (InvalidAddressException e) {
                log.warn("Skipping invalid {} address '{}': {}", header, address, e.getMessage());
                continue;
            }
            if (header.isSingleAddress()) {
                break;
            }
        }
        addrHeaders.put(header, parsed);
    }

    public List<InternetAddress> getAddrHeader(AddressHeader header) {
        return Collections.unmodifiableList(addrHeaders.getOrDefault(header, List.of()));
    }

    public List<String> getAddrHeaderAsString(AddressHeader header) {
        return getAddrHeader(header).stream().map(InternetAddress::toUnicodeString).toList();
    }

    public void from(String address) {
        setAddrHeader(AddressHeader.FROM, address);
    }

    public void fromFormat(String name, String address) {
        addrHeaders.put(AddressHeader.FROM, List.of(parseAddress(AddressHeader.FROM, name, address)));
    }

    public void envelopeFrom(String address) {
        setAddrHeader(AddressHeader.ENVELOPE_FROM, address);
    }

    public void envelopeFromFormat(String name, String address) {
        addrHeaders.put(AddressHeader.ENVELOPE_FROM, List.of(parseAddress(AddressHeader.ENVELOPE_FROM, name, address)));
    }

    public void to(String... addresses) {
        setAddrHeader(AddressHeader.TO, addresses);
    }

    public void addTo(String address) {
        addAddress(AddressHeader.TO, address);
    }

    public void addToFormat(String name, String address) {
        addAddress(AddressHeader.TO, name, address);
    }

    public void toIgnoreInvalid(String... addresses) {
        setAddrHeaderIgnoreInvalid(AddressHeader.TO, addresses);
    }

    public void cc(String... addresses) {
        setAddrHeader(AddressHeader.CC, addresses);
    }

    public void addCc(String address) {
        addAddress(AddressHeader.CC, address);
    }

    public void addCcFormat(String name, String address) {
        addAddress(AddressHeader.CC, name, address);
    }

    public void ccIgnoreInvalid(String... addresses) {
        setAddrHeaderIgnoreInvalid(AddressHeader.CC, addresses);
    }

    public void bcc(String... addresses) {
        setAddrHeader(AddressHeader.BCC, addresses);
    }

    public void addBcc(String address) {
        addAddress(AddressHeader.BCC, address);
    }

    public void addBccFormat(String name, String address) {
        addAddress(AddressHeader.BCC, name, address);
    }

    public void bccIgnoreInvalid(String... addresses) {
        setAddrHeaderIgnoreInvalid(AddressHeader.BCC, addresses);
    }

    public void replyTo(String address) {
        setAddrHeader(AddressHeader.REPLY_TO, address);
    }

    public void replyToFormat(String name, String address) {
        addrHeaders.put(AddressHeader.REPLY_TO, List.of(parseAddress(AddressHeader.REPLY_TO, name, address)));
    }

    /**
     * Requests a message disposition notification (RFC 8098) to be sent to the given addresses.
     */
    public void requestMdnTo(String... addresses) {
        setAddrHeader(AddressHeader.DISPOSITION_NOTIFICATION_TO, addresses);
    }

    public void requestMdnToFormat(String name, String address) {
        addrHeaders.put(AddressHeader.DISPOSITION_NOTIFICATION_TO,
                new ArrayList<>(List.of(parseAddress(AddressHeader.DISPOSITION_NOTIFICATION_TO, name, address))));
    }

    public void requestMdnAddTo(String address) {
        addAddress(AddressHeader.DISPOSITION_NOTIFICATION_TO, address);
    }

    private void addAddress(AddressHeader header, String address) {
        appendAddress(header, parseAddress(header, address));
    }

    private void addAddress(AddressHeader header, String name, String address) {
        appendAddress(header, parseAddress(header, name, address));
    }

    private void appendAddress(AddressHeader header, InternetAddress address) {
        List<InternetAddress> current = new ArrayList<>(addrHeaders.getOrDefault(header, List.of()));
        current.add(address);
        addrHeaders.put(header, current);
    }

    private InternetAddress parseAddress(AddressHeader header, String address) {
        if (address == null) {
            throw new InvalidAddressException(header, null, new AddressException("address is null"));
        }
        try {
            InternetAddress parsed = new InternetAddress(address.trim(), true);
            parsed.validate();
            return parsed;
        } catch (AddressException e) {
            throw new InvalidAddressException(header, address, e);
        }
    }

    private InternetAddress parseAddress(AddressHeader header, String name, String address) {
        InternetAddress parsed = parseAddress(header, address);
        if (name == null || name.isEmpty()) {
            return parsed;
        }
        try {
            return new InternetAddress(parsed.getAddress(), name, charset.name());
        } catch (UnsupportedEncodingException e) {
            throw new InvalidAddressException(header, address, e);
        }
    }

    /**
     * Returns the envelope sender: the envelope-From address if set, otherwise the From address.
     *
     * @param fullAddress whether to include the display name
     * @throws IllegalStateException if neither envelope-From nor From is set
     */
    public String getSender(boolean fullAddress) {
        List<InternetAddress> from = addrHeaders.get(AddressHeader.ENVELOPE_FROM);
        if (from == null || from.isEmpty()) {
            from = addrHeaders.get(AddressHeader.FROM);
        }
        if (from == null || from.isEmpty()) {
            throw new IllegalStateException("no FROM address set");
        }
        InternetAddress sender = from.get(0);
        return fullAddress ? sender.toUnicodeString() : sender.getAddress();
    }

    /**
     * Returns the unique addresses of all To, Cc and Bcc recipients.
     *
     * @throws IllegalStateException if there are no recipients
     */
    public List<String> getRecipients() {
        Set<String> recipients = new LinkedHashSet<>();
        for (AddressHeader header : List.of(AddressHeader.TO, AddressHeader.CC, AddressHeader.BCC)) {
            for (InternetAddress address : addrHeaders.getOrDefault(header, List.of())) {
                recipients.add(address.getAddress());
            }
        }
        if (recipients.isEmpty()) {
            throw new IllegalStateException("no recipient addresses set");
        }
        return new ArrayList<>(recipients);
    }

    // ========== Generic headers ==========

    /**
     * Sets a generic header. Values containing non-ASCII characters are stored as RFC 2047 encoded words.
     */
    public void setGenHeader(String name, String... values) {
        Objects.requireNonNull(name, "name must not be null");
        List<String> encoded = new ArrayList<>(values.length);
        for (String value : values) {
            encoded.add(HeaderWordEncoder.encode(value, charset, encoding.headerWordEncoding()));
        }
        genHeaders.put(name, encoded);
    }

    public void setGenHeader(Header header, String... values) {
        setGenHeader(header.getName(), values);
    }

    /**
     * Sets a header whose value is written exactly as given, without encoding or folding.
     * The caller is responsible for the value being valid on the wire.
     */
    public void setGenHeaderPreformatted(String name, String value) {
        Objects.requireNonNull(name, "name must not be null");
        preformattedHeaders.put(name, value);
    }

    public void setGenHeaderPreformatted(Header header, String value) {
        setGenHeaderPreformatted(header.getName(), value);
    }

    public List<String> getGenHeader(String name) {
        return Collections.unmodifiableList(genHeaders.getOrDefault(name, List.of()));
    }

    public List<String> getGenHeader(Header header) {
        return getGenHeader(header.getName());
    }

    public boolean hasGenHeader(Header header) {
        return genHeaders.containsKey(header.getName()) || preformattedHeaders.containsKey(header.getName());
    }

    public Map<String, List<String>> getGenHeaders() {
        return Collections.unmodifiableMap(genHeaders);
    }

    public Map<String, String> getPreformattedHeaders() {
        return Collections.unmodifiableMap(preformattedHeaders);
    }

    public void subject(String subject) {
        setGenHeader(Header.SUBJECT, subject);
    }

    public void setDate() {
        setDateWithValue(ZonedDateTime.now());
    }

    public void setDateWithValue(ZonedDateTime date) {
        setGenHeader(Header.DATE, date.format(RFC_1123_Z_FORMATTER));
    }

    public void setMessageId() {
        setGenHeader(Header.MESSAGE_ID, MessageIdGenerator.next());
    }

    /**
     * Sets the Message-ID to the given value. Angle brackets are added.
     */
    public void setMessageIdWithValue(String messageId) {
        setGenHeader(Header.MESSAGE_ID, "<" + messageId + ">");
    }

    public String getMessageId() {
        List<String> values = getGenHeader(Header.MESSAGE_ID);
        return values.isEmpty() ? "" : values.get(0);
    }

    /**
     * Marks the message as bulk mail ({@code Precedence: bulk}).
     */
    public void setBulk() {
        setGenHeader(Header.PRECEDENCE, "bulk");
        setGenHeader(Header.X_AUTO_RESPONSE_SUPPRESS, "All");
    }

    public void setImportance(Importance importance) {
        if (importance == Importance.NORMAL) {
            return;
        }
        setGenHeader(Header.IMPORTANCE, importance.getValue());
        setGenHeader(Header.PRIORITY, importance.getNumString());
        setGenHeader(Header.X_PRIORITY, importance.getXPriorityString());
        setGenHeader(Header.X_MS_MAIL_PRIORITY, importance.getNumString());
    }

    public void setOrganization(String organization) {
        setGenHeader(Header.ORGANIZATION, organization);
    }

    /**
     * Sets both the User-Agent and X-Mailer headers.
     */
    public void setUserAgent(String userAgent) {
        setGenHeader(Header.USER_AGENT, userAgent);
        setGenHeader(Header.X_MAILER, userAgent);
    }

    // ========== Body parts ==========

    public Part setBodyString(String contentType, String body) {
        return setBodyWriter(contentType, BodyWriter.ofString(body, charset));
    }

    public Part setBodyWriter(String contentType, BodyWriter writer) {
        Part part = newPart(contentType, writer);
        parts.clear();
        parts.add(part);
        return part;
    }

    public Part addAlternativeString(String contentType, String body) {
        return addAlternativeWriter(contentType, BodyWriter.ofString(body, charset));
    }

    public Part addAlternativeWriter(String contentType, BodyWriter writer) {
        Part part = newPart(contentType, writer);
        parts.add(part);
        return part;
    }

    /**
     * Replaces the body with an already signed S/MIME blob (DER encoded PKCS#7 signed-data).
     */
    public Part setSmimeSignedBody(byte[] pkcs7Der) {
        Objects.requireNonNull(pkcs7Der, "pkcs7Der must not be null");
        Part part = new Part(ContentTypes.APPLICATION_PKCS7_MIME + "; smime-type=signed-data; name=\"smime.p7m\"",
                null, TransferEncoding.BASE64, BodyWriter.ofBytes(pkcs7Der));
        parts.clear();
        parts.add(part);
        return part;
    }

    private Part newPart(String contentType, BodyWriter writer) {
        return new Part(contentType, charset, encoding, writer);
    }

    public List<Part> getParts() {
        return Collections.unmodifiableList(parts);
    }

    // ========== Attachments and embeds ==========

    public MailFile attachFile(Path path) {
        return addFile(attachments, fileFromPath(path));
    }

    public MailFile attachBytes(String name, byte[] content) {
        return addFile(attachments, new MailFile(name, BodyWriter.ofBytes(content)));
    }

    public MailFile attachReader(String name, BodyWriter.InputStreamSource source) {
        return addFile(attachments, new MailFile(name, BodyWriter.ofInputStream(source)));
    }

    public MailFile attachResource(String name, String classpathLocation) {
        return addFile(attachments, fileFromResource(name, classpathLocation));
    }

    public MailFile attachFile(MailFile file) {
        return addFile(attachments, file);
    }

    public MailFile embedFile(Path path) {
        return addFile(embeds, asEmbed(fileFromPath(path)));
    }

    public MailFile embedBytes(String name, byte[] content) {
        return addFile(embeds, asEmbed(new MailFile(name, BodyWriter.ofBytes(content))));
    }

    public MailFile embedReader(String name, BodyWriter.InputStreamSource source) {
        return addFile(embeds, asEmbed(new MailFile(name, BodyWriter.ofInputStream(source))));
    }

    public MailFile embedResource(String name, String classpathLocation) {
        return addFile(embeds, asEmbed(fileFromResource(name, classpathLocation)));
    }

    public MailFile embedFile(MailFile file) {
        return addFile(embeds, asEmbed(file));
    }

    public List<MailFile> getAttachments() {
        return Collections.unmodifiableList(attachments);
    }

    public List<MailFile> getEmbeds() {
        return Collections.unmodifiableList(embeds);
    }

    private MailFile addFile(List<MailFile> target, MailFile file) {
        Objects.requireNonNull(file, "file must not be null");
        target.add(file);
        return file;
    }

    private static MailFile asEmbed(MailFile file) {
        if (file.getContentId() == null) {
            file.setContentId(file.getName());
        }
        return file;
    }

    private static MailFile fileFromPath(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("file does not exist or is not a regular file: " + path);
        }
        return new MailFile(path.getFileName().toString(), BodyWriter.ofPath(path));
    }

    private MailFile fileFromResource(String name, String location) {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = Message.class.getClassLoader();
        }
        if (classLoader.getResource(location) == null) {
            throw new IllegalArgumentException("classpath resource not found: " + location);
        }
        return new MailFile(name, BodyWriter.ofClasspathResource(location, classLoader));
    }

    // ========== Serialization ==========

    /**
     * Writes the message, with all middlewares applied, to the given stream.
     *
     * @return number of bytes written
     */
    public long writeTo(OutputStream out) throws IOException {
        return new MimeWriter(out).writeMessage(this, null);
    }

    /**
     * Writes the message to the given stream, skipping middlewares of the given type for this call only.
     */
    public long writeToSkipMiddleware(OutputStream out, MiddlewareType skipType) throws IOException {
        return new MimeWriter(out).writeMessage(this, skipType);
    }

    /**
     * Writes the message to a file, typically with the {@code .eml} extension.
     */
    public long writeToFile(Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        try (OutputStream out = Files.newOutputStream(path)) {
            return writeTo(out);
        }
    }

    public byte[] toByteArray() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            writeTo(out);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize message", e);
        }
        return out.toByteArray();
    }

    /**
     * Returns a copy of this message with all middlewares applied, except those of the skipped type.
     * The message itself is left untouched.
     */
    public Message applyMiddlewares(MiddlewareType skipType) {
        Message result = copy();
        for (Middleware middleware : middlewares) {
            if (skipType != null && skipType.equals(middleware.type())) {
                continue;
            }
            result = Objects.requireNonNull(middleware.handle(result),
                    "middleware " + middleware.type().name() + " returned null");
        }
        return result;
    }

    /**
     * Returns a copy that shares body writers but no mutable collections with this message.
     */
    public Message copy() {
        Message copy = new Message(charset, encoding);
        genHeaders.forEach((name, values) -> copy.genHeaders.put(name, new ArrayList<>(values)));
        copy.preformattedHeaders.putAll(preformattedHeaders);
        addrHeaders.forEach((header, addresses) -> copy.addrHeaders.put(header, new ArrayList<>(addresses)));
        for (Part part : parts) {
            Part partCopy = new Part(part.getContentType(), part.getCharset(), part.getEncoding(), part.getWriter());
            partCopy.setDescription(part.getDescription());
            if (part.isDeleted()) {
                partCopy.delete();
            }
            copy.parts.add(partCopy);
        }
        attachments.forEach(file -> copy.attachments.add(file.copy()));
        embeds.forEach(file -> copy.embeds.add(file.copy()));
        copy.middlewares.addAll(middlewares);
        copy.generatedBoundaries.addAll(generatedBoundaries);
        copy.mimeVersion = mimeVersion;
        copy.boundary = boundary;
        copy.defaultUserAgentSuppressed = defaultUserAgentSuppressed;
        return copy;
    }

    /**
     * Clears addresses, headers, parts, attachments, embeds and send state so the message can be reused.
     * Charset, encoding, MIME version, boundary and middlewares are kept.
     */
    public void reset() {
        addrHeaders.clear();
        genHeaders.clear();
        preformattedHeaders.clear();
        parts.clear();
        attachments.clear();
        embeds.clear();
        generatedBoundaries.clear();
        sendError = null;
        delivered = false;
    }

    /**
     * Returns true if the message or any of its parts or files is written with the 8bit transfer encoding.
     */
    public boolean requiresEightBitTransport() {
        if (encoding == TransferEncoding.EIGHT_BIT) {
            return true;
        }
        return parts.stream().anyMatch(part -> !part.isDeleted() && part.getEncoding() == TransferEncoding.EIGHT_BIT)
                || attachments.stream().anyMatch(file -> file.getEncoding() == TransferEncoding.EIGHT_BIT)
                || embeds.stream().anyMatch(file -> file.getEncoding() == TransferEncoding.EIGHT_BIT);
    }

    // ========== Send state ==========

    public void setSendError(SendException sendError) {
        this.sendError = sendError;
    }

    public void setDelivered(boolean delivered) {
        this.delivered = delivered;
    }

    public boolean hasSendError() {
        return sendError != null;
    }

    public boolean sendErrorIsTemp() {
        return sendError != null && sendError.isTemporary();
    }

    /**
     * Returns true if the message was accepted for some but not all of its recipients.
     */
    public boolean isPartiallyDelivered() {
        return delivered && sendError != null && !sendError.getRecipientErrors().isEmpty();
    }

    public Map<String, Throwable> getRecipientErrors() {
        return sendError == null ? Map.of() : sendError.getRecipientErrors();
    }
}

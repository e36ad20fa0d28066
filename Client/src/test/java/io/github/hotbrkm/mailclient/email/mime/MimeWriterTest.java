package io.github.hotbrkm.mailclient.email.mime;

import io.github.hotbrkm.mailclient.email.message.ContentTypes;
import io.github.hotbrkm.mailclient.email.message.Header;
import io.github.hotbrkm.mailclient.email.message.Message;
import io.github.hotbrkm.mailclient.email.message.Middleware;
import io.github.hotbrkm.mailclient.email.message.MiddlewareType;
import io.github.hotbrkm.mailclient.email.message.TransferEncoding;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MimeWriter Test")
class MimeWriterTest {

    private static Message baseMessage() {
        Message message = new Message();
        message.from("sender@example.com");
        message.to("rcpt@example.com");
        message.subject("Structure");
        return message;
    }

    private static MimeMessage parse(byte[] bytes) throws Exception {
        return new MimeMessage(Session.getInstance(new Properties()), new ByteArrayInputStream(bytes));
    }

    private static String text(Message message) {
        return new String(message.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Single text part is written as a flat message")
    void testSinglePartFlat() throws Exception {
        // Given
        Message message = baseMessage();
        message.setBodyString(ContentTypes.TEXT_PLAIN, "Hello");

        // When
        byte[] bytes = message.toByteArray();
        MimeMessage parsed = parse(bytes);

        // Then
        assertThat(parsed.getContentType()).startsWith("text/plain; charset=UTF-8");
        assertThat(parsed.getEncoding()).isEqualTo("quoted-printable");
        assertThat(parsed.getContent()).isEqualTo("Hello");
        assertThat(parsed.getHeader("MIME-Version", null)).isEqualTo("1.0");
        assertThat(parsed.getHeader("Date", null)).isNotBlank();
        assertThat(parsed.getMessageID()).startsWith("<").endsWith(">");
        assertThat(parsed.getHeader("User-Agent", null)).isEqualTo(MimeWriter.DEFAULT_USER_AGENT);
    }

    @Test
    @DisplayName("Two parts become multipart/alternative")
    void testAlternative() throws Exception {
        // Given
        Message message = baseMessage();
        message.setBodyString(ContentTypes.TEXT_PLAIN, "plain");
        message.addAlternativeString(ContentTypes.TEXT_HTML, "<p>html</p>");

        // When
        MimeMessage parsed = parse(message.toByteArray());

        // Then
        assertThat(parsed.getContentType()).startsWith("multipart/alternative");
        MimeMultipart multipart = (MimeMultipart) parsed.getContent();
        assertThat(multipart.getCount()).isEqualTo(2);
        assertThat(multipart.getBodyPart(0).getContentType()).startsWith("text/plain");
        assertThat(multipart.getBodyPart(1).getContentType()).startsWith("text/html");
        assertThat(multipart.getBodyPart(1).getContent()).isEqualTo("<p>html</p>");
    }

    @Test
    @DisplayName("Body with attachment becomes multipart/mixed")
    void testMixed() throws Exception {
        // Given
        Message message = baseMessage();
        message.setBodyString(ContentTypes.TEXT_PLAIN, "see attachment");
        message.attachBytes("data.bin", new byte[]{0, 1, 2, (byte) 0xFF});

        // When
        MimeMessage parsed = parse(message.toByteArray());

        // Then
        assertThat(parsed.getContentType()).startsWith("multipart/mixed");
        MimeMultipart multipart = (MimeMultipart) parsed.getContent();
        assertThat(multipart.getCount()).isEqualTo(2);
        MimeBodyPart attachment = (MimeBodyPart) multipart.getBodyPart(1);
        assertThat(attachment.getDisposition()).isEqualTo("attachment");
        assertThat(attachment.getFileName()).isEqualTo("data.bin");
        assertThat(attachment.getEncoding()).isEqualTo("base64");
        assertThat(attachment.getInputStream().readAllBytes()).containsExactly(0, 1, 2, 0xFF);
    }

    @Test
    @DisplayName("Alternative body with embed and attachment nests mixed, related and alternative")
    void testFullNesting() throws Exception {
        // Given
        Message message = baseMessage();
        message.setBodyString(ContentTypes.TEXT_PLAIN, "plain");
        message.addAlternativeString(ContentTypes.TEXT_HTML, "<img src=\"cid:logo.png\">");
        message.embedBytes("logo.png", new byte[]{1, 2, 3});
        message.attachBytes("report.pdf", new byte[]{4, 5, 6});

        // When
        MimeMessage parsed = parse(message.toByteArray());

        // Then
        assertThat(parsed.getContentType()).startsWith("multipart/mixed");
        MimeMultipart mixed = (MimeMultipart) parsed.getContent();
        assertThat(mixed.getCount()).isEqualTo(2);
        assertThat(mixed.getBodyPart(0).getContentType()).startsWith("multipart/related");
        assertThat(mixed.getBodyPart(1).getFileName()).isEqualTo("report.pdf");

        MimeMultipart related = (MimeMultipart) mixed.getBodyPart(0).getContent();
        assertThat(related.getCount()).isEqualTo(2);
        assertThat(related.getBodyPart(0).getContentType()).startsWith("multipart/alternative");
        MimeBodyPart embed = (MimeBodyPart) related.getBodyPart(1);
        assertThat(embed.getDisposition()).isEqualTo("inline");
        assertThat(embed.getContentID()).isEqualTo("<logo.png>");
        assertThat(embed.getContentType()).startsWith("image/png");

        MimeMultipart alternative = (MimeMultipart) related.getBodyPart(0).getContent();
        assertThat(alternative.getCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("A single attachment without body is written flat")
    void testSingleAttachmentFlat() throws Exception {
        // Given
        Message message = baseMessage();
        message.attachBytes("only.txt", "content".getBytes(StandardCharsets.UTF_8));

        // When
        MimeMessage parsed = parse(message.toByteArray());

        // Then
        assertThat(parsed.getContentType()).startsWith("text/plain");
        assertThat(parsed.getDisposition()).isEqualTo("attachment");
        assertThat(parsed.getFileName()).isEqualTo("only.txt");
    }

    @Test
    @DisplayName("Two attachments without body become multipart/mixed")
    void testTwoAttachments() throws Exception {
        // Given
        Message message = baseMessage();
        message.attachBytes("a.txt", "a".getBytes(StandardCharsets.UTF_8));
        message.attachBytes("b.txt", "b".getBytes(StandardCharsets.UTF_8));

        // When
        MimeMessage parsed = parse(message.toByteArray());

        // Then
        assertThat(parsed.getContentType()).startsWith("multipart/mixed");
        assertThat(((MimeMultipart) parsed.getContent()).getCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Writing the same message twice produces identical bytes")
    void testRepeatedWritesIdentical() throws IOException {
        // Given
        Message message = baseMessage();
        message.setBodyString(ContentTypes.TEXT_PLAIN, "plain");
        message.addAlternativeString(ContentTypes.TEXT_HTML, "<b>html</b>");
        message.attachBytes("a.txt", "a".getBytes(StandardCharsets.UTF_8));

        // When
        ByteArrayOutputStream first = new ByteArrayOutputStream();
        ByteArrayOutputStream second = new ByteArrayOutputStream();
        long firstCount = message.writeTo(first);
        long secondCount = message.writeTo(second);

        // Then
        assertThat(first.toByteArray()).isEqualTo(second.toByteArray());
        assertThat(firstCount).isEqualTo(first.size());
        assertThat(secondCount).isEqualTo(second.size());
    }

    @Test
    @DisplayName("A configured boundary is used for the outermost level only")
    void testCustomBoundary() throws Exception {
        // Given
        Message message = baseMessage();
        message.setBoundary("outer-boundary");
        message.setBodyString(ContentTypes.TEXT_PLAIN, "plain");
        message.addAlternativeString(ContentTypes.TEXT_HTML, "<b>html</b>");
        message.attachBytes("a.txt", "a".getBytes(StandardCharsets.UTF_8));

        // When
        String written = text(message);
        MimeMessage parsed = parse(written.getBytes(StandardCharsets.UTF_8));

        // Then
        assertThat(written).contains("boundary=outer-boundary").contains("--outer-boundary--");
        MimeMultipart mixed = (MimeMultipart) parsed.getContent();
        assertThat(mixed.getBodyPart(0).getContentType()).doesNotContain("outer-boundary");
    }

    @Test
    @DisplayName("Bcc and envelope sender are not written as headers")
    void testHiddenHeaders() {
        // Given
        Message message = baseMessage();
        message.bcc("hidden@example.com");
        message.envelopeFrom("bounce@example.com");
        message.setBodyString(ContentTypes.TEXT_PLAIN, "x");

        // When
        String written = text(message);

        // Then
        assertThat(written).doesNotContain("hidden@example.com").doesNotContain("bounce@example.com");
        assertThat(written).contains("From: <sender@example.com>\r\n").contains("To: <rcpt@example.com>\r\n");
    }

    @Test
    @DisplayName("Display names are quoted or encoded")
    void testDisplayNames() {
        // Given
        Message message = new Message();
        message.fromFormat("Toni Tester", "toni@example.com");
        message.addToFormat("Jürgen Müller", "juergen@example.com");
        message.setBodyString(ContentTypes.TEXT_PLAIN, "x");

        // When
        String written = text(message);

        // Then
        assertThat(written).contains("From: \"Toni Tester\" <toni@example.com>\r\n");
        assertThat(written).contains("To: =?UTF-8?Q?J=C3=BCrgen_M=C3=BCller?= <juergen@example.com>\r\n");
    }

    @Test
    @DisplayName("Base64 message encoding encodes the body and B-encodes headers")
    void testBase64Encoding() throws Exception {
        // Given
        Message message = new Message(StandardCharsets.UTF_8, TransferEncoding.BASE64);
        message.from("sender@example.com");
        message.to("rcpt@example.com");
        message.subject("Grüße");
        message.setBodyString(ContentTypes.TEXT_PLAIN, "Hallo Welt");

        // When
        String written = text(message);
        MimeMessage parsed = parse(written.getBytes(StandardCharsets.UTF_8));

        // Then
        assertThat(written).contains("Subject: =?UTF-8?B?");
        assertThat(written).contains("SGFsbG8gV2VsdA==\r\n");
        assertThat(parsed.getSubject()).isEqualTo("Grüße");
        assertThat(parsed.getContent()).isEqualTo("Hallo Welt");
    }

    @Test
    @DisplayName("Middlewares change the written copy, not the message, and can be skipped")
    void testMiddlewares() {
        // Given
        MiddlewareType upperType = new MiddlewareType("upper-subject");
        Message message = baseMessage();
        message.setBodyString(ContentTypes.TEXT_PLAIN, "x");
        message.addMiddleware(new Middleware() {
            @Override
            public Message handle(Message copy) {
                copy.subject(copy.getGenHeader("Subject").get(0).toUpperCase());
                return copy;
            }

            @Override
            public MiddlewareType type() {
                return upperType;
            }
        });

        // When
        String withMiddleware = text(message);
        ByteArrayOutputStream skipped = new ByteArrayOutputStream();
        try {
            message.writeToSkipMiddleware(skipped, upperType);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }

        // Then
        assertThat(withMiddleware).contains("Subject: STRUCTURE\r\n");
        assertThat(skipped.toString(StandardCharsets.UTF_8)).contains("Subject: Structure\r\n");
        assertThat(message.getGenHeader("Subject")).containsExactly("Structure");
    }

    @Test
    @DisplayName("Deleted parts are skipped")
    void testDeletedPartSkipped() throws Exception {
        // Given
        Message message = baseMessage();
        message.setBodyString(ContentTypes.TEXT_PLAIN, "plain");
        message.addAlternativeString(ContentTypes.TEXT_HTML, "<b>html</b>").delete();

        // When
        MimeMessage parsed = parse(message.toByteArray());

        // Then
        assertThat(parsed.getContentType()).startsWith("text/plain");
    }

    @Test
    @DisplayName("Suppressing the user agent after a write removes it from later writes")
    void testSuppressUserAgentAfterWrite() {
        // Given
        Message message = baseMessage();
        message.setBodyString(ContentTypes.TEXT_PLAIN, "Hello");
        String first = text(message);

        // When
        message.suppressDefaultUserAgent();
        String second = text(message);

        // Then
        assertThat(first).contains("User-Agent: " + MimeWriter.DEFAULT_USER_AGENT + "\r\n");
        assertThat(second).doesNotContain("User-Agent").doesNotContain("X-Mailer");
        assertThat(message.hasGenHeader(Header.USER_AGENT)).isFalse();
    }

    @Test
    @DisplayName("An explicit user agent replaces the default")
    void testExplicitUserAgent() throws Exception {
        // Given
        Message message = baseMessage();
        message.setUserAgent("custom-agent/2.0");
        message.setBodyString(ContentTypes.TEXT_PLAIN, "Hello");

        // When
        MimeMessage parsed = parse(message.toByteArray());

        // Then
        assertThat(parsed.getHeader("User-Agent", null)).isEqualTo("custom-agent/2.0");
        assertThat(parsed.getHeader("X-Mailer", null)).isEqualTo("custom-agent/2.0");
    }

    @Test
    @DisplayName("Part descriptions are written for flat and multipart bodies")
    void testPartDescription() throws Exception {
        // Given
        Message flat = baseMessage();
        flat.setBodyString(ContentTypes.TEXT_PLAIN, "plain").setDescription("Plain body");
        Message multipart = baseMessage();
        multipart.setBodyString(ContentTypes.TEXT_PLAIN, "plain").setDescription("Plain body");
        multipart.addAlternativeString(ContentTypes.TEXT_HTML, "<b>html</b>").setDescription("HTML body");

        // When
        MimeMessage parsedFlat = parse(flat.toByteArray());
        MimeMultipart alternative = (MimeMultipart) parse(multipart.toByteArray()).getContent();

        // Then
        assertThat(parsedFlat.getDescription()).isEqualTo("Plain body");
        assertThat(parsedFlat.getContent()).isEqualTo("plain");
        assertThat(alternative.getBodyPart(0).getDescription()).isEqualTo("Plain body");
        assertThat(alternative.getBodyPart(1).getDescription()).isEqualTo("HTML body");
    }

    @Test
    @DisplayName("Quoted-printable bodies escape special bytes and normalize line breaks")
    void testQuotedPrintableBody() throws Exception {
        // Given
        Message message = baseMessage();
        message.setBodyString(ContentTypes.TEXT_PLAIN, "a=b \u00fc\nline \r\nnext\rend");

        // When
        String written = text(message);

        // Then
        String body = written.substring(written.indexOf("\r\n\r\n") + 4);
        assertThat(body).isEqualTo("a=3Db =C3=BC\r\nline=20\r\nnext\r\nend");
        assertThat(parse(written.getBytes(StandardCharsets.UTF_8)).getContent())
                .isEqualTo("a=b \u00fc\r\nline \r\nnext\r\nend");
    }

    @Test
    @DisplayName("Long quoted-printable lines are soft wrapped without splitting escapes")
    void testQuotedPrintableSoftWrap() throws Exception {
        // Given
        String text = "x".repeat(200) + "\n" + "y".repeat(73) + "\u00e9";
        Message message = baseMessage();
        message.setBodyString(ContentTypes.TEXT_PLAIN, text);

        // When
        String written = text(message);

        // Then
        String body = written.substring(written.indexOf("\r\n\r\n") + 4);
        for (String line : body.split("\r\n")) {
            assertThat(line.length()).isLessThanOrEqualTo(76);
        }
        assertThat(body).endsWith("y".repeat(73) + "=\r\n=C3=A9");
        assertThat(parse(written.getBytes(StandardCharsets.UTF_8)).getContent())
                .isEqualTo(text.replace("\n", "\r\n"));
    }

    @Test
    @DisplayName("Long headers are folded at whitespace within 76 columns")
    void testHeaderFolding() throws Exception {
        // Given
        String subject = String.join(" ", Collections.nCopies(30, "word"));
        Message message = baseMessage();
        message.subject(subject);
        message.setBodyString(ContentTypes.TEXT_PLAIN, "Hello");

        // When
        String written = text(message);

        // Then
        int start = written.indexOf("Subject: ");
        String header = written.substring(start, written.indexOf("\r\n", start));
        String[] lines = written.substring(start).split("\r\n");
        assertThat(lines[0]).isEqualTo(header).hasSizeLessThanOrEqualTo(76);
        assertThat(lines[1]).startsWith(" ").doesNotStartWith("  ").hasSizeLessThanOrEqualTo(76);
        assertThat(parse(written.getBytes(StandardCharsets.UTF_8)).getSubject()).isEqualTo(subject);
    }

    @Test
    @DisplayName("Header folding keeps short values and never splits a long word")
    void testFoldHeader() {
        // Given
        String word = "=?UTF-8?q?" + "a".repeat(90) + "?=";

        // When // Then
        assertThat(MimeWriter.foldHeader("Subject", "Hello World")).isEqualTo("Subject: Hello World");
        assertThat(MimeWriter.foldHeader("Subject", "x " + word)).isEqualTo("Subject: x\r\n " + word);
        assertThat(MimeWriter.foldHeader("X-Empty", "")).isEqualTo("X-Empty:");
    }

    @Test
    @DisplayName("Unsafe characters in file names are replaced")
    void testSanitizeFileName() {
        // When // Then
        assertThat(MimeWriter.sanitizeFileName("a/b:c\"d?.txt")).isEqualTo("a_b_c_d_.txt");
    }
}

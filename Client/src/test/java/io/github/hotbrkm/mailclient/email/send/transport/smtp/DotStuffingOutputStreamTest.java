package io.github.hotbrkm.mailclient.email.send.transport.smtp;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DotStuffingOutputStream Test")
class DotStuffingOutputStreamTest {

    private static String stuff(String content) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (DotStuffingOutputStream data = new DotStuffingOutputStream(out)) {
            data.write(content.getBytes(StandardCharsets.US_ASCII));
        }
        return out.toString(StandardCharsets.US_ASCII);
    }

    @Test
    @DisplayName("Leading dots are doubled, other dots are kept")
    void testDotsDoubled() throws IOException {
        // When // Then
        assertThat(stuff(".first\r\nmid.dle\r\n.\r\n..two\r\n"))
                .isEqualTo("..first\r\nmid.dle\r\n..\r\n...two\r\n.\r\n");
    }

    @Test
    @DisplayName("Bare LF and bare CR become CRLF")
    void testLineEndingsNormalized() throws IOException {
        // When // Then
        assertThat(stuff("a\nb\rc\r\n")).isEqualTo("a\r\nb\r\nc\r\n.\r\n");
        assertThat(stuff("a\r.b")).isEqualTo("a\r\n..b\r\n.\r\n");
    }

    @Test
    @DisplayName("Content without final line break gets one before the terminator")
    void testTerminator() throws IOException {
        // When // Then
        assertThat(stuff("no newline")).isEqualTo("no newline\r\n.\r\n");
        assertThat(stuff("")).isEqualTo(".\r\n");
    }
}

package io.github.hotbrkm.mailclient.email.mime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Base64LineBreaker Test")
class Base64LineBreakerTest {

    @ParameterizedTest(name = "{0} input bytes")
    @ValueSource(ints = {0, 1, 56, 57, 58, 75, 76, 77, 10000})
    @DisplayName("Encoded lines are at most 76 characters and decode back to the input")
    void testLinesDecodeToInput(int size) throws IOException {
        // Given
        byte[] input = new byte[size];
        new Random(size).nextBytes(input);
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        // When
        try (OutputStream encoder = Base64.getEncoder().wrap(new Base64LineBreaker(out))) {
            encoder.write(input);
        }

        // Then
        String encoded = out.toString(StandardCharsets.US_ASCII);
        if (size == 0) {
            assertThat(encoded).isEmpty();
            return;
        }
        assertThat(encoded).endsWith("\r\n");
        for (String line : encoded.split("\r\n")) {
            assertThat(line.length()).isBetween(1, 76);
        }
        assertThat(Base64.getMimeDecoder().decode(encoded)).isEqualTo(input);
    }

    @Test
    @DisplayName("Exactly one full line gets a single CRLF")
    void testExactLine() throws IOException {
        // Given
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Base64LineBreaker breaker = new Base64LineBreaker(out);

        // When
        breaker.write("a".repeat(76).getBytes(StandardCharsets.US_ASCII));
        breaker.close();

        // Then
        assertThat(out.toString(StandardCharsets.US_ASCII)).isEqualTo("a".repeat(76) + "\r\n");
    }

    @Test
    @DisplayName("Writing after close fails and the underlying stream stays open")
    void testWriteAfterClose() throws IOException {
        // Given
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Base64LineBreaker breaker = new Base64LineBreaker(out);
        breaker.write('x');
        breaker.close();

        // When // Then
        assertThatThrownBy(() -> breaker.write('y')).isInstanceOf(IOException.class);
        out.write('z');
        assertThat(out.toString(StandardCharsets.US_ASCII)).isEqualTo("x\r\nz");
    }
}

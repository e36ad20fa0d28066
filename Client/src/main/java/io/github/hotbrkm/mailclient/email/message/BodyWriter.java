package io.github.hotbrkm.mailclient.email.message;

import java.io.ByteArrayInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Produces the raw (unencoded) bytes of a body part or file.
 * <p>
 * A writer may be invoked any number of times, once per serialization of the owning message.
 * Writers backed by external resources open the resource on each call and close it before returning.
 */
@FunctionalInterface
public interface BodyWriter {

    /**
     * Writes the content to the given stream.
     *
     * @param out destination stream, not closed by the writer
     * @return number of bytes written
     * @throws IOException if the content cannot be produced or written
     */
    long writeTo(OutputStream out) throws IOException;

    static BodyWriter ofString(String content, Charset charset) {
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(charset, "charset must not be null");
        return ofBytes(content.getBytes(charset));
    }

    static BodyWriter ofBytes(byte[] content) {
        Objects.requireNonNull(content, "content must not be null");
        byte[] copy = content.clone();
        return out -> {
            out.write(copy);
            return copy.length;
        };
    }

    static BodyWriter ofPath(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        return out -> {
            try (InputStream in = Files.newInputStream(path)) {
                return in.transferTo(out);
            }
        };
    }

    static BodyWriter ofInputStream(InputStreamSource source) {
        Objects.requireNonNull(source, "source must not be null");
        return out -> {
            try (InputStream in = source.open()) {
                if (in == null) {
                    throw new IOException("input stream source returned null");
                }
                return in.transferTo(out);
            }
        };
    }

    static BodyWriter ofClasspathResource(String location, ClassLoader classLoader) {
        Objects.requireNonNull(location, "location must not be null");
        Objects.requireNonNull(classLoader, "classLoader must not be null");
        return ofInputStream(() -> {
            InputStream in = classLoader.getResourceAsStream(location);
            if (in == null) {
                throw new FileNotFoundException("classpath resource not found: " + location);
            }
            return in;
        });
    }

    /**
     * Opens a fresh stream on every call.
     */
    @FunctionalInterface
    interface InputStreamSource {
        InputStream open() throws IOException;

        static InputStreamSource ofBytes(byte[] content) {
            byte[] copy = content.clone();
            return () -> new ByteArrayInputStream(copy);
        }
    }
}

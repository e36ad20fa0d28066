package io.github.hotbrkm.mailclient.email.mime;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * Splits a stream of base64 characters into CRLF-terminated lines of at most 76 characters.
 * Closing this stream flushes the last line but does not close the underlying stream.
 */
public class Base64LineBreaker extends OutputStream {

    public static final int MAX_LINE_LENGTH = 76;
    private static final byte[] CRLF = {'\r', '\n'};

    private final OutputStream out;
    private final byte[] line;
    private int used;
    private boolean closed;

    public Base64LineBreaker(OutputStream out) {
        this(out, MAX_LINE_LENGTH);
    }

    public Base64LineBreaker(OutputStream out, int maxLineLength) {
        if (maxLineLength <= 0) {
            throw new IllegalArgumentException("maxLineLength must be positive: " + maxLineLength);
        }
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.line = new byte[maxLineLength];
    }

    @Override
    public void write(int b) throws IOException {
        ensureOpen();
        line[used++] = (byte) b;
        if (used == line.length) {
            flushLine();
        }
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        ensureOpen();
        Objects.checkFromIndexSize(off, len, b.length);
        while (len > 0) {
            int chunk = Math.min(len, line.length - used);
            System.arraycopy(b, off, line, used, chunk);
            used += chunk;
            off += chunk;
            len -= chunk;
            if (used == line.length) {
                flushLine();
            }
        }
    }

    @Override
    public void flush() throws IOException {
        out.flush();
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        if (used > 0) {
            flushLine();
        }
        out.flush();
    }

    private void flushLine() throws IOException {
        out.write(line, 0, used);
        out.write(CRLF);
        used = 0;
    }

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("line breaker is closed");
        }
    }
}

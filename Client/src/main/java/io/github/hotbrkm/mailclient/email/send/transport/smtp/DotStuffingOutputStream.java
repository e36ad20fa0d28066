package io.github.hotbrkm.mailclient.email.send.transport.smtp;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;

/**
 * Encodes message content for the SMTP DATA phase: line endings become CRLF, a dot at the start of a
 * line is doubled, and closing the stream writes the terminating {@code .} line. The underlying stream
 * is flushed but not closed.
 */
public class DotStuffingOutputStream extends FilterOutputStream {

    private static final int STATE_BEGIN_LINE = 0;
    private static final int STATE_IN_LINE = 1;
    private static final int STATE_CR = 2;

    private int state = STATE_BEGIN_LINE;
    private boolean closed;

    public DotStuffingOutputStream(OutputStream out) {
        super(out);
    }

    @Override
    public void write(int b) throws IOException {
        if (closed) {
            throw new IOException("DATA stream is closed");
        }
        switch (b & 0xFF) {
            case '\r' -> {
                if (state == STATE_CR) {
                    // lone CR followed by another CR
                    out.write('\n');
                }
                out.write('\r');
                state = STATE_CR;
            }
            case '\n' -> {
                if (state != STATE_CR) {
                    out.write('\r');
                }
                out.write('\n');
                state = STATE_BEGIN_LINE;
            }
            case '.' -> {
                if (state == STATE_CR) {
                    out.write('\n');
                    state = STATE_BEGIN_LINE;
                }
                if (state == STATE_BEGIN_LINE) {
                    out.write('.');
                }
                out.write('.');
                state = STATE_IN_LINE;
            }
            default -> {
                if (state == STATE_CR) {
                    out.write('\n');
                }
                out.write(b);
                state = STATE_IN_LINE;
            }
        }
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        for (int i = off; i < off + len; i++) {
            write(b[i]);
        }
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        switch (state) {
            case STATE_CR -> out.write('\n');
            case STATE_IN_LINE -> out.write(new byte[]{'\r', '\n'});
            default -> {
            }
        }
        out.write(new byte[]{'.', '\r', '\n'});
        out.flush();
    }
}

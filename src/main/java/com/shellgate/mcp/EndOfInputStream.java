package com.shellgate.mcp;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Input stream that runs a callback once, the first time a read reports end of
 * stream. Lets the stdio server notice that its client has gone away.
 */
final class EndOfInputStream extends FilterInputStream {

    private final Runnable onEndOfInput;
    private final AtomicBoolean ended = new AtomicBoolean();

    EndOfInputStream(InputStream in, Runnable onEndOfInput) {
        super(in);
        this.onEndOfInput = onEndOfInput;
    }

    @Override
    public int read() throws IOException {
        int b = super.read();
        if (b == -1) {
            signalEnd();
        }
        return b;
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
        int n = super.read(buffer, offset, length);
        if (n == -1) {
            signalEnd();
        }
        return n;
    }

    private void signalEnd() {
        if (ended.compareAndSet(false, true)) {
            onEndOfInput.run();
        }
    }
}

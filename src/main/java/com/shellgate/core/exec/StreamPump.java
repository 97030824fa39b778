package com.shellgate.core.exec;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;

/**
 * Copies one child output stream into one or more {@link OutputBuffer}s on a
 * dedicated daemon thread until EOF.
 */
final class StreamPump implements Runnable {

    private static final int CHUNK_SIZE = 8192;

    private final InputStream source;
    private final OutputBuffer[] targets;
    private final Thread thread;
    private volatile IOException failure;

    private StreamPump(InputStream source, String name, OutputBuffer... targets) {
        this.source = source;
        this.targets = targets;
        this.thread = new Thread(this, name);
        this.thread.setDaemon(true);
    }

    static StreamPump start(InputStream source, String name, OutputBuffer... targets) {
        var pump = new StreamPump(source, name, targets);
        pump.thread.start();
        return pump;
    }

    @Override
    public void run() {
        byte[] chunk = new byte[CHUNK_SIZE];
        try {
            int read;
            while ((read = source.read(chunk)) != -1) {
                for (OutputBuffer target : targets) {
                    target.write(chunk, 0, read);
                }
            }
        } catch (IOException e) {
            failure = e;
        }
    }

    /**
     * Waits for the pump to reach EOF.
     *
     * @return {@code true} if the stream was fully drained within the timeout
     */
    boolean await(Duration timeout) throws InterruptedException {
        thread.join(Math.max(1, timeout.toMillis()));
        return !thread.isAlive();
    }

    /** Surfaces a read error hit while draining. */
    void rethrowFailure() throws IOException {
        IOException e = failure;
        if (e != null) {
            throw new IOException("Failed reading from " + thread.getName() + ": " + e.getMessage(), e);
        }
    }
}

package com.kmg.altbuddy.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Consumes one output stream of a child process on a dedicated daemon thread, so the
 * child never blocks on a full pipe. Only the most recent {@code limit} characters are kept.
 */
final class OutputDrain {
    private static final Logger log = LoggerFactory.getLogger(OutputDrain.class);

    private final StringBuilder buffer = new StringBuilder();
    private final int limit;
    private final Thread thread;

    private OutputDrain(InputStream stream, String name, int limit) {
        this.limit = limit;
        this.thread = new Thread(() -> drain(stream), name);
        this.thread.setDaemon(true);
    }

    static OutputDrain start(InputStream stream, String name, int limit) {
        OutputDrain drain = new OutputDrain(stream, name, limit);
        drain.thread.start();
        return drain;
    }

    // Returns false when the reader is still busy after the wait; the caller moves on anyway.
    boolean join(Duration timeout) throws InterruptedException {
        thread.join(Math.max(1L, timeout.toMillis()));
        return !thread.isAlive();
    }

    synchronized String text() {
        return buffer.toString();
    }

    synchronized String tail(int maxChars) {
        int start = Math.max(0, buffer.length() - maxChars);
        return buffer.substring(start).trim();
    }

    private void drain(InputStream stream) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            char[] chunk = new char[8192];
            int read;
            while ((read = reader.read(chunk)) != -1) {
                append(chunk, read);
            }
        } catch (IOException e) {
            log.debug("{} stopped: {}", thread.getName(), e.getMessage());
        }
    }

    private synchronized void append(char[] chunk, int length) {
        buffer.append(chunk, 0, length);
        int overflow = buffer.length() - limit;
        if (overflow > 0) {
            buffer.delete(0, overflow);
        }
    }
}

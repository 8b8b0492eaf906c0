package com.horstmann.tmgrader;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Collects at most a fixed number of bytes. Further bytes are counted as truncated and
 * dropped, so a runaway program can neither block on a full pipe nor exhaust memory.
 */
public class BoundedOutput extends OutputStream {
    private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    private final int limit;
    private boolean truncated;

    public BoundedOutput(int limit) {
        this.limit = limit;
    }

    @Override
    public synchronized void write(int b) {
        if (bytes.size() < limit) bytes.write(b);
        else truncated = true;
    }

    @Override
    public synchronized void write(byte[] b, int off, int len) {
        int room = limit - bytes.size();
        if (len > room) {
            truncated = true;
            len = Math.max(room, 0);
        }
        bytes.write(b, off, len);
    }

    /**
     * Reads the stream to its end, keeping what fits.
     */
    public void drain(InputStream in) throws IOException {
        byte[] buffer = new byte[8192];
        int n;
        while ((n = in.read(buffer)) != -1)
            write(buffer, 0, n);
    }

    public synchronized boolean isTruncated() {
        return truncated;
    }

    @Override
    public synchronized String toString() {
        return new String(bytes.toByteArray(), StandardCharsets.UTF_8).replace("\r", "");
    }
}

// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor.utils;

import org.jetbrains.annotations.NotNull;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.zip.GZIPOutputStream;

/**
 * Reading from this stream yields the gzip encoding of its source, compressed chunk by chunk as it is read, so the
 * source is never buffered whole. {@link #resetSource(InputStream)} starts a new gzip member over another source.
 */
public class GzipCompressingInputStream extends InputStream {
    private static final int CHUNK_SIZE = 16 * 1024;

    private final byte[] chunk = new byte[CHUNK_SIZE];
    private final DrainableBuffer compressed = new DrainableBuffer();
    private InputStream source;
    private GZIPOutputStream gzip;
    private boolean finished;
    private int readPosition;

    public GzipCompressingInputStream(InputStream source) {
        resetSource(source);
    }

    /**
     * Discards any unread output and starts compressing {@code source} from its current position.
     */
    public void resetSource(InputStream source) {
        Ensure.argIsNotNull(source, "source");
        if (gzip != null && !finished) {
            try {
                gzip.close();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        compressed.reset();
        readPosition = 0;
        finished = false;
        this.source = source;
        try {
            gzip = new GZIPOutputStream(compressed, CHUNK_SIZE);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public int read() throws IOException {
        byte[] single = new byte[1];
        int n = read(single, 0, 1);
        return n == -1 ? -1 : single[0] & 0xff;
    }

    @Override
    public int read(@NotNull byte[] b, int off, int len) throws IOException {
        if (len == 0) {
            return 0;
        }
        if (!fill()) {
            return -1;
        }

        int n = Math.min(len, compressed.size() - readPosition);
        System.arraycopy(compressed.buffer(), readPosition, b, off, n);
        readPosition += n;
        return n;
    }

    @Override
    public int available() {
        return compressed.size() - readPosition;
    }

    @Override
    public void close() throws IOException {
        try {
            if (!finished) {
                gzip.close();
                finished = true;
            }
        } finally {
            source.close();
        }
    }

    // Compresses source chunks until there is unread output. Returns false once everything was read.
    private boolean fill() throws IOException {
        if (readPosition < compressed.size()) {
            return true;
        }
        compressed.reset();
        readPosition = 0;

        while (compressed.size() == 0 && !finished) {
            int n = source.read(chunk);
            if (n == -1) {
                gzip.close();
                finished = true;
            } else if (n > 0) {
                gzip.write(chunk, 0, n);
            }
        }
        return compressed.size() > 0;
    }

    private static class DrainableBuffer extends ByteArrayOutputStream {
        byte[] buffer() {
            return buf;
        }
    }
}

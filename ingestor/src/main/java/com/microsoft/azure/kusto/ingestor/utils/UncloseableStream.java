package com.microsoft.azure.kusto.ingestor.utils;

import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.InputStream;

/**
 * This class exists to handle outside dependencies which close a stream when we don't want to.
 * The caller of an ingestion owns its stream, so HTTP and storage clients only ever see it wrapped in this class.
 */
public class UncloseableStream extends InputStream {
    private final InputStream innerStream;

    public UncloseableStream(InputStream innerStream) {
        this.innerStream = innerStream;
    }

    public InputStream getInnerStream() {
        return innerStream;
    }

    /**
     * Explicitly does nothing, thus preserving the inner stream as open
     */
    @Override
    public void close() {
        // Explicitly do nothing
    }

    @Override
    public int read() throws IOException {
        return innerStream.read();
    }

    @Override
    public int read(@NotNull byte[] b, int off, int len) throws IOException {
        return innerStream.read(b, off, len);
    }

    @Override
    public long skip(long n) throws IOException {
        return innerStream.skip(n);
    }

    @Override
    public int available() throws IOException {
        return innerStream.available();
    }
}

// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor.streaming;

import com.microsoft.azure.kusto.ingestor.IngestionProperties.DataFormat;
import org.jetbrains.annotations.Nullable;
import reactor.core.publisher.Mono;

import java.io.InputStream;

/**
 * A connection that writes gzip-compressed payloads straight into a table. Implementations must allow concurrent
 * writes; a {@link com.microsoft.azure.kusto.ingestor.StreamingIngestClient} shares one connection between all its
 * calls.
 */
public interface StreamingConnection {
    /**
     * Writes one payload. The payload stream is read to its end and left open.
     *
     * @param payload    the gzip-compressed data
     * @param mappingRef the name of a mapping pre-defined on the table, or null
     * @param requestId  the client request id sent with the write
     */
    Mono<Void> writeAsync(String database, String table, InputStream payload, DataFormat format, @Nullable String mappingRef, String requestId);
}

// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor;

import com.microsoft.azure.kusto.ingestor.result.IngestionResult;
import reactor.core.publisher.Mono;

import java.io.Closeable;
import java.io.InputStream;

/**
 * Ingests data into one table of a Kusto database. Implementations are safe for concurrent use.
 */
public interface Ingestor extends Closeable {

    /**
     * <p>Ingest data from a file into Kusto database.</p>
     * The path is either a local file (a filesystem path or a {@code file:} URI) or, where the client supports it,
     * an {@code https://} blob URL.
     *
     * @param context cancellation signal of the call
     * @param path    The file to be ingested
     * @param options Settings used to customize the ingestion operation
     * @return {@link IngestionResult} object including the ingestion result
     * @see IngestionOptions
     */
    IngestionResult ingestFromFile(IngestionContext context, String path, IngestionOption... options);

    IngestionResult ingestFromFile(String path, IngestionOption... options);

    Mono<IngestionResult> ingestFromFileAsync(IngestionContext context, String path, IngestionOption... options);

    Mono<IngestionResult> ingestFromFileAsync(String path, IngestionOption... options);

    /**
     * <p>Ingest data from an input stream, into Kusto database.</p>
     * The stream is read to its end and is not closed. Its format must be set with
     * {@link IngestionOptions#fileFormat(IngestionProperties.DataFormat)}.
     *
     * @param context cancellation signal of the call
     * @param stream  The data to be ingested
     * @param options Settings used to customize the ingestion operation
     * @return {@link IngestionResult} object including the ingestion result
     * @see IngestionOptions
     */
    IngestionResult ingestFromStream(IngestionContext context, InputStream stream, IngestionOption... options);

    IngestionResult ingestFromStream(InputStream stream, IngestionOption... options);

    Mono<IngestionResult> ingestFromStreamAsync(IngestionContext context, InputStream stream, IngestionOption... options);

    Mono<IngestionResult> ingestFromStreamAsync(InputStream stream, IngestionOption... options);
}

// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor.staging;

import com.microsoft.azure.kusto.ingestor.IngestionProperties;
import reactor.core.publisher.Mono;

import java.io.InputStream;
import java.nio.file.Path;

/**
 * Stages queued ingestion data in blob storage and posts the notification that hands it to the service.
 * Every operation completes only once the notification was enqueued.
 */
public interface StagingClient {
    /**
     * Uploads a local file, then enqueues it. Deletes the file afterwards when
     * {@link IngestionProperties#isDeleteSourceOnSuccess()} is set.
     */
    Mono<Void> uploadLocalFileAsync(Path file, IngestionProperties properties);

    /**
     * Enqueues a blob that is already in storage. The blob is never modified or deleted.
     *
     * @param rawDataSize the uncompressed size of the blob's data, or 0 if unknown
     */
    Mono<Void> uploadBlobAsync(String blobUri, long rawDataSize, IngestionProperties properties);

    /**
     * Uploads the stream's content, then enqueues it. The stream is read to its end and left open.
     *
     * @return the URL of the staged blob, without its SAS token
     */
    Mono<String> uploadStreamAsync(InputStream stream, IngestionProperties properties);
}

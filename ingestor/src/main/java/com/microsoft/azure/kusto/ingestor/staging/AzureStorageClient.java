// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor.staging;

import com.azure.core.util.BinaryData;
import com.azure.core.util.FluxUtil;
import com.azure.data.tables.TableAsyncClient;
import com.azure.data.tables.models.TableEntity;
import com.azure.storage.blob.BlobAsyncClient;
import com.azure.storage.blob.BlobContainerAsyncClient;
import com.azure.storage.blob.models.ParallelTransferOptions;
import com.azure.storage.queue.QueueAsyncClient;
import com.microsoft.azure.kusto.ingestor.utils.Ensure;
import com.microsoft.azure.kusto.ingestor.utils.GzipCompressingInputStream;
import com.microsoft.azure.kusto.ingestor.utils.UncloseableStream;
import org.apache.commons.codec.binary.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;
import java.lang.invoke.MethodHandles;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Thin wrapper over the storage SDK calls used for staging. It performs no retries.
 */
public class AzureStorageClient {
    private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());
    private static final int UPLOAD_BLOCK_SIZE = 4 * 1024 * 1024;

    public AzureStorageClient() {
    }

    Mono<Void> postMessageToQueue(QueueAsyncClient queueAsyncClient, String content) {
        Ensure.argIsNotNull(queueAsyncClient, "queueAsyncClient");
        Ensure.stringIsNotBlank(content, "content");

        byte[] bytesEncoded = Base64.encodeBase64(content.getBytes(StandardCharsets.UTF_8));
        return queueAsyncClient.sendMessage(BinaryData.fromBytes(bytesEncoded)).then();
    }

    Mono<Void> azureTableInsertEntity(TableAsyncClient tableAsyncClient, TableEntity tableEntity) {
        Ensure.argIsNotNull(tableAsyncClient, "tableAsyncClient");
        Ensure.argIsNotNull(tableEntity, "tableEntity");

        return tableAsyncClient.createEntity(tableEntity);
    }

    Mono<Void> uploadLocalFileToBlob(Path file, String blobName, BlobContainerAsyncClient asyncContainer, boolean shouldCompress) {
        Ensure.argIsNotNull(file, "file");
        Ensure.stringIsNotBlank(blobName, "blobName");
        Ensure.argIsNotNull(asyncContainer, "asyncContainer");
        log.debug("uploadLocalFileToBlob: filePath: {}, blobName: {}, storageUri: {}", file, blobName, asyncContainer.getBlobContainerUrl());

        BlobAsyncClient blobAsyncClient = asyncContainer.getBlobAsyncClient(blobName);
        if (!shouldCompress) {
            return blobAsyncClient.uploadFromFile(file.toString(), true);
        }

        return Mono.using(
                () -> Files.newInputStream(file),
                stream -> upload(new GzipCompressingInputStream(new UncloseableStream(stream)), blobAsyncClient),
                stream -> closeQuietly(stream, file.toString()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    Mono<Void> uploadStreamToBlob(InputStream inputStream, String blobName, BlobContainerAsyncClient asyncContainer, boolean shouldCompress) {
        Ensure.argIsNotNull(inputStream, "inputStream");
        Ensure.stringIsNotBlank(blobName, "blobName");
        Ensure.argIsNotNull(asyncContainer, "asyncContainer");
        log.debug("uploadStreamToBlob: blobName: {}, storageUri: {}", blobName, asyncContainer.getBlobContainerUrl());

        BlobAsyncClient blobAsyncClient = asyncContainer.getBlobAsyncClient(blobName);
        InputStream source = new UncloseableStream(inputStream);
        return Mono.defer(() -> upload(shouldCompress ? new GzipCompressingInputStream(source) : source, blobAsyncClient))
                .subscribeOn(Schedulers.boundedElastic());
    }

    Mono<Void> deleteBlob(BlobContainerAsyncClient asyncContainer, String blobName) {
        log.debug("deleteBlob: blobName: {}, storageUri: {}", blobName, asyncContainer.getBlobContainerUrl());
        return asyncContainer.getBlobAsyncClient(blobName).delete();
    }

    private Mono<Void> upload(InputStream stream, BlobAsyncClient blobAsyncClient) {
        ParallelTransferOptions transferOptions = new ParallelTransferOptions().setBlockSizeLong((long) UPLOAD_BLOCK_SIZE);
        return blobAsyncClient.upload(FluxUtil.toFluxByteBuffer(stream, UPLOAD_BLOCK_SIZE), transferOptions, true).then();
    }

    private static void closeQuietly(InputStream stream, String name) {
        try {
            stream.close();
        } catch (IOException e) {
            log.warn("Failed to close '{}': {}", name, e.getMessage());
        }
    }
}

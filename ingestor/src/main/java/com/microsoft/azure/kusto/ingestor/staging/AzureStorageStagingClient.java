// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor.staging;

import com.azure.data.tables.TableAsyncClient;
import com.azure.data.tables.models.TableEntity;
import com.microsoft.azure.kusto.ingestor.IngestionProperties;
import com.microsoft.azure.kusto.ingestor.exceptions.IngestionClientException;
import com.microsoft.azure.kusto.ingestor.exceptions.IngestionConfigurationException;
import com.microsoft.azure.kusto.ingestor.exceptions.IngestionServiceException;
import com.microsoft.azure.kusto.ingestor.resources.ContainerWithSas;
import com.microsoft.azure.kusto.ingestor.resources.IngestionResourceManager;
import com.microsoft.azure.kusto.ingestor.resources.IngestionResourceSet;
import com.microsoft.azure.kusto.ingestor.resources.ResourceWithSas;
import com.microsoft.azure.kusto.ingestor.result.IngestionStatusInTableDescription;
import com.microsoft.azure.kusto.ingestor.result.OperationStatus;
import com.microsoft.azure.kusto.ingestor.source.CompressionType;
import com.microsoft.azure.kusto.ingestor.utils.Ensure;
import com.microsoft.azure.kusto.ingestor.utils.ExceptionUtils;
import com.microsoft.azure.kusto.ingestor.utils.IngestionUtils;
import com.microsoft.azure.kusto.ingestor.utils.UriUtils;
import com.microsoft.azure.kusto.ingestor.utils.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;
import java.lang.invoke.MethodHandles;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

/**
 * Stages data in the temporary containers discovered by an {@link IngestionResourceManager} and posts the
 * notification to one of its ingestion queues. Each step tries the discovered resources in turn.
 * <p>
 * When the notification cannot be posted for a blob this client uploaded itself, the blob is deleted on a best
 * effort basis and the enqueue error is surfaced. Blobs supplied by the caller are never deleted.
 */
public class AzureStorageStagingClient implements StagingClient {
    private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());
    private static final int MAX_ATTEMPTS = 3;
    private static final int COMPRESSED_FILE_MULTIPLIER = 11;

    private final IngestionResourceManager resourceManager;
    private final AzureStorageClient azureStorageClient;

    public AzureStorageStagingClient(IngestionResourceManager resourceManager) {
        this(resourceManager, new AzureStorageClient());
    }

    AzureStorageStagingClient(IngestionResourceManager resourceManager, AzureStorageClient azureStorageClient) {
        Ensure.argIsNotNull(resourceManager, "resourceManager");
        Ensure.argIsNotNull(azureStorageClient, "azureStorageClient");
        this.resourceManager = resourceManager;
        this.azureStorageClient = azureStorageClient;
    }

    @Override
    public Mono<Void> uploadLocalFileAsync(Path file, IngestionProperties properties) {
        Ensure.argIsNotNull(file, "file");
        Ensure.argIsNotNull(properties, "properties");
        String operation = "AzureStorageStagingClient.uploadLocalFile";

        return Mono.defer(() -> {
            String fileName = String.valueOf(file.getFileName());
            CompressionType compression = IngestionUtils.getCompression(fileName);
            boolean shouldCompress = shouldCompress(compression, properties.getDataFormat());
            String blobName = genBlobName(fileName, properties, shouldCompress ? CompressionType.GZ : compression);
            long rawDataSize = properties.getRawDataSize() > 0 ? properties.getRawDataSize() : estimateFileRawSize(file, compression, properties);

            return resourceManager.getResourcesAsync()
                    .flatMap(resources -> tryEachResource(resources.getContainers(), MAX_ATTEMPTS,
                            container -> azureStorageClient.uploadLocalFileToBlob(file, blobName, container.getResource(), shouldCompress),
                            operation)
                            .flatMap(container -> enqueueStagedBlob(resources, container, blobName, rawDataSize, properties, operation)))
                    .then(Mono.defer(() -> deleteSourceIfRequested(file, properties)));
        }).onErrorMap(ExceptionUtils.toIngestionException(operation, file.toString()));
    }

    @Override
    public Mono<Void> uploadBlobAsync(String blobUri, long rawDataSize, IngestionProperties properties) {
        Ensure.stringIsNotBlank(blobUri, "blobUri is blank");
        Ensure.argIsNotNull(properties, "properties");
        String operation = "AzureStorageStagingClient.uploadBlob";

        if (rawDataSize <= 0) {
            log.warn("Blob '{}' was sent for ingestion without specifying its raw data size", UriUtils.removeSecretsFromUrl(blobUri));
        }
        return resourceManager.getResourcesAsync()
                .flatMap(resources -> enqueue(resources, blobUri, rawDataSize, properties, operation))
                .onErrorMap(ExceptionUtils.toIngestionException(operation, UriUtils.removeSecretsFromUrl(blobUri)));
    }

    @Override
    public Mono<String> uploadStreamAsync(InputStream stream, IngestionProperties properties) {
        Ensure.argIsNotNull(stream, "stream");
        Ensure.argIsNotNull(properties, "properties");
        String operation = "AzureStorageStagingClient.uploadStream";

        return Mono.defer(() -> {
            boolean shouldCompress = shouldCompress(CompressionType.NONE, properties.getDataFormat());
            String blobName = genBlobName("StreamUpload", properties, shouldCompress ? CompressionType.GZ : null);

            // A partially read stream cannot be uploaded again, so only one container is tried
            return resourceManager.getResourcesAsync()
                    .flatMap(resources -> tryEachResource(resources.getContainers(), 1,
                            container -> azureStorageClient.uploadStreamToBlob(stream, blobName, container.getResource(), shouldCompress),
                            operation)
                            .flatMap(container -> enqueueStagedBlob(resources, container, blobName, properties.getRawDataSize(), properties, operation)
                                    .thenReturn(container.getEndpointWithoutSas() + "/" + blobName)));
        }).onErrorMap(ExceptionUtils.toIngestionException(operation, "StreamUpload"));
    }

    private Mono<Void> enqueueStagedBlob(IngestionResourceSet resources, ContainerWithSas container, String blobName, long rawDataSize,
            IngestionProperties properties, String operation) {
        String blobUrl = container.getEndpointWithoutSas() + "/" + blobName + container.getSas();
        log.info("Staged blob '{}' for ingestion into {}.{}", container.getEndpointWithoutSas() + "/" + blobName,
                properties.getDatabaseName(), properties.getTableName());

        return enqueue(resources, blobUrl, rawDataSize, properties, operation)
                .onErrorResume(enqueueError -> azureStorageClient.deleteBlob(container.getResource(), blobName)
                        .doOnSuccess(ignored -> log.warn("Enqueue failed, deleted staged blob '{}'", blobName))
                        .onErrorResume(deleteError -> {
                            log.warn("Enqueue failed and staged blob '{}' could not be deleted: {}", blobName, deleteError.getMessage());
                            enqueueError.addSuppressed(deleteError);
                            return Mono.empty();
                        })
                        .then(Mono.error(enqueueError)));
    }

    private Mono<Void> enqueue(IngestionResourceSet resources, String blobUrl, long rawDataSize, IngestionProperties properties, String operation) {
        return Mono.fromCallable(() -> {
            IngestionBlobInfo blobInfo = buildBlobInfo(blobUrl, rawDataSize, properties);
            return Utils.getObjectMapper().writeValueAsString(blobInfo);
        }).flatMap(message -> insertPendingStatus(blobUrl, properties)
                .then(tryEachResource(resources.getQueues(), MAX_ATTEMPTS,
                        queue -> azureStorageClient.postMessageToQueue(queue.getResource(), message),
                        operation + ".postToQueue")))
                .then();
    }

    IngestionBlobInfo buildBlobInfo(String blobUrl, long rawDataSize, IngestionProperties properties) throws IOException {
        IngestionBlobInfo blobInfo = new IngestionBlobInfo(blobUrl, properties.getDatabaseName(), properties.getTableName());
        if (rawDataSize > 0) {
            blobInfo.setRawDataSize(rawDataSize);
        }
        if (properties.getSourceId() != null) {
            blobInfo.setId(properties.getSourceId());
        }
        blobInfo.setRetainBlobOnSuccess(properties.isRetainBlobOnSuccess());
        blobInfo.setReportLevel(properties.getReportLevel().getKustoValue());
        blobInfo.setReportMethod(properties.getReportMethod().getKustoValue());
        blobInfo.setFlushImmediately(properties.getFlushImmediately());
        blobInfo.setIngestionStatusInTable(properties.getIngestionStatusInTable());
        blobInfo.setValidationPolicy(properties.getValidationPolicy());
        blobInfo.setAdditionalProperties(properties.toAdditionalProperties());
        return blobInfo;
    }

    // Seeds the status table entry so it can be polled before the service picks up the message
    private Mono<Void> insertPendingStatus(String blobUrl, IngestionProperties properties) {
        IngestionStatusInTableDescription description = properties.getIngestionStatusInTable();
        if (description == null) {
            return Mono.empty();
        }

        TableAsyncClient statusTable;
        try {
            statusTable = description.getTableAsyncClient();
        } catch (URISyntaxException e) {
            return Mono.error(new IngestionClientException("AzureStorageStagingClient.insertPendingStatus",
                    UriUtils.removeSecretsFromUrl(description.getTableConnectionString()), "The status table URL is not valid", e));
        }

        Map<String, Object> entityProperties = new HashMap<>();
        entityProperties.put("Status", OperationStatus.Pending.name());
        entityProperties.put("IngestionSourceId", properties.getSourceId());
        entityProperties.put("IngestionSourcePath", UriUtils.removeSecretsFromUrl(blobUrl));
        entityProperties.put("Database", properties.getDatabaseName());
        entityProperties.put("Table", properties.getTableName());
        entityProperties.put("UpdatedOn", OffsetDateTime.now(ZoneOffset.UTC));

        TableEntity entity = new TableEntity(description.getPartitionKey(), description.getRowKey()).setProperties(entityProperties);
        return azureStorageClient.azureTableInsertEntity(statusTable, entity);
    }

    private <T extends ResourceWithSas<?>> Mono<T> tryEachResource(List<T> resources, int maxAttempts, Function<T, Mono<Void>> action, String actionName) {
        if (resources.isEmpty()) {
            return Mono.error(new IngestionConfigurationException(actionName, String.format("%s: No resources were discovered.", actionName)));
        }
        int attempts = Math.min(maxAttempts, resources.size());
        return attempt(1, attempts, resources, action, actionName, new ArrayList<>());
    }

    private <T extends ResourceWithSas<?>> Mono<T> attempt(int attempt, int attempts, List<T> resources, Function<T, Mono<Void>> action,
            String actionName, List<String> usedResources) {
        T resource = resources.get(attempt - 1);
        usedResources.add(String.format("%s (%s)", resource.getEndpointWithoutSas(), resource.getAccountName()));
        log.debug("Attempt {} of {} for {}.", attempt, attempts, actionName);

        return Mono.defer(() -> action.apply(resource))
                .thenReturn(resource)
                .onErrorResume(e -> {
                    if (e instanceof IngestionClientException || e instanceof IllegalArgumentException) {
                        return Mono.error(e);
                    }
                    log.warn("Error during attempt {} of {} for {}: {}", attempt, attempts, actionName, ExceptionUtils.getMessageEx(e));
                    if (attempt >= attempts) {
                        String message = String.format("%s: All %d attempts failed with last error: %s. Used resources: %s",
                                actionName, attempts, ExceptionUtils.getMessageEx(e), String.join(", ", usedResources));
                        Throwable mapped = ExceptionUtils.toIngestionException(e, actionName, null);
                        Integer statusCode = mapped instanceof IngestionServiceException ? ((IngestionServiceException) mapped).getStatusCode() : null;
                        return Mono.error(new IngestionServiceException(actionName, null, message, statusCode, e));
                    }
                    return attempt(attempt + 1, attempts, resources, action, actionName, usedResources);
                });
    }

    private Mono<Void> deleteSourceIfRequested(Path file, IngestionProperties properties) {
        if (!properties.isDeleteSourceOnSuccess()) {
            return Mono.empty();
        }
        return Mono.<Void>fromRunnable(() -> {
            try {
                Files.deleteIfExists(file);
                log.info("Deleted source file '{}' after it was queued for ingestion", file);
            } catch (IOException e) {
                log.warn("Failed to delete source file '{}': {}", file, e.getMessage());
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private static boolean shouldCompress(CompressionType sourceCompression, IngestionProperties.DataFormat dataFormat) {
        return sourceCompression == CompressionType.NONE && (dataFormat == null || dataFormat.isCompressible());
    }

    private static long estimateFileRawSize(Path file, CompressionType compression, IngestionProperties properties) {
        long fileSize;
        try {
            fileSize = Files.size(file);
        } catch (IOException e) {
            throw new IngestionClientException("AzureStorageStagingClient.uploadLocalFile", file.toString(), "Could not read the file size", e);
        }
        IngestionProperties.DataFormat format = properties.getDataFormat();
        boolean compressed = compression != CompressionType.NONE || (format != null && !format.isCompressible());
        return compressed ? fileSize * COMPRESSED_FILE_MULTIPLIER : fileSize;
    }

    static String genBlobName(String fileName, IngestionProperties properties, CompressionType compressionType) {
        IngestionProperties.DataFormat dataFormat = properties.getDataFormat();
        return String.format("%s__%s__%s__%s%s%s",
                properties.getDatabaseName(),
                properties.getTableName(),
                removeExtensions(fileName),
                UUID.randomUUID(),
                dataFormat == null ? "" : "." + dataFormat.getKustoValue(),
                compressionType == null || compressionType == CompressionType.NONE ? "" : "." + compressionType.name().toLowerCase());
    }

    private static String removeExtensions(String fileName) {
        int dot = fileName.indexOf('.');
        return dot <= 0 ? fileName : fileName.substring(0, dot);
    }
}

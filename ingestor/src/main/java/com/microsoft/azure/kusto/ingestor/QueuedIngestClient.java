// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor;

import com.microsoft.azure.kusto.ingestor.IngestionProperties.IngestionReportLevel;
import com.microsoft.azure.kusto.ingestor.exceptions.IngestionConfigurationException;
import com.microsoft.azure.kusto.ingestor.resources.IngestionResourceManager;
import com.microsoft.azure.kusto.ingestor.resources.IngestionResourceSet;
import com.microsoft.azure.kusto.ingestor.resources.TableWithSas;
import com.microsoft.azure.kusto.ingestor.result.IngestionResult;
import com.microsoft.azure.kusto.ingestor.result.IngestionStatusInTableDescription;
import com.microsoft.azure.kusto.ingestor.result.OperationStatus;
import com.microsoft.azure.kusto.ingestor.staging.StagingClient;
import com.microsoft.azure.kusto.ingestor.utils.Ensure;
import com.microsoft.azure.kusto.ingestor.utils.IngestionUtils;
import com.microsoft.azure.kusto.ingestor.utils.UriUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.io.InputStream;
import java.lang.invoke.MethodHandles;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Queued ingestion: local files and streams are staged in blob storage, blob URLs are referenced as they are,
 * and a notification is enqueued for the service to pick up. A returned result means the notification was
 * accepted, not that the data was ingested; {@link IngestionResult#getIngestionStatusAsync()} tracks the
 * outcome when the call reported to the status table.
 */
public class QueuedIngestClient extends IngestClientBase {
    private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    static final UUID STATUS_ROW_KEY = new UUID(0L, 0L);
    private static final String CLASS_NAME = QueuedIngestClient.class.getSimpleName();

    private final IngestionResourceManager resourceManager;
    private final StagingClient stagingClient;

    public QueuedIngestClient(IngestionResourceManager resourceManager, StagingClient stagingClient, String databaseName, String tableName) {
        super(databaseName, tableName);
        Ensure.argIsNotNull(resourceManager, "resourceManager");
        Ensure.argIsNotNull(stagingClient, "stagingClient");
        log.info("Creating a new QueuedIngestClient for {}.{}", databaseName, tableName);
        this.resourceManager = resourceManager;
        this.stagingClient = stagingClient;
    }

    @Override
    protected String getClientType() {
        return CLASS_NAME;
    }

    @Override
    protected Mono<IngestionResult> ingestFromFileAsyncImpl(IngestionContext context, String path, IngestionOption... options) {
        String operation = CLASS_NAME.concat(".ingestFromFile");
        boolean isLocal = IngestionUtils.isLocalPath(path);
        IngestionMode mode = isLocal ? IngestionMode.QUEUED_FILE : IngestionMode.QUEUED_BLOB;
        IngestionProperties properties = IngestionPropertiesBuilder.build(databaseName, tableName, mode, operation, options);
        resolveDataFormat(properties, path, operation);

        if (isLocal) {
            Path file = IngestionUtils.toLocalPath(path);
            return prepareAsync(context, properties, operation)
                    .flatMap(prepared -> context.bind(stagingClient.uploadLocalFileAsync(file, prepared), operation)
                            .then(Mono.fromCallable(() -> createResult(prepared, file.toString()))));
        }

        return prepareAsync(context, properties, operation)
                .flatMap(prepared -> context.bind(stagingClient.uploadBlobAsync(path, prepared.getRawDataSize(), prepared), operation)
                        .then(Mono.fromCallable(() -> createResult(prepared, UriUtils.removeSecretsFromUrl(path)))));
    }

    @Override
    protected Mono<IngestionResult> ingestFromStreamAsyncImpl(IngestionContext context, InputStream stream, IngestionOption... options) {
        String operation = CLASS_NAME.concat(".ingestFromStream");
        IngestionProperties properties = IngestionPropertiesBuilder.build(databaseName, tableName, IngestionMode.QUEUED_STREAM, operation, options);
        requireDataFormat(properties, operation);

        return prepareAsync(context, properties, operation)
                .flatMap(prepared -> context.bind(stagingClient.uploadStreamAsync(stream, prepared), operation)
                        .map(stagedUrl -> createResult(prepared, stagedUrl)));
    }

    /**
     * Adds what the service needs beyond the caller's options: the identity token, and the source id and status
     * table entry of reported ingestions.
     */
    private Mono<IngestionProperties> prepareAsync(IngestionContext context, IngestionProperties properties, String operation) {
        return context.bind(resourceManager.getIdentityTokenAsync(), operation)
                .flatMap(token -> {
                    properties.setAuthorizationContext(token);
                    if (properties.getReportLevel() == IngestionReportLevel.NONE) {
                        return Mono.just(properties);
                    }

                    if (properties.getSourceId() == null) {
                        properties.setSourceId(UUID.randomUUID());
                    }
                    if (!properties.reportsToTable()) {
                        return Mono.just(properties);
                    }

                    return context.bind(resourceManager.getResourcesAsync(), operation)
                            .map(resources -> withStatusTable(properties, resources, operation));
                });
    }

    private static IngestionProperties withStatusTable(IngestionProperties properties, IngestionResourceSet resources, String operation) {
        if (resources.getStatusTables().isEmpty()) {
            throw new IngestionConfigurationException(operation, "Reporting to a table was requested, but the cluster has no ingestion status table.");
        }

        // Staging writes the Pending entry through this client
        TableWithSas statusTable = resources.getStatusTables().get(0);
        IngestionStatusInTableDescription description = new IngestionStatusInTableDescription();
        description.setTableConnectionString(statusTable.getUrl());
        description.setAsyncTableClient(statusTable.getResource());
        description.setPartitionKey(properties.getSourceId().toString());
        description.setRowKey(STATUS_ROW_KEY.toString());
        properties.setIngestionStatusInTable(description);
        return properties;
    }

    private static IngestionResult createResult(IngestionProperties properties, String sourcePath) {
        IngestionResult result = new IngestionResult(properties, sourcePath);
        result.finalizeStatus(properties.getIngestionStatusInTable() != null ? OperationStatus.Pending : OperationStatus.Queued);
        log.debug("Queued ingestion of '{}' into {}.{}", sourcePath, properties.getDatabaseName(), properties.getTableName());
        return result;
    }

    @Override
    public void close() {
        // The resource manager and staging client are shared and owned by the factory
    }
}

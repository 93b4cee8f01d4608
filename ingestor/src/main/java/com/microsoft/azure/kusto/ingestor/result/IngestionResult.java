// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor.result;

import com.azure.data.tables.TableAsyncClient;
import com.microsoft.azure.kusto.ingestor.IngestionProperties;
import com.microsoft.azure.kusto.ingestor.exceptions.IngestionClientException;
import com.microsoft.azure.kusto.ingestor.exceptions.IngestionServiceException;
import org.jetbrains.annotations.Nullable;
import reactor.core.publisher.Mono;

import java.net.URISyntaxException;
import java.time.Instant;

/**
 * The outcome of one ingestion call: a snapshot of the properties it ran with and the status of its source.
 * The status is finalized once, by the ingestion client, before the result is handed to the caller.
 */
public class IngestionResult {
    private final IngestionProperties properties;
    private final IngestionStatus status;
    private final IngestionStatusInTableDescription tableStatusHint;
    private boolean finalized;

    /**
     * @param properties the properties of the call; a deep copy is kept
     * @param sourcePath the local path, blob URL or staged blob URL of the ingested data
     */
    public IngestionResult(IngestionProperties properties, String sourcePath) {
        this.properties = new IngestionProperties(properties);
        IngestionStatusInTableDescription hint = this.properties.getIngestionStatusInTable();
        this.tableStatusHint = hint == null ? null : new IngestionStatusInTableDescription(hint);

        this.status = new IngestionStatus();
        status.setIngestionSourcePath(sourcePath);
        status.setIngestionSourceId(this.properties.getSourceId());
        status.setDatabase(this.properties.getDatabaseName());
        status.setTable(this.properties.getTableName());
    }

    /**
     * Sets the final local status. May only be called once.
     *
     * @throws IllegalStateException if the status was already finalized
     */
    public synchronized void finalizeStatus(OperationStatus operationStatus) {
        if (finalized) {
            throw new IllegalStateException("Ingestion status was already finalized as " + status.getStatus());
        }
        status.setStatus(operationStatus);
        status.setUpdatedOn(Instant.now());
        finalized = true;
    }

    public synchronized boolean isFinalized() {
        return finalized;
    }

    public IngestionProperties getProperties() {
        return properties;
    }

    /**
     * @return a copy of the status recorded when the call returned
     */
    public synchronized IngestionStatus getIngestionStatus() {
        return new IngestionStatus(status);
    }

    /**
     * @return where the service reports this ingestion's outcome, or null when it is not tracked in a table
     */
    @Nullable
    public IngestionStatusInTableDescription getTableStatusHint() {
        return tableStatusHint;
    }

    /**
     * Reads the current status from the status table when the ingestion is tracked there, otherwise returns the
     * locally recorded status.
     */
    public Mono<IngestionStatus> getIngestionStatusAsync() {
        if (tableStatusHint == null) {
            return Mono.fromSupplier(this::getIngestionStatus);
        }

        return Mono.defer(() -> {
            TableAsyncClient tableAsyncClient;
            try {
                tableAsyncClient = tableStatusHint.getTableAsyncClient();
            } catch (URISyntaxException e) {
                return Mono.error(new IngestionClientException("IngestionResult.getIngestionStatus", null,
                        "TableConnectionString could not be parsed as URI reference.", e));
            }
            return tableAsyncClient.getEntity(tableStatusHint.getPartitionKey(), tableStatusHint.getRowKey())
                    .map(IngestionStatus::fromEntity)
                    .onErrorMap(e -> !(e instanceof IngestionClientException), e -> new IngestionServiceException("IngestionResult.getIngestionStatus",
                            status.getIngestionSourcePath(), "Failed to read the ingestion status table: " + e.getMessage(), e));
        });
    }

    public IngestionStatus getIngestionStatusFromTable() {
        return getIngestionStatusAsync().block();
    }
}

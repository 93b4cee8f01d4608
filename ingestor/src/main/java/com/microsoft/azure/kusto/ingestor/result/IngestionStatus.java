// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor.result;

import com.azure.data.tables.models.TableEntity;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * This class represents an ingestion status.
 * Any change to this class must be made in a backwards/forwards-compatible manner, since instances are also read
 * from the status table the service writes.
 */
public class IngestionStatus {
    private OperationStatus status;
    private UUID ingestionSourceId;
    private String ingestionSourcePath;
    private String database;
    private String table;
    private Instant updatedOn;
    private UUID operationId;
    private String errorCode;
    private String details;

    public IngestionStatus() {
    }

    public IngestionStatus(IngestionStatus other) {
        this.status = other.status;
        this.ingestionSourceId = other.ingestionSourceId;
        this.ingestionSourcePath = other.ingestionSourcePath;
        this.database = other.database;
        this.table = other.table;
        this.updatedOn = other.updatedOn;
        this.operationId = other.operationId;
        this.errorCode = other.errorCode;
        this.details = other.details;
    }

    /**
     * The status is {@link OperationStatus#Pending} while the service processes a tracked ingestion, and is updated
     * as soon as the ingestion completes.
     */
    public OperationStatus getStatus() {
        return status;
    }

    public void setStatus(OperationStatus status) {
        this.status = status;
    }

    /**
     * A unique identifier of the ingested source, supplied with the ingestion or generated for it.
     */
    public UUID getIngestionSourceId() {
        return ingestionSourceId;
    }

    public void setIngestionSourceId(UUID ingestionSourceId) {
        this.ingestionSourceId = ingestionSourceId;
    }

    /**
     * The local path, blob URL or staged blob URL of the ingested data.
     */
    public String getIngestionSourcePath() {
        return ingestionSourcePath;
    }

    public void setIngestionSourcePath(String ingestionSourcePath) {
        this.ingestionSourcePath = ingestionSourcePath;
    }

    public String getDatabase() {
        return database;
    }

    public void setDatabase(String database) {
        this.database = database;
    }

    public String getTable() {
        return table;
    }

    public void setTable(String table) {
        this.table = table;
    }

    public Instant getUpdatedOn() {
        return updatedOn;
    }

    public void setUpdatedOn(Instant updatedOn) {
        this.updatedOn = updatedOn;
    }

    public UUID getOperationId() {
        return operationId;
    }

    public void setOperationId(UUID operationId) {
        this.operationId = operationId;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public void setErrorCode(String errorCode) {
        this.errorCode = errorCode;
    }

    /**
     * In case of a failure - the failure's details.
     */
    public String getDetails() {
        return details;
    }

    public void setDetails(String details) {
        this.details = details;
    }

    public static IngestionStatus fromEntity(TableEntity tableEntity) {
        IngestionStatus ingestionStatus = new IngestionStatus();
        ingestionStatus.setIngestionSourceId(toUuid(tableEntity.getProperty("IngestionSourceId")));
        ingestionStatus.setOperationId(toUuid(tableEntity.getProperty("OperationId")));
        ingestionStatus.setDatabase((String) tableEntity.getProperty("Database"));
        ingestionStatus.setTable((String) tableEntity.getProperty("Table"));
        ingestionStatus.setIngestionSourcePath((String) tableEntity.getProperty("IngestionSourcePath"));
        ingestionStatus.setErrorCode((String) tableEntity.getProperty("ErrorCode"));
        ingestionStatus.setDetails((String) tableEntity.getProperty("Details"));

        Object status = tableEntity.getProperty("Status");
        if (status instanceof String) {
            ingestionStatus.setStatus(OperationStatus.valueOf((String) status));
        } else {
            ingestionStatus.setStatus((OperationStatus) status);
        }

        Object updatedOn = tableEntity.getProperty("UpdatedOn");
        if (updatedOn instanceof OffsetDateTime) {
            ingestionStatus.setUpdatedOn(((OffsetDateTime) updatedOn).toInstant());
        } else {
            ingestionStatus.setUpdatedOn((Instant) updatedOn);
        }
        return ingestionStatus;
    }

    private static UUID toUuid(Object value) {
        if (value == null) {
            return null;
        }
        return value instanceof UUID ? (UUID) value : UUID.fromString(value.toString());
    }
}

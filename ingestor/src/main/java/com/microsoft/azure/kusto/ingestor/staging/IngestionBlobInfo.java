// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor.staging;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.microsoft.azure.kusto.ingestor.IngestionProperties;
import com.microsoft.azure.kusto.ingestor.ValidationPolicy;
import com.microsoft.azure.kusto.ingestor.result.IngestionStatusInTableDescription;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * The notification message posted to the ingestion queue for one staged blob.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class IngestionBlobInfo {
    @JsonProperty("BlobPath")
    private final String blobPath;
    @JsonProperty("RawDataSize")
    private Long rawDataSize;
    @JsonProperty("DatabaseName")
    private final String databaseName;
    @JsonProperty("TableName")
    private final String tableName;
    @JsonProperty("Id")
    private UUID id;
    @JsonProperty("RetainBlobOnSuccess")
    private Boolean retainBlobOnSuccess;
    @JsonProperty("ReportLevel")
    private String reportLevel;
    @JsonProperty("ReportMethod")
    private String reportMethod;
    @JsonProperty("FlushImmediately")
    private Boolean flushImmediately;
    @JsonProperty("IngestionStatusInTable")
    private IngestionStatusInTableDescription ingestionStatusInTable;
    @JsonProperty("ValidationPolicy")
    private ValidationPolicy validationPolicy;
    @JsonProperty("AdditionalProperties")
    private Map<String, String> additionalProperties;
    @JsonProperty("SourceMessageCreationTime")
    private final Instant sourceMessageCreationTime;

    public IngestionBlobInfo(String blobPath, String databaseName, String tableName) {
        this.blobPath = blobPath;
        this.databaseName = databaseName;
        this.tableName = tableName;
        id = UUID.randomUUID();
        retainBlobOnSuccess = true;
        reportLevel = IngestionProperties.IngestionReportLevel.FAILURES_ONLY.getKustoValue();
        reportMethod = IngestionProperties.IngestionReportMethod.QUEUE.getKustoValue();
        flushImmediately = false;
        sourceMessageCreationTime = Instant.now();
    }

    public String getBlobPath() {
        return blobPath;
    }

    public Long getRawDataSize() {
        return rawDataSize;
    }

    public void setRawDataSize(Long rawDataSize) {
        this.rawDataSize = rawDataSize;
    }

    public String getDatabaseName() {
        return databaseName;
    }

    public String getTableName() {
        return tableName;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public Boolean getRetainBlobOnSuccess() {
        return retainBlobOnSuccess;
    }

    public void setRetainBlobOnSuccess(Boolean retainBlobOnSuccess) {
        this.retainBlobOnSuccess = retainBlobOnSuccess;
    }

    public String getReportLevel() {
        return reportLevel;
    }

    public void setReportLevel(String reportLevel) {
        this.reportLevel = reportLevel;
    }

    public String getReportMethod() {
        return reportMethod;
    }

    public void setReportMethod(String reportMethod) {
        this.reportMethod = reportMethod;
    }

    public Boolean getFlushImmediately() {
        return flushImmediately;
    }

    public void setFlushImmediately(boolean flushImmediately) {
        this.flushImmediately = flushImmediately;
    }

    public IngestionStatusInTableDescription getIngestionStatusInTable() {
        return ingestionStatusInTable;
    }

    public void setIngestionStatusInTable(IngestionStatusInTableDescription ingestionStatusInTable) {
        this.ingestionStatusInTable = ingestionStatusInTable;
    }

    public ValidationPolicy getValidationPolicy() {
        return validationPolicy;
    }

    public void setValidationPolicy(ValidationPolicy validationPolicy) {
        this.validationPolicy = validationPolicy;
    }

    public Map<String, String> getAdditionalProperties() {
        return additionalProperties;
    }

    public void setAdditionalProperties(Map<String, String> additionalProperties) {
        this.additionalProperties = additionalProperties;
    }

    public Instant getSourceMessageCreationTime() {
        return sourceMessageCreationTime;
    }
}

// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor;

import com.microsoft.azure.kusto.ingestor.IngestionProperties.DataFormat;
import com.microsoft.azure.kusto.ingestor.IngestionProperties.IngestionReportLevel;
import com.microsoft.azure.kusto.ingestor.IngestionProperties.IngestionReportMethod;
import com.microsoft.azure.kusto.ingestor.utils.Ensure;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Factories for the options accepted by the ingestion clients.
 * Null or blank arguments fail immediately with {@link IllegalArgumentException}; using an option with a mode it
 * does not support fails the ingestion call before any I/O.
 */
public class IngestionOptions {
    private static final Set<IngestionMode> QUEUED_FILE_ONLY = Collections.unmodifiableSet(EnumSet.of(IngestionMode.QUEUED_FILE));

    private IngestionOptions() {
        // Static factories only
    }

    /**
     * The format of the data. When omitted for a file or blob the format is inferred from its name.
     */
    public static IngestionOption fileFormat(DataFormat format) {
        Ensure.argIsNotNull(format, "format");
        return option("FileFormat", IngestionMode.ALL, props -> props.setDataFormat(format));
    }

    /**
     * Use a mapping pre-defined on the destination table.
     */
    public static IngestionOption ingestionMappingRef(String mappingName, IngestionMapping.IngestionMappingKind kind) {
        Ensure.stringIsNotBlank(mappingName, "mappingName is blank");
        Ensure.argIsNotNull(kind, "kind");
        return option("IngestionMappingRef", IngestionMode.ALL,
                props -> props.getIngestionMapping().setIngestionMappingReference(mappingName, kind));
    }

    /**
     * Pass the column mappings inline as a JSON array.
     */
    public static IngestionOption ingestionMapping(String mappingJson, IngestionMapping.IngestionMappingKind kind) {
        Ensure.stringIsNotBlank(mappingJson, "mappingJson is blank");
        Ensure.argIsNotNull(kind, "kind");
        return option("IngestionMapping", IngestionMode.QUEUED,
                props -> props.getIngestionMapping().setColumnMappings(mappingJson, kind));
    }

    /**
     * Delete the local file once it was staged and the notification was enqueued.
     */
    public static IngestionOption deleteSource() {
        return option("DeleteSource", QUEUED_FILE_ONLY, props -> props.setDeleteSourceOnSuccess(true));
    }

    public static IngestionOption flushImmediately() {
        return option("FlushImmediately", IngestionMode.QUEUED, props -> props.setFlushImmediately(true));
    }

    public static IngestionOption reportLevel(IngestionReportLevel level) {
        Ensure.argIsNotNull(level, "level");
        return option("ReportLevel", IngestionMode.QUEUED, props -> props.setReportLevel(level));
    }

    public static IngestionOption reportMethod(IngestionReportMethod method) {
        Ensure.argIsNotNull(method, "method");
        return option("ReportMethod", IngestionMode.QUEUED, props -> props.setReportMethod(method));
    }

    /**
     * Report both failures and successes to the status table, so the ingestion can be tracked through
     * {@link com.microsoft.azure.kusto.ingestor.result.IngestionResult#getIngestionStatusAsync()}.
     */
    public static IngestionOption reportResultToTable() {
        return option("ReportResultToTable", IngestionMode.QUEUED, props -> {
            props.setReportLevel(IngestionReportLevel.FAILURES_AND_SUCCESSES);
            props.setReportMethod(IngestionReportMethod.TABLE);
        });
    }

    public static IngestionOption sourceId(UUID sourceId) {
        Ensure.argIsNotNull(sourceId, "sourceId");
        return option("SourceId", IngestionMode.QUEUED, props -> props.setSourceId(sourceId));
    }

    /**
     * The uncompressed size of the data, which helps the service plan the ingestion.
     */
    public static IngestionOption rawDataSize(long rawDataSize) {
        Ensure.isTrue(rawDataSize >= 0, "rawDataSize must not be negative");
        return option("RawDataSize", IngestionMode.QUEUED, props -> props.setRawDataSize(rawDataSize));
    }

    public static IngestionOption tags(String... tags) {
        List<String> values = nonBlank(tags, "tags");
        return option("Tags", IngestionMode.QUEUED, props -> props.getAdditionalTags().addAll(values));
    }

    public static IngestionOption ingestByTags(String... tags) {
        List<String> values = nonBlank(tags, "ingestByTags");
        return option("IngestByTags", IngestionMode.QUEUED, props -> props.getIngestByTags().addAll(values));
    }

    public static IngestionOption dropByTags(String... tags) {
        List<String> values = nonBlank(tags, "dropByTags");
        return option("DropByTags", IngestionMode.QUEUED, props -> props.getDropByTags().addAll(values));
    }

    public static IngestionOption ingestIfNotExists(String... tags) {
        List<String> values = nonBlank(tags, "ingestIfNotExists");
        return option("IngestIfNotExists", IngestionMode.QUEUED, props -> props.getIngestIfNotExists().addAll(values));
    }

    public static IngestionOption ignoreFirstRecord() {
        return option("IgnoreFirstRecord", IngestionMode.QUEUED, props -> props.setIgnoreFirstRecord(true));
    }

    /**
     * Overrides the creation time of the resulting extents, used when backfilling historical data.
     */
    public static IngestionOption creationTime(Instant creationTime) {
        Ensure.argIsNotNull(creationTime, "creationTime");
        return option("CreationTime", IngestionMode.QUEUED, props -> props.setCreationTime(creationTime));
    }

    public static IngestionOption validationPolicy(ValidationPolicy.ValidationOptions options, ValidationPolicy.ValidationImplications implications) {
        Ensure.argIsNotNull(options, "options");
        Ensure.argIsNotNull(implications, "implications");
        ValidationPolicy policy = new ValidationPolicy(options, implications);
        return option("ValidationPolicy", IngestionMode.QUEUED, props -> props.setValidationPolicy(policy));
    }

    public static IngestionOption additionalProperty(String key, String value) {
        Ensure.stringIsNotBlank(key, "key is blank");
        Ensure.argIsNotNull(value, "value");
        return option("AdditionalProperty", IngestionMode.QUEUED, props -> props.getAdditionalProperties().put(key, value));
    }

    /**
     * The {@code x-ms-client-request-id} sent with a streaming write, for correlating it in service logs.
     */
    public static IngestionOption clientRequestId(String clientRequestId) {
        Ensure.stringIsNotBlank(clientRequestId, "clientRequestId is blank");
        return option("ClientRequestId", IngestionMode.STREAMING, props -> props.setClientRequestId(clientRequestId));
    }

    private static List<String> nonBlank(String[] values, String name) {
        Ensure.argIsNotNull(values, name);
        for (String value : values) {
            Ensure.stringIsNotBlank(value, name + " contains a blank value");
        }
        return Collections.unmodifiableList(Arrays.asList(values.clone()));
    }

    private static IngestionOption option(String name, Set<IngestionMode> modes, Consumer<IngestionProperties> applier) {
        return new IngestionOption() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public Set<IngestionMode> getSupportedModes() {
                return modes;
            }

            @Override
            public void apply(IngestionProperties properties) {
                applier.accept(properties);
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}

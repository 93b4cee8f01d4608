// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.azure.kusto.ingestor.exceptions.IngestionArgumentException;
import com.microsoft.azure.kusto.ingestor.result.IngestionStatusInTableDescription;
import com.microsoft.azure.kusto.ingestor.utils.Ensure;
import com.microsoft.azure.kusto.ingestor.utils.IngestionUtils;
import com.microsoft.azure.kusto.ingestor.utils.UriUtils;
import com.microsoft.azure.kusto.ingestor.utils.Utils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.text.TextStringBuilder;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * The property set of a single ingestion. Created fresh for every call by {@link IngestionPropertiesBuilder}
 * and never shared between calls.
 */
public class IngestionProperties {
    private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final String databaseName;
    private final String tableName;
    private boolean retainBlobOnSuccess;
    private IngestionReportLevel reportLevel;
    private IngestionReportMethod reportMethod;
    private IngestionStatusInTableDescription ingestionStatusInTable;
    private boolean flushImmediately;
    private boolean deleteSourceOnSuccess;
    private long rawDataSize;

    private DataFormat dataFormat;
    private IngestionMapping ingestionMapping;
    private String authorizationContext;
    private List<String> additionalTags;
    private List<String> ingestByTags;
    private List<String> dropByTags;
    private List<String> ingestIfNotExists;
    private boolean ignoreFirstRecord;
    private Instant creationTime;
    private ValidationPolicy validationPolicy;
    private Map<String, String> additionalProperties;

    private boolean shouldCompress;
    private String clientRequestId;

    private UUID sourceId;

    /**
     * Creates an initialized {@code IngestionProperties} instance with a given {@code databaseName} and {@code tableName}.
     * The default values of the rest of the properties are:
     * <blockquote>
     * <p>{@code retainBlobOnSuccess} : {@code true;}</p>
     * <p>{@code reportLevel} : {@code IngestionReportLevel.FAILURES_ONLY;}</p>
     * <p>{@code reportMethod} : {@code IngestionReportMethod.QUEUE;}</p>
     * <p>{@code dataFormat} : {@code null}, meaning unknown</p>
     * </blockquote>
     *
     * @param databaseName the name of the database in the destination Kusto cluster.
     * @param tableName    the name of the table in the destination database.
     */
    public IngestionProperties(String databaseName, String tableName) {
        this.databaseName = databaseName;
        this.tableName = tableName;
        this.retainBlobOnSuccess = true;
        this.reportLevel = IngestionReportLevel.FAILURES_ONLY;
        this.reportMethod = IngestionReportMethod.QUEUE;
        this.ingestionMapping = new IngestionMapping();
        this.additionalTags = new ArrayList<>();
        this.ingestByTags = new ArrayList<>();
        this.dropByTags = new ArrayList<>();
        this.ingestIfNotExists = new ArrayList<>();
        this.additionalProperties = new HashMap<>();
    }

    /**
     * Copy constructor for {@code IngestionProperties}.
     *
     * @param other the instance to copy from.
     */
    public IngestionProperties(IngestionProperties other) {
        this.databaseName = other.databaseName;
        this.tableName = other.tableName;
        this.retainBlobOnSuccess = other.retainBlobOnSuccess;
        this.reportLevel = other.reportLevel;
        this.reportMethod = other.reportMethod;
        this.ingestionStatusInTable = other.ingestionStatusInTable == null ? null : new IngestionStatusInTableDescription(other.ingestionStatusInTable);
        this.flushImmediately = other.flushImmediately;
        this.deleteSourceOnSuccess = other.deleteSourceOnSuccess;
        this.rawDataSize = other.rawDataSize;
        this.dataFormat = other.dataFormat;
        this.ingestionMapping = new IngestionMapping(other.ingestionMapping);
        this.authorizationContext = other.authorizationContext;
        this.additionalTags = new ArrayList<>(other.additionalTags);
        this.ingestByTags = new ArrayList<>(other.ingestByTags);
        this.dropByTags = new ArrayList<>(other.dropByTags);
        this.ingestIfNotExists = new ArrayList<>(other.ingestIfNotExists);
        this.ignoreFirstRecord = other.ignoreFirstRecord;
        this.creationTime = other.creationTime;
        this.validationPolicy = other.validationPolicy;
        this.additionalProperties = new HashMap<>(other.additionalProperties);
        this.shouldCompress = other.shouldCompress;
        this.clientRequestId = other.clientRequestId;
        this.sourceId = other.sourceId;
    }

    public String getDatabaseName() {
        return databaseName;
    }

    public String getTableName() {
        return tableName;
    }

    public boolean isRetainBlobOnSuccess() {
        return retainBlobOnSuccess;
    }

    public void setRetainBlobOnSuccess(boolean retainBlobOnSuccess) {
        this.retainBlobOnSuccess = retainBlobOnSuccess;
    }

    public IngestionReportLevel getReportLevel() {
        return reportLevel;
    }

    public void setReportLevel(IngestionReportLevel reportLevel) {
        this.reportLevel = reportLevel;
    }

    public IngestionReportMethod getReportMethod() {
        return reportMethod;
    }

    public void setReportMethod(IngestionReportMethod reportMethod) {
        this.reportMethod = reportMethod;
    }

    @Nullable
    public IngestionStatusInTableDescription getIngestionStatusInTable() {
        return ingestionStatusInTable;
    }

    public void setIngestionStatusInTable(IngestionStatusInTableDescription ingestionStatusInTable) {
        this.ingestionStatusInTable = ingestionStatusInTable;
    }

    public boolean getFlushImmediately() {
        return flushImmediately;
    }

    public void setFlushImmediately(boolean flushImmediately) {
        this.flushImmediately = flushImmediately;
    }

    public boolean isDeleteSourceOnSuccess() {
        return deleteSourceOnSuccess;
    }

    public void setDeleteSourceOnSuccess(boolean deleteSourceOnSuccess) {
        this.deleteSourceOnSuccess = deleteSourceOnSuccess;
    }

    /**
     * @return the uncompressed size of the data in bytes, or 0 if unknown
     */
    public long getRawDataSize() {
        return rawDataSize;
    }

    public void setRawDataSize(long rawDataSize) {
        this.rawDataSize = rawDataSize;
    }

    /**
     * @return the data format, or null if it is not known yet
     */
    @Nullable
    public DataFormat getDataFormat() {
        return dataFormat;
    }

    public void setDataFormat(DataFormat dataFormat) {
        Ensure.argIsNotNull(dataFormat, "dataFormat");
        this.dataFormat = dataFormat;
    }

    public IngestionMapping getIngestionMapping() {
        return ingestionMapping;
    }

    @Nullable
    public String getAuthorizationContext() {
        return authorizationContext;
    }

    public void setAuthorizationContext(String authorizationContext) {
        this.authorizationContext = authorizationContext;
    }

    public List<String> getAdditionalTags() {
        return additionalTags;
    }

    public List<String> getIngestByTags() {
        return ingestByTags;
    }

    /**
     * Drop-by tags are added to the ingested extents so they can later be dropped together.
     * This should be used with care - See <a href="https://docs.microsoft.com/en-us/azure/kusto/management/extents-overview#drop-by-extent-tags">kusto docs</a>
     */
    public List<String> getDropByTags() {
        return dropByTags;
    }

    /**
     * Ingestion is skipped when an extent already carries one of these ingest-by tags.
     */
    public List<String> getIngestIfNotExists() {
        return ingestIfNotExists;
    }

    public boolean isIgnoreFirstRecord() {
        return ignoreFirstRecord;
    }

    public void setIgnoreFirstRecord(boolean ignoreFirstRecord) {
        this.ignoreFirstRecord = ignoreFirstRecord;
    }

    @Nullable
    public Instant getCreationTime() {
        return creationTime;
    }

    public void setCreationTime(Instant creationTime) {
        this.creationTime = creationTime;
    }

    @Nullable
    public ValidationPolicy getValidationPolicy() {
        return validationPolicy;
    }

    public void setValidationPolicy(ValidationPolicy validationPolicy) {
        this.validationPolicy = validationPolicy;
    }

    public Map<String, String> getAdditionalProperties() {
        return additionalProperties;
    }

    public boolean isShouldCompress() {
        return shouldCompress;
    }

    public void setShouldCompress(boolean shouldCompress) {
        this.shouldCompress = shouldCompress;
    }

    @Nullable
    public String getClientRequestId() {
        return clientRequestId;
    }

    public void setClientRequestId(String clientRequestId) {
        this.clientRequestId = clientRequestId;
    }

    @Nullable
    public UUID getSourceId() {
        return sourceId;
    }

    public void setSourceId(UUID sourceId) {
        this.sourceId = sourceId;
    }

    boolean reportsToTable() {
        return reportMethod == IngestionReportMethod.TABLE || reportMethod == IngestionReportMethod.QUEUE_AND_TABLE;
    }

    /**
     * Flattens the properties the service reads from the {@code AdditionalProperties} bag of a queued ingestion message.
     */
    public Map<String, String> toAdditionalProperties() throws JsonProcessingException {
        ObjectMapper objectMapper = Utils.getObjectMapper();
        Map<String, String> fullAdditionalProperties = new HashMap<>();
        if (!dropByTags.isEmpty() || !ingestByTags.isEmpty() || !additionalTags.isEmpty()) {
            List<String> tags = new ArrayList<>(additionalTags);
            for (String t : ingestByTags) {
                tags.add(String.format("%s%s", "ingest-by:", t));
            }
            for (String t : dropByTags) {
                tags.add(String.format("%s%s", "drop-by:", t));
            }
            fullAdditionalProperties.put("tags", objectMapper.writeValueAsString(tags));
        }

        if (!ingestIfNotExists.isEmpty()) {
            fullAdditionalProperties.put("ingestIfNotExists", objectMapper.writeValueAsString(ingestIfNotExists));
        }
        if (ignoreFirstRecord) {
            fullAdditionalProperties.put("ignoreFirstRecord", "true");
        }
        if (creationTime != null) {
            fullAdditionalProperties.put("creationTime", creationTime.toString());
        }
        fullAdditionalProperties.putAll(additionalProperties);
        if (dataFormat != null) {
            fullAdditionalProperties.put("format", dataFormat.getKustoValue());
        }
        if (authorizationContext != null) {
            fullAdditionalProperties.put("authorizationContext", authorizationContext);
        }

        String mappingReference = ingestionMapping.getIngestionMappingReference();
        if (StringUtils.isNotBlank(mappingReference)) {
            fullAdditionalProperties.put("ingestionMappingReference", mappingReference);
            fullAdditionalProperties.put("ingestionMappingType", ingestionMapping.getIngestionMappingKind().getKustoValue());
        } else if (ingestionMapping.getColumnMappingsJson() != null) {
            fullAdditionalProperties.put("ingestionMapping", ingestionMapping.getColumnMappingsJson());
            fullAdditionalProperties.put("ingestionMappingType", ingestionMapping.getIngestionMappingKind().getKustoValue());
        }

        return fullAdditionalProperties;
    }

    /**
     * Validate the minimum non-empty values needed for data ingestion and mappings.
     * Format dependent checks are skipped while the format is still unknown.
     */
    void validate(String operation) {
        TextStringBuilder message = new TextStringBuilder();
        if (StringUtils.isBlank(databaseName)) {
            message.appendln("databaseName is blank.");
        }
        if (StringUtils.isBlank(tableName)) {
            message.appendln("tableName is blank.");
        }

        String mappingReference = ingestionMapping.getIngestionMappingReference();
        String columnMappings = ingestionMapping.getColumnMappingsJson();
        IngestionMapping.IngestionMappingKind ingestionMappingKind = ingestionMapping.getIngestionMappingKind();

        if (columnMappings == null && StringUtils.isBlank(mappingReference)) {
            if (dataFormat != null && dataFormat.isMappingRequired()) {
                message.appendln("Mapping must be specified for '%s' format.", dataFormat.getKustoValue());
            }
        } else {
            if (ingestionMappingKind == null) {
                message.appendln("A mapping was defined without an IngestionMappingKind.");
            } else if (dataFormat != null && !dataFormat.getIngestionMappingKind().equals(ingestionMappingKind)) {
                message.appendln("Wrong ingestion mapping for format '%s'; mapping kind should be '%s', but was '%s'.",
                        dataFormat.getKustoValue(), dataFormat.getIngestionMappingKind().getKustoValue(), ingestionMappingKind.getKustoValue());
            }

            if (columnMappings != null && StringUtils.isNotBlank(mappingReference)) {
                message.appendln("Both mapping reference '%s' and column mappings were defined.", mappingReference);
            }
        }

        if (!message.isEmpty()) {
            String messageStr = message.build();
            log.error("{}: {}", operation, messageStr);
            throw new IngestionArgumentException(operation, messageStr);
        }
    }

    public enum DataFormat {
        CSV("csv", IngestionMapping.IngestionMappingKind.CSV, false, true),
        TSV("tsv", IngestionMapping.IngestionMappingKind.CSV, false, true),
        SCSV("scsv", IngestionMapping.IngestionMappingKind.CSV, false, true),
        SOHSV("sohsv", IngestionMapping.IngestionMappingKind.CSV, false, true),
        PSV("psv", IngestionMapping.IngestionMappingKind.CSV, false, true),
        TXT("txt", IngestionMapping.IngestionMappingKind.CSV, false, true),
        TSVE("tsve", IngestionMapping.IngestionMappingKind.CSV, false, true),
        JSON("json", IngestionMapping.IngestionMappingKind.JSON, true, true),
        SINGLEJSON("singlejson", IngestionMapping.IngestionMappingKind.JSON, true, true),
        MULTIJSON("multijson", IngestionMapping.IngestionMappingKind.JSON, true, true),
        AVRO("avro", IngestionMapping.IngestionMappingKind.AVRO, true, false),
        APACHEAVRO("apacheavro", IngestionMapping.IngestionMappingKind.APACHEAVRO, false, true),
        PARQUET("parquet", IngestionMapping.IngestionMappingKind.PARQUET, false, false),
        SSTREAM("sstream", IngestionMapping.IngestionMappingKind.SSTREAM, false, true),
        ORC("orc", IngestionMapping.IngestionMappingKind.ORC, false, false),
        RAW("raw", IngestionMapping.IngestionMappingKind.CSV, false, true),
        W3CLOGFILE("w3clogfile", IngestionMapping.IngestionMappingKind.W3CLOGFILE, false, true);

        private final String kustoValue;
        private final IngestionMapping.IngestionMappingKind ingestionMappingKind;
        private final boolean mappingRequired;
        private final boolean compressible;

        DataFormat(String kustoValue, IngestionMapping.IngestionMappingKind ingestionMappingKind, boolean mappingRequired, boolean compressible) {
            this.kustoValue = kustoValue;
            this.ingestionMappingKind = ingestionMappingKind;
            this.mappingRequired = mappingRequired;
            this.compressible = compressible;
        }

        public String getKustoValue() {
            return kustoValue;
        }

        public IngestionMapping.IngestionMappingKind getIngestionMappingKind() {
            return ingestionMappingKind;
        }

        public boolean isMappingRequired() {
            return mappingRequired;
        }

        public boolean isCompressible() {
            return compressible;
        }

        /**
         * Infers the format from a file name or URL, ignoring a trailing {@code .gz} or {@code .zip},
         * e.g. {@code data.json.gz} is {@link #JSON}.
         *
         * @return the format, or null if the extension is not a known format
         */
        @Nullable
        public static DataFormat fromFileName(String fileName) {
            if (StringUtils.isBlank(fileName)) {
                return null;
            }

            String name = UriUtils.getFileNameFromPath(fileName);
            switch (IngestionUtils.getCompression(name)) {
                case GZ:
                    name = StringUtils.removeEndIgnoreCase(name, ".gz");
                    break;
                case ZIP:
                    name = StringUtils.removeEndIgnoreCase(name, ".zip");
                    break;
                default:
                    break;
            }

            int dot = name.lastIndexOf('.');
            if (dot < 0 || dot == name.length() - 1) {
                return null;
            }
            String extension = name.substring(dot + 1);
            for (DataFormat format : values()) {
                if (format.kustoValue.equalsIgnoreCase(extension)) {
                    return format;
                }
            }
            return null;
        }
    }

    public enum IngestionReportLevel {
        FAILURES_ONLY("FailuresOnly"),
        NONE("None"),
        FAILURES_AND_SUCCESSES("FailuresAndSuccesses");

        private final String kustoValue;

        IngestionReportLevel(String kustoValue) {
            this.kustoValue = kustoValue;
        }

        public String getKustoValue() {
            return kustoValue;
        }
    }

    public enum IngestionReportMethod {
        QUEUE("Queue"),
        TABLE("Table"),
        QUEUE_AND_TABLE("QueueAndTable");

        private final String kustoValue;

        IngestionReportMethod(String kustoValue) {
            this.kustoValue = kustoValue;
        }

        public String getKustoValue() {
            return kustoValue;
        }
    }
}

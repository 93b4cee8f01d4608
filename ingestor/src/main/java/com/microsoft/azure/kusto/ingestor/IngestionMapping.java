// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor;

/**
 * This class describes the ingestion mapping to use for an ingestion request.
 * A mapping is either a reference to a mapping pre-defined on the destination table, or an inline JSON
 * description of the column mappings, together with its kind.
 */
public class IngestionMapping {
    private IngestionMappingKind ingestionMappingKind;
    private String ingestionMappingReference;
    private String columnMappingsJson;

    /**
     * Creates a default ingestion mapping with null kind and empty mapping reference.
     */
    public IngestionMapping() {
    }

    /**
     * Copy constructor for IngestionMapping.
     *
     * @param other the instance to copy from
     */
    public IngestionMapping(IngestionMapping other) {
        this.ingestionMappingKind = other.ingestionMappingKind;
        this.ingestionMappingReference = other.ingestionMappingReference;
        this.columnMappingsJson = other.columnMappingsJson;
    }

    /**
     * @param ingestionMappingReference the name of the pre-defined ingestion mapping
     * @param ingestionMappingKind      the format of the source data to map from
     */
    public void setIngestionMappingReference(String ingestionMappingReference, IngestionMappingKind ingestionMappingKind) {
        this.ingestionMappingReference = ingestionMappingReference;
        this.ingestionMappingKind = ingestionMappingKind;
    }

    /**
     * Please use setIngestionMappingReference for production as passing the mapping every time is wasteful
     *
     * @param columnMappingsJson   a JSON array describing the column mappings
     * @param ingestionMappingKind the format of the source data to map from
     */
    public void setColumnMappings(String columnMappingsJson, IngestionMappingKind ingestionMappingKind) {
        this.columnMappingsJson = columnMappingsJson;
        this.ingestionMappingKind = ingestionMappingKind;
    }

    public IngestionMappingKind getIngestionMappingKind() {
        return ingestionMappingKind;
    }

    public String getIngestionMappingReference() {
        return ingestionMappingReference;
    }

    public String getColumnMappingsJson() {
        return columnMappingsJson;
    }

    /*
     * Represents an ingestion mapping kind - the format of the source data to map from.
     */
    public enum IngestionMappingKind {
        CSV("Csv"),
        JSON("Json"),
        AVRO("Avro"),
        PARQUET("Parquet"),
        SSTREAM("SStream"),
        ORC("Orc"),
        APACHEAVRO("ApacheAvro"),
        W3CLOGFILE("W3CLogFile");

        private final String kustoValue;

        IngestionMappingKind(String kustoValue) {
            this.kustoValue = kustoValue;
        }

        public String getKustoValue() {
            return kustoValue;
        }
    }
}

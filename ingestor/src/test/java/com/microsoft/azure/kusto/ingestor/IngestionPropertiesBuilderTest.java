// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor;

import com.microsoft.azure.kusto.ingestor.IngestionMapping.IngestionMappingKind;
import com.microsoft.azure.kusto.ingestor.IngestionProperties.DataFormat;
import com.microsoft.azure.kusto.ingestor.IngestionProperties.IngestionReportLevel;
import com.microsoft.azure.kusto.ingestor.IngestionProperties.IngestionReportMethod;
import com.microsoft.azure.kusto.ingestor.exceptions.IngestionArgumentException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IngestionPropertiesBuilderTest {
    private static final String OPERATION = "IngestionPropertiesBuilderTest";

    @Test
    void build_AppliesOptionsInOrder() {
        IngestionProperties props = IngestionPropertiesBuilder.build("db", "table", IngestionMode.QUEUED_FILE, OPERATION,
                IngestionOptions.fileFormat(DataFormat.CSV),
                IngestionOptions.fileFormat(DataFormat.PSV),
                IngestionOptions.flushImmediately());

        assertEquals(DataFormat.PSV, props.getDataFormat());
        assertTrue(props.getFlushImmediately());
        assertEquals("db", props.getDatabaseName());
        assertEquals("table", props.getTableName());
    }

    @Test
    void build_RetainBlobOnSuccessFollowsMode() {
        assertTrue(IngestionPropertiesBuilder.build("db", "table", IngestionMode.QUEUED_BLOB, OPERATION).isRetainBlobOnSuccess());
        assertFalse(IngestionPropertiesBuilder.build("db", "table", IngestionMode.STREAMING_FILE, OPERATION).isRetainBlobOnSuccess());
    }

    @ParameterizedTest
    @EnumSource(value = IngestionMode.class, names = {"QUEUED_FILE", "QUEUED_BLOB", "QUEUED_STREAM"})
    void build_StreamingOnlyOption_RejectedForQueuedModes(IngestionMode mode) {
        IngestionArgumentException e = assertThrows(IngestionArgumentException.class,
                () -> IngestionPropertiesBuilder.build("db", "table", mode, OPERATION, IngestionOptions.clientRequestId("request-1")));

        assertTrue(e.getMessage().contains("ClientRequestId"));
        assertEquals(OPERATION, e.getOperation());
    }

    @ParameterizedTest
    @EnumSource(value = IngestionMode.class, names = {"STREAMING_FILE", "STREAMING_STREAM"})
    void build_QueuedOnlyOptions_RejectedForStreamingModes(IngestionMode mode) {
        IngestionArgumentException e = assertThrows(IngestionArgumentException.class,
                () -> IngestionPropertiesBuilder.build("db", "table", mode, OPERATION,
                        IngestionOptions.ingestionMapping("[]", IngestionMappingKind.CSV),
                        IngestionOptions.reportResultToTable(),
                        IngestionOptions.fileFormat(DataFormat.CSV)));

        // Every unsupported option is reported at once
        assertTrue(e.getMessage().contains("IngestionMapping"));
        assertTrue(e.getMessage().contains("ReportResultToTable"));
        assertFalse(e.getMessage().contains("FileFormat"));
    }

    @Test
    void build_DeleteSource_OnlyForLocalFiles() {
        assertTrue(IngestionPropertiesBuilder.build("db", "table", IngestionMode.QUEUED_FILE, OPERATION, IngestionOptions.deleteSource())
                .isDeleteSourceOnSuccess());
        assertThrows(IngestionArgumentException.class,
                () -> IngestionPropertiesBuilder.build("db", "table", IngestionMode.QUEUED_BLOB, OPERATION, IngestionOptions.deleteSource()));
        assertThrows(IngestionArgumentException.class,
                () -> IngestionPropertiesBuilder.build("db", "table", IngestionMode.QUEUED_STREAM, OPERATION, IngestionOptions.deleteSource()));
    }

    @Test
    void build_NullOption_Throws() {
        assertThrows(IngestionArgumentException.class,
                () -> IngestionPropertiesBuilder.build("db", "table", IngestionMode.QUEUED_FILE, OPERATION, (IngestionOption) null));
    }

    @Test
    void build_MappingKindDoesNotMatchFormat_Throws() {
        IngestionArgumentException e = assertThrows(IngestionArgumentException.class,
                () -> IngestionPropertiesBuilder.build("db", "table", IngestionMode.QUEUED_FILE, OPERATION,
                        IngestionOptions.fileFormat(DataFormat.CSV),
                        IngestionOptions.ingestionMappingRef("JsonMapping", IngestionMappingKind.JSON)));

        assertTrue(e.getMessage().contains("Wrong ingestion mapping"));
    }

    @Test
    void build_MappingReferenceAndInlineMapping_Throws() {
        assertThrows(IngestionArgumentException.class,
                () -> IngestionPropertiesBuilder.build("db", "table", IngestionMode.QUEUED_FILE, OPERATION,
                        IngestionOptions.ingestionMappingRef("CsvMapping", IngestionMappingKind.CSV),
                        IngestionOptions.ingestionMapping("[{\"Column\":\"a\",\"Properties\":{\"Ordinal\":\"0\"}}]", IngestionMappingKind.CSV)));
    }

    @Test
    void build_FormatRequiringMappingWithoutOne_Throws() {
        assertThrows(IngestionArgumentException.class,
                () -> IngestionPropertiesBuilder.build("db", "table", IngestionMode.QUEUED_FILE, OPERATION, IngestionOptions.fileFormat(DataFormat.JSON)));
    }

    @Test
    void build_BlankTable_Throws() {
        assertThrows(IngestionArgumentException.class, () -> IngestionPropertiesBuilder.build("db", " ", IngestionMode.QUEUED_FILE, OPERATION));
    }

    @Test
    void reportResultToTable_SetsLevelAndMethod() {
        IngestionProperties props = IngestionPropertiesBuilder.build("db", "table", IngestionMode.QUEUED_STREAM, OPERATION,
                IngestionOptions.reportResultToTable());

        assertEquals(IngestionReportLevel.FAILURES_AND_SUCCESSES, props.getReportLevel());
        assertEquals(IngestionReportMethod.TABLE, props.getReportMethod());
    }

    @Test
    void optionFactories_RejectInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> IngestionOptions.fileFormat(null));
        assertThrows(IllegalArgumentException.class, () -> IngestionOptions.clientRequestId(""));
        assertThrows(IllegalArgumentException.class, () -> IngestionOptions.tags("a", " "));
    }
}

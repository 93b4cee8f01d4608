// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor.result;

import com.azure.data.tables.models.TableEntity;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class IngestionStatusTest {

    @Test
    void fromEntity_ReadsServiceColumns() {
        UUID sourceId = UUID.randomUUID();
        OffsetDateTime updatedOn = OffsetDateTime.of(2024, 1, 1, 12, 0, 0, 0, ZoneOffset.UTC);
        Map<String, Object> properties = new HashMap<>();
        properties.put("Status", "Failed");
        properties.put("IngestionSourceId", sourceId.toString());
        properties.put("IngestionSourcePath", "https://account1.blob.core.windows.net/container/data.csv.gz");
        properties.put("Database", "db");
        properties.put("Table", "table");
        properties.put("UpdatedOn", updatedOn);
        properties.put("ErrorCode", "BadRequest_EmptyBlob");
        properties.put("Details", "Blob is empty");
        TableEntity entity = new TableEntity(sourceId.toString(), new UUID(0L, 0L).toString()).setProperties(properties);

        IngestionStatus status = IngestionStatus.fromEntity(entity);

        assertEquals(OperationStatus.Failed, status.getStatus());
        assertEquals(sourceId, status.getIngestionSourceId());
        assertEquals("db", status.getDatabase());
        assertEquals("table", status.getTable());
        assertEquals(updatedOn.toInstant(), status.getUpdatedOn());
        assertEquals("BadRequest_EmptyBlob", status.getErrorCode());
        assertNull(status.getOperationId());
    }
}

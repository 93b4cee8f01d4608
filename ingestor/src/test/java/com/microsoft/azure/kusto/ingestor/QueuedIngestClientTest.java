// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor;

import com.microsoft.azure.kusto.ingestor.IngestionMapping.IngestionMappingKind;
import com.microsoft.azure.kusto.ingestor.IngestionProperties.DataFormat;
import com.microsoft.azure.kusto.ingestor.IngestionProperties.IngestionReportLevel;
import com.microsoft.azure.kusto.ingestor.exceptions.IngestionArgumentException;
import com.microsoft.azure.kusto.ingestor.exceptions.IngestionCancelledException;
import com.microsoft.azure.kusto.ingestor.exceptions.IngestionConfigurationException;
import com.microsoft.azure.kusto.ingestor.exceptions.IngestionServiceException;
import com.microsoft.azure.kusto.ingestor.resources.IngestionResourceManager;
import com.microsoft.azure.kusto.ingestor.result.IngestionResult;
import com.microsoft.azure.kusto.ingestor.result.IngestionStatus;
import com.microsoft.azure.kusto.ingestor.result.IngestionStatusInTableDescription;
import com.microsoft.azure.kusto.ingestor.result.OperationStatus;
import com.microsoft.azure.kusto.ingestor.staging.StagingClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class QueuedIngestClientTest {
    private static final String IDENTITY_TOKEN = "identityToken";
    private static final String STAGED_BLOB_URL = "https://account1.blob.core.windows.net/20240101-ingestdata/db__table__StreamUpload__0.csv.gz";
    private static final String BLOB_PATH = "https://account1.blob.core.windows.net/container/data.csv";

    private IngestionResourceManager resourceManagerMock;
    private StagingClient stagingClientMock;
    private QueuedIngestClient queuedIngestClient;
    private Path csvFile;

    @BeforeEach
    void setUp() {
        resourceManagerMock = mock(IngestionResourceManager.class);
        when(resourceManagerMock.getIdentityTokenAsync()).thenReturn(Mono.just(IDENTITY_TOKEN));
        when(resourceManagerMock.getResourcesAsync()).thenReturn(Mono.just(TestUtils.defaultResourceSet(true)));

        stagingClientMock = mock(StagingClient.class);
        when(stagingClientMock.uploadLocalFileAsync(any(Path.class), any(IngestionProperties.class))).thenReturn(Mono.empty());
        when(stagingClientMock.uploadBlobAsync(anyString(), anyLong(), any(IngestionProperties.class))).thenReturn(Mono.empty());
        when(stagingClientMock.uploadStreamAsync(any(InputStream.class), any(IngestionProperties.class))).thenReturn(Mono.just(STAGED_BLOB_URL));

        queuedIngestClient = new QueuedIngestClient(resourceManagerMock, stagingClientMock, "db", "table");
        csvFile = TestUtils.resourcePath("testdata/dataset.csv");
    }

    private IngestionProperties capturedFileProperties() {
        ArgumentCaptor<IngestionProperties> captor = ArgumentCaptor.forClass(IngestionProperties.class);
        verify(stagingClientMock).uploadLocalFileAsync(eq(csvFile), captor.capture());
        return captor.getValue();
    }

    @Test
    void ingestFromFile_LocalFile_StagesFileWithInferredFormat() {
        IngestionResult result = queuedIngestClient.ingestFromFile(csvFile.toString());

        IngestionProperties props = capturedFileProperties();
        assertEquals(DataFormat.CSV, props.getDataFormat());
        assertEquals(IDENTITY_TOKEN, props.getAuthorizationContext());
        assertTrue(props.isRetainBlobOnSuccess());
        assertNotNull(props.getSourceId());
        assertNull(props.getIngestionStatusInTable());
        verify(stagingClientMock, never()).uploadBlobAsync(anyString(), anyLong(), any(IngestionProperties.class));

        IngestionStatus status = result.getIngestionStatus();
        assertEquals(OperationStatus.Queued, status.getStatus());
        assertEquals(csvFile.toString(), status.getIngestionSourcePath());
        assertEquals(props.getSourceId(), status.getIngestionSourceId());
        assertEquals("db", status.getDatabase());
        assertEquals("table", status.getTable());
        assertTrue(result.isFinalized());
    }

    @Test
    void ingestFromFile_FileUri_IsTreatedAsLocal() {
        queuedIngestClient.ingestFromFile(csvFile.toUri().toString(), IngestionOptions.deleteSource());

        assertTrue(capturedFileProperties().isDeleteSourceOnSuccess());
    }

    @Test
    void ingestFromFile_BlobUrl_EnqueuesBlobWithoutStaging() {
        String blobUrl = BLOB_PATH + "?" + TestUtils.SAS;

        IngestionResult result = queuedIngestClient.ingestFromFile(blobUrl, IngestionOptions.rawDataSize(1024));

        ArgumentCaptor<IngestionProperties> captor = ArgumentCaptor.forClass(IngestionProperties.class);
        verify(stagingClientMock).uploadBlobAsync(eq(blobUrl), eq(1024L), captor.capture());
        verify(stagingClientMock, never()).uploadLocalFileAsync(any(Path.class), any(IngestionProperties.class));
        assertEquals(DataFormat.CSV, captor.getValue().getDataFormat());
        // The SAS never leaks into the result
        assertEquals(BLOB_PATH, result.getIngestionStatus().getIngestionSourcePath());
    }

    @Test
    void ingestFromFile_CompressedBlob_InfersInnerFormat() {
        String blobUrl = "https://account1.blob.core.windows.net/container/data.json.gz?" + TestUtils.SAS;

        queuedIngestClient.ingestFromFile(blobUrl, IngestionOptions.ingestionMappingRef("JsonMapping", IngestionMappingKind.JSON));

        ArgumentCaptor<IngestionProperties> captor = ArgumentCaptor.forClass(IngestionProperties.class);
        verify(stagingClientMock).uploadBlobAsync(eq(blobUrl), eq(0L), captor.capture());
        assertEquals(DataFormat.JSON, captor.getValue().getDataFormat());
        assertEquals("JsonMapping", captor.getValue().getIngestionMapping().getIngestionMappingReference());
    }

    @Test
    void ingestFromFile_ExplicitFormatWins() {
        queuedIngestClient.ingestFromFile(csvFile.toString(), IngestionOptions.fileFormat(DataFormat.PSV));

        assertEquals(DataFormat.PSV, capturedFileProperties().getDataFormat());
    }

    @Test
    void ingestFromFile_FormatCannotBeInferred_ThrowsBeforeAnyCall() {
        String blobUrl = "https://account1.blob.core.windows.net/container/data?" + TestUtils.SAS;

        assertThrows(IngestionArgumentException.class, () -> queuedIngestClient.ingestFromFile(blobUrl));

        verifyNoInteractions(stagingClientMock, resourceManagerMock);
    }

    @Test
    void ingestFromFile_StreamingOption_Rejected() {
        IngestionArgumentException e = assertThrows(IngestionArgumentException.class,
                () -> queuedIngestClient.ingestFromFile(csvFile.toString(), IngestionOptions.clientRequestId("request-1")));

        assertEquals("QueuedIngestClient.ingestFromFile", e.getOperation());
        verifyNoInteractions(stagingClientMock, resourceManagerMock);
    }

    @Test
    void ingestFromFile_UnknownPath_Throws() {
        assertThrows(IngestionArgumentException.class, () -> queuedIngestClient.ingestFromFile("/no/such/file.csv"));

        verifyNoInteractions(stagingClientMock);
    }

    @Test
    void ingestFromStream_WithoutFormat_ThrowsWithoutStaging() {
        InputStream stream = new ByteArrayInputStream("a,b".getBytes(StandardCharsets.UTF_8));

        assertThrows(IngestionArgumentException.class, () -> queuedIngestClient.ingestFromStream(stream));

        verifyNoInteractions(stagingClientMock);
    }

    @Test
    void ingestFromStream_ReturnsStagedBlobAsSource() {
        InputStream stream = new ByteArrayInputStream("a,b".getBytes(StandardCharsets.UTF_8));

        IngestionResult result = queuedIngestClient.ingestFromStream(stream, IngestionOptions.fileFormat(DataFormat.CSV));

        verify(stagingClientMock).uploadStreamAsync(eq(stream), any(IngestionProperties.class));
        assertEquals(STAGED_BLOB_URL, result.getIngestionStatus().getIngestionSourcePath());
        assertEquals(OperationStatus.Queued, result.getIngestionStatus().getStatus());
    }

    @Test
    void ingestFromFile_ReportToTable_SetsStatusTableEntryAndPending() {
        UUID sourceId = UUID.randomUUID();

        IngestionResult result = queuedIngestClient.ingestFromFile(csvFile.toString(),
                IngestionOptions.reportResultToTable(), IngestionOptions.sourceId(sourceId));

        IngestionStatusInTableDescription description = capturedFileProperties().getIngestionStatusInTable();
        assertNotNull(description);
        assertEquals(sourceId.toString(), description.getPartitionKey());
        assertEquals("00000000-0000-0000-0000-000000000000", description.getRowKey());
        assertEquals(TestUtils.tableUrl("account1", "ingestionsstatus20240101"), description.getTableConnectionString());

        assertEquals(OperationStatus.Pending, result.getIngestionStatus().getStatus());
        assertNotNull(result.getTableStatusHint());
        assertEquals(sourceId.toString(), result.getTableStatusHint().getPartitionKey());
    }

    @Test
    void ingestFromFile_ReportToTableWithoutStatusTable_ThrowsConfigurationError() {
        when(resourceManagerMock.getResourcesAsync()).thenReturn(Mono.just(TestUtils.defaultResourceSet(false)));

        assertThrows(IngestionConfigurationException.class,
                () -> queuedIngestClient.ingestFromFile(csvFile.toString(), IngestionOptions.reportResultToTable()));

        verifyNoInteractions(stagingClientMock);
    }

    @Test
    void ingestFromFile_ReportLevelNone_AssignsNoSourceId() {
        IngestionResult result = queuedIngestClient.ingestFromFile(csvFile.toString(), IngestionOptions.reportLevel(IngestionReportLevel.NONE));

        assertNull(capturedFileProperties().getSourceId());
        assertEquals(OperationStatus.Queued, result.getIngestionStatus().getStatus());
    }

    @Test
    void ingestFromFile_PreCancelledContext_FailsBeforeAnyCall() {
        IngestionContext context = IngestionContext.create();
        context.cancel();

        assertThrows(IngestionCancelledException.class, () -> queuedIngestClient.ingestFromFile(context, csvFile.toString()));

        verifyNoInteractions(stagingClientMock, resourceManagerMock);
    }

    @Test
    void ingestFromFile_CancelledWhileStaging_FailsWithCancellation() {
        when(stagingClientMock.uploadLocalFileAsync(any(Path.class), any(IngestionProperties.class))).thenReturn(Mono.never());
        IngestionContext context = IngestionContext.create();

        StepVerifier.create(queuedIngestClient.ingestFromFileAsync(context, csvFile.toString()))
                .expectSubscription()
                .then(context::cancel)
                .expectError(IngestionCancelledException.class)
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void ingestFromFile_StagingServiceError_PropagatesUnmodified() {
        IngestionServiceException failure = new IngestionServiceException("AzureStorageStagingClient.uploadLocalFile", "file", "queue unavailable", null);
        when(stagingClientMock.uploadLocalFileAsync(any(Path.class), any(IngestionProperties.class))).thenReturn(Mono.error(failure));

        StepVerifier.create(queuedIngestClient.ingestFromFileAsync(csvFile.toString()))
                .expectErrorMatches(e -> e == failure)
                .verify();
    }

    @Test
    void ingestFromFile_UnexpectedError_WrappedWithOperation() {
        RuntimeException cause = new RuntimeException("unexpected");
        when(stagingClientMock.uploadLocalFileAsync(any(Path.class), any(IngestionProperties.class))).thenReturn(Mono.error(cause));

        IngestionServiceException e = assertThrows(IngestionServiceException.class, () -> queuedIngestClient.ingestFromFile(csvFile.toString()));

        assertSame(cause, e.getCause());
        assertEquals("QueuedIngestClient.ingestFromFile", e.getOperation());
    }
}

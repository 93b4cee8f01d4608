// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor.resources;

import com.microsoft.azure.kusto.ingestor.KustoClient;
import com.microsoft.azure.kusto.ingestor.TestUtils;
import com.microsoft.azure.kusto.ingestor.exceptions.IngestionClientException;
import com.microsoft.azure.kusto.ingestor.exceptions.IngestionServiceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ResourceManagerTest {
    private static final String AUTH_TOKEN = "AuthenticationToken";

    private KustoClient clientMock;
    private ResourceManager resourceManager;

    @BeforeEach
    void setUp() {
        clientMock = mock(KustoClient.class);
        when(clientMock.getClusterUrl()).thenReturn("https://ingest-cluster.kusto.windows.net");
        when(clientMock.executeMgmtAsync(ResourceManager.IDENTITY_GET_COMMAND))
                .thenReturn(Mono.just(Collections.singletonList(Collections.singletonList(AUTH_TOKEN))));
        resourceManager = new ResourceManager(clientMock, null);
    }

    static List<List<String>> generateIngestionResourcesResult(int containers) {
        List<List<String>> rows = new ArrayList<>();
        for (int i = 0; i < containers; i++) {
            rows.add(Arrays.asList("TempStorage", TestUtils.containerUrl("storage" + i, "20240101-ingestdata")));
        }
        rows.add(Arrays.asList("SecuredReadyForAggregationQueue", TestUtils.queueUrl("storage0", "readyforaggregation-secured")));
        rows.add(Arrays.asList("FailedIngestionsQueue", TestUtils.queueUrl("storage0", "failedingestions")));
        rows.add(Arrays.asList("SuccessfulIngestionsQueue", TestUtils.queueUrl("storage0", "successfulingestions")));
        rows.add(Arrays.asList("IngestionsStatusTable", TestUtils.tableUrl("storage0", "ingestionsstatus20240101")));
        rows.add(Arrays.asList("SomeFutureResourceType", "https://storage0.blob.core.windows.net/other"));
        return rows;
    }

    @Test
    void getResources_ParsesKnownResourceTypes() {
        when(clientMock.executeMgmtAsync(ResourceManager.INGESTION_RESOURCES_SHOW_COMMAND))
                .thenReturn(Mono.just(generateIngestionResourcesResult(2)));

        IngestionResourceSet resources = resourceManager.getResourcesAsync().block();

        assertNotNull(resources);
        assertEquals(2, resources.getContainers().size());
        assertEquals(1, resources.getQueues().size());
        assertEquals(1, resources.getStatusTables().size());
        assertEquals("https://storage0.queue.core.windows.net/readyforaggregation-secured", resources.getQueues().get(0).getEndpointWithoutSas());
        assertEquals("?" + TestUtils.SAS, resources.getContainers().get(0).getSas());
        assertEquals(TestUtils.tableUrl("storage0", "ingestionsstatus20240101"), resources.getStatusTables().get(0).getUrl());
    }

    @Test
    void getResources_LoadsOnceAndCaches() {
        when(clientMock.executeMgmtAsync(ResourceManager.INGESTION_RESOURCES_SHOW_COMMAND))
                .thenReturn(Mono.just(generateIngestionResourcesResult(1)));

        IngestionResourceSet first = resourceManager.getResourcesAsync().block();
        IngestionResourceSet second = resourceManager.getResourcesAsync().block();

        assertSame(first, second);
        verify(clientMock, times(1)).executeMgmtAsync(ResourceManager.INGESTION_RESOURCES_SHOW_COMMAND);
    }

    @Test
    void refresh_SwapsWholeSnapshot() {
        when(clientMock.executeMgmtAsync(ResourceManager.INGESTION_RESOURCES_SHOW_COMMAND))
                .thenReturn(Mono.just(generateIngestionResourcesResult(1)), Mono.just(generateIngestionResourcesResult(3)));

        IngestionResourceSet before = resourceManager.getResourcesAsync().block();
        resourceManager.refresh().block();
        IngestionResourceSet after = resourceManager.getResourcesAsync().block();

        assertNotNull(before);
        assertNotNull(after);
        assertEquals(1, before.getContainers().size());
        assertEquals(3, after.getContainers().size());
    }

    @Test
    void getIdentityToken_ReturnsFirstCell() {
        StepVerifier.create(resourceManager.getIdentityTokenAsync())
                .expectNext(AUTH_TOKEN)
                .verifyComplete();
    }

    @Test
    void getIdentityToken_EmptyResult_ThrowsServiceException() {
        when(clientMock.executeMgmtAsync(ResourceManager.IDENTITY_GET_COMMAND)).thenReturn(Mono.just(Collections.emptyList()));

        StepVerifier.create(resourceManager.getIdentityTokenAsync())
                .expectError(IngestionServiceException.class)
                .verify();
    }

    @Test
    void getResources_CommandFails_ThrowsServiceExceptionWithCause() {
        RuntimeException cause = new RuntimeException("management endpoint unavailable");
        when(clientMock.executeMgmtAsync(ResourceManager.INGESTION_RESOURCES_SHOW_COMMAND)).thenReturn(Mono.error(cause));

        StepVerifier.create(resourceManager.getResourcesAsync())
                .expectErrorMatches(e -> e instanceof IngestionServiceException && e.getCause() == cause)
                .verify();
    }

    @Test
    void getResources_UrlWithoutSas_ThrowsClientException() {
        List<List<String>> rows = Collections.singletonList(Arrays.asList("TempStorage", "https://storage0.blob.core.windows.net/container"));
        when(clientMock.executeMgmtAsync(ResourceManager.INGESTION_RESOURCES_SHOW_COMMAND)).thenReturn(Mono.just(rows));

        StepVerifier.create(resourceManager.getResourcesAsync())
                .expectError(IngestionClientException.class)
                .verify();
    }

    @Test
    void getResources_ConcurrentFirstReaders_ShareOneLoad() throws Exception {
        Sinks.One<List<List<String>>> rows = Sinks.one();
        when(clientMock.executeMgmtAsync(ResourceManager.INGESTION_RESOURCES_SHOW_COMMAND)).thenReturn(rows.asMono());
        Sinks.One<List<List<String>>> tokenRows = Sinks.one();
        when(clientMock.executeMgmtAsync(ResourceManager.IDENTITY_GET_COMMAND)).thenReturn(tokenRows.asMono());

        int readers = 50;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(16);
        try {
            List<Future<CompletableFuture<IngestionResourceSet>>> resourceReads = new ArrayList<>();
            List<Future<CompletableFuture<String>>> tokenReads = new ArrayList<>();
            for (int i = 0; i < readers; i++) {
                resourceReads.add(pool.submit(() -> {
                    start.await();
                    return resourceManager.getResourcesAsync().toFuture();
                }));
                tokenReads.add(pool.submit(() -> {
                    start.await();
                    return resourceManager.getIdentityTokenAsync().toFuture();
                }));
            }
            start.countDown();

            // Every reader has subscribed before the load completes
            List<CompletableFuture<IngestionResourceSet>> resourceResults = new ArrayList<>();
            for (Future<CompletableFuture<IngestionResourceSet>> read : resourceReads) {
                resourceResults.add(read.get(10, TimeUnit.SECONDS));
            }
            List<CompletableFuture<String>> tokenResults = new ArrayList<>();
            for (Future<CompletableFuture<String>> read : tokenReads) {
                tokenResults.add(read.get(10, TimeUnit.SECONDS));
            }
            rows.tryEmitValue(generateIngestionResourcesResult(1));
            tokenRows.tryEmitValue(Collections.singletonList(Collections.singletonList(AUTH_TOKEN)));

            Set<IngestionResourceSet> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
            for (CompletableFuture<IngestionResourceSet> result : resourceResults) {
                distinct.add(result.get(10, TimeUnit.SECONDS));
            }
            for (CompletableFuture<String> result : tokenResults) {
                assertEquals(AUTH_TOKEN, result.get(10, TimeUnit.SECONDS));
            }

            assertEquals(1, distinct.size());
            verify(clientMock, times(1)).executeMgmtAsync(ResourceManager.INGESTION_RESOURCES_SHOW_COMMAND);
            verify(clientMock, times(1)).executeMgmtAsync(ResourceManager.IDENTITY_GET_COMMAND);
            assertSame(distinct.iterator().next(), resourceManager.getResourcesAsync().block());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void getResources_FailedLoadIsRetriedByNextReader() {
        when(clientMock.executeMgmtAsync(ResourceManager.INGESTION_RESOURCES_SHOW_COMMAND))
                .thenReturn(Mono.error(new RuntimeException("unavailable")), Mono.just(generateIngestionResourcesResult(1)));

        StepVerifier.create(resourceManager.getResourcesAsync())
                .expectError(IngestionServiceException.class)
                .verify();
        IngestionResourceSet resources = resourceManager.getResourcesAsync().block();

        assertNotNull(resources);
        verify(clientMock, times(2)).executeMgmtAsync(ResourceManager.INGESTION_RESOURCES_SHOW_COMMAND);
    }
}

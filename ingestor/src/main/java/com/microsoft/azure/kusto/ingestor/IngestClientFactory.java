// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor;

import com.azure.core.http.HttpClient;
import com.microsoft.azure.kusto.ingestor.http.HttpClientFactory;
import com.microsoft.azure.kusto.ingestor.http.HttpClientProperties;
import com.microsoft.azure.kusto.ingestor.resources.IngestionResourceManager;
import com.microsoft.azure.kusto.ingestor.resources.ResourceManager;
import com.microsoft.azure.kusto.ingestor.resources.ResourceManagerCache;
import com.microsoft.azure.kusto.ingestor.staging.AzureStorageStagingClient;
import com.microsoft.azure.kusto.ingestor.streaming.HttpStreamingConnection;
import com.microsoft.azure.kusto.ingestor.utils.Ensure;
import org.jetbrains.annotations.Nullable;

import java.io.Closeable;
import java.io.IOException;

/**
 * Creates ingestion clients. All clients created for the same {@link KustoClient} instance share one
 * {@link ResourceManager}, and all clients share one pooled HTTP client.
 */
public class IngestClientFactory implements Closeable {
    private final HttpClient httpClient;
    private final ResourceManagerCache resourceManagers;

    /**
     * Creates a factory with default http client properties.
     */
    public IngestClientFactory() {
        this((HttpClientProperties) null);
    }

    /**
     * @param properties additional properties to configure the http client, or null for the defaults
     */
    public IngestClientFactory(@Nullable HttpClientProperties properties) {
        this(HttpClientFactory.create(properties));
    }

    public IngestClientFactory(HttpClient httpClient) {
        Ensure.argIsNotNull(httpClient, "httpClient");
        this.httpClient = httpClient;
        this.resourceManagers = new ResourceManagerCache(client -> new ResourceManager(client, httpClient));
    }

    IngestClientFactory(HttpClient httpClient, ResourceManagerCache resourceManagers) {
        this.httpClient = httpClient;
        this.resourceManagers = resourceManagers;
    }

    /**
     * Creates a new queued ingest client.
     *
     * @param client the client of the cluster's data management endpoint
     * @return a new queued ingest client
     */
    public QueuedIngestClient createQueuedClient(KustoClient client, String databaseName, String tableName) {
        IngestionResourceManager resourceManager = resourceManagers.getOrCreate(client);
        return new QueuedIngestClient(resourceManager, new AzureStorageStagingClient(resourceManager), databaseName, tableName);
    }

    /**
     * Creates a new streaming ingest client. Its connection is opened on the first write.
     *
     * @param client the client of the cluster's engine endpoint
     * @return a new streaming ingest client
     */
    public StreamingIngestClient createStreamingClient(KustoClient client, String databaseName, String tableName) {
        Ensure.argIsNotNull(client, "client");
        return new StreamingIngestClient(() -> new HttpStreamingConnection(client, httpClient), databaseName, tableName);
    }

    ResourceManagerCache getResourceManagers() {
        return resourceManagers;
    }

    @Override
    public void close() throws IOException {
        resourceManagers.close();
    }
}

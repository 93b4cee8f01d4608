package com.microsoft.azure.kusto.ingestor.resources;

import com.azure.core.http.HttpClient;
import com.azure.storage.queue.QueueAsyncClient;
import com.azure.storage.queue.QueueClientBuilder;
import com.microsoft.azure.kusto.ingestor.utils.UriUtils;
import org.jetbrains.annotations.Nullable;

import java.net.URISyntaxException;

/**
 * A queue the ingestion service reads staged blob notifications from.
 */
public class QueueWithSas implements ResourceWithSas<QueueAsyncClient> {
    private final String url;
    private final QueueAsyncClient queueAsyncClient;

    public QueueWithSas(String url, @Nullable HttpClient httpClient) throws URISyntaxException {
        String[] parts = UriUtils.getSasAndEndpointFromResourceURL(url);
        this.url = url;
        this.queueAsyncClient = new QueueClientBuilder()
                .endpoint(parts[0])
                .sasToken(parts[1])
                .httpClient(httpClient)
                .buildAsyncClient();
    }

    @Override
    public String getUrl() {
        return url;
    }

    @Override
    public String getEndpointWithoutSas() {
        return queueAsyncClient.getQueueUrl();
    }

    @Override
    public String getAccountName() {
        return queueAsyncClient.getAccountName();
    }

    @Override
    public QueueAsyncClient getResource() {
        return queueAsyncClient;
    }
}

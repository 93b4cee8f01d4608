package com.microsoft.azure.kusto.ingestor.resources;

import com.azure.core.http.HttpClient;
import com.azure.storage.blob.BlobContainerAsyncClient;
import com.azure.storage.blob.BlobContainerClientBuilder;
import com.microsoft.azure.kusto.ingestor.utils.UriUtils;
import org.jetbrains.annotations.Nullable;

import java.net.URISyntaxException;

/**
 * A temporary storage container that data is staged into before a queued ingestion is enqueued.
 */
public class ContainerWithSas implements ResourceWithSas<BlobContainerAsyncClient> {
    private final String url;
    private final String sas;
    private final BlobContainerAsyncClient asyncContainer;

    public ContainerWithSas(String url, @Nullable HttpClient httpClient) throws URISyntaxException {
        String[] parts = UriUtils.getSasAndEndpointFromResourceURL(url);
        this.url = url;
        this.sas = '?' + parts[1];
        this.asyncContainer = new BlobContainerClientBuilder()
                .endpoint(parts[0])
                .sasToken(parts[1])
                .httpClient(httpClient)
                .buildAsyncClient();
    }

    /**
     * @return the SAS token, including the leading '?', to append to the URL of a blob in this container
     */
    public String getSas() {
        return sas;
    }

    @Override
    public String getUrl() {
        return url;
    }

    @Override
    public String getEndpointWithoutSas() {
        return asyncContainer.getBlobContainerUrl();
    }

    @Override
    public String getAccountName() {
        return asyncContainer.getAccountName();
    }

    @Override
    public BlobContainerAsyncClient getResource() {
        return asyncContainer;
    }
}

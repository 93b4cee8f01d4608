package com.microsoft.azure.kusto.ingestor.resources;

/**
 * A storage resource handed out by the ingestion service, addressed by a URL carrying a SAS token.
 */
public interface ResourceWithSas<T> {
    /**
     * @return the full URL, SAS token included
     */
    String getUrl();

    String getEndpointWithoutSas();

    String getAccountName();

    T getResource();
}

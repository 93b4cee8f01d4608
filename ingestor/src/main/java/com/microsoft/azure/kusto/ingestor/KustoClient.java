// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * The backend client an ingestion client is created for. Resource managers are cached per instance of this
 * interface, compared by reference.
 */
public interface KustoClient {
    /**
     * @return the ingestion endpoint of the cluster, e.g. {@code https://ingest-mycluster.kusto.windows.net}
     */
    String getClusterUrl();

    /**
     * @return the value of the {@code Authorization} header for requests to the cluster
     */
    Mono<String> getAuthorizationAsync();

    /**
     * Executes a management command.
     *
     * @return the rows of the primary result table, each row as its column values
     */
    Mono<List<List<String>>> executeMgmtAsync(String command);
}

// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor.resources;

import reactor.core.publisher.Mono;

/**
 * Supplies the storage resources and the identity token queued ingestion needs. One instance is shared by every
 * ingestion client created for the same backend client, see {@link ResourceManagerCache}.
 */
public interface IngestionResourceManager {
    Mono<IngestionResourceSet> getResourcesAsync();

    /**
     * @return the token the service uses to authorize the queued ingestion, sent as the authorization context
     */
    Mono<String> getIdentityTokenAsync();
}

// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor.resources;

import com.azure.core.http.HttpClient;
import com.microsoft.azure.kusto.ingestor.KustoClient;
import com.microsoft.azure.kusto.ingestor.exceptions.IngestionClientException;
import com.microsoft.azure.kusto.ingestor.exceptions.IngestionServiceException;
import com.microsoft.azure.kusto.ingestor.utils.Ensure;
import com.microsoft.azure.kusto.ingestor.utils.UriUtils;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.io.Closeable;
import java.lang.invoke.MethodHandles;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Discovers the ingestion resources and the identity token of a cluster through its management channel.
 * Both are loaded on first use and kept until {@link #refresh()} replaces them; scheduling refreshes is left to
 * the caller.
 */
public class ResourceManager implements IngestionResourceManager, Closeable {
    private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    static final String INGESTION_RESOURCES_SHOW_COMMAND = ".show ingestion resources";
    static final String IDENTITY_GET_COMMAND = ".get kusto identity token";

    private final KustoClient client;
    private final HttpClient httpClient;
    private final AtomicReference<IngestionResourceSet> resources = new AtomicReference<>();
    private final AtomicReference<String> identityToken = new AtomicReference<>();
    private final AtomicReference<Mono<IngestionResourceSet>> resourcesLoad = new AtomicReference<>();
    private final AtomicReference<Mono<String>> identityTokenLoad = new AtomicReference<>();

    public ResourceManager(KustoClient client, @Nullable HttpClient httpClient) {
        Ensure.argIsNotNull(client, "client");
        this.client = client;
        this.httpClient = httpClient;
    }

    enum ResourceType {
        SECURED_READY_FOR_AGGREGATION_QUEUE("SecuredReadyForAggregationQueue"),
        FAILED_INGESTIONS_QUEUE("FailedIngestionsQueue"),
        SUCCESSFUL_INGESTIONS_QUEUE("SuccessfulIngestionsQueue"),
        TEMP_STORAGE("TempStorage"),
        INGESTIONS_STATUS_TABLE("IngestionsStatusTable");

        private final String resourceTypeName;

        ResourceType(String resourceTypeName) {
            this.resourceTypeName = resourceTypeName;
        }

        @Nullable
        static ResourceType findByResourceTypeName(String resourceTypeName) {
            for (ResourceType resourceType : values()) {
                if (resourceType.resourceTypeName.equalsIgnoreCase(resourceTypeName)) {
                    return resourceType;
                }
            }
            return null;
        }
    }

    @Override
    public Mono<IngestionResourceSet> getResourcesAsync() {
        return Mono.defer(() -> loadOnce(resources, resourcesLoad, this::refreshResourcesAsync));
    }

    @Override
    public Mono<String> getIdentityTokenAsync() {
        return Mono.defer(() -> loadOnce(identityToken, identityTokenLoad, this::refreshIdentityTokenAsync));
    }

    /**
     * Returns the cached value, or joins the load in flight, starting one only when there is none. A load publishes
     * its value before it is unregistered, and a failed load is unregistered so the next reader starts over.
     */
    private static <T> Mono<T> loadOnce(AtomicReference<T> cached, AtomicReference<Mono<T>> inFlight, Supplier<Mono<T>> load) {
        while (true) {
            Mono<T> pending = inFlight.get();
            if (pending != null) {
                return pending;
            }
            T current = cached.get();
            if (current != null) {
                return Mono.just(current);
            }

            Mono<T> started = Mono.defer(load).doFinally(signal -> inFlight.set(null)).cache();
            if (inFlight.compareAndSet(null, started)) {
                return started;
            }
        }
    }

    /**
     * Reloads both the resource snapshot and the identity token. Readers keep seeing the previous snapshot until
     * the new one is published.
     */
    public Mono<Void> refresh() {
        return Mono.when(refreshResourcesAsync(), refreshIdentityTokenAsync());
    }

    private Mono<IngestionResourceSet> refreshResourcesAsync() {
        return client.executeMgmtAsync(INGESTION_RESOURCES_SHOW_COMMAND)
                .doOnSubscribe(ignored -> log.info("Refreshing Ingestion Resources"))
                .onErrorMap(e -> !(e instanceof IngestionClientException || e instanceof IngestionServiceException),
                        e -> new IngestionServiceException("ResourceManager.refreshIngestionResources", client.getClusterUrl(),
                                "Error refreshing IngestionResources. " + e.getMessage(), e))
                .map(this::parseResources)
                .doOnNext(newSet -> {
                    resources.set(newSet);
                    log.info("Refreshing Ingestion Resources Finished: {} queues, {} containers, {} status tables",
                            newSet.getQueues().size(), newSet.getContainers().size(), newSet.getStatusTables().size());
                });
    }

    private Mono<String> refreshIdentityTokenAsync() {
        return client.executeMgmtAsync(IDENTITY_GET_COMMAND)
                .doOnSubscribe(ignored -> log.info("Refreshing Ingestion Auth Token"))
                .onErrorMap(e -> !(e instanceof IngestionClientException || e instanceof IngestionServiceException),
                        e -> new IngestionServiceException("ResourceManager.refreshIngestionAuthToken", client.getClusterUrl(),
                                "Error refreshing IngestionAuthToken. " + e.getMessage(), e))
                .map(rows -> {
                    if (rows.isEmpty() || rows.get(0).isEmpty() || StringUtils.isBlank(rows.get(0).get(0))) {
                        throw new IngestionServiceException("ResourceManager.refreshIngestionAuthToken", client.getClusterUrl(),
                                "The cluster returned no identity token.", (Throwable) null);
                    }
                    return rows.get(0).get(0);
                })
                .doOnNext(token -> {
                    identityToken.set(token);
                    log.info("Refreshing Ingestion Auth Token Finished");
                });
    }

    private IngestionResourceSet parseResources(List<List<String>> rows) {
        List<QueueWithSas> queues = new ArrayList<>();
        List<ContainerWithSas> containers = new ArrayList<>();
        List<TableWithSas> statusTables = new ArrayList<>();

        for (List<String> row : rows) {
            if (row.size() < 2) {
                throw new IngestionClientException("Malformed ingestion resources row: " + row.size() + " columns");
            }
            String resourceTypeName = row.get(0);
            String storageUrl = row.get(1);
            ResourceType resourceType = ResourceType.findByResourceTypeName(resourceTypeName);
            if (resourceType == null) {
                log.debug("Ignoring unknown ingestion resource type '{}'", resourceTypeName);
                continue;
            }

            try {
                switch (resourceType) {
                    case TEMP_STORAGE:
                        containers.add(new ContainerWithSas(storageUrl, httpClient));
                        break;
                    case INGESTIONS_STATUS_TABLE:
                        statusTables.add(new TableWithSas(storageUrl, httpClient));
                        break;
                    case SECURED_READY_FOR_AGGREGATION_QUEUE:
                        queues.add(new QueueWithSas(storageUrl, httpClient));
                        break;
                    default:
                        // Success and failure notification queues are not read by this client
                        break;
                }
            } catch (URISyntaxException e) {
                throw new IngestionClientException("ResourceManager.refreshIngestionResources", UriUtils.removeSecretsFromUrl(storageUrl),
                        "Could not parse the URL of ingestion resource " + resourceTypeName, e);
            }
        }

        return new IngestionResourceSet(queues, containers, statusTables);
    }

    @Override
    public void close() {
        resources.set(null);
        identityToken.set(null);
        resourcesLoad.set(null);
        identityTokenLoad.set(null);
    }
}

// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor.resources;

import com.microsoft.azure.kusto.ingestor.KustoClient;
import com.microsoft.azure.kusto.ingestor.utils.Ensure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Hands out one {@link IngestionResourceManager} per {@link KustoClient} instance, so that every ingestion client
 * created for the same backend client shares its discovered resources.
 * <p>
 * Lookups read a published, never mutated, snapshot map without locking. A miss takes the lock, checks again and
 * publishes a copy of the map with the new entry, so the factory runs at most once per client even under
 * concurrent first use. Entries live as long as the cache.
 */
public class ResourceManagerCache implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final Function<KustoClient, IngestionResourceManager> factory;
    private final Object lock = new Object();
    private volatile Map<KustoClient, IngestionResourceManager> managers = Collections.emptyMap();

    public ResourceManagerCache(Function<KustoClient, IngestionResourceManager> factory) {
        Ensure.argIsNotNull(factory, "factory");
        this.factory = factory;
    }

    public IngestionResourceManager getOrCreate(KustoClient client) {
        Ensure.argIsNotNull(client, "client");

        IngestionResourceManager manager = managers.get(client);
        if (manager != null) {
            return manager;
        }

        synchronized (lock) {
            manager = managers.get(client);
            if (manager != null) {
                return manager;
            }

            manager = factory.apply(client);
            Ensure.argIsNotNull(manager, "factory returned a null resource manager");
            Map<KustoClient, IngestionResourceManager> updated = new IdentityHashMap<>(managers);
            updated.put(client, manager);
            managers = updated;
            log.info("Created resource manager for cluster {}", client.getClusterUrl());
            return manager;
        }
    }

    public int size() {
        return managers.size();
    }

    /**
     * Closes every cached manager that is {@link Closeable} and empties the cache. The first failure is rethrown
     * after all managers were closed.
     */
    @Override
    public void close() throws IOException {
        List<IngestionResourceManager> toClose;
        synchronized (lock) {
            toClose = new ArrayList<>(managers.values());
            managers = Collections.emptyMap();
        }

        IOException failure = null;
        for (IngestionResourceManager manager : toClose) {
            if (manager instanceof Closeable) {
                try {
                    ((Closeable) manager).close();
                } catch (IOException e) {
                    log.warn("Failed to close resource manager: {}", e.getMessage());
                    if (failure == null) {
                        failure = e;
                    } else {
                        failure.addSuppressed(e);
                    }
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}

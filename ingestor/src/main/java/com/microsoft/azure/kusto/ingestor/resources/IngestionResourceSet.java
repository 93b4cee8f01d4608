// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor.resources;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An immutable snapshot of the storage resources discovered for one cluster. Refreshing replaces the whole
 * snapshot, so readers always see a consistent set.
 */
public final class IngestionResourceSet {
    private final List<QueueWithSas> queues;
    private final List<ContainerWithSas> containers;
    private final List<TableWithSas> statusTables;

    public IngestionResourceSet(List<QueueWithSas> queues, List<ContainerWithSas> containers, List<TableWithSas> statusTables) {
        this.queues = Collections.unmodifiableList(new ArrayList<>(queues));
        this.containers = Collections.unmodifiableList(new ArrayList<>(containers));
        this.statusTables = Collections.unmodifiableList(new ArrayList<>(statusTables));
    }

    public List<QueueWithSas> getQueues() {
        return queues;
    }

    public List<ContainerWithSas> getContainers() {
        return containers;
    }

    public List<TableWithSas> getStatusTables() {
        return statusTables;
    }
}

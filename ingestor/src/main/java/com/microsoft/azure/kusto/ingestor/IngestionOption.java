// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor;

import java.util.Set;

/**
 * A single setting applied to the {@link IngestionProperties} of one ingestion call.
 * Instances are created through {@link IngestionOptions}.
 */
public interface IngestionOption {
    String getName();

    /**
     * @return the modes this option may be used with; using it with any other mode is an argument error
     */
    Set<IngestionMode> getSupportedModes();

    void apply(IngestionProperties properties);
}

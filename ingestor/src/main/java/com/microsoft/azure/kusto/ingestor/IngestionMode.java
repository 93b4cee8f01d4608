// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * The transport and source kind of an ingestion call. Options declare the modes they apply to.
 */
public enum IngestionMode {
    QUEUED_FILE,
    QUEUED_BLOB,
    QUEUED_STREAM,
    STREAMING_FILE,
    STREAMING_STREAM;

    public static final Set<IngestionMode> ALL = Collections.unmodifiableSet(EnumSet.allOf(IngestionMode.class));
    public static final Set<IngestionMode> QUEUED = Collections.unmodifiableSet(EnumSet.of(QUEUED_FILE, QUEUED_BLOB, QUEUED_STREAM));
    public static final Set<IngestionMode> STREAMING = Collections.unmodifiableSet(EnumSet.of(STREAMING_FILE, STREAMING_STREAM));

    public boolean isQueued() {
        return QUEUED.contains(this);
    }
}

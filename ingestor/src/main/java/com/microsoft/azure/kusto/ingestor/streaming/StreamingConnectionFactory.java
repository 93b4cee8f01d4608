// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor.streaming;

/**
 * Creates the {@link StreamingConnection} of a streaming client on its first write.
 */
@FunctionalInterface
public interface StreamingConnectionFactory {
    StreamingConnection create();
}

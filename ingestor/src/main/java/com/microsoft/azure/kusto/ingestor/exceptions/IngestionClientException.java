// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor.exceptions;

import com.azure.core.exception.AzureException;

/**
 * An error originating on the client side of an ingestion: bad arguments, missing configuration or local I/O.
 */
public class IngestionClientException extends AzureException {
    private String ingestionSource;
    private String operation;

    public String getIngestionSource() {
        return ingestionSource;
    }

    /**
     * @return the entry point that raised this error, e.g. {@code QueuedIngestClient.ingestFromFile}, or null if unknown
     */
    public String getOperation() {
        return operation;
    }

    public IngestionClientException(String message) {
        super(message);
    }

    public IngestionClientException(String message, Throwable throwable) {
        super(message, throwable);
    }

    public IngestionClientException(String operation, String ingestionSource, String message, Throwable throwable) {
        this(message, throwable);
        this.operation = operation;
        this.ingestionSource = ingestionSource;
    }
}

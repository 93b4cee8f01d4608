// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor.exceptions;

import com.azure.core.exception.AzureException;
import org.jetbrains.annotations.Nullable;

/**
 * A failure reported by, or while talking to, a backend service: blob staging, queue posting or a streaming write.
 */
public class IngestionServiceException extends AzureException {
    private String ingestionSource;
    private String operation;
    private Integer statusCode;

    public String getIngestionSource() {
        return ingestionSource;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * @return the HTTP status code returned by the service, or null when the failure was not an HTTP response
     */
    @Nullable
    public Integer getStatusCode() {
        return statusCode;
    }

    public IngestionServiceException(String message) {
        super(message);
    }

    public IngestionServiceException(String message, Throwable throwable) {
        super(message, throwable);
    }

    public IngestionServiceException(String operation, String ingestionSource, String message, Throwable throwable) {
        this(message, throwable);
        this.operation = operation;
        this.ingestionSource = ingestionSource;
    }

    public IngestionServiceException(String operation, String ingestionSource, String message, @Nullable Integer statusCode, Throwable throwable) {
        this(operation, ingestionSource, message, throwable);
        this.statusCode = statusCode;
    }
}

// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor.exceptions;

/**
 * The caller cancelled the ingestion, or its deadline passed, before it completed.
 * Extends {@link IngestionServiceException} so callers can handle it together with transport failures.
 */
public class IngestionCancelledException extends IngestionServiceException {
    private final boolean deadlineExceeded;

    public IngestionCancelledException(String operation, String message, boolean deadlineExceeded) {
        super(operation, null, message, (Throwable) null);
        this.deadlineExceeded = deadlineExceeded;
    }

    public boolean isDeadlineExceeded() {
        return deadlineExceeded;
    }
}

// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor.exceptions;

/**
 * An invalid, missing or mode-inapplicable argument. Always raised before any I/O is performed.
 */
public class IngestionArgumentException extends IngestionClientException {
    public IngestionArgumentException(String message) {
        super(message);
    }

    public IngestionArgumentException(String operation, String message) {
        super(operation, null, message, null);
    }
}

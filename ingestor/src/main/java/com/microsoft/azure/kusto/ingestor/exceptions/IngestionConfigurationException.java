// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor.exceptions;

/**
 * A backend resource required by the requested ingestion settings was not discovered, e.g. reporting to a status
 * table on a cluster that exposes none.
 */
public class IngestionConfigurationException extends IngestionClientException {
    public IngestionConfigurationException(String operation, String message) {
        super(operation, null, message, null);
    }
}

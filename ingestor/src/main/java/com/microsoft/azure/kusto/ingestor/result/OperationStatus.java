// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor.result;

/**
 * The state of an ingestion, as reported locally or by the service in the status table.
 */
public enum OperationStatus {
    /** Tracked in the status table, and the service has not finished it yet. */
    Pending,
    Succeeded,
    Failed,
    /** Handed to the service's queue; no further status is available locally. */
    Queued,
    Skipped,
    PartiallySucceeded
}

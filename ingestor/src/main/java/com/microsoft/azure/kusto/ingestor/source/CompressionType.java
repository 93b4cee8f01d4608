// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor.source;

public enum CompressionType {
    /** Readable and neither gzip nor zip. */
    NONE,
    /** The source could not be inspected. */
    UNKNOWN,
    GZ,
    ZIP
}

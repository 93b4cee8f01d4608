// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor.result;

import com.azure.data.tables.TableAsyncClient;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.microsoft.azure.kusto.ingestor.resources.TableWithSas;

import java.net.URISyntaxException;

/**
 * Locates the status table entry the service updates for one ingestion.
 */
public class IngestionStatusInTableDescription {
    @JsonProperty("TableConnectionString")
    private String tableConnectionString;

    @JsonProperty("PartitionKey")
    private String partitionKey;

    @JsonProperty("RowKey")
    private String rowKey;

    @JsonIgnore
    private transient TableAsyncClient tableAsyncClient;

    public IngestionStatusInTableDescription() {
    }

    public IngestionStatusInTableDescription(IngestionStatusInTableDescription other) {
        this.tableConnectionString = other.tableConnectionString;
        this.partitionKey = other.partitionKey;
        this.rowKey = other.rowKey;
        this.tableAsyncClient = other.tableAsyncClient;
    }

    public String getTableConnectionString() {
        return this.tableConnectionString;
    }

    public void setTableConnectionString(String tableConnectionString) {
        this.tableConnectionString = tableConnectionString;
    }

    public String getPartitionKey() {
        return partitionKey;
    }

    public void setPartitionKey(String partitionKey) {
        this.partitionKey = partitionKey;
    }

    public String getRowKey() {
        return rowKey;
    }

    public void setRowKey(String rowKey) {
        this.rowKey = rowKey;
    }

    /**
     * @return a client for the status table, created from the connection string on first use
     * @throws URISyntaxException if the connection string is not a table URL with a SAS token
     */
    @JsonIgnore
    public TableAsyncClient getTableAsyncClient() throws URISyntaxException {
        if (tableAsyncClient == null) {
            tableAsyncClient = TableWithSas.createTableClientFromUrl(getTableConnectionString(), null);
        }
        return tableAsyncClient;
    }

    public void setAsyncTableClient(TableAsyncClient tableAsyncClient) {
        this.tableAsyncClient = tableAsyncClient;
    }
}

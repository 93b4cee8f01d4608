package com.microsoft.azure.kusto.ingestor.resources;

import com.azure.core.http.HttpClient;
import com.azure.data.tables.TableAsyncClient;
import com.azure.data.tables.TableClientBuilder;
import com.microsoft.azure.kusto.ingestor.utils.UriUtils;
import org.jetbrains.annotations.Nullable;

import java.net.URISyntaxException;

/**
 * A status table the ingestion service reports per-ingestion outcomes to.
 */
public class TableWithSas implements ResourceWithSas<TableAsyncClient> {
    private final String url;
    private final TableAsyncClient tableAsyncClient;

    public TableWithSas(String url, @Nullable HttpClient httpClient) throws URISyntaxException {
        this.url = url;
        this.tableAsyncClient = createTableClientFromUrl(url, httpClient);
    }

    @Override
    public String getUrl() {
        return url;
    }

    @Override
    public String getEndpointWithoutSas() {
        return tableAsyncClient.getTableEndpoint();
    }

    @Override
    public String getAccountName() {
        return tableAsyncClient.getAccountName();
    }

    @Override
    public TableAsyncClient getResource() {
        return tableAsyncClient;
    }

    public static TableAsyncClient createTableClientFromUrl(String url, @Nullable HttpClient httpClient) throws URISyntaxException {
        String[] parts = UriUtils.getSasAndEndpointFromResourceURL(url);
        int tableNameIndex = parts[0].lastIndexOf('/');
        String tableName = parts[0].substring(tableNameIndex + 1);
        return new TableClientBuilder()
                .endpoint(parts[0].substring(0, tableNameIndex))
                .sasToken(parts[1])
                .tableName(tableName)
                .httpClient(httpClient)
                .buildAsyncClient();
    }
}

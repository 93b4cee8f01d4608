// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor;

import com.microsoft.azure.kusto.ingestor.exceptions.IngestionArgumentException;
import com.microsoft.azure.kusto.ingestor.result.IngestionResult;
import com.microsoft.azure.kusto.ingestor.utils.Ensure;
import com.microsoft.azure.kusto.ingestor.utils.ExceptionUtils;
import com.microsoft.azure.kusto.ingestor.utils.UriUtils;
import reactor.core.publisher.Mono;

import java.io.InputStream;

public abstract class IngestClientBase implements Ingestor {
    protected final String databaseName;
    protected final String tableName;

    protected IngestClientBase(String databaseName, String tableName) {
        Ensure.stringIsNotBlank(databaseName, "databaseName is blank");
        Ensure.stringIsNotBlank(tableName, "tableName is blank");
        this.databaseName = databaseName;
        this.tableName = tableName;
    }

    protected abstract String getClientType();

    protected abstract Mono<IngestionResult> ingestFromFileAsyncImpl(IngestionContext context, String path, IngestionOption... options);

    protected abstract Mono<IngestionResult> ingestFromStreamAsyncImpl(IngestionContext context, InputStream stream, IngestionOption... options);

    public String getDatabaseName() {
        return databaseName;
    }

    public String getTableName() {
        return tableName;
    }

    @Override
    public IngestionResult ingestFromFile(IngestionContext context, String path, IngestionOption... options) {
        return ingestFromFileAsync(context, path, options).block();
    }

    @Override
    public IngestionResult ingestFromFile(String path, IngestionOption... options) {
        return ingestFromFile(IngestionContext.create(), path, options);
    }

    @Override
    public Mono<IngestionResult> ingestFromFileAsync(IngestionContext context, String path, IngestionOption... options) {
        String operation = getClientType().concat(".ingestFromFile");
        return Mono.defer(() -> {
            Ensure.argIsNotNull(context, "context");
            Ensure.stringIsNotBlank(path, "path is blank");
            context.throwIfCancelled(operation);
            return ingestFromFileAsyncImpl(context, path, options);
        }).onErrorMap(ExceptionUtils.toIngestionException(operation, path == null ? null : UriUtils.removeSecretsFromUrl(path)));
    }

    @Override
    public Mono<IngestionResult> ingestFromFileAsync(String path, IngestionOption... options) {
        return ingestFromFileAsync(IngestionContext.create(), path, options);
    }

    @Override
    public IngestionResult ingestFromStream(IngestionContext context, InputStream stream, IngestionOption... options) {
        return ingestFromStreamAsync(context, stream, options).block();
    }

    @Override
    public IngestionResult ingestFromStream(InputStream stream, IngestionOption... options) {
        return ingestFromStream(IngestionContext.create(), stream, options);
    }

    @Override
    public Mono<IngestionResult> ingestFromStreamAsync(IngestionContext context, InputStream stream, IngestionOption... options) {
        String operation = getClientType().concat(".ingestFromStream");
        return Mono.defer(() -> {
            Ensure.argIsNotNull(context, "context");
            Ensure.argIsNotNull(stream, "stream");
            context.throwIfCancelled(operation);
            return ingestFromStreamAsyncImpl(context, stream, options);
        }).onErrorMap(ExceptionUtils.toIngestionException(operation, null));
    }

    @Override
    public Mono<IngestionResult> ingestFromStreamAsync(InputStream stream, IngestionOption... options) {
        return ingestFromStreamAsync(IngestionContext.create(), stream, options);
    }

    /**
     * Fails when no format was set and none can be inferred from {@code path}, then re-checks the mapping against
     * the format.
     */
    static void resolveDataFormat(IngestionProperties properties, String path, String operation) {
        if (properties.getDataFormat() == null) {
            IngestionProperties.DataFormat inferred = IngestionProperties.DataFormat.fromFileName(path);
            if (inferred == null) {
                throw new IngestionArgumentException(operation,
                        String.format("The data format of '%s' could not be inferred from its name; set it with the FileFormat option.",
                                UriUtils.removeSecretsFromUrl(path)));
            }
            properties.setDataFormat(inferred);
        }
        properties.validate(operation);
    }

    static void requireDataFormat(IngestionProperties properties, String operation) {
        if (properties.getDataFormat() == null) {
            throw new IngestionArgumentException(operation, "The data format of a stream must be set with the FileFormat option.");
        }
    }
}

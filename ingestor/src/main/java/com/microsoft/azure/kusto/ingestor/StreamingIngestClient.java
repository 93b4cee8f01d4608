// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor;

import com.microsoft.azure.kusto.ingestor.IngestionProperties.DataFormat;
import com.microsoft.azure.kusto.ingestor.exceptions.IngestionArgumentException;
import com.microsoft.azure.kusto.ingestor.result.IngestionResult;
import com.microsoft.azure.kusto.ingestor.result.OperationStatus;
import com.microsoft.azure.kusto.ingestor.source.CompressionType;
import com.microsoft.azure.kusto.ingestor.streaming.StreamingConnection;
import com.microsoft.azure.kusto.ingestor.streaming.StreamingConnectionFactory;
import com.microsoft.azure.kusto.ingestor.utils.Ensure;
import com.microsoft.azure.kusto.ingestor.utils.ExceptionUtils;
import com.microsoft.azure.kusto.ingestor.utils.GzipCompressingInputStream;
import com.microsoft.azure.kusto.ingestor.utils.IngestionUtils;
import com.microsoft.azure.kusto.ingestor.utils.UncloseableStream;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.lang.invoke.MethodHandles;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Streaming ingestion: the data is gzip-compressed on the fly and written straight into the table over a
 * {@link StreamingConnection}, so a returned result means the data was ingested. Accepts local files and streams
 * only. Payloads of 4 MiB and more are rejected by the service, and that rejection is surfaced as it is.
 */
public class StreamingIngestClient extends IngestClientBase {
    private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    static final String CLIENT_REQUEST_ID_PREFIX = "KI.executeStreamingIngest;";
    private static final String CLASS_NAME = StreamingIngestClient.class.getSimpleName();

    private final StreamingConnectionFactory connectionFactory;
    private final Object connectionLock = new Object();
    private volatile StreamingConnection connection;

    public StreamingIngestClient(StreamingConnectionFactory connectionFactory, String databaseName, String tableName) {
        super(databaseName, tableName);
        Ensure.argIsNotNull(connectionFactory, "connectionFactory");
        log.info("Creating a new StreamingIngestClient for {}.{}", databaseName, tableName);
        this.connectionFactory = connectionFactory;
    }

    @Override
    protected String getClientType() {
        return CLASS_NAME;
    }

    @Override
    protected Mono<IngestionResult> ingestFromFileAsyncImpl(IngestionContext context, String path, IngestionOption... options) {
        String operation = CLASS_NAME.concat(".ingestFromFile");
        if (!IngestionUtils.isLocalPath(path)) {
            throw new IngestionArgumentException(operation, "Streaming ingestion accepts local files only; ingest blobs with a queued client.");
        }
        IngestionProperties properties = IngestionPropertiesBuilder.build(databaseName, tableName, IngestionMode.STREAMING_FILE, operation, options);
        resolveDataFormat(properties, path, operation);
        Path file = IngestionUtils.toLocalPath(path);

        return Mono.fromCallable(() -> IngestionUtils.detectCompression(file))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(compression -> {
                    if (compression == CompressionType.ZIP) {
                        return Mono.error(new IngestionArgumentException(operation,
                                String.format("'%s' is a zip archive; streaming ingestion accepts uncompressed or gzip data only.", path)));
                    }
                    properties.setShouldCompress(compression != CompressionType.GZ);
                    return Mono.using(() -> Files.newInputStream(file),
                            data -> streamImpl(context, data, properties, file.toString(), operation),
                            StreamingIngestClient::closeQuietly)
                            .subscribeOn(Schedulers.boundedElastic());
                });
    }

    @Override
    protected Mono<IngestionResult> ingestFromStreamAsyncImpl(IngestionContext context, InputStream stream, IngestionOption... options) {
        String operation = CLASS_NAME.concat(".ingestFromStream");
        IngestionProperties properties = IngestionPropertiesBuilder.build(databaseName, tableName, IngestionMode.STREAMING_STREAM, operation, options);
        requireDataFormat(properties, operation);
        properties.setShouldCompress(true);

        return streamImpl(context, stream, properties, null, operation);
    }

    /**
     * Writes a small, already formatted payload.
     *
     * @param mappingName the name of a mapping pre-defined on the table, or null
     */
    public IngestionResult stream(IngestionContext context, byte[] payload, DataFormat format, @Nullable String mappingName) {
        return streamAsync(context, payload, format, mappingName).block();
    }

    public Mono<IngestionResult> streamAsync(IngestionContext context, byte[] payload, DataFormat format, @Nullable String mappingName) {
        String operation = CLASS_NAME.concat(".stream");
        return Mono.defer(() -> {
            Ensure.argIsNotNull(context, "context");
            Ensure.argIsNotNull(payload, "payload");
            Ensure.argIsNotNull(format, "format");
            context.throwIfCancelled(operation);

            List<IngestionOption> options = new ArrayList<>();
            options.add(IngestionOptions.fileFormat(format));
            if (StringUtils.isNotBlank(mappingName)) {
                options.add(IngestionOptions.ingestionMappingRef(mappingName, format.getIngestionMappingKind()));
            }
            IngestionProperties properties = IngestionPropertiesBuilder.build(databaseName, tableName, IngestionMode.STREAMING_STREAM, operation,
                    options.toArray(new IngestionOption[0]));
            properties.setShouldCompress(true);

            return streamImpl(context, new ByteArrayInputStream(payload), properties, null, operation);
        }).onErrorMap(ExceptionUtils.toIngestionException(operation, null));
    }

    private Mono<IngestionResult> streamImpl(IngestionContext context, InputStream data, IngestionProperties properties, @Nullable String sourcePath,
            String operation) {
        String requestId = properties.getClientRequestId() != null
                ? properties.getClientRequestId()
                : CLIENT_REQUEST_ID_PREFIX + UUID.randomUUID();
        String mappingRef = properties.getIngestionMapping().getIngestionMappingReference();

        Mono<Void> write;
        if (properties.isShouldCompress()) {
            // The caller owns the source, the compressor only owns its deflater
            write = Mono.using(() -> new GzipCompressingInputStream(new UncloseableStream(data)),
                    payload -> writeAsync(payload, properties, mappingRef, requestId),
                    StreamingIngestClient::closeQuietly);
        } else {
            write = writeAsync(data, properties, mappingRef, requestId);
        }

        return context.bind(write, operation)
                .then(Mono.fromCallable(() -> {
                    IngestionResult result = new IngestionResult(properties, sourcePath);
                    result.finalizeStatus(OperationStatus.Succeeded);
                    log.debug("Streaming ingestion into {}.{} succeeded, request id {}", databaseName, tableName, requestId);
                    return result;
                }));
    }

    private Mono<Void> writeAsync(InputStream payload, IngestionProperties properties, @Nullable String mappingRef, String requestId) {
        return Mono.defer(() -> getConnection().writeAsync(databaseName, tableName, payload, properties.getDataFormat(), mappingRef, requestId));
    }

    StreamingConnection getConnection() {
        StreamingConnection current = connection;
        if (current != null) {
            return current;
        }

        synchronized (connectionLock) {
            if (connection == null) {
                StreamingConnection created = connectionFactory.create();
                Ensure.argIsNotNull(created, "connection factory returned a null connection");
                connection = created;
                log.info("Opened streaming connection for {}.{}", databaseName, tableName);
            }
            return connection;
        }
    }

    private static void closeQuietly(Closeable closeable) {
        try {
            closeable.close();
        } catch (IOException e) {
            log.warn("Failed to close ingestion source stream: {}", e.getMessage());
        }
    }

    @Override
    public void close() throws IOException {
        StreamingConnection current;
        synchronized (connectionLock) {
            current = connection;
            connection = null;
        }
        if (current instanceof Closeable) {
            ((Closeable) current).close();
        }
    }
}

// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor.streaming;

import com.azure.core.http.HttpClient;
import com.azure.core.http.HttpHeaderName;
import com.azure.core.http.HttpMethod;
import com.azure.core.http.HttpRequest;
import com.azure.core.http.HttpResponse;
import com.azure.core.util.BinaryData;
import com.microsoft.azure.kusto.ingestor.IngestionProperties.DataFormat;
import com.microsoft.azure.kusto.ingestor.KustoClient;
import com.microsoft.azure.kusto.ingestor.exceptions.IngestionServiceException;
import com.microsoft.azure.kusto.ingestor.utils.Ensure;
import com.microsoft.azure.kusto.ingestor.utils.ExceptionUtils;
import com.microsoft.azure.kusto.ingestor.utils.UncloseableStream;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.io.InputStream;
import java.lang.invoke.MethodHandles;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Writes streaming ingestion payloads to the cluster's {@code /v1/rest/ingest} endpoint over a shared azure-core
 * {@link HttpClient}, which pools its connections and is safe for concurrent use.
 */
public class HttpStreamingConnection implements StreamingConnection {
    private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    static final String STREAMING_INGEST_ENDPOINT = "%s/v1/rest/ingest/%s/%s?streamFormat=%s";
    static final String CLIENT_REQUEST_ID_HEADER = "x-ms-client-request-id";
    private static final String KUSTO_API_VERSION = "2019-02-13";
    private static final int MAX_ERROR_BODY_LENGTH = 1024;

    private final KustoClient client;
    private final HttpClient httpClient;

    public HttpStreamingConnection(KustoClient client, HttpClient httpClient) {
        Ensure.argIsNotNull(client, "client");
        Ensure.argIsNotNull(httpClient, "httpClient");
        this.client = client;
        this.httpClient = httpClient;
    }

    @Override
    public Mono<Void> writeAsync(String database, String table, InputStream payload, DataFormat format, String mappingRef, String requestId) {
        Ensure.stringIsNotBlank(database, "database is blank");
        Ensure.stringIsNotBlank(table, "table is blank");
        Ensure.argIsNotNull(payload, "payload");
        Ensure.argIsNotNull(format, "format");
        Ensure.stringIsNotBlank(requestId, "requestId is blank");

        String endpoint = buildEndpoint(database, table, format, mappingRef);
        String operation = "HttpStreamingConnection.write";

        return client.getAuthorizationAsync()
                .flatMap(authorization -> {
                    HttpRequest request = new HttpRequest(HttpMethod.POST, endpoint);
                    request.setHeader(HttpHeaderName.CONTENT_TYPE, "application/octet-stream");
                    request.setHeader(HttpHeaderName.CONTENT_ENCODING, "gzip");
                    request.setHeader(HttpHeaderName.ACCEPT, "application/json");
                    request.setHeader(HttpHeaderName.fromString("x-ms-version"), KUSTO_API_VERSION);
                    request.setHeader(HttpHeaderName.fromString(CLIENT_REQUEST_ID_HEADER), requestId);
                    request.setHeader(HttpHeaderName.AUTHORIZATION, authorization);
                    // The caller owns the payload stream
                    request.setBody(BinaryData.fromStream(new UncloseableStream(payload)));

                    log.debug("Streaming ingestion into {}.{}, request id {}", database, table, requestId);
                    return httpClient.send(request);
                })
                .flatMap(response -> handleResponse(response, endpoint, operation))
                .onErrorMap(ExceptionUtils.toIngestionException(operation, endpoint));
    }

    private static Mono<Void> handleResponse(HttpResponse response, String endpoint, String operation) {
        int statusCode = response.getStatusCode();
        if (statusCode < 400) {
            return response.getBody().then().doFinally(ignored -> response.close());
        }

        return response.getBodyAsString()
                .defaultIfEmpty("")
                .flatMap(body -> Mono.<Void>error(new IngestionServiceException(operation, endpoint,
                        String.format("Streaming ingestion failed with status %d: %s", statusCode, StringUtils.abbreviate(body, MAX_ERROR_BODY_LENGTH)),
                        statusCode, null)))
                .doFinally(ignored -> response.close());
    }

    String buildEndpoint(String database, String table, DataFormat format, String mappingRef) {
        String clusterUrl = StringUtils.removeEnd(client.getClusterUrl(), "/");
        String endpoint = String.format(STREAMING_INGEST_ENDPOINT, clusterUrl, encode(database), encode(table), format.getKustoValue());
        if (StringUtils.isNotEmpty(mappingRef)) {
            endpoint = endpoint.concat(String.format("&mappingName=%s", encode(mappingRef)));
        }
        return endpoint;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}

package com.microsoft.azure.kusto.ingestor.utils;

import com.azure.core.exception.HttpResponseException;
import com.microsoft.azure.kusto.ingestor.exceptions.IngestionClientException;
import com.microsoft.azure.kusto.ingestor.exceptions.IngestionServiceException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.function.Function;

public class ExceptionUtils {
    private ExceptionUtils() {
        // Hide constructor, as this is a static utility class
    }

    public static String getMessageEx(Throwable e) {
        return (e.getMessage() == null && e.getCause() != null) ? e.getCause().getMessage() : e.getMessage();
    }

    /**
     * Ingestion errors and argument errors pass through unmodified. Local I/O errors become
     * {@link IngestionClientException}; anything else, typically an SDK or transport error, becomes
     * {@link IngestionServiceException} carrying the HTTP status code when there is one.
     */
    public static Throwable toIngestionException(Throwable e, String operation, String ingestionSource) {
        if (e instanceof IngestionClientException || e instanceof IngestionServiceException || e instanceof IllegalArgumentException) {
            return e;
        }

        String message = String.format("%s failed: %s", operation, getMessageEx(e));
        if (e instanceof IOException || e instanceof UncheckedIOException) {
            return new IngestionClientException(operation, ingestionSource, message, e);
        }

        Integer statusCode = null;
        if (e instanceof HttpResponseException && ((HttpResponseException) e).getResponse() != null) {
            statusCode = ((HttpResponseException) e).getResponse().getStatusCode();
        }
        return new IngestionServiceException(operation, ingestionSource, message, statusCode, e);
    }

    public static Function<Throwable, Throwable> toIngestionException(String operation, String ingestionSource) {
        return e -> toIngestionException(e, operation, ingestionSource);
    }
}

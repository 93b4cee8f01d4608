package com.microsoft.azure.kusto.ingestor.utils;

import org.apache.commons.lang3.StringUtils;

import java.net.URI;
import java.net.URISyntaxException;

public class UriUtils {
    private UriUtils() {
        // Providing hidden constructor to hide default public constructor in utils class
    }

    public static String setPathForUri(String uri, String path) throws URISyntaxException {
        path = StringUtils.prependIfMissing(path, "/");

        URI baseUri = new URI(uri);
        URI newUri = new URI(
                baseUri.getScheme(),
                baseUri.getAuthority(),
                path,
                baseUri.getQuery(),
                baseUri.getFragment());
        return newUri.toString();
    }

    public static String appendPathToUri(String uri, String path) throws URISyntaxException {
        String existing = new URI(uri).getPath();
        return setPathForUri(uri, StringUtils.appendIfMissing(existing == null ? "" : existing, "/") + path);
    }

    /**
     * Splits a resource URL into its endpoint and SAS token.
     *
     * @return a two element array: the endpoint, then the SAS query without the leading '?'
     */
    public static String[] getSasAndEndpointFromResourceURL(String url) throws URISyntaxException {
        String[] parts = url.split("\\?");

        if (parts.length != 2) {
            throw new URISyntaxException(url, "URL is missing the required SAS query");
        }
        return parts;
    }

    /**
     * Strips the query string, which usually holds a SAS token, so the URL can be logged.
     */
    public static String removeSecretsFromUrl(String url) {
        int queryStart = url.indexOf('?');
        return queryStart < 0 ? url : url.substring(0, queryStart);
    }

    public static String getFileNameFromPath(String path) {
        if (path == null) {
            return null;
        }
        String withoutQuery = path.split("\\?")[0];
        int lastSeparator = Math.max(withoutQuery.lastIndexOf('/'), withoutQuery.lastIndexOf('\\'));
        return withoutQuery.substring(lastSeparator + 1);
    }
}

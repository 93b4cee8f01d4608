package com.microsoft.azure.kusto.ingestor.utils;

import org.apache.commons.lang3.StringUtils;

import java.net.URI;
import java.net.URISyntaxException;

public class Ensure {
    private Ensure() {
        // Static utility class
    }

    public static void stringIsNotBlank(String str, String message) {
        if (StringUtils.isBlank(str)) {
            throw new IllegalArgumentException(message);
        }
    }

    public static void argIsNotNull(Object arg, String message) {
        if (arg == null) {
            throw new IllegalArgumentException(message);
        }
    }

    public static void isTrue(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    public static URI validateAndCreateUri(String uri) {
        stringIsNotBlank(uri, "uri is blank");
        try {
            return new URI(uri);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("not a valid uri: " + uri, e);
        }
    }
}

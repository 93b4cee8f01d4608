package com.microsoft.azure.kusto.ingestor.utils;

import com.microsoft.azure.kusto.ingestor.exceptions.IngestionArgumentException;
import com.microsoft.azure.kusto.ingestor.source.CompressionType;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.lang.invoke.MethodHandles;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

public class IngestionUtils {
    private IngestionUtils() {
        // Hide the default constructor, since this is a utils class
    }

    private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private static final String HTTPS_PREFIX = "https://";
    private static final String FILE_SCHEME = "file";
    private static final byte[] GZIP_MAGIC = {(byte) 0x1f, (byte) 0x8b};
    private static final byte[] ZIP_MAGIC = {'P', 'K', 3, 4};

    /**
     * Classifies an ingestion path.
     *
     * @param path an {@code https://} blob URL, a {@code file:} URI or a filesystem path
     * @return true for local files, false for remote blob references
     * @throws IngestionArgumentException if the path is none of the above
     */
    public static boolean isLocalPath(String path) {
        Ensure.stringIsNotBlank(path, "path is blank");

        if (StringUtils.startsWithIgnoreCase(path, HTTPS_PREFIX)) {
            try {
                URI uri = new URI(path);
                if (StringUtils.isBlank(uri.getHost())) {
                    throw new IngestionArgumentException("blob URL has no host: " + UriUtils.removeSecretsFromUrl(path));
                }
            } catch (URISyntaxException e) {
                throw new IngestionArgumentException("not a valid blob URL: " + UriUtils.removeSecretsFromUrl(path));
            }
            return false;
        }

        if (StringUtils.startsWithIgnoreCase(path, FILE_SCHEME + ":")) {
            toLocalPath(path);
            return true;
        }

        try {
            if (Files.exists(Paths.get(path))) {
                return true;
            }
        } catch (InvalidPathException e) {
            log.debug("'{}' is not a valid filesystem path: {}", path, e.getMessage());
        }

        throw new IngestionArgumentException(String.format("path '%s' is neither an https blob URL nor an existing local file", path));
    }

    /**
     * Resolves a {@code file:} URI or plain filesystem path to a {@link Path}.
     */
    public static Path toLocalPath(String path) {
        if (StringUtils.startsWithIgnoreCase(path, FILE_SCHEME + ":")) {
            try {
                return Paths.get(new URI(path));
            } catch (URISyntaxException | IllegalArgumentException e) {
                throw new IngestionArgumentException("not a valid file URI: " + path);
            }
        }
        try {
            return Paths.get(path);
        } catch (InvalidPathException e) {
            throw new IngestionArgumentException("not a valid file path: " + path);
        }
    }

    /**
     * Decides the compression of a file by its extension, falling back to the gzip and zip magic bytes.
     *
     * @return {@link CompressionType#UNKNOWN} when the file cannot be read
     */
    public static CompressionType detectCompression(Path path) {
        CompressionType byName = getCompression(path.getFileName() == null ? path.toString() : path.getFileName().toString());
        if (byName != CompressionType.NONE) {
            return byName;
        }

        byte[] header;
        try (InputStream stream = Files.newInputStream(path)) {
            header = readBytesFromInputStream(stream, ZIP_MAGIC.length);
        } catch (IOException e) {
            log.debug("Could not read header of '{}' to detect compression: {}", path, e.getMessage());
            return CompressionType.UNKNOWN;
        }

        if (startsWith(header, GZIP_MAGIC)) {
            return CompressionType.GZ;
        }
        if (startsWith(header, ZIP_MAGIC)) {
            return CompressionType.ZIP;
        }
        return CompressionType.NONE;
    }

    public static CompressionType getCompression(String fileName) {
        String lower = fileName.toLowerCase();
        if (lower.endsWith(".gz")) {
            return CompressionType.GZ;
        }
        if (lower.endsWith(".zip")) {
            return CompressionType.ZIP;
        }
        return CompressionType.NONE;
    }

    public static byte[] readBytesFromInputStream(InputStream inputStream, int bytesToRead) throws IOException {
        byte[] data = new byte[bytesToRead];
        int offset = 0;
        int numBytesRead;
        while (offset < bytesToRead && (numBytesRead = inputStream.read(data, offset, bytesToRead - offset)) != -1) {
            offset += numBytesRead;
        }

        if (offset == bytesToRead) {
            return data;
        }
        byte[] truncated = new byte[offset];
        System.arraycopy(data, 0, truncated, 0, offset);
        return truncated;
    }

    private static boolean startsWith(byte[] data, byte[] prefix) {
        if (data.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (data[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}

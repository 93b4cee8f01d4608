package com.microsoft.azure.kusto.ingestor.http;

import com.azure.core.http.HttpClient;
import com.azure.core.http.HttpHeaderName;
import com.azure.core.util.Header;
import com.azure.core.util.HttpClientOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * A static factory for HTTP clients.
 */
public class HttpClientFactory {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpClientFactory.class);

    private HttpClientFactory() {
    }

    /**
     * Creates a new HTTP client.
     *
     * @param properties custom HTTP client properties, or null for the defaults
     * @return a new HTTP client
     */
    public static HttpClient create(HttpClientProperties properties) {
        LOGGER.info("Creating new HTTP Client");
        return HttpClient.createDefault(createOptions(properties));
    }

    static HttpClientOptions createOptions(HttpClientProperties properties) {
        HttpClientOptions options = new HttpClientOptions();
        if (properties == null) {
            return options;
        }

        options.setMaximumConnectionPoolSize(properties.maxConnectionTotal());
        options.setConnectionIdleTimeout(Duration.ofSeconds(properties.maxIdleTime()));
        options.setResponseTimeout(Duration.ofSeconds(properties.readTimeout()));

        if (properties.isKeepAlive()) {
            List<Header> headers = new ArrayList<>();
            headers.add(new Header(HttpHeaderName.CONNECTION.getCaseSensitiveName(), "Keep-Alive"));
            // Keep-Alive is not a standard request header, so azure-core has no name for it
            headers.add(new Header("Keep-Alive", "timeout=" + properties.maxKeepAliveTime()));
            options.setHeaders(headers);
        }

        if (properties.getProxy() != null) {
            options.setProxyOptions(properties.getProxy());
        }
        return options;
    }
}

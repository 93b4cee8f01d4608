package com.microsoft.azure.kusto.ingestor.http;

import com.azure.core.http.ProxyOptions;

/**
 * HTTP client settings for streaming ingestion. Timeouts are in seconds.
 */
public class HttpClientProperties {
    private final Integer maxIdleTime;
    private final boolean keepAlive;
    private final Integer maxKeepAliveTime;
    private final Integer maxConnectionTotal;
    private final ProxyOptions proxy;
    private final Integer readTimeout;

    private HttpClientProperties(HttpClientPropertiesBuilder builder) {
        this.maxIdleTime = builder.maxIdleTime;
        this.keepAlive = builder.keepAlive;
        this.maxKeepAliveTime = builder.maxKeepAliveTime;
        this.maxConnectionTotal = builder.maxConnectionsTotal;
        this.proxy = builder.proxy;
        this.readTimeout = builder.readTimeout;
    }

    /**
     * Instantiates a new builder.
     *
     * @return a new {@code HttpClientPropertiesBuilder}
     */
    public static HttpClientPropertiesBuilder builder() {
        return new HttpClientPropertiesBuilder();
    }

    /**
     * The time in seconds an idle pooled connection is kept before it is closed.
     *
     * @return the maximum idle time
     */
    public Integer maxIdleTime() {
        return maxIdleTime;
    }

    /**
     * The time in seconds to wait for the response of a streaming write.
     *
     * @return the read timeout
     */
    public Integer readTimeout() {
        return readTimeout;
    }

    public boolean isKeepAlive() {
        return keepAlive;
    }

    public Integer maxKeepAliveTime() {
        return maxKeepAliveTime;
    }

    public Integer maxConnectionTotal() {
        return maxConnectionTotal;
    }

    public ProxyOptions getProxy() {
        return proxy;
    }

    public static class HttpClientPropertiesBuilder {
        private Integer maxIdleTime = 120;
        private boolean keepAlive;
        private Integer maxKeepAliveTime = 120;
        private Integer readTimeout = 10 * 60;
        private Integer maxConnectionsTotal = 40;
        private ProxyOptions proxy = null;

        private HttpClientPropertiesBuilder() {
        }

        public HttpClientPropertiesBuilder maxIdleTime(Integer maxIdleTime) {
            this.maxIdleTime = maxIdleTime;
            return this;
        }

        /**
         * Asks the server to keep connections alive for {@link #maxKeepAliveTime(Integer)} seconds.
         * Servers are not obligated to honor it.
         */
        public HttpClientPropertiesBuilder keepAlive(boolean keepAlive) {
            this.keepAlive = keepAlive;
            return this;
        }

        public HttpClientPropertiesBuilder maxKeepAliveTime(Integer maxKeepAliveTime) {
            this.maxKeepAliveTime = maxKeepAliveTime;
            return this;
        }

        public HttpClientPropertiesBuilder readTimeout(Integer readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public HttpClientPropertiesBuilder maxConnectionsTotal(Integer maxConnectionsTotal) {
            this.maxConnectionsTotal = maxConnectionsTotal;
            return this;
        }

        public HttpClientPropertiesBuilder proxy(ProxyOptions proxy) {
            this.proxy = proxy;
            return this;
        }

        public HttpClientProperties build() {
            return new HttpClientProperties(this);
        }
    }
}

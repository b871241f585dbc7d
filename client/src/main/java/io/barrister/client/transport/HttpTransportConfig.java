package io.barrister.client.transport;

import java.time.Duration;
import java.util.Map;

import io.barrister.client.http.HttpClientBuilder;
import io.barrister.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Settings of an {@link HttpTransport}.
 */
public class HttpTransportConfig {

    private final HttpClientBuilder httpClientBuilder;
    private final Map<String, String> headers;
    private final @Nullable Duration timeout;

    public HttpTransportConfig(HttpClientBuilder httpClientBuilder, Map<String, String> headers, @Nullable Duration timeout) {
        Assert.checkNotNullParam("httpClientBuilder", httpClientBuilder);
        Assert.checkNotNullParam("headers", headers);
        this.httpClientBuilder = httpClientBuilder;
        this.headers = Map.copyOf(headers);
        this.timeout = timeout;
    }

    public HttpTransportConfig() {
        this(HttpClientBuilder.DEFAULT_FACTORY, Map.of(), null);
    }

    public HttpClientBuilder getHttpClientBuilder() {
        return httpClientBuilder;
    }

    /**
     * Returns the headers added to every request, besides {@code Content-Type}.
     *
     * @return the extra headers
     */
    public Map<String, String> getHeaders() {
        return headers;
    }

    /**
     * Returns the per-request timeout.
     *
     * @return the timeout, or {@code null} to wait indefinitely
     */
    public @Nullable Duration getTimeout() {
        return timeout;
    }
}

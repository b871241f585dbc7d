package io.barrister.client.transport;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import io.barrister.client.http.HttpClientBuilder;
import io.barrister.util.Assert;
import org.jspecify.annotations.Nullable;

public class HttpTransportConfigBuilder {

    private HttpClientBuilder httpClientBuilder = HttpClientBuilder.DEFAULT_FACTORY;
    private final Map<String, String> headers = new LinkedHashMap<>();
    private @Nullable Duration timeout;

    public HttpTransportConfigBuilder httpClientBuilder(HttpClientBuilder httpClientBuilder) {
        Assert.checkNotNullParam("httpClientBuilder", httpClientBuilder);
        this.httpClientBuilder = httpClientBuilder;

        return this;
    }

    public HttpTransportConfigBuilder header(String name, String value) {
        Assert.checkNotNullParam("name", name);
        Assert.checkNotNullParam("value", value);
        headers.put(name, value);

        return this;
    }

    public HttpTransportConfigBuilder timeout(Duration timeout) {
        Assert.checkNotNullParam("timeout", timeout);
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Parameter 'timeout' must be positive");
        }
        this.timeout = timeout;

        return this;
    }

    public HttpTransportConfig build() {
        return new HttpTransportConfig(httpClientBuilder, headers, timeout);
    }
}

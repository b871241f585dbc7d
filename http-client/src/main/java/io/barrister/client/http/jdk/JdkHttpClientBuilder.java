package io.barrister.client.http.jdk;

import java.time.Duration;

import io.barrister.client.http.HttpClient;
import io.barrister.client.http.HttpClientBuilder;
import org.jspecify.annotations.Nullable;

public class JdkHttpClientBuilder implements HttpClientBuilder {

    private @Nullable Duration connectTimeout;

    /**
     * Sets the connect timeout of the clients this builder creates.
     *
     * @param connectTimeout the timeout
     * @return this builder
     */
    public JdkHttpClientBuilder connectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
        return this;
    }

    @Override
    public HttpClient create(String url) {
        return new JdkHttpClient(url, connectTimeout);
    }
}

package io.barrister.client.transport;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.concurrent.ExecutionException;

import io.barrister.client.http.HttpClient;
import io.barrister.client.http.HttpClient.PostRequestBuilder;
import io.barrister.client.http.HttpResponse;
import io.barrister.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link Transport} that POSTs each payload to a single HTTP endpoint.
 * <p>
 * Requests are sent with {@code Content-Type: application/json}. A reply with a status
 * outside {@code 2xx} is a transport failure, whatever its body.
 */
public class HttpTransport implements Transport {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpTransport.class);

    static final String CONTENT_TYPE = "Content-Type";
    static final String APPLICATION_JSON = "application/json";

    private final String endpoint;
    private final String path;
    private final HttpClient httpClient;
    private final HttpTransportConfig config;

    public HttpTransport(String endpoint) {
        this(endpoint, new HttpTransportConfig());
    }

    public HttpTransport(String endpoint, HttpTransportConfig config) {
        Assert.checkNotNullParam("endpoint", endpoint);
        Assert.checkNotNullParam("config", config);
        URL url = parseEndpoint(endpoint);
        this.endpoint = endpoint;
        this.path = url.getFile().isEmpty() ? "/" : url.getFile();
        String baseUrl = url.getProtocol() + "://" + url.getAuthority();
        this.httpClient = config.getHttpClientBuilder().create(baseUrl);
        this.config = config;
    }

    private static URL parseEndpoint(String endpoint) {
        try {
            URL url = new URI(endpoint).toURL();
            if (url.getHost() == null || url.getHost().isEmpty()) {
                throw new IllegalArgumentException("Endpoint has no host: " + endpoint);
            }
            return url;
        } catch (URISyntaxException | MalformedURLException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid endpoint URL: " + endpoint, e);
        }
    }

    public String getEndpoint() {
        return endpoint;
    }

    @Override
    public byte[] send(byte[] request) throws IOException {
        PostRequestBuilder post = httpClient.post(path)
                .addHeader(CONTENT_TYPE, APPLICATION_JSON)
                .addHeaders(config.getHeaders())
                .body(request);
        if (config.getTimeout() != null) {
            post.timeout(config.getTimeout());
        }

        HttpResponse response;
        try {
            response = post.send().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for " + endpoint, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException ioe) {
                throw ioe;
            }
            throw new IOException("Request to " + endpoint + " failed: " + cause, cause);
        }

        if (!response.success()) {
            LOGGER.debug("Endpoint {} replied with HTTP {}", endpoint, response.statusCode());
            throw new IOException("Request to " + endpoint + " failed with HTTP status " + response.statusCode());
        }
        return response.body();
    }
}

package io.barrister.client.http.jdk;

import static java.net.HttpURLConnection.HTTP_FORBIDDEN;
import static java.net.HttpURLConnection.HTTP_UNAUTHORIZED;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.net.URLConnection;
import java.net.URLStreamHandler;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse.BodyHandlers;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

import io.barrister.client.http.HttpClient;
import io.barrister.client.http.HttpResponse;
import org.jspecify.annotations.Nullable;

class JdkHttpClient implements HttpClient {

    static final String AUTHENTICATION_FAILED = "Authentication failed: server returned 401 Unauthorized";
    static final String AUTHORIZATION_FAILED = "Authorization failed: server returned 403 Forbidden";

    private final java.net.http.HttpClient httpClient;
    private final String baseUrl;

    JdkHttpClient(String baseUrl) {
        this(baseUrl, null);
    }

    JdkHttpClient(String baseUrl, @Nullable Duration connectTimeout) {
        java.net.http.HttpClient.Builder builder = java.net.http.HttpClient.newBuilder()
                .version(java.net.http.HttpClient.Version.HTTP_1_1)
                .followRedirects(java.net.http.HttpClient.Redirect.NORMAL);
        if (connectTimeout != null) {
            builder.connectTimeout(connectTimeout);
        }
        this.httpClient = builder.build();

        URL targetUrl = buildUrl(baseUrl);
        this.baseUrl = targetUrl.getProtocol() + "://" + targetUrl.getAuthority();
    }

    String getBaseUrl() {
        return baseUrl;
    }

    private static final URLStreamHandler URL_HANDLER = new URLStreamHandler() {
        @Override
        protected @Nullable URLConnection openConnection(URL u) {
            return null;
        }
    };

    private static URL buildUrl(String uri) {
        try {
            return new URL(null, uri, URL_HANDLER);
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException("URI [" + uri + "] is not valid", e);
        }
    }

    @Override
    public PostRequestBuilder post(String path) {
        return new JdkPostRequestBuilder(path);
    }

    private class JdkPostRequestBuilder implements PostRequestBuilder {

        private final String path;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private byte[] body = new byte[0];
        private @Nullable Duration timeout;

        JdkPostRequestBuilder(String path) {
            this.path = path;
        }

        @Override
        public PostRequestBuilder addHeader(String name, String value) {
            headers.put(name, value);
            return this;
        }

        @Override
        public PostRequestBuilder addHeaders(Map<String, String> headers) {
            if (headers != null && !headers.isEmpty()) {
                for (Map.Entry<String, String> entry : headers.entrySet()) {
                    addHeader(entry.getKey(), entry.getValue());
                }
            }
            return this;
        }

        @Override
        public PostRequestBuilder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        @Override
        public PostRequestBuilder body(byte[] body) {
            this.body = body;
            return this;
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .POST(HttpRequest.BodyPublishers.ofByteArray(body));
            for (Map.Entry<String, String> headerEntry : headers.entrySet()) {
                builder.header(headerEntry.getKey(), headerEntry.getValue());
            }
            if (timeout != null) {
                builder.timeout(timeout);
            }
            return httpClient.sendAsync(builder.build(), BodyHandlers.ofByteArray()).thenCompose(RESPONSE_MAPPER);
        }
    }

    private static final Function<java.net.http.HttpResponse<byte[]>, CompletionStage<HttpResponse>> RESPONSE_MAPPER = response -> {
        if (response.statusCode() == HTTP_UNAUTHORIZED) {
            return CompletableFuture.failedStage(new IOException(AUTHENTICATION_FAILED));
        } else if (response.statusCode() == HTTP_FORBIDDEN) {
            return CompletableFuture.failedStage(new IOException(AUTHORIZATION_FAILED));
        }
        return CompletableFuture.completedFuture(new JdkHttpResponse(response));
    };

    private record JdkHttpResponse(java.net.http.HttpResponse<byte[]> response) implements HttpResponse {

        @Override
        public int statusCode() {
            return response.statusCode();
        }

        @Override
        public byte[] body() {
            return response.body();
        }
    }
}

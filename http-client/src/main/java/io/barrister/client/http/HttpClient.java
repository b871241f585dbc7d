package io.barrister.client.http;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A minimal HTTP client, bound to one base URL.
 * <p>
 * Barrister only needs to POST a JSON payload and read the reply, so the abstraction
 * exposes nothing else. Alternative implementations are plugged in through
 * {@link HttpClientBuilder}.
 */
public interface HttpClient {

    static HttpClient createHttpClient(String baseUrl) {
        return HttpClientBuilder.DEFAULT_FACTORY.create(baseUrl);
    }

    PostRequestBuilder post(String path);

    interface PostRequestBuilder {

        PostRequestBuilder addHeader(String name, String value);

        PostRequestBuilder addHeaders(Map<String, String> headers);

        PostRequestBuilder timeout(Duration timeout);

        PostRequestBuilder body(byte[] body);

        /**
         * Sends the request. The future fails with an {@link java.io.IOException} if the
         * exchange fails or the server rejects the credentials.
         *
         * @return the response
         */
        CompletableFuture<HttpResponse> send();

        default CompletableFuture<HttpResponse> send(byte[] body) {
            return body(body).send();
        }
    }
}

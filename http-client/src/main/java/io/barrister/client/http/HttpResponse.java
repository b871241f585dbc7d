package io.barrister.client.http;

import java.nio.charset.StandardCharsets;

public interface HttpResponse {

    int statusCode();

    default boolean success() {
        return statusCode() >= 200 && statusCode() < 300;
    }

    byte[] body();

    default String bodyAsString() {
        return new String(body(), StandardCharsets.UTF_8);
    }
}

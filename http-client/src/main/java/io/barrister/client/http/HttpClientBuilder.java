package io.barrister.client.http;

import io.barrister.client.http.jdk.JdkHttpClientBuilder;

public interface HttpClientBuilder {

    HttpClientBuilder DEFAULT_FACTORY = new JdkHttpClientBuilder();

    HttpClient create(String url);
}

package com.vectororm.orm.client;

import com.vectororm.common.serialization.MilvusResponseReader;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;

@RequiredArgsConstructor
public class MilvusRestClientFactory {

    private final WebClient.Builder webClientBuilder;
    private final MilvusResponseReader responseReader;
    private final int maxQueryWindow;

    /**
     * @param baseUri Milvus endpoint, e.g. {@code http://localhost:19530}
     * @param token bearer token, or {@code null}
     * @param database database name sent as {@code dbName}, or {@code null} for the server default
     */
    public MilvusRestClient create(URI baseUri, String token, String database) {
        WebClient.Builder builder = webClientBuilder.clone()
                .baseUrl(baseUri.toString());
        if (token != null && !token.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + token);
        }
        return new MilvusRestClient(builder.build(), responseReader, database, maxQueryWindow);
    }
}

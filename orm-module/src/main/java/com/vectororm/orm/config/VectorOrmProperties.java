package com.vectororm.orm.config;

import com.vectororm.common.client.VectorStoreClient;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Connection settings, keyed by alias:
 * <pre>
 * vector-orm:
 *   connections:
 *     default:
 *       uri: http://localhost:19530
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "vector-orm")
public class VectorOrmProperties {

    /**
     * TCP connect timeout in milliseconds.
     */
    @Min(1)
    private int connectionTimeout = 5000;

    /**
     * Response, read and write timeout in milliseconds.
     */
    @Min(1)
    private int readTimeout = 10000;

    /**
     * Largest number of rows one scalar query may return.
     */
    @Min(1)
    private int maxQueryWindow = VectorStoreClient.DEFAULT_MAX_QUERY_WINDOW;

    @NotNull
    @Valid
    private Map<String, Connection> connections = new LinkedHashMap<>();

    @Data
    public static class Connection {
        @NotBlank
        private String uri;
        private String token;
        private String database;
    }
}

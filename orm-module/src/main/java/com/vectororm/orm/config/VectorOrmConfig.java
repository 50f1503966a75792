package com.vectororm.orm.config;

import com.vectororm.common.serialization.MilvusResponseReader;
import com.vectororm.orm.client.MilvusRestClientFactory;
import com.vectororm.orm.connection.ConnectionRegistrar;
import com.vectororm.orm.connection.ConnectionRegistry;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Registers the connections declared under {@code vector-orm.connections}. Applications
 * may supply their own registry, response reader or client factory.
 */
@AutoConfiguration
@EnableConfigurationProperties(VectorOrmProperties.class)
public class VectorOrmConfig {

    @Bean
    @ConditionalOnMissingBean
    public ConnectionRegistry connectionRegistry() {
        return ConnectionRegistry.global();
    }

    @Bean
    @ConditionalOnMissingBean
    public MilvusResponseReader milvusResponseReader() {
        return new MilvusResponseReader();
    }

    @Bean
    @ConditionalOnMissingBean
    public MilvusRestClientFactory milvusRestClientFactory(VectorOrmProperties properties,
                                                           MilvusResponseReader milvusResponseReader) {
        return new MilvusRestClientFactory(vectorStoreWebClientBuilder(properties), milvusResponseReader,
                properties.getMaxQueryWindow());
    }

    @Bean
    public ConnectionRegistrar connectionRegistrar(VectorOrmProperties properties,
                                                   MilvusRestClientFactory milvusRestClientFactory,
                                                   ConnectionRegistry connectionRegistry) {
        return new ConnectionRegistrar(properties, milvusRestClientFactory, connectionRegistry);
    }

    // kept out of the context so an application's own WebClient.Builder is not replaced
    static WebClient.Builder vectorStoreWebClientBuilder(VectorOrmProperties properties) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, properties.getConnectionTimeout())
                .responseTimeout(Duration.ofMillis(properties.getReadTimeout()))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(properties.getReadTimeout(), TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(properties.getReadTimeout(), TimeUnit.MILLISECONDS)));

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(10 * 1024 * 1024));
    }
}

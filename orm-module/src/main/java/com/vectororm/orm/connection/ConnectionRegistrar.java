package com.vectororm.orm.connection;

import com.vectororm.orm.client.MilvusRestClientFactory;
import com.vectororm.orm.config.VectorOrmProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Registers a client for every configured alias on startup and removes them on shutdown.
 * Aliases registered by other code are left alone.
 */
@Slf4j
@RequiredArgsConstructor
public class ConnectionRegistrar implements InitializingBean, DisposableBean {

    private final VectorOrmProperties properties;
    private final MilvusRestClientFactory clientFactory;
    private final ConnectionRegistry registry;

    private final List<String> registered = new ArrayList<>();

    @Override
    public void afterPropertiesSet() {
        for (Map.Entry<String, VectorOrmProperties.Connection> entry : properties.getConnections().entrySet()) {
            String alias = entry.getKey();
            VectorOrmProperties.Connection connection = entry.getValue();
            URI uri = URI.create(connection.getUri());
            registry.register(alias, clientFactory.create(uri, connection.getToken(), connection.getDatabase()));
            registered.add(alias);
            log.info("Registered vector store connection '{}' at {}", alias, uri);
        }
    }

    @Override
    public void destroy() {
        for (String alias : registered) {
            registry.unregister(alias);
            log.info("Unregistered vector store connection '{}'", alias);
        }
        registered.clear();
    }

    public List<String> registeredAliases() {
        return List.copyOf(registered);
    }
}

package com.vectororm.orm.connection;

import com.vectororm.common.client.VectorStoreClient;
import com.vectororm.orm.exception.ConnectionNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide mapping from connection alias to client handle.
 * <p>
 * Entries are added and removed by whoever manages connections (see
 * {@code ConnectionRegistrar}); models and querysets only {@link #resolve(String)}.
 */
@Slf4j
public class ConnectionRegistry {

    public static final String DEFAULT_ALIAS = "default";

    private static final ConnectionRegistry GLOBAL = new ConnectionRegistry();

    private final Map<String, VectorStoreClient> clients = new ConcurrentHashMap<>();

    /**
     * Registry shared by every model that does not bind its own
     */
    public static ConnectionRegistry global() {
        return GLOBAL;
    }

    /**
     * Register a client under an alias
     * @throws IllegalStateException if the alias is already taken
     */
    public void register(String alias, VectorStoreClient client) {
        if (alias == null || alias.isBlank()) {
            throw new IllegalArgumentException("Alias cannot be null or blank");
        }
        if (client == null) {
            throw new IllegalArgumentException("Client cannot be null");
        }
        VectorStoreClient existing = clients.putIfAbsent(alias, client);
        if (existing != null) {
            throw new IllegalStateException("Connection alias '" + alias + "' already exists");
        }
        log.debug("Registered connection '{}' ({})", alias, client.getClass().getSimpleName());
    }

    /**
     * Remove an alias
     * @return the client that was registered, if any
     */
    public Optional<VectorStoreClient> unregister(String alias) {
        VectorStoreClient removed = clients.remove(alias);
        if (removed != null) {
            log.debug("Unregistered connection '{}'", alias);
        }
        return Optional.ofNullable(removed);
    }

    /**
     * Look up the client for an alias
     * @throws ConnectionNotFoundException if nothing is registered under the alias
     */
    public VectorStoreClient resolve(String alias) {
        VectorStoreClient client = clients.get(alias);
        if (client == null) {
            throw new ConnectionNotFoundException(alias);
        }
        return client;
    }

    public boolean contains(String alias) {
        return clients.containsKey(alias);
    }

    public Set<String> aliases() {
        return Set.copyOf(clients.keySet());
    }
}

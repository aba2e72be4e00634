package fun.fengwk.rsh.core.service.state;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SetArgs;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;

import java.time.Duration;

/**
 * Valkey state store over a single Lettuce connection.
 *
 * @author fengwk
 */
public class ValkeyStateStore implements StateStore {

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;

    ValkeyStateStore(RedisClient client, StatefulRedisConnection<String, String> connection) {
        this.client = client;
        this.connection = connection;
    }

    /**
     * Open a connection to the configured valkey server.
     *
     * @throws StoreUnavailableException if the connection cannot be established
     */
    public static ValkeyStateStore connect(StateStorageProperties properties) {
        RedisURI uri = RedisURI.builder()
            .withHost(properties.getValkeyHost())
            .withPort(properties.getValkeyPort())
            .withTimeout(Duration.ofMillis(Math.max(1L, properties.getCommandTimeoutMs())))
            .build();
        RedisClient client = RedisClient.create(uri);
        client.setOptions(ClientOptions.builder()
            .socketOptions(SocketOptions.builder()
                .connectTimeout(Duration.ofMillis(Math.max(1L, properties.getConnectTimeoutMs())))
                .build())
            .build());
        try {
            return new ValkeyStateStore(client, client.connect());
        } catch (RedisException ex) {
            client.shutdown();
            throw new StoreUnavailableException(
                "failed to connect to valkey " + properties.getValkeyHost() + ":" + properties.getValkeyPort()
                    + ", error=" + ex.getMessage(),
                ex
            );
        }
    }

    @Override
    public String get(String key) {
        try {
            return commands().get(key);
        } catch (RedisException ex) {
            throw new StoreUnavailableException("valkey get failed: " + ex.getMessage(), ex);
        }
    }

    @Override
    public void set(String key, String value, long ttlSeconds) {
        try {
            commands().set(key, value, SetArgs.Builder.ex(ttlSeconds));
        } catch (RedisException ex) {
            throw new StoreUnavailableException("valkey set failed: " + ex.getMessage(), ex);
        }
    }

    @Override
    public boolean exists(String key) {
        try {
            Long count = commands().exists(key);
            return count != null && count == 1L;
        } catch (RedisException ex) {
            throw new StoreUnavailableException("valkey exists failed: " + ex.getMessage(), ex);
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
        } finally {
            client.shutdown();
        }
    }

    private RedisCommands<String, String> commands() {
        return connection.sync();
    }

}

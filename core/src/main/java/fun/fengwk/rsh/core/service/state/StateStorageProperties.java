package fun.fengwk.rsh.core.service.state;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Session state persistence configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "rsh.state-storage")
public class StateStorageProperties {

    /**
     * Whether session state is persisted to valkey.
     */
    private boolean enabled = false;

    /**
     * Valkey host.
     */
    private String valkeyHost = "valkey";

    /**
     * Valkey port.
     */
    private int valkeyPort = 6379;

    /**
     * Time to live of a stored session state in seconds.
     */
    private long ttlSeconds = 1800;

    /**
     * Key prefix, the session id is appended to it.
     */
    private String keyPrefix = "session:";

    /**
     * Timeout for establishing the valkey connection.
     */
    private long connectTimeoutMs = 5000;

    /**
     * Timeout for a single valkey command.
     */
    private long commandTimeoutMs = 2000;

    /**
     * Interval between reconnect attempts while no connection exists.
     */
    private long reconnectIntervalMs = 30000;

}

package fun.fengwk.rsh.core.service.state;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Owns the process-wide state store handle.
 *
 * <p>The handle is only replaced at startup, by the reconnect schedule and at shutdown. A failed connect
 * leaves the handle absent and the process keeps running without persistence.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class StateStoreConnector {

    private final StateStorageProperties stateStorageProperties;
    private final Function<StateStorageProperties, StateStore> opener;
    private final AtomicReference<StateStore> handle = new AtomicReference<>();

    @Autowired
    public StateStoreConnector(StateStorageProperties stateStorageProperties) {
        this(stateStorageProperties, ValkeyStateStore::connect);
    }

    StateStoreConnector(StateStorageProperties stateStorageProperties,
                        Function<StateStorageProperties, StateStore> opener) {
        this.stateStorageProperties = stateStorageProperties;
        this.opener = opener;
    }

    @PostConstruct
    public void connect() {
        if (!stateStorageProperties.isEnabled()) {
            log.info("valkey storage disabled");
            return;
        }
        tryConnect();
    }

    @Scheduled(
        initialDelayString = "${rsh.state-storage.reconnect-interval-ms:30000}",
        fixedDelayString = "${rsh.state-storage.reconnect-interval-ms:30000}"
    )
    public void reconnectIfMissing() {
        if (!stateStorageProperties.isEnabled() || handle.get() != null) {
            return;
        }
        log.info("valkey connection missing, reconnecting, host={}, port={}",
            stateStorageProperties.getValkeyHost(), stateStorageProperties.getValkeyPort());
        tryConnect();
    }

    public Optional<StateStore> current() {
        return Optional.ofNullable(handle.get());
    }

    public boolean isConnected() {
        return handle.get() != null;
    }

    @PreDestroy
    public void close() {
        StateStore store = handle.getAndSet(null);
        if (store == null) {
            return;
        }
        try {
            store.close();
            log.info("valkey connection closed");
        } catch (Exception ex) {
            log.error("error closing valkey client, error={}", ex.getMessage(), ex);
        }
    }

    synchronized boolean tryConnect() {
        if (handle.get() != null) {
            return true;
        }
        try {
            StateStore store = opener.apply(stateStorageProperties);
            handle.set(store);
            log.info("valkey connection established, host={}, port={}",
                stateStorageProperties.getValkeyHost(), stateStorageProperties.getValkeyPort());
            return true;
        } catch (StoreUnavailableException ex) {
            log.error("failed to connect to valkey, host={}, port={}, error={}",
                stateStorageProperties.getValkeyHost(), stateStorageProperties.getValkeyPort(), ex.getMessage());
            return false;
        }
    }

}

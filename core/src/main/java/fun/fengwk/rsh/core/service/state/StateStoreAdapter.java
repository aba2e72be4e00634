package fun.fengwk.rsh.core.service.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * Session state persistence that never fails its caller.
 *
 * <p>Store failures are logged and reported as absent or false. When persistence is disabled or no store
 * handle exists, the store is not contacted at all.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StateStoreAdapter {

    private final StateStorageProperties stateStorageProperties;
    private final StateStoreConnector stateStoreConnector;
    private final ObjectMapper objectMapper;

    public boolean isEnabled() {
        return stateStorageProperties.isEnabled();
    }

    public long ttlSeconds() {
        return Math.max(1L, stateStorageProperties.getTtlSeconds());
    }

    public Optional<StoredSessionState> tryGet(String sessionId) {
        Optional<StateStore> store = availableStore();
        if (store.isEmpty()) {
            return Optional.empty();
        }
        try {
            String value = store.get().get(key(sessionId));
            if (!StringUtils.hasText(value)) {
                log.debug("no session state found, sessionId={}", sessionId);
                return Optional.empty();
            }
            JsonNode node = objectMapper.readTree(value);
            if (node == null || !node.isObject()) {
                log.warn("stored session state is not a json object, sessionId={}", sessionId);
                return Optional.empty();
            }
            log.info("session state retrieved, sessionId={}", sessionId);
            return Optional.of(new StoredSessionState(value));
        } catch (StoreUnavailableException ex) {
            log.warn("failed to load session state, sessionId={}, error={}", sessionId, ex.getMessage());
            return Optional.empty();
        } catch (JsonProcessingException ex) {
            log.warn("stored session state unreadable, sessionId={}, error={}", sessionId, ex.getOriginalMessage());
            return Optional.empty();
        }
    }

    public boolean trySet(String sessionId, StoredSessionState state, long ttlSeconds) {
        Optional<StateStore> store = availableStore();
        if (store.isEmpty()) {
            return false;
        }
        if (state == null || !StringUtils.hasText(state.json())) {
            log.warn("skip storing empty session state, sessionId={}", sessionId);
            return false;
        }
        try {
            long ttl = Math.max(1L, ttlSeconds);
            store.get().set(key(sessionId), state.json(), ttl);
            log.info("session state stored, sessionId={}, ttl={}", sessionId, ttl);
            return true;
        } catch (StoreUnavailableException ex) {
            log.warn("failed to store session state, sessionId={}, error={}", sessionId, ex.getMessage());
            return false;
        }
    }

    public boolean tryExists(String sessionId) {
        Optional<StateStore> store = availableStore();
        if (store.isEmpty()) {
            return false;
        }
        try {
            return store.get().exists(key(sessionId));
        } catch (StoreUnavailableException ex) {
            log.warn("failed to check session existence, sessionId={}, error={}", sessionId, ex.getMessage());
            return false;
        }
    }

    String key(String sessionId) {
        return stateStorageProperties.getKeyPrefix() + sessionId;
    }

    private Optional<StateStore> availableStore() {
        if (!stateStorageProperties.isEnabled()) {
            return Optional.empty();
        }
        Optional<StateStore> store = stateStoreConnector.current();
        if (store.isEmpty()) {
            log.debug("state storage enabled but valkey client not available");
        }
        return store;
    }

}

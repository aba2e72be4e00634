package fun.fengwk.rsh.core.service.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class StateStoreAdapterTest {

    private static final String STATE = "{\"cookies\":[],\"origins\":[]}";

    private InMemoryStateStore store;
    private StateStorageProperties properties;
    private StateStoreAdapter adapter;

    @BeforeEach
    public void setUp() {
        store = new InMemoryStateStore();
        properties = StateStoreFixtures.enabledProperties();
        adapter = StateStoreFixtures.connectedAdapter(properties, store);
    }

    @Test
    public void shouldStoreStateUnderPrefixedKeyWithTtl() {
        boolean stored = adapter.trySet("abc", new StoredSessionState(STATE), 60);

        assertThat(stored).isTrue();
        assertThat(store.value("session:abc")).isEqualTo(STATE);
        assertThat(store.ttl("session:abc")).isEqualTo(60L);
    }

    @Test
    public void shouldReadBackStoredState() {
        store.put("session:abc", STATE);

        assertThat(adapter.tryExists("abc")).isTrue();
        assertThat(adapter.tryGet("abc")).contains(new StoredSessionState(STATE));
    }

    @Test
    public void shouldReportMissingState() {
        assertThat(adapter.tryExists("missing")).isFalse();
        assertThat(adapter.tryGet("missing")).isEmpty();
    }

    @Test
    public void shouldTreatUnreadableStateAsAbsent() {
        store.put("session:abc", "not json");

        assertThat(adapter.tryExists("abc")).isTrue();
        assertThat(adapter.tryGet("abc")).isEmpty();
    }

    @Test
    public void shouldTreatNonObjectStateAsAbsent() {
        store.put("session:abc", "[1,2]");

        assertThat(adapter.tryGet("abc")).isEmpty();
    }

    @Test
    public void shouldSwallowStoreFailures() {
        store.put("session:abc", STATE);
        store.setUnavailable(true);

        assertThat(adapter.tryExists("abc")).isFalse();
        assertThat(adapter.tryGet("abc")).isEmpty();
        assertThat(adapter.trySet("abc", new StoredSessionState(STATE), 60)).isFalse();
    }

    @Test
    public void shouldNotContactStoreWhenDisabled() {
        properties.setEnabled(false);

        assertThat(adapter.tryExists("abc")).isFalse();
        assertThat(adapter.tryGet("abc")).isEmpty();
        assertThat(adapter.trySet("abc", new StoredSessionState(STATE), 60)).isFalse();
        assertThat(store.calls()).isZero();
    }

    @Test
    public void shouldShortCircuitWhenNoHandleExists() {
        StateStoreConnector connector = StateStoreFixtures.failingConnector(properties);
        StateStoreAdapter disconnected = new StateStoreAdapter(properties, connector, new ObjectMapper());

        assertThat(disconnected.tryExists("abc")).isFalse();
        assertThat(disconnected.tryGet("abc")).isEqualTo(Optional.empty());
        assertThat(disconnected.trySet("abc", new StoredSessionState(STATE), 60)).isFalse();
    }

    @Test
    public void shouldRejectEmptyState() {
        assertThat(adapter.trySet("abc", new StoredSessionState(" "), 60)).isFalse();
        assertThat(store.value("session:abc")).isNull();
    }

    @Test
    public void shouldClampTtlToOneSecond() {
        properties.setTtlSeconds(0);

        assertThat(adapter.ttlSeconds()).isEqualTo(1L);
        adapter.trySet("abc", new StoredSessionState(STATE), 0);
        assertThat(store.ttl("session:abc")).isEqualTo(1L);
    }

}

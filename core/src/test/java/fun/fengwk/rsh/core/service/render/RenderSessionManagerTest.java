package fun.fengwk.rsh.core.service.render;

import com.microsoft.playwright.PlaywrightException;
import fun.fengwk.rsh.core.service.browser.engine.FakeRenderEngine;
import fun.fengwk.rsh.core.service.state.InMemoryStateStore;
import fun.fengwk.rsh.core.service.state.StateStorageProperties;
import fun.fengwk.rsh.core.service.state.StateStoreFixtures;
import fun.fengwk.rsh.core.service.state.StoredSessionState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class RenderSessionManagerTest {

    private static final String URL = "https://example.com/";

    private FakeRenderEngine engine;
    private InMemoryStateStore store;
    private StateStorageProperties properties;
    private RenderSessionManager manager;

    @BeforeEach
    public void setUp() {
        engine = new FakeRenderEngine();
        store = new InMemoryStateStore();
        properties = StateStoreFixtures.enabledProperties();
        manager = new RenderSessionManager(
            engine,
            StateStoreFixtures.connectedAdapter(properties, store),
            new RenderProperties()
        );
    }

    @Test
    public void shouldRenderPersistAndDispose() {
        RenderOutcome outcome = manager.render(URL, "s1", Optional.empty());

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.statusCode()).isEqualTo(200);
        assertThat(outcome.html()).contains(URL);
        assertThat(outcome.stateStored()).isTrue();
        assertThat(store.value("session:s1")).contains("last-url");
        assertThat(store.ttl("session:s1")).isEqualTo(1800L);
        assertThat(engine.lastContext().closeCount()).isEqualTo(1);
        assertThat(engine.activeContexts()).isZero();
    }

    @Test
    public void shouldApplyUniformContextOptions() {
        manager.render(URL, "s1", Optional.empty());

        FakeRenderEngine.FakeRenderContext context = engine.lastContext();
        assertThat(context.options().getViewportWidth()).isEqualTo(1920);
        assertThat(context.options().getViewportHeight()).isEqualTo(1080);
        assertThat(context.options().isIgnoreHttpsErrors()).isTrue();
        assertThat(context.options().isJavaScriptEnabled()).isTrue();
        assertThat(context.options().getUserAgent()).contains("Chrome/120");
        assertThat(context.options().getExtraHeaders()).containsEntry("Accept-Language", "en-US,en;q=0.9");
        assertThat(context.options().getStorageState()).isNull();
    }

    @Test
    public void shouldKeepPageStatusCode() {
        engine.setPageStatus(404);

        RenderOutcome outcome = manager.render(URL, "s1", Optional.empty());

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.statusCode()).isEqualTo(404);
    }

    @Test
    public void shouldSeedContextWithRestoreState() {
        String state = FakeRenderEngine.storageState(Map.of("auth", "token-1"));

        manager.render(URL, "s1", Optional.of(new StoredSessionState(state)));

        assertThat(engine.lastContext().options().getStorageState()).isEqualTo(state);
        assertThat(engine.lastContext().cookiesBeforeNavigation()).containsEntry("auth", "token-1");
    }

    @Test
    public void shouldCarryStateIntoNextRender() {
        manager.render("https://example.com/login", "s1", Optional.empty());
        StoredSessionState stored = new StoredSessionState(store.value("session:s1"));

        manager.render("https://example.com/account", "s1", Optional.of(stored));

        assertThat(engine.contexts()).hasSize(2);
        assertThat(engine.lastContext().cookiesBeforeNavigation())
            .containsEntry("last-url", "https://example.com/login");
    }

    @Test
    public void shouldMapTimeoutTo504AndDisposeOnce() {
        engine.failRender(new PlaywrightException("Timeout 30000ms exceeded."));

        RenderOutcome outcome = manager.render(URL, "s1", Optional.empty());

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.statusCode()).isEqualTo(504);
        assertThat(outcome.failureType()).isEqualTo(RenderFailureType.NAVIGATION_TIMEOUT);
        assertThat(outcome.error()).contains("Timeout 30000ms exceeded");
        assertThat(engine.lastContext().closeCount()).isEqualTo(1);
        assertThat(engine.activeContexts()).isZero();
    }

    @Test
    public void shouldMapNetworkErrorTo502() {
        engine.failRender(new PlaywrightException("net::ERR_NAME_NOT_RESOLVED at https://nowhere.invalid/"));

        RenderOutcome outcome = manager.render(URL, "s1", Optional.empty());

        assertThat(outcome.statusCode()).isEqualTo(502);
    }

    @Test
    public void shouldMapOtherErrorTo500() {
        engine.failRender(new PlaywrightException("Target crashed"));

        RenderOutcome outcome = manager.render(URL, "s1", Optional.empty());

        assertThat(outcome.statusCode()).isEqualTo(500);
        assertThat(outcome.error()).isEqualTo("Target crashed");
    }

    @Test
    public void shouldPersistStateEvenWhenRenderFails() {
        engine.failRender(new PlaywrightException("Timeout 30000ms exceeded."));

        RenderOutcome outcome = manager.render(URL, "s1", Optional.empty());

        assertThat(outcome.stateStored()).isTrue();
        assertThat(store.value("session:s1")).isNotNull();
    }

    @Test
    public void shouldDisposeWhenCaptureFails() {
        engine.failCapture(new PlaywrightException("Target page, context or browser has been closed"));

        RenderOutcome outcome = manager.render(URL, "s1", Optional.empty());

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.stateStored()).isFalse();
        assertThat(engine.lastContext().closeCount()).isEqualTo(1);
    }

    @Test
    public void shouldKeepRenderResultWhenStoreUnavailable() {
        store.setUnavailable(true);

        RenderOutcome outcome = manager.render(URL, "s1", Optional.empty());

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.stateStored()).isFalse();
        assertThat(engine.lastContext().closeCount()).isEqualTo(1);
    }

    @Test
    public void shouldSkipCaptureWhenPersistenceDisabled() {
        properties.setEnabled(false);
        engine.failCapture(new IllegalStateException("must not capture"));

        RenderOutcome outcome = manager.render(URL, "s1", Optional.empty());

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.stateStored()).isFalse();
        assertThat(store.calls()).isZero();
    }

    @Test
    public void shouldKeepSuccessfulOutcomeWhenDisposalFails() {
        engine.failClose(new IllegalStateException("browser has been closed"));

        RenderOutcome outcome = manager.render(URL, "s1", Optional.empty());

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.statusCode()).isEqualTo(200);
        assertThat(outcome.stateStored()).isTrue();
        assertThat(engine.lastContext().closeCount()).isEqualTo(1);
    }

    @Test
    public void shouldKeepFailureClassificationWhenDisposalFails() {
        engine.failRender(new PlaywrightException("net::ERR_CONNECTION_RESET at https://example.com/"));
        engine.failClose(new IllegalStateException("browser has been closed"));

        RenderOutcome outcome = manager.render(URL, "s1", Optional.empty());

        assertThat(outcome.statusCode()).isEqualTo(502);
        assertThat(engine.lastContext().closeCount()).isEqualTo(1);
    }

    @Test
    public void shouldClassifyContextCreationFailure() {
        engine.failCreate(new IllegalStateException("engine lane 1 is closed"));

        RenderOutcome outcome = manager.render(URL, "s1", Optional.empty());

        assertThat(outcome.statusCode()).isEqualTo(500);
        assertThat(outcome.stateStored()).isFalse();
        assertThat(engine.contexts()).isEmpty();
        assertThat(store.calls()).isZero();
    }

}

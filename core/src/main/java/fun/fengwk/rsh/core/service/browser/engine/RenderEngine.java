package fun.fengwk.rsh.core.service.browser.engine;

/**
 * Headless rendering engine shared by all requests.
 *
 * <p>Implementations must allow {@link #newIsolatedContext(ContextOptions)} to be called concurrently.
 * The engine is started once at startup and closed once at shutdown.
 *
 * @author fengwk
 */
public interface RenderEngine extends AutoCloseable {

    /**
     * Create a new isolated browser context, optionally seeded with stored state.
     *
     * @param options context options
     * @return a context owned by the caller, must be closed by the caller
     */
    RenderContext newIsolatedContext(ContextOptions options);

    boolean isConnected();

    /**
     * Count of contexts created by this engine and not yet closed.
     */
    int activeContexts();

    @Override
    void close();

}

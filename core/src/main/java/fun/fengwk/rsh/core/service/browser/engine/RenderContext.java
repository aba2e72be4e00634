package fun.fengwk.rsh.core.service.browser.engine;

/**
 * One isolated browser session, owned by exactly one request.
 *
 * @author fengwk
 */
public interface RenderContext extends AutoCloseable {

    /**
     * Navigate to the url and serialize the resulting document.
     *
     * @param url absolute url
     * @param navigateTimeoutMs hard ceiling for navigation including network idle
     * @param settleTimeoutMs ceiling for the extra document-ready wait after navigation
     * @return rendered page
     */
    RenderedPage render(String url, long navigateTimeoutMs, long settleTimeoutMs);

    /**
     * Serialize cookies, local storage and origin state of this context.
     */
    String captureState();

    /**
     * Dispose the context. Idempotent, never throws.
     */
    @Override
    void close();

}

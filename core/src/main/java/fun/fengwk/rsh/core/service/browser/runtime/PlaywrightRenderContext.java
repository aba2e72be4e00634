package fun.fengwk.rsh.core.service.browser.runtime;

import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.WaitUntilState;
import fun.fengwk.rsh.core.service.browser.engine.RenderContext;
import fun.fengwk.rsh.core.service.browser.engine.RenderedPage;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Render context over a Playwright browser context bound to one engine lane.
 *
 * <p>Close is idempotent and releases the context exactly once.
 *
 * @author fengwk
 */
@Slf4j
public class PlaywrightRenderContext implements RenderContext {

    private static final int STATUS_WITHOUT_RESPONSE = 200;

    /**
     * Allowance on top of the navigation and settle ceilings for opening the page and reading its content.
     */
    static final long RENDER_GRACE_MS = 2000;

    private final EngineLane lane;
    private final BrowserContext browserContext;
    private final long contextTimeoutMs;
    private final Runnable onClose;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    PlaywrightRenderContext(EngineLane lane, BrowserContext browserContext, long contextTimeoutMs, Runnable onClose) {
        this.lane = lane;
        this.browserContext = browserContext;
        this.contextTimeoutMs = contextTimeoutMs;
        this.onClose = onClose;
    }

    @Override
    public RenderedPage render(String url, long navigateTimeoutMs, long settleTimeoutMs) {
        ensureOpen();
        // Deadline includes time queued on the lane.
        long deadlineMs = navigateTimeoutMs + settleTimeoutMs + RENDER_GRACE_MS;
        return lane.call(browser -> {
            try (Page page = browserContext.newPage()) {
                Response response = page.navigate(url,
                    new Page.NavigateOptions()
                        .setWaitUntil(WaitUntilState.NETWORKIDLE)
                        .setTimeout((double) navigateTimeoutMs)
                );
                waitForDocumentReady(page, url, settleTimeoutMs);
                String html = page.content();
                int statusCode = response == null ? STATUS_WITHOUT_RESPONSE : response.status();
                return new RenderedPage(html, statusCode);
            }
        }, deadlineMs);
    }

    @Override
    public String captureState() {
        ensureOpen();
        return lane.call(browser -> browserContext.storageState(), contextTimeoutMs);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            boolean completed = lane.runDetached(browser -> {
                browserContext.close();
                return null;
            }, contextTimeoutMs);
            if (!completed) {
                log.warn("browser context close still queued on lane, lane={}, timeoutMs={}",
                    lane.getLaneId(), contextTimeoutMs);
            }
        } catch (Exception ex) {
            if (isExpectedCloseException(ex)) {
                log.debug("browser context already closed, lane={}, skip close", lane.getLaneId());
            } else {
                log.warn("failed to close browser context, lane={}", lane.getLaneId(), ex);
            }
        } finally {
            onClose.run();
        }
    }

    private void waitForDocumentReady(Page page, String url, long settleTimeoutMs) {
        // Whichever comes first wins: document ready or the settle ceiling.
        try {
            page.waitForLoadState(
                LoadState.DOMCONTENTLOADED,
                new Page.WaitForLoadStateOptions().setTimeout((double) settleTimeoutMs)
            );
        } catch (PlaywrightException ex) {
            log.debug("document ready wait ended, url={}, error={}", url, ex.getMessage());
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("render context is closed");
        }
    }

    private boolean isExpectedCloseException(Exception ex) {
        String message = ex.getMessage() == null ? "" : ex.getMessage().toLowerCase();
        String exceptionName = ex.getClass().getSimpleName();
        return "TargetClosedError".equals(exceptionName)
            || message.contains("target page, context or browser has been closed")
            || message.contains("channel has been closed")
            || message.contains("connection closed")
            || message.contains("is closed");
    }

}

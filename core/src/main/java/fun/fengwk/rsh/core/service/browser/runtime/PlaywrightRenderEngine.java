package fun.fengwk.rsh.core.service.browser.runtime;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Playwright;
import fun.fengwk.rsh.core.service.browser.BrowserProperties;
import fun.fengwk.rsh.core.service.browser.engine.ContextOptions;
import fun.fengwk.rsh.core.service.browser.engine.RenderContext;
import fun.fengwk.rsh.core.service.browser.engine.RenderEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Chromium render engine backed by Playwright.
 *
 * <p>The engine owns a fixed set of {@link EngineLane lanes}. Each new context is bound to the least loaded
 * connected lane, ties broken round-robin, so contexts on different lanes render in parallel and a new context
 * is not queued behind a busy lane while another lane is idle.
 *
 * @author fengwk
 */
@Slf4j
public class PlaywrightRenderEngine implements RenderEngine {

    private final List<EngineLane> lanes;
    private final long contextTimeoutMs;
    private final AtomicInteger cursor = new AtomicInteger(0);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    PlaywrightRenderEngine(List<EngineLane> lanes, long contextTimeoutMs) {
        this.lanes = List.copyOf(lanes);
        this.contextTimeoutMs = contextTimeoutMs;
    }

    /**
     * Launch the engine, blocking until every lane's browser is up.
     *
     * @throws IllegalStateException if any lane fails to launch
     */
    public static PlaywrightRenderEngine launch(BrowserProperties browserProperties) {
        return launch(browserProperties, defaultBrowserSessionFactory(browserProperties));
    }

    static PlaywrightRenderEngine launch(BrowserProperties browserProperties, BrowserSession.Factory factory) {
        int laneCount = Math.max(1, browserProperties.getLanes());
        List<EngineLane> lanes = new ArrayList<>(laneCount);
        try {
            for (int i = 1; i <= laneCount; i++) {
                lanes.add(EngineLane.start(i, factory, browserProperties.getLaunchTimeoutMs()));
            }
        } catch (RuntimeException ex) {
            log.error("failed to initialize browser, error={}", ex.getMessage(), ex);
            lanes.forEach(EngineLane::close);
            throw ex;
        }
        log.info("browser initialized, lanes={}, headless={}", laneCount, browserProperties.isHeadless());
        return new PlaywrightRenderEngine(lanes, browserProperties.getContextTimeoutMs());
    }

    @Override
    public RenderContext newIsolatedContext(ContextOptions options) {
        if (closed.get()) {
            throw new IllegalStateException("render engine is closed");
        }
        EngineLane lane = leastLoadedLane();
        lane.bindContext();
        BrowserContext browserContext;
        try {
            browserContext = lane.call(
                browser -> browser.newContext(toNewContextOptions(options)),
                contextTimeoutMs,
                PlaywrightRenderEngine::closeAbandonedContext
            );
        } catch (RuntimeException ex) {
            lane.unbindContext();
            throw ex;
        }
        log.debug("context created, lane={}, laneLoad={}, activeContexts={}", lane.getLaneId(), lane.load(), activeContexts());
        return new PlaywrightRenderContext(lane, browserContext, contextTimeoutMs, lane::unbindContext);
    }

    @Override
    public boolean isConnected() {
        return !closed.get() && !lanes.isEmpty() && lanes.stream().allMatch(EngineLane::isConnected);
    }

    /**
     * Sum of the contexts bound to each lane. Counted on bind and release rather than read from
     * {@code browser.contexts()}, which would have to queue on every lane thread behind running renders.
     */
    @Override
    public int activeContexts() {
        return lanes.stream().mapToInt(EngineLane::boundContexts).sum();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        for (EngineLane lane : lanes) {
            lane.close();
        }
        log.info("browser closed, lanes={}", lanes.size());
    }

    private EngineLane leastLoadedLane() {
        int start = Math.floorMod(cursor.getAndIncrement(), lanes.size());
        EngineLane best = null;
        for (int i = 0; i < lanes.size(); i++) {
            EngineLane lane = lanes.get((start + i) % lanes.size());
            if (!lane.isConnected()) {
                continue;
            }
            if (best == null || lane.load() < best.load()) {
                best = lane;
            }
        }
        return best == null ? lanes.get(start) : best;
    }

    private static void closeAbandonedContext(BrowserContext browserContext) {
        log.warn("context created after its caller gave up, closing it");
        browserContext.close();
    }

    static Browser.NewContextOptions toNewContextOptions(ContextOptions options) {
        Browser.NewContextOptions contextOptions = new Browser.NewContextOptions()
            .setViewportSize(options.getViewportWidth(), options.getViewportHeight())
            .setIgnoreHTTPSErrors(options.isIgnoreHttpsErrors())
            .setJavaScriptEnabled(options.isJavaScriptEnabled());
        if (StringUtils.hasText(options.getUserAgent())) {
            contextOptions.setUserAgent(options.getUserAgent());
        }
        if (options.getExtraHeaders() != null && !options.getExtraHeaders().isEmpty()) {
            contextOptions.setExtraHTTPHeaders(options.getExtraHeaders());
        }
        if (StringUtils.hasText(options.getStorageState())) {
            contextOptions.setStorageState(options.getStorageState());
        }
        return contextOptions;
    }

    private static BrowserSession.Factory defaultBrowserSessionFactory(BrowserProperties browserProperties) {
        return () -> {
            Playwright playwright = Playwright.create();
            try {
                BrowserType.LaunchOptions options = new BrowserType.LaunchOptions()
                    .setHeadless(browserProperties.isHeadless());
                if (browserProperties.getLaunchArgs() != null && !browserProperties.getLaunchArgs().isEmpty()) {
                    options.setArgs(browserProperties.getLaunchArgs());
                }
                if (StringUtils.hasText(browserProperties.getBrowserChannel())) {
                    options.setChannel(browserProperties.getBrowserChannel());
                }
                if (StringUtils.hasText(browserProperties.getExecutablePath())) {
                    options.setExecutablePath(Paths.get(browserProperties.getExecutablePath()));
                }
                Browser browser = playwright.chromium().launch(options);
                return new BrowserSession(playwright, browser);
            } catch (RuntimeException ex) {
                playwright.close();
                throw ex;
            }
        };
    }

}

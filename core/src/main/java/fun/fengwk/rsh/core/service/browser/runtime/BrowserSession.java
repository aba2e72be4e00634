package fun.fengwk.rsh.core.service.browser.runtime;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.Playwright;

/**
 * Playwright driver and the browser launched from it.
 *
 * <p>Both objects are bound to the thread that created them.
 *
 * @author fengwk
 */
public class BrowserSession implements AutoCloseable {

    private final Playwright playwright;
    private final Browser browser;

    public BrowserSession(Playwright playwright, Browser browser) {
        this.playwright = playwright;
        this.browser = browser;
    }

    public Browser browser() {
        return browser;
    }

    @Override
    public void close() {
        try {
            browser.close();
        } finally {
            playwright.close();
        }
    }

    /**
     * Creates browser sessions, invoked on the lane thread.
     */
    @FunctionalInterface
    public interface Factory {

        BrowserSession create();

    }

}

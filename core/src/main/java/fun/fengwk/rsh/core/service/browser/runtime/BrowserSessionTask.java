package fun.fengwk.rsh.core.service.browser.runtime;

import com.microsoft.playwright.Browser;

/**
 * Task executed on an engine lane thread with the lane's browser.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface BrowserSessionTask<T> {

    T execute(Browser browser) throws Exception;

}

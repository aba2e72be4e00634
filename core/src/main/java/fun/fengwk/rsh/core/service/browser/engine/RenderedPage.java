package fun.fengwk.rsh.core.service.browser.engine;

/**
 * Rendered document and the status code of the main response.
 *
 * @author fengwk
 */
public record RenderedPage(String html, int statusCode) {
}

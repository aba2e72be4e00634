package fun.fengwk.rsh.core.service.render;

import fun.fengwk.rsh.core.service.browser.engine.RenderedPage;

/**
 * Result of one render attempt.
 *
 * @param statusCode status of the rendered page on success, the classified http status on failure
 * @param html serialized document, null on failure
 * @param error failure message, null on success
 * @param failureType failure classification, null on success
 * @param stateStored whether the context state was persisted
 * @author fengwk
 */
public record RenderOutcome(
    int statusCode,
    String html,
    String error,
    RenderFailureType failureType,
    boolean stateStored
) {

    public static RenderOutcome success(RenderedPage page, boolean stateStored) {
        return new RenderOutcome(page.statusCode(), page.html(), null, null, stateStored);
    }

    public static RenderOutcome failure(RenderFailureType failureType, String error, boolean stateStored) {
        return new RenderOutcome(failureType.getHttpStatus(), null, error, failureType, stateStored);
    }

    public boolean isSuccess() {
        return failureType == null;
    }

}

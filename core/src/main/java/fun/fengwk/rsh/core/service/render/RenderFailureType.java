package fun.fengwk.rsh.core.service.render;

import com.microsoft.playwright.TimeoutError;

import java.util.Locale;

/**
 * Classified render failures and the http status each maps to.
 *
 * @author fengwk
 */
public enum RenderFailureType {

    NAVIGATION_TIMEOUT(504),
    NETWORK_FAILURE(502),
    UNCLASSIFIED(500),
    ;

    private final int httpStatus;

    RenderFailureType(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public static RenderFailureType classify(Throwable error) {
        if (error instanceof TimeoutError || error instanceof java.util.concurrent.TimeoutException) {
            return NAVIGATION_TIMEOUT;
        }
        String message = error == null || error.getMessage() == null
            ? ""
            : error.getMessage().toLowerCase(Locale.ROOT);
        if (message.contains("timeout")) {
            return NAVIGATION_TIMEOUT;
        }
        // Chromium network errors look like net::ERR_NAME_NOT_RESOLVED.
        if (message.contains("net::")) {
            return NETWORK_FAILURE;
        }
        return UNCLASSIFIED;
    }

}

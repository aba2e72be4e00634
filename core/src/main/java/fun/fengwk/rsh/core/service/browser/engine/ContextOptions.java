package fun.fengwk.rsh.core.service.browser.engine;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Options applied when creating a render context.
 *
 * @author fengwk
 */
@Data
@Builder
public class ContextOptions {

    private int viewportWidth;
    private int viewportHeight;
    private String userAgent;
    private boolean ignoreHttpsErrors;
    private boolean javaScriptEnabled;
    private Map<String, String> extraHeaders;

    /**
     * Storage state json to seed the context with, null for a blank context.
     */
    private String storageState;

}

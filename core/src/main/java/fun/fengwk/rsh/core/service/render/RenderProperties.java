package fun.fengwk.rsh.core.service.render;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Render behavior applied uniformly to every context.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "rsh.render")
public class RenderProperties {

    /**
     * Hard ceiling for navigation, including the wait for network idle.
     */
    private long navigateTimeoutMs = 30000;

    /**
     * Ceiling for the extra document-ready wait after network idle.
     */
    private long settleTimeoutMs = 3000;

    private int viewportWidth = 1920;

    private int viewportHeight = 1080;

    /**
     * Fixed user agent for every context.
     */
    private String userAgent =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    /**
     * Accept-Language header sent with every request.
     */
    private String acceptLanguage = "en-US,en;q=0.9";

    /**
     * Render pages behind invalid or self-signed certificates.
     */
    private boolean ignoreHttpsErrors = true;

    private boolean javaScriptEnabled = true;

    /**
     * Url schemes accepted for rendering.
     */
    private List<String> allowedSchemes = List.of("http", "https");

}

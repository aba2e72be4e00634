package fun.fengwk.rsh.core.service.browser;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Browser engine launch configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "rsh.browser")
public class BrowserProperties {

    /**
     * Number of engine lanes, each lane is one thread owning one browser process.
     */
    private int lanes = 4;

    /**
     * Whether the browser runs headless.
     */
    private boolean headless = true;

    /**
     * Browser channel, e.g. chrome, msedge.
     */
    private String browserChannel = "";

    /**
     * Browser executable path.
     */
    private String executablePath = "";

    /**
     * Launch args for browser.
     */
    private List<String> launchArgs = List.of(
        "--no-sandbox",
        "--disable-setuid-sandbox",
        "--disable-dev-shm-usage",
        "--disable-accelerated-2d-canvas",
        "--no-first-run",
        "--no-zygote",
        "--disable-gpu"
    );

    /**
     * Timeout for launching one lane browser.
     */
    private long launchTimeoutMs = 60000;

    /**
     * Deadline for creating, capturing and closing a context on its lane, queue time included.
     */
    private long contextTimeoutMs = 10000;

}

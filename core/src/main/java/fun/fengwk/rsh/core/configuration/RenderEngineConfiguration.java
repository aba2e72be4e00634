package fun.fengwk.rsh.core.configuration;

import fun.fengwk.rsh.core.service.browser.BrowserProperties;
import fun.fengwk.rsh.core.service.browser.engine.RenderEngine;
import fun.fengwk.rsh.core.service.browser.runtime.PlaywrightRenderEngine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Render engine wiring. A launch failure fails application startup.
 *
 * @author fengwk
 */
@Configuration
public class RenderEngineConfiguration {

    @Bean(destroyMethod = "close")
    public RenderEngine renderEngine(BrowserProperties browserProperties) {
        return PlaywrightRenderEngine.launch(browserProperties);
    }

}

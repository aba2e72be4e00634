package fun.fengwk.rsh.core.service.lifecycle;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Process lifecycle configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "rsh.lifecycle")
public class LifecycleProperties {

    /**
     * Shut the process down when an unexpected fault escapes a request or thread.
     */
    private boolean shutdownOnFault = true;

}

package fun.fengwk.rsh.core.configuration;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the store reconnect schedule.
 *
 * @author fengwk
 */
@Configuration
@EnableScheduling
public class StateStorageConfiguration {
}

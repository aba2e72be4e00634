package fun.fengwk.rsh.core.service.lifecycle;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shuts the process down after an unexpected fault.
 *
 * <p>Closing the application context disposes the render engine and the store connection, then the
 * process exits. Signals (SIGTERM, SIGINT) take the same path through the Spring shutdown hook.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GracefulShutdown {

    private final ApplicationContext applicationContext;
    private final LifecycleProperties lifecycleProperties;
    private final AtomicBoolean initiated = new AtomicBoolean(false);

    @PostConstruct
    public void installUncaughtExceptionHandler() {
        if (!lifecycleProperties.isShutdownOnFault()) {
            return;
        }
        Thread.setDefaultUncaughtExceptionHandler((thread, ex) -> {
            log.error("uncaught exception, thread={}, error={}", thread.getName(), ex.getMessage(), ex);
            initiate("uncaughtException");
        });
    }

    /**
     * Start shutdown on a separate thread, later calls are ignored.
     *
     * @return whether this call started the shutdown
     */
    public boolean initiate(String reason) {
        if (!lifecycleProperties.isShutdownOnFault()) {
            log.warn("graceful shutdown disabled, ignore, reason={}", reason);
            return false;
        }
        if (!initiated.compareAndSet(false, true)) {
            return false;
        }
        log.info("graceful shutdown initiated, reason={}", reason);
        Thread thread = new Thread(() -> {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        });
        thread.setName("rsh-shutdown");
        thread.start();
        return true;
    }

}

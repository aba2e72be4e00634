package fun.fengwk.rsh.core.service.session;

import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Mints random session ids.
 *
 * @author fengwk
 */
@Component
public class SessionIdGenerator {

    public String generate() {
        // Type 4 uuid backed by SecureRandom.
        return UUID.randomUUID().toString();
    }

}

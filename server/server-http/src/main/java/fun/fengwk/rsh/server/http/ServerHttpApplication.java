package fun.fengwk.rsh.server.http;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * @author fengwk
 */
@SpringBootApplication(scanBasePackages = "fun.fengwk.rsh")
public class ServerHttpApplication {

    public static void main(String[] args) {
        SpringApplication.run(ServerHttpApplication.class, args);
    }

}

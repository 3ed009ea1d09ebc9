package com.tierflow;

import com.tierflow.core.health.HealthCheckService;
import com.tierflow.core.health.HealthStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
public class TierflowApplication {

    private static final Logger log = LoggerFactory.getLogger(TierflowApplication.class);

    public static void main(String[] args) throws InterruptedException {
        // Engine only: no web server
        new SpringApplicationBuilder(TierflowApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off"
                )
                .run(args);

        // Worker threads are daemons; the shutdown hook closes the context on SIGTERM
        Thread.currentThread().join();
    }

    @Bean
    ApplicationRunner healthReport(HealthCheckService healthCheckService) {
        return args -> {
            for (HealthStatus status : healthCheckService.checkAll()) {
                if (status.status() == HealthStatus.Status.UP) {
                    log.info("{}: {} ({})", status.component(), status.status(), status.detail());
                } else {
                    log.warn("{}: {} ({})", status.component(), status.status(), status.detail());
                }
            }
        };
    }
}

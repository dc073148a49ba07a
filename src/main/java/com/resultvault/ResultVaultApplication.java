package com.resultvault;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
public class ResultVaultApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResultVaultApplication.class, args);
    }

    /**
     * Enable scheduling only when the retention sweep is switched on.
     * The storage core itself never schedules work.
     */
    @EnableScheduling
    @ConditionalOnProperty(prefix = "app.retention.sweep", name = "enabled", havingValue = "true")
    static class SchedulingConfiguration {
    }
}

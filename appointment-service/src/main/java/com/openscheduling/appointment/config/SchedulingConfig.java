package com.openscheduling.appointment.config;

import com.openscheduling.availability.domain.model.SchedulingPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Wires the availability engine: scheduling policy, clock and the executor that runs
 * time-bounded searches.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(SchedulingProperties.class)
public class SchedulingConfig {

    @Bean
    public SchedulingPolicy schedulingPolicy(SchedulingProperties properties) {
        SchedulingPolicy policy = properties.toPolicy();
        log.info("Scheduling policy: zone {}, duration {}-{} min, default buffer {} min",
                policy.getZoneId(), policy.getMinDurationMinutes(), policy.getMaxDurationMinutes(),
                policy.getDefaultBufferMinutes());
        return policy;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "availabilitySearchExecutor")
    public Executor availabilitySearchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("availability-");
        executor.initialize();
        return executor;
    }
}

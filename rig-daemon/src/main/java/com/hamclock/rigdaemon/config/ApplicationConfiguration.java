package com.hamclock.rigdaemon.config;

import com.hamclock.rigdaemon.model.RadioSnapshot;
import com.hamclock.rigdaemon.service.ChangeBroadcaster;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.time.Instant;

/**
 * Minimal Application Configuration - Only essential beans
 */
@Configuration
@EnableScheduling
public class ApplicationConfiguration implements WebMvcConfigurer {

    // Poll ticks, re-polls and tune delays
    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("rig-sched-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    // Blocking XML-RPC calls to flrig
    @Bean("rigIoExecutor")
    public ThreadPoolTaskExecutor rigIoExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(3);
        executor.setMaxPoolSize(6);
        executor.setQueueCapacity(64);
        executor.setThreadNamePrefix("rig-io-");
        executor.initialize();
        return executor;
    }

    // Event-stream writes; one drain task per client with a backlog
    @Bean("streamExecutor")
    public ThreadPoolTaskExecutor streamExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(256);
        executor.setThreadNamePrefix("rig-sse-");
        executor.initialize();
        return executor;
    }

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Rig Daemon API")
                .version("1.0.0")
                .description("HTTP/SSE bridge to rigctld, flrig or a simulated transceiver")
                .license(new License()
                    .name("MIT License")
                    .url("https://opensource.org/licenses/MIT")));
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
            .allowedOriginPatterns("*")
            .allowedMethods("GET", "POST", "OPTIONS")
            .allowedHeaders("*")
            .maxAge(3600);
    }

    @Bean
    public HealthIndicator rigHealthIndicator(ChangeBroadcaster broadcaster, RigProperties properties) {
        return () -> {
            RadioSnapshot snapshot = broadcaster.snapshot();
            Health.Builder builder = snapshot.connected() ? Health.up() : Health.outOfService();
            Instant lastUpdate = snapshot.lastUpdateAt();
            return builder
                .withDetail("type", properties.radioType().id())
                .withDetail("connected", snapshot.connected())
                .withDetail("lastUpdate", lastUpdate.toString())
                .build();
        };
    }
}

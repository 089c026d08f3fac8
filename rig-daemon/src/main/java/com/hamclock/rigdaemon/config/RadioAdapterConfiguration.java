package com.hamclock.rigdaemon.config;

import com.hamclock.rigdaemon.adapter.RadioAdapter;
import com.hamclock.rigdaemon.adapter.RadioPoller;
import com.hamclock.rigdaemon.adapter.flrig.ApacheFlrigClient;
import com.hamclock.rigdaemon.adapter.flrig.FlrigAdapter;
import com.hamclock.rigdaemon.adapter.mock.MockRadioAdapter;
import com.hamclock.rigdaemon.adapter.rigctld.RigctldAdapter;
import com.hamclock.rigdaemon.model.RadioState;
import com.hamclock.rigdaemon.service.ChangeBroadcaster;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.TaskScheduler;

import java.util.concurrent.Executor;

/**
 * Adapter selection - one backend per process, fixed by {@code rig.radio.type} at startup
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RigProperties.class)
public class RadioAdapterConfiguration {

    @Bean
    public RadioState radioState() {
        return new RadioState();
    }

    @Bean
    public RadioAdapter radioAdapter(RigProperties properties,
                                     ChangeBroadcaster broadcaster,
                                     TaskScheduler taskScheduler,
                                     @Qualifier("rigIoExecutor") Executor rigIoExecutor) {
        RadioType type = properties.radioType();
        log.info("🔧 Creating {} adapter", type.id());
        return switch (type) {
            case FLRIG -> new FlrigAdapter(
                new ApacheFlrigClient(properties.host(), properties.effectivePort(), properties.connectTimeout()),
                broadcaster, rigIoExecutor, taskScheduler, properties);
            case MOCK -> new MockRadioAdapter(broadcaster, taskScheduler, properties);
            case RIGCTLD -> new RigctldAdapter(properties, broadcaster, taskScheduler);
        };
    }

    @Bean
    public RadioPoller radioPoller(RadioAdapter radioAdapter) {
        if (radioAdapter instanceof RadioPoller poller) {
            return poller;
        }
        throw new IllegalStateException("Adapter " + radioAdapter.getClass().getSimpleName() + " cannot be polled");
    }

    /**
     * Open the backend link once the HTTP server is up
     */
    @EventListener
    @Order(1)
    public void connectRadio(ApplicationReadyEvent event) {
        RigProperties properties = event.getApplicationContext().getBean(RigProperties.class);
        RadioAdapter adapter = event.getApplicationContext().getBean(RadioAdapter.class);

        log.info("📻 Radio backend: {} at {}:{}", properties.radioType().id(), properties.host(),
            properties.effectivePort());
        log.info("⏱️ Poll interval: {} ms, tune delay: {} ms", properties.pollInterval(), properties.tuneDelay());
        log.info("🔐 PTT via API: {}", properties.pttEnabled() ? "enabled" : "disabled");

        try {
            adapter.connect();
        } catch (RuntimeException e) {
            log.error("💥 Failed to start radio adapter", e);
        }
    }
}

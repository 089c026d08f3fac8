package com.hamclock.rigdaemon.service;

import com.hamclock.rigdaemon.adapter.RadioPoller;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drives the active adapter's poll at {@code rig.radio.poll-interval}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PollScheduler {

    private final RadioPoller poller;

    @Scheduled(fixedRateString = "${rig.radio.poll-interval:1000}", initialDelayString = "${rig.radio.poll-interval:1000}")
    public void tick() {
        try {
            poller.poll();
        } catch (RuntimeException e) {
            log.error("❌ Poll tick failed: {}", e.getMessage(), e);
        }
    }
}

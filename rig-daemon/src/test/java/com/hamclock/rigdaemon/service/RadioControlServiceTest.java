package com.hamclock.rigdaemon.service;

import com.hamclock.rigdaemon.adapter.RadioAdapter;
import com.hamclock.rigdaemon.adapter.RadioPoller;
import com.hamclock.rigdaemon.dto.ConfigResponse;
import com.hamclock.rigdaemon.exception.RigDaemonException;
import com.hamclock.rigdaemon.support.ManualTaskScheduler;
import com.hamclock.rigdaemon.support.RigPropertiesFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class RadioControlServiceTest {

    private RecordingAdapter adapter;
    private ManualTaskScheduler scheduler;

    @BeforeEach
    void setUp() {
        adapter = new RecordingAdapter();
        scheduler = new ManualTaskScheduler();
    }

    private RadioControlService service(boolean pttEnabled) {
        return new RadioControlService(adapter, adapter, scheduler, RigPropertiesFixtures.withPtt("rigctld", pttEnabled));
    }

    @Test
    void keyingIsRefusedBeforeReachingAdapter() {
        CompletableFuture<Void> result = service(false).setPtt(true);

        ExecutionException error = assertThrows(ExecutionException.class, result::get);
        RigDaemonException cause = (RigDaemonException) error.getCause();
        assertEquals("PTT disabled in configuration", cause.getMessage());
        assertEquals(HttpStatus.FORBIDDEN, cause.getHttpStatus());
        assertTrue(adapter.calls.isEmpty());
    }

    @Test
    void unkeyingIsAlwaysAllowed() throws Exception {
        service(false).setPtt(false).get();

        assertEquals(List.of("ptt false"), adapter.calls);
    }

    @Test
    void keyingPassesWhenEnabled() throws Exception {
        service(true).setPtt(true).get();

        assertEquals(List.of("ptt true"), adapter.calls);
    }

    @Test
    void frequencyWriteIsConfirmedByRepoll() throws Exception {
        service(false).setFrequency(7_074_000L, false).get();

        assertEquals(List.of("freq 7074000"), adapter.calls);
        assertEquals(1, scheduler.pendingCount());
        assertTrue(scheduler.pendingDelaysMillis().get(0) <= 100);

        scheduler.runAll();
        assertEquals(List.of("freq 7074000", "poll"), adapter.calls);
    }

    @Test
    void tuneFlagSchedulesTuneAfterDelay() throws Exception {
        service(false).setFrequency(14_074_000L, true).get();

        assertEquals(2, scheduler.pendingCount());
        long tuneDelay = scheduler.pendingDelaysMillis().get(1);
        assertTrue(tuneDelay > 2500 && tuneDelay <= 3000);

        scheduler.runAll();
        assertEquals(List.of("freq 14074000", "poll", "tune"), adapter.calls);
    }

    @Test
    void failedWriteSkipsRepollAndTune() {
        adapter.failWrites = true;

        CompletableFuture<Void> result = service(false).setFrequency(1L, true);

        assertThrows(ExecutionException.class, result::get);
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void modeWriteCarriesPassband() throws Exception {
        service(false).setMode("CW", 500).get();
        scheduler.runAll();

        assertEquals(List.of("mode CW 500", "poll"), adapter.calls);
    }

    @Test
    void configViewReflectsProperties() {
        ConfigResponse config = service(true).currentConfig();

        assertEquals("rigctld", config.getType());
        assertEquals(4532, config.getPort());
        assertTrue(config.isPttEnabled());
        assertEquals(3000, config.getTuneDelay());
    }

    /**
     * Adapter double recording the calls it receives.
     */
    private static final class RecordingAdapter implements RadioAdapter, RadioPoller {

        final List<String> calls = new ArrayList<>();
        boolean failWrites;

        private CompletableFuture<Void> record(String call) {
            if (failWrites) {
                return CompletableFuture.failedFuture(RigDaemonException.rigError("rejected"));
            }
            calls.add(call);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void connect() {
        }

        @Override
        public void poll() {
            calls.add("poll");
        }

        @Override
        public CompletableFuture<String> sendCommand(String command) {
            calls.add(command);
            return CompletableFuture.completedFuture("");
        }

        @Override
        public CompletableFuture<Void> setFrequency(long frequencyHz) {
            return record("freq " + frequencyHz);
        }

        @Override
        public CompletableFuture<Void> setMode(String mode, int passbandHz) {
            return record("mode " + mode + " " + passbandHz);
        }

        @Override
        public CompletableFuture<Void> setPTT(boolean transmit) {
            return record("ptt " + transmit);
        }

        @Override
        public CompletableFuture<Void> tune() {
            return record("tune");
        }
    }
}

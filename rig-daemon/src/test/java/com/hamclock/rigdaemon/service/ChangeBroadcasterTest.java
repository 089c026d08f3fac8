package com.hamclock.rigdaemon.service;

import com.hamclock.rigdaemon.dto.InitEvent;
import com.hamclock.rigdaemon.dto.RigEvent;
import com.hamclock.rigdaemon.dto.UpdateEvent;
import com.hamclock.rigdaemon.helper.DefaultSubscriberRegistry;
import com.hamclock.rigdaemon.helper.RecordingSubscriber;
import com.hamclock.rigdaemon.model.RadioState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class ChangeBroadcasterTest {

    private DefaultSubscriberRegistry registry;
    private ChangeBroadcaster broadcaster;
    private RecordingSubscriber client;

    @BeforeEach
    void setUp() throws IOException {
        registry = new DefaultSubscriberRegistry();
        broadcaster = new ChangeBroadcaster(new RadioState(), registry, Runnable::run);
        client = new RecordingSubscriber("client-1");
        broadcaster.subscribe(client);
    }

    @Test
    void subscribeSendsInitSnapshotFirst() throws IOException {
        broadcaster.updateFrequency(7_074_000L);
        broadcaster.updateMode("USB");
        broadcaster.updateConnected(true);

        RecordingSubscriber late = new RecordingSubscriber("client-2");
        broadcaster.subscribe(late);

        assertEquals(1, late.events().size());
        InitEvent init = (InitEvent) late.events().get(0);
        assertEquals("init", init.type());
        assertEquals(7_074_000L, init.freq());
        assertEquals("USB", init.mode());
        assertTrue(init.connected());
        assertEquals(2, registry.getSubscriberCount());
    }

    @Test
    void repeatedValueIsBroadcastOnce() {
        broadcaster.updateFrequency(14_074_000L);
        broadcaster.updateFrequency(14_074_000L);
        broadcaster.updateFrequency(14_074_000L);

        assertEquals(List.of(14_074_000L), client.updates(UpdateEvent.FREQ));
    }

    @Test
    void everyPropertyHasItsOwnEvent() {
        broadcaster.updateFrequency(3_573_000L);
        broadcaster.updateMode("PKTUSB");
        broadcaster.updatePassband(3000);
        broadcaster.updatePtt(true);
        broadcaster.updateConnected(true);

        List<UpdateEvent> updates = client.allUpdates();
        assertEquals(List.of("freq", "mode", "width", "ptt", "connected"),
                updates.stream().map(UpdateEvent::prop).toList());
        assertTrue(updates.stream().allMatch(update -> "update".equals(update.type())));
    }

    @Test
    void unchangedSnapshotProducesNoTraffic() {
        broadcaster.updatePtt(false);
        broadcaster.updateConnected(false);
        broadcaster.updatePassband(0);

        assertTrue(client.allUpdates().isEmpty());
    }

    @Test
    void brokenSubscriberIsDropped() {
        RecordingSubscriber healthy = new RecordingSubscriber("client-2");
        registry.register(healthy);
        client.breakStream();

        broadcaster.updateMode("CW");

        assertEquals(1, registry.getSubscriberCount());
        assertEquals(List.of("CW"), healthy.updates(UpdateEvent.MODE));
    }

    @Test
    void unsubscribeStopsDelivery() {
        broadcaster.unsubscribe("client-1");

        broadcaster.updateMode("AM");

        assertTrue(client.allUpdates().isEmpty());
        assertEquals(0, registry.getSubscriberCount());
    }

    @Test
    void touchDoesNotBroadcast() {
        broadcaster.touch();

        assertTrue(client.allUpdates().isEmpty());
        assertTrue(broadcaster.snapshot().lastUpdateAt().isAfter(Instant.EPOCH));
    }

    @Test
    void concurrentWritersStreamInStoreOrder() throws Exception {
        CountDownLatch firstStored = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        // pauses the first writer after its store, before its broadcast
        RadioState slowState = new RadioState() {
            @Override
            public boolean setFrequencyHz(long value) {
                boolean changed = super.setFrequencyHz(value);
                if (value == 1L) {
                    firstStored.countDown();
                    await(releaseFirst);
                }
                return changed;
            }
        };
        ChangeBroadcaster racing = new ChangeBroadcaster(slowState, new DefaultSubscriberRegistry(), Runnable::run);
        RecordingSubscriber watcher = new RecordingSubscriber("watcher");
        racing.subscribe(watcher);

        Thread writerA = new Thread(() -> racing.updateFrequency(1L), "poll-a");
        Thread writerB = new Thread(() -> racing.updateFrequency(2L), "poll-b");
        writerA.start();
        assertTrue(firstStored.await(2, TimeUnit.SECONDS));
        writerB.start();
        waitUntilBlocked(writerB);
        releaseFirst.countDown();
        writerA.join(2000);
        writerB.join(2000);

        assertEquals(2L, racing.snapshot().frequencyHz());
        assertEquals(List.of(1L, 2L), watcher.updates(UpdateEvent.FREQ));
    }

    @Test
    void stalledClientDoesNotHoldUpUpdates() throws Exception {
        CountDownLatch unblock = new CountDownLatch(1);
        RecordingSubscriber stalled = new RecordingSubscriber("stalled") {
            @Override
            public void send(RigEvent event) throws IOException {
                if (event instanceof UpdateEvent) {
                    await(unblock);
                }
                super.send(event);
            }
        };
        RecordingSubscriber healthy = new RecordingSubscriber("healthy");
        ExecutorService delivery = Executors.newFixedThreadPool(2);
        try {
            ChangeBroadcaster async = new ChangeBroadcaster(new RadioState(), new DefaultSubscriberRegistry(), delivery);
            async.subscribe(stalled);
            async.subscribe(healthy);

            assertTimeout(Duration.ofSeconds(1), () -> {
                async.updateFrequency(14_074_000L);
                async.updateMode("FT8");
            });

            waitFor(() -> healthy.allUpdates().size() == 2);
            assertEquals(List.of(14_074_000L), healthy.updates(UpdateEvent.FREQ));
            assertTrue(stalled.allUpdates().isEmpty());

            unblock.countDown();
            waitFor(() -> stalled.allUpdates().size() == 2);
            assertEquals(List.of("FT8"), stalled.updates(UpdateEvent.MODE));
        } finally {
            unblock.countDown();
            delivery.shutdownNow();
        }
    }

    @Test
    void brokenSubscriberIsClosed() {
        client.breakStream();

        broadcaster.updatePtt(true);

        assertTrue(client.isClosed());
        assertEquals(0, registry.getSubscriberCount());
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void waitUntilBlocked(Thread thread) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 2000;
        while (thread.getState() != Thread.State.BLOCKED && System.currentTimeMillis() < deadline) {
            Thread.sleep(1);
        }
    }

    private static void waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 2000;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertTrue(condition.getAsBoolean(), "condition not met within 2 s");
    }
}

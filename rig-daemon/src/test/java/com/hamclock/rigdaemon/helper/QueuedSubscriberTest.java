package com.hamclock.rigdaemon.helper;

import com.hamclock.rigdaemon.dto.UpdateEvent;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class QueuedSubscriberTest {

    private final List<Runnable> parked = new ArrayList<>();
    private final List<String> failed = new ArrayList<>();

    @Test
    void sendOnlyQueuesUntilTheDrainRuns() throws IOException {
        RecordingSubscriber client = new RecordingSubscriber("client");
        QueuedSubscriber outbox = new QueuedSubscriber(client, parked::add, 8, failed::add);

        outbox.send(UpdateEvent.of(UpdateEvent.FREQ, 7_074_000L));
        outbox.send(UpdateEvent.of(UpdateEvent.FREQ, 7_075_000L));
        outbox.send(UpdateEvent.of(UpdateEvent.MODE, "CW"));

        assertTrue(client.events().isEmpty());
        assertEquals(1, parked.size());
        assertEquals(3, outbox.backlogSize());

        runParked();

        assertEquals(List.of(7_074_000L, 7_075_000L), client.updates(UpdateEvent.FREQ));
        assertEquals(List.of("CW"), client.updates(UpdateEvent.MODE));
        assertEquals(0, outbox.backlogSize());
    }

    @Test
    void clientThatFallsTooFarBehindIsRetired() throws IOException {
        RecordingSubscriber client = new RecordingSubscriber("slow");
        QueuedSubscriber outbox = new QueuedSubscriber(client, parked::add, 2, failed::add);

        outbox.send(UpdateEvent.of(UpdateEvent.PTT, true));
        outbox.send(UpdateEvent.of(UpdateEvent.PTT, false));
        assertThrows(IOException.class, () -> outbox.send(UpdateEvent.of(UpdateEvent.PTT, true)));

        assertTrue(outbox.isRetired());
        assertEquals(0, outbox.backlogSize());
        assertFalse(client.isClosed());

        runParked();

        assertTrue(client.events().isEmpty());
        assertTrue(client.isClosed());
        assertThrows(IOException.class, () -> outbox.send(UpdateEvent.of(UpdateEvent.PTT, false)));
    }

    @Test
    void failedWriteReportsTheClientOnce() throws IOException {
        RecordingSubscriber client = new RecordingSubscriber("gone");
        QueuedSubscriber outbox = new QueuedSubscriber(client, Runnable::run, 8, failed::add);
        client.breakStream();

        outbox.send(UpdateEvent.of(UpdateEvent.CONNECTED, true));

        assertEquals(List.of("gone"), failed);
        assertTrue(client.isClosed());
        assertTrue(outbox.isRetired());
        assertThrows(IOException.class, () -> outbox.send(UpdateEvent.of(UpdateEvent.CONNECTED, false)));
        assertEquals(List.of("gone"), failed);
    }

    @Test
    void rejectedDrainRetiresTheClient() {
        RecordingSubscriber client = new RecordingSubscriber("client");
        QueuedSubscriber outbox = new QueuedSubscriber(client, task -> {
            throw new RejectedExecutionException("pool exhausted");
        }, 8, failed::add);

        assertThrows(IOException.class, () -> outbox.send(UpdateEvent.of(UpdateEvent.MODE, "USB")));
        assertTrue(outbox.isRetired());
        assertTrue(client.events().isEmpty());
    }

    @Test
    void closeFromTheBroadcasterDoesNotWriteOnTheCallingThread() {
        RecordingSubscriber client = new RecordingSubscriber("client");
        QueuedSubscriber outbox = new QueuedSubscriber(client, parked::add, 8, failed::add);

        outbox.close();

        assertFalse(client.isClosed());
        runParked();
        assertTrue(client.isClosed());
    }

    private void runParked() {
        List<Runnable> tasks = List.copyOf(parked);
        parked.clear();
        tasks.forEach(Runnable::run);
    }
}

package com.hamclock.rigdaemon.service;

import com.hamclock.rigdaemon.dto.InitEvent;
import com.hamclock.rigdaemon.dto.RigEvent;
import com.hamclock.rigdaemon.dto.UpdateEvent;
import com.hamclock.rigdaemon.helper.QueuedSubscriber;
import com.hamclock.rigdaemon.helper.Subscriber;
import com.hamclock.rigdaemon.helper.SubscriberRegistry;
import com.hamclock.rigdaemon.model.RadioSnapshot;
import com.hamclock.rigdaemon.model.RadioState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.concurrent.Executor;

/**
 * Single write path into {@link RadioState}.
 *
 * Each update compares the incoming value with the stored one; an unchanged value is dropped
 * silently, a changed value is stored and pushed to every subscriber as an {@link UpdateEvent}.
 * A subscriber whose delivery fails is unregistered.
 * <p>
 * Each compare-and-set runs under the broadcaster monitor together with the hand-off of its event,
 * so every client sees the changes of one property in the order they were stored. Subscribing
 * takes the same monitor, so a new client never misses an update that was not yet part of its
 * initial snapshot.
 * <p>
 * The hand-off never touches the network: each client gets a {@link QueuedSubscriber} drained on
 * the {@code streamExecutor}, and one slow client cannot stall the adapter thread or the others.
 */
@Slf4j
@Service
public class ChangeBroadcaster {

    // events a client may fall behind before it is dropped
    static final int SUBSCRIBER_BACKLOG = 256;

    private final RadioState state;
    private final SubscriberRegistry registry;
    private final Executor deliveryExecutor;

    public ChangeBroadcaster(RadioState state, SubscriberRegistry registry,
                             @Qualifier("streamExecutor") Executor deliveryExecutor) {
        this.state = state;
        this.registry = registry;
        this.deliveryExecutor = deliveryExecutor;
    }

    public synchronized void updateFrequency(long frequencyHz) {
        if (state.setFrequencyHz(frequencyHz)) {
            broadcast(UpdateEvent.of(UpdateEvent.FREQ, frequencyHz));
        }
    }

    public synchronized void updateMode(String mode) {
        if (state.setMode(mode)) {
            broadcast(UpdateEvent.of(UpdateEvent.MODE, mode));
        }
    }

    public synchronized void updatePassband(int passbandHz) {
        if (state.setPassbandHz(passbandHz)) {
            broadcast(UpdateEvent.of(UpdateEvent.WIDTH, passbandHz));
        }
    }

    public synchronized void updatePtt(boolean transmitEnabled) {
        if (state.setTransmitEnabled(transmitEnabled)) {
            broadcast(UpdateEvent.of(UpdateEvent.PTT, transmitEnabled));
        }
    }

    public synchronized void updateConnected(boolean connected) {
        if (state.setConnected(connected)) {
            broadcast(UpdateEvent.of(UpdateEvent.CONNECTED, connected));
        }
    }

    // Refresh lastUpdateAt after a successful poll or confirmed write
    public void touch() {
        state.touch();
    }

    public RadioSnapshot snapshot() {
        return state.snapshot();
    }

    public boolean isConnected() {
        return state.isConnected();
    }

    /**
     * Register a new stream client and send it the full state first.
     *
     * The snapshot is written on the calling thread, before the controller hands the stream to
     * the container, so the write only buffers. Later updates go through the client's outbox.
     *
     * @throws IOException if the initial snapshot cannot be written; the client is not registered
     */
    public synchronized void subscribe(Subscriber subscriber) throws IOException {
        subscriber.send(InitEvent.of(state.snapshot()));
        registry.register(new QueuedSubscriber(subscriber, deliveryExecutor, SUBSCRIBER_BACKLOG, registry::unregister));
    }

    public void unsubscribe(String subscriberId) {
        registry.unregister(subscriberId);
    }

    synchronized void broadcast(RigEvent event) {
        log.debug("📡 Broadcasting {}", event);
        for (Subscriber subscriber : registry.subscribers()) {
            try {
                subscriber.send(event);
            } catch (IOException | IllegalStateException e) {
                log.debug("📭 Dropping subscriber {}: {}", subscriber.id(), e.getMessage());
                registry.unregister(subscriber.id());
                subscriber.close();
            }
        }
    }
}

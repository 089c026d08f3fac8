package com.hamclock.rigdaemon.helper;

import com.hamclock.rigdaemon.dto.RigEvent;
import com.hamclock.rigdaemon.dto.UpdateEvent;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test double capturing every event it is sent. Can be switched to fail like a closed stream,
 * and remembers whether it was closed.
 */
public class RecordingSubscriber implements Subscriber {

    private final String id;
    private final List<RigEvent> events = new CopyOnWriteArrayList<>();
    private volatile boolean broken;
    private volatile boolean closed;

    public RecordingSubscriber(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void send(RigEvent event) throws IOException {
        if (broken) {
            throw new IOException("stream closed");
        }
        events.add(event);
    }

    @Override
    public void close() {
        closed = true;
    }

    public void breakStream() {
        broken = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public List<RigEvent> events() {
        return List.copyOf(events);
    }

    /**
     * Values of the update events for one property, in delivery order.
     */
    public List<Object> updates(String prop) {
        return events.stream()
                .filter(UpdateEvent.class::isInstance)
                .map(UpdateEvent.class::cast)
                .filter(update -> update.prop().equals(prop))
                .map(UpdateEvent::value)
                .toList();
    }

    public List<UpdateEvent> allUpdates() {
        return events.stream()
                .filter(UpdateEvent.class::isInstance)
                .map(UpdateEvent.class::cast)
                .toList();
    }
}

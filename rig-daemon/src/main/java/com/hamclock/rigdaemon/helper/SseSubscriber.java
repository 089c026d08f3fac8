package com.hamclock.rigdaemon.helper;

import com.hamclock.rigdaemon.dto.RigEvent;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

/**
 * {@link Subscriber} backed by a Spring {@link SseEmitter}; each event becomes one {@code data:} JSON line.
 */
public record SseSubscriber(String id, SseEmitter emitter) implements Subscriber {

    @Override
    public void send(RigEvent event) throws IOException {
        // SseEmitter is not safe for concurrent sends
        synchronized (emitter) {
            emitter.send(SseEmitter.event().data(event, MediaType.APPLICATION_JSON));
        }
    }

    @Override
    public void close() {
        emitter.complete();
    }
}

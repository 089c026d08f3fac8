package com.hamclock.rigdaemon.helper;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default implementation of SubscriberRegistry
 *
 * Thread-safe; registration order does not matter for delivery.
 */
@Slf4j
@Component
public class DefaultSubscriberRegistry implements SubscriberRegistry {

    private final ConcurrentMap<String, Subscriber> subscribers = new ConcurrentHashMap<>();

    @Override
    public void register(Subscriber subscriber) {
        if (subscriber == null || subscriber.id() == null) {
            log.warn("⚠️ Attempt to register null subscriber or subscriber id");
            return;
        }

        Subscriber previous = subscribers.put(subscriber.id(), subscriber);
        if (previous != null) {
            log.debug("🔄 Replaced existing subscriber registration: {}", subscriber.id());
        } else {
            log.info("📝 Stream client connected: {} (Total: {})", subscriber.id(), subscribers.size());
        }
    }

    @Override
    public void unregister(String subscriberId) {
        if (subscriberId == null) {
            return;
        }

        Subscriber removed = subscribers.remove(subscriberId);
        if (removed != null) {
            log.info("🗑️ Stream client disconnected: {} (Remaining: {})", subscriberId, subscribers.size());
        } else {
            log.debug("📭 Subscriber not found for unregistration: {}", subscriberId);
        }
    }

    @Override
    public Collection<Subscriber> subscribers() {
        return List.copyOf(subscribers.values());
    }

    @Override
    public int getSubscriberCount() {
        return subscribers.size();
    }
}

package com.hamclock.rigdaemon.helper;

import java.util.Collection;

/**
 * Registry of open event-stream clients.
 *
 * Lets the change broadcaster reach every subscriber without knowing how the
 * HTTP layer holds the underlying connections.
 */
public interface SubscriberRegistry {

    /**
     * Register a subscriber under its own id
     *
     * @param subscriber the subscriber
     */
    void register(Subscriber subscriber);

    /**
     * Unregister a subscriber
     *
     * @param subscriberId the id to remove
     */
    void unregister(String subscriberId);

    /**
     * Snapshot of the currently registered subscribers
     */
    Collection<Subscriber> subscribers();

    /**
     * Get the number of registered subscribers
     *
     * @return count of subscribers
     */
    int getSubscriberCount();
}

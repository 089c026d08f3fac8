package com.hamclock.rigdaemon.adapter;

/**
 * Read side of an adapter, driven by the poll scheduler and by the re-poll after each write.
 */
@FunctionalInterface
public interface RadioPoller {

    // Issue one round of read commands; results land in the shared state asynchronously
    void poll();
}

package net.scanward.core.spi;

import net.scanward.core.model.DispatchMessage;

/**
 * Durable, at-least-once channel towards the worker pool.
 * A normal return means the broker has accepted and persisted the message.
 */
public interface WorkQueue {
    void publish(DispatchMessage message) throws Exception;
}

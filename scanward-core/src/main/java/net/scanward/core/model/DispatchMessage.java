package net.scanward.core.model;

import java.util.UUID;

/** Payload handed to workers through the work queue: {@code {"id": ..., "target": ...}}. */
public record DispatchMessage(UUID id, String target) {
    public static DispatchMessage of(Scan scan) {
        return new DispatchMessage(scan.id(), scan.target());
    }
}

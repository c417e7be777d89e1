package net.scanward.core.spi;

import java.util.UUID;

/** Allocates scan identifiers. Implementations must be safe for concurrent callers. */
@FunctionalInterface
public interface IdGenerator {
    UUID next() throws Exception;
}

package net.scanward.core.spi;

import java.util.concurrent.Callable;

/**
 * Runs a body inside a store transaction. Any exception thrown by the body rolls the
 * transaction back and reaches the caller unchanged.
 */
public interface TxRunner {
    /** Joins the transaction bound to the current thread, or opens one. */
    <T> T required(Callable<T> body) throws Exception;

    /** Always opens a fresh transaction, suspending any outer one until it finishes. */
    <T> T requiresNew(Callable<T> body) throws Exception;
}

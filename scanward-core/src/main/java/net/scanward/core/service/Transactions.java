package net.scanward.core.service;

import net.scanward.core.error.PersistenceException;
import net.scanward.core.error.ScanwardException;
import net.scanward.core.spi.TxRunner;

import java.sql.SQLException;
import java.sql.SQLTransientException;
import java.util.concurrent.Callable;

/** Store calls from the services: domain failures pass through, everything else becomes a PersistenceException. */
final class Transactions {
    private Transactions() {}

    static <T> T required(TxRunner tx, String what, Callable<T> body) {
        try {
            return tx.required(body);
        } catch (ScanwardException e) {
            throw e;
        } catch (Exception e) {
            throw new PersistenceException(what, e);
        }
    }

    /** Serialization failure, deadlock or lock timeout somewhere in the cause chain. */
    static boolean isConflict(Throwable t) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof SQLTransientException) return true;
            if (c instanceof SQLException sql && sql.getSQLState() != null && sql.getSQLState().startsWith("40")) {
                return true;
            }
            if (c.getCause() == c) break;
        }
        return false;
    }
}

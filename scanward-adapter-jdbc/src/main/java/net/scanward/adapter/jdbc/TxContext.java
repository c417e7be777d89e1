package net.scanward.adapter.jdbc;

import java.sql.Connection;

/** Connection of the transaction running on the current thread. Repositories only ever use this one. */
public final class TxContext {
    private static final ThreadLocal<Connection> LOCAL = new ThreadLocal<>();

    private TxContext() {}

    public static void set(Connection c) { LOCAL.set(c); }

    public static Connection get() { return LOCAL.get(); }

    public static void clear() { LOCAL.remove(); }

    /** The bound connection, or an IllegalStateException when called outside a transaction. */
    public static Connection require() {
        Connection c = LOCAL.get();
        if (c == null) throw new IllegalStateException("TxContext required (wrap with a TxRunner)");
        return c;
    }
}

package net.custodian.adapter.jdbc;

import java.sql.Connection;

/** 현재 스레드의 트랜잭션 커넥션. JdbcTxRunner 가 설정/해제한다. */
public final class TxContext {
    private static final ThreadLocal<Connection> LOCAL = new ThreadLocal<>();
    private TxContext() {}
    public static void set(Connection c) { LOCAL.set(c); }
    public static Connection get() { return LOCAL.get(); }
    public static void clear() { LOCAL.remove(); }

    /** Repository 용: 트랜잭션 밖에서 호출되면 IllegalStateException */
    public static Connection require() {
        Connection c = LOCAL.get();
        if (c == null) throw new IllegalStateException("TxContext required (wrap with JdbcTxRunner)");
        return c;
    }
}

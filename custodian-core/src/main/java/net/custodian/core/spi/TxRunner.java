package net.custodian.core.spi;

import java.util.concurrent.Callable;

public interface TxRunner {
    <T> T required(Callable<T> body) throws Exception;
    <T> T requiresNew(Callable<T> body) throws Exception;
    default void required(Runnable body) throws Exception { required(() -> { body.run(); return null; }); }
    default void requiresNew(Runnable body) throws Exception { requiresNew(() -> { body.run(); return null; }); }

    /** 트랜잭션이 없는 저장소(InMemoryOptionStore 등)용: body를 그대로 호출 */
    static TxRunner direct() {
        return new TxRunner() {
            @Override public <T> T required(Callable<T> body) throws Exception { return body.call(); }
            @Override public <T> T requiresNew(Callable<T> body) throws Exception { return body.call(); }
        };
    }
}

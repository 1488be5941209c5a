package net.custodian.integration.spring.tx;

import net.custodian.adapter.jdbc.TxContext;
import net.custodian.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/**
 * 스프링 트랜잭션 위에서 동작하는 TxRunner.
 * 스프링이 바인딩한 커넥션을 TxContext 에 꽂아 JDBC repository 가 그대로 사용하게 한다.
 */
public final class SpringTxRunner implements TxRunner {
    private final TransactionTemplate required;
    private final TransactionTemplate requiresNew;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.required = template(tm, TransactionDefinition.PROPAGATION_REQUIRED);
        this.requiresNew = template(tm, TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.ds = ds;
    }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        return execute(required, false, body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        return execute(requiresNew, true, body);
    }

    private <T> T execute(TransactionTemplate tpl, boolean newTx, Callable<T> body) throws Exception {
        try {
            return tpl.execute(status -> {
                Connection outer = TxContext.get();
                // REQUIRED 중첩 호출은 바깥 커넥션 그대로 사용
                if (outer != null && !newTx) return call(body);

                // 스프링 트랜잭션의 물리 커넥션을 끌어와 TxContext에 꽂아줌
                Connection con = DataSourceUtils.getConnection(ds);
                try {
                    TxContext.set(con);
                    return call(body);
                } finally {
                    TxContext.clear();
                    if (outer != null) TxContext.set(outer);    // REQUIRES_NEW: 바깥 컨텍스트 복원
                    DataSourceUtils.releaseConnection(con, ds);
                }
            });
        } catch (CheckedBodyException e) {
            // 롤백은 TransactionTemplate 이 처리. 원래 예외를 그대로 던진다
            throw e.getCause();
        }
    }

    private static <T> T call(Callable<T> body) {
        try {
            return body.call();
        } catch (RuntimeException re) {
            throw re;
        } catch (Exception e) {
            throw new CheckedBodyException(e);
        }
    }

    private static TransactionTemplate template(PlatformTransactionManager tm, int propagation) {
        var tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(propagation);
        return tpl;
    }

    /** TransactionCallback 밖으로 검사 예외를 운반 */
    private static final class CheckedBodyException extends RuntimeException {
        CheckedBodyException(Exception cause) { super(cause); }

        @Override
        public synchronized Exception getCause() { return (Exception) super.getCause(); }
    }
}

package net.custodian.integration.spring.tx;

import net.custodian.adapter.jdbc.TxContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;

import javax.sql.DataSource;
import java.io.IOException;
import java.sql.Connection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SpringTxRunnerTest {

    private PlatformTransactionManager tm;
    private TransactionStatus status;
    private DataSource ds;
    private Connection outerCon;
    private Connection innerCon;
    private SpringTxRunner tx;

    @BeforeEach
    void setUp() throws Exception {
        tm = mock(PlatformTransactionManager.class);
        status = mock(TransactionStatus.class);
        ds = mock(DataSource.class);
        outerCon = mock(Connection.class);
        innerCon = mock(Connection.class);
        when(tm.getTransaction(any())).thenReturn(status);
        when(ds.getConnection()).thenReturn(outerCon, innerCon);
        tx = new SpringTxRunner(tm, ds);
    }

    @AfterEach
    void tearDown() {
        TxContext.clear();
    }

    @Test
    void bindsConnectionOnlyInsideBody() throws Exception {
        Connection seen = tx.required(TxContext::get);

        assertThat(seen).isSameAs(outerCon);
        assertThat(TxContext.get()).isNull();
        verify(tm).commit(status);
    }

    @Test
    void requiredJoinsOuterContext() throws Exception {
        Connection inner = tx.required(() -> tx.required(TxContext::get));

        assertThat(inner).isSameAs(outerCon);
    }

    @Test
    void requiresNewBindsItsOwnConnectionAndRestoresOuter() throws Exception {
        Connection[] seen = new Connection[2];
        tx.required(() -> {
            seen[0] = tx.requiresNew(TxContext::get);
            seen[1] = TxContext.get();
            return null;
        });

        assertThat(seen[0]).isSameAs(innerCon);
        assertThat(seen[1]).isSameAs(outerCon);
    }

    @Test
    void checkedExceptionRollsBackAndPropagatesUnwrapped() {
        assertThatThrownBy(() -> tx.required(() -> { throw new IOException("disk"); }))
                .isInstanceOf(IOException.class)
                .hasMessage("disk");

        verify(tm).rollback(status);
        verify(tm, never()).commit(status);
        assertThat(TxContext.get()).isNull();
    }

    @Test
    void runtimeExceptionPropagatesAsIs() {
        assertThatThrownBy(() -> tx.required(() -> { throw new IllegalStateException("nope"); }))
                .isInstanceOf(IllegalStateException.class);

        verify(tm).rollback(status);
    }
}

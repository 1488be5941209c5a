package net.custodian.integration.spring;

import net.custodian.adapter.jdbc.repo.JdbcOptionStore;
import net.custodian.core.spi.OptionStore;
import net.custodian.core.spi.TxRunner;
import net.custodian.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

/** DataSource 가 있을 때의 영속 계층 연결 (adapter-jdbc 재사용) */
@Configuration(proxyBeanMethods = false)
public class CustodianSpringConfig {

    // TxRunner (Spring)
    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // OptionStore 구현 등록
    @Bean
    public OptionStore optionStore(DataSource ds) {
        return new JdbcOptionStore(ds);
    }
}

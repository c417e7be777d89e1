package net.scanward.integration.spring;

import net.scanward.adapter.jdbc.repo.JdbcScanRepository;
import net.scanward.adapter.jdbc.repo.JdbcScanResultRepository;
import net.scanward.core.spi.Clock;
import net.scanward.core.spi.ScanRepository;
import net.scanward.core.spi.ScanResultRepository;
import net.scanward.core.spi.TxRunner;
import net.scanward.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

@Configuration
public class ScanwardSpringConfig {

    // TxRunner (Spring)
    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // Repository 구현 등록 (adapter-jdbc 재사용)
    @Bean public ScanRepository scanRepository() { return new JdbcScanRepository(); }
    @Bean public ScanResultRepository scanResultRepository() { return new JdbcScanResultRepository(); }

    @Bean public Clock systemClock() { return java.time.Instant::now; }
}

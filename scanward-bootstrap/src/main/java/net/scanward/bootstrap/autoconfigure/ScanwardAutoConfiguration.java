package net.scanward.bootstrap.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import net.scanward.adapter.amqp.RabbitWorkQueue;
import net.scanward.bootstrap.props.ScanwardProperties;
import net.scanward.core.maintenance.MaintenanceService;
import net.scanward.core.service.DispatchService;
import net.scanward.core.service.ResultIngestService;
import net.scanward.core.service.RetryPolicy;
import net.scanward.core.service.ScanQueryService;
import net.scanward.core.service.UuidV7Generator;
import net.scanward.core.spi.*;
import net.scanward.integration.spring.ScanwardSpringConfig;
import net.scanward.integration.spring.sched.ScanwardSchedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Lazy;

@AutoConfiguration(after = {DataSourceAutoConfiguration.class, DataSourceTransactionManagerAutoConfiguration.class})
@EnableConfigurationProperties(ScanwardProperties.class)
@Import(ScanwardSpringConfig.class) // integration-spring: repos/tx/clock wiring
public class ScanwardAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(ScanwardAutoConfiguration.class);

    // --- SPI 기본 구현(없으면) 제공 ---

    @Bean
    @ConditionalOnMissingBean(IdGenerator.class)
    public IdGenerator scanIdGenerator() {
        return new UuidV7Generator();
    }

    /** RabbitMQ work queue; skipped when the application brings its own {@link WorkQueue}. */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnMissingBean(WorkQueue.class)
    static class AmqpWorkQueueConfiguration {

        @Bean
        public ConnectionFactory scanwardAmqpConnectionFactory(ScanwardProperties props) throws Exception {
            ConnectionFactory f = new ConnectionFactory();
            f.setUri(props.getQueue().getUri());
            f.setAutomaticRecoveryEnabled(true);
            return f;
        }

        // 브로커가 없어도 앱은 뜬다: 첫 발행 시점에 연결
        @Bean(destroyMethod = "close")
        @Lazy
        public Connection scanwardAmqpConnection(ConnectionFactory scanwardAmqpConnectionFactory) throws Exception {
            log.info("Connecting to broker {}:{}", scanwardAmqpConnectionFactory.getHost(), scanwardAmqpConnectionFactory.getPort());
            return scanwardAmqpConnectionFactory.newConnection("scanward");
        }

        @Bean(destroyMethod = "close")
        public WorkQueue workQueue(@Lazy Connection scanwardAmqpConnection,
                                   ObjectProvider<ObjectMapper> objectMapper,
                                   ScanwardProperties props) {
            return new RabbitWorkQueue(scanwardAmqpConnection,
                    props.getQueue().getName(),
                    props.getQueue().getConfirmTimeout(),
                    objectMapper.getIfAvailable(ObjectMapper::new),
                    props.getQueue().getMaxIdleChannels());
        }
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public DispatchService dispatchService(ScanRepository scans,
                                           WorkQueue queue,
                                           TxRunner tx,
                                           Clock clock,
                                           IdGenerator ids,
                                           ScanwardProperties props) {
        var d = props.getDispatch();
        return new DispatchService(scans, queue, tx, clock, ids,
                RetryPolicy.exponential(d.getRetryBackoff(), d.getMaxBackoff()),
                d.getPublishAttempts(), d.getMaxPending());
    }

    @Bean
    @ConditionalOnMissingBean
    public ResultIngestService resultIngestService(ScanRepository scans,
                                                   ScanResultRepository results,
                                                   TxRunner tx,
                                                   Clock clock,
                                                   ScanwardProperties props) {
        return new ResultIngestService(scans, results, tx, clock,
                props.getIngest().isDedupeProgress(), props.getIngest().getConflictRetries());
    }

    @Bean
    @ConditionalOnMissingBean
    public ScanQueryService scanQueryService(ScanRepository scans, ScanResultRepository results, TxRunner tx) {
        return new ScanQueryService(scans, results, tx);
    }

    @Bean
    @ConditionalOnMissingBean
    public MaintenanceService maintenance(ScanRepository scans, WorkQueue queue, TxRunner tx, Clock clock) {
        return new MaintenanceService(scans, queue, tx, clock);
    }

    // --- 스케줄러 등록 (프로퍼티로 주기 제어) ---

    @Bean
    @ConditionalOnProperty(prefix = "scanward.maintenance", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ScanwardSchedulers scanwardSchedulers(MaintenanceService maintenance, ScanwardProperties props) {
        var s = new ScanwardSchedulers(maintenance);

        // @Scheduled 딜레이는 scanward.maintenance.delay-ms 에서 읽힘. 나머지만 세터로 주입
        var m = props.getMaintenance();
        s.setStaleAfter(m.getStaleAfter());
        s.setMaxDispatchAttempts(m.getMaxDispatchAttempts());
        s.setBatchSize(m.getBatchSize());
        return s;
    }
}

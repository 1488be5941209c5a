package net.custodian.bootstrap.autoconfigure;

import net.custodian.bootstrap.props.CustodianProperties;
import net.custodian.bootstrap.schedule.InitialScheduleRegistrar;
import net.custodian.bootstrap.schedule.TaskCatalog;
import net.custodian.bootstrap.settings.PropertiesSettingsProvider;
import net.custodian.core.cache.CacheBackend;
import net.custodian.core.cache.CacheFactory;
import net.custodian.core.execution.ScheduledTask;
import net.custodian.core.execution.TaskExecutor;
import net.custodian.core.maintenance.MaintenanceService;
import net.custodian.core.progress.ProgressStore;
import net.custodian.core.ratelimit.OptionLock;
import net.custodian.core.ratelimit.RateLimiter;
import net.custodian.core.service.RetryPolicy;
import net.custodian.core.service.SchedulingService;
import net.custodian.core.spi.*;
import net.custodian.core.support.InMemoryOptionStore;
import net.custodian.integration.spring.CustodianSpringConfig;
import net.custodian.integration.spring.cache.SpringCacheClient;
import net.custodian.integration.spring.sched.CustodianSchedulers;
import net.custodian.integration.spring.sched.SpringHostScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.cache.CacheAutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnSingleCandidate;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.ZoneId;

@AutoConfiguration(after = {
        DataSourceAutoConfiguration.class,
        DataSourceTransactionManagerAutoConfiguration.class,
        CacheAutoConfiguration.class})
@EnableConfigurationProperties(CustodianProperties.class)
public class CustodianAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(CustodianAutoConfiguration.class);

    // --- 저장소: DataSource 가 있으면 JDBC, 없으면 메모리 ---

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnSingleCandidate(DataSource.class)
    @ConditionalOnBean(PlatformTransactionManager.class)
    @ConditionalOnMissingBean(OptionStore.class)
    @Import(CustodianSpringConfig.class) // integration-spring: tx/option store wiring
    static class JdbcStoreConfiguration {
    }

    @Bean
    @ConditionalOnMissingBean(OptionStore.class)
    public OptionStore inMemoryOptionStore() {
        log.info("No DataSource found; checkpoints and transients are kept in memory");
        return new InMemoryOptionStore();
    }

    @Bean
    @ConditionalOnMissingBean(TxRunner.class)
    public TxRunner directTxRunner() {
        return TxRunner.direct();
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock custodianClock() {
        return Clock.system();
    }

    // --- 설정 ---

    @Bean
    @ConditionalOnMissingBean(SettingsProvider.class)
    public SettingsProvider settingsProvider(CustodianProperties props) {
        return new PropertiesSettingsProvider(props, TaskCatalog.from(props));
    }

    // --- 캐시 ---

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnBean(CacheManager.class)
    @ConditionalOnProperty(prefix = "custodian.cache", name = "use-cache-manager", havingValue = "true")
    static class CacheManagerClientConfiguration {
        @Bean
        @ConditionalOnMissingBean(ExternalCacheClient.class)
        public ExternalCacheClient springCacheClient(CacheManager cacheManager, CustodianProperties props) {
            return new SpringCacheClient(cacheManager, props.getCache().isPersistent());
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public CacheFactory cacheFactory(ObjectProvider<ExternalCacheClient> externalClient,
                                     OptionStore options,
                                     TxRunner tx,
                                     Clock clock,
                                     CustodianProperties props) {
        var factory = new CacheFactory(externalClient.getIfAvailable(), options, tx, clock);
        factory.setDefaultPrefix(props.getCache().getPrefix());
        return factory;
    }

    @Bean
    @ConditionalOnMissingBean(CacheBackend.class)
    public CacheBackend cacheBackend(CacheFactory factory) {
        return factory.getInstance();
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public ProgressStore progressStore(OptionStore options, TxRunner tx, Clock clock) {
        return new ProgressStore(options, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public OptionLock optionLock(OptionStore options, TxRunner tx, Clock clock, CustodianProperties props) {
        var rl = props.getRateLimit();
        return new OptionLock(options, tx, clock,
                rl.getLockTtl(), rl.getLockAttempts(), RetryPolicy.fixed(rl.getLockBackoff()));
    }

    @Bean
    @ConditionalOnMissingBean
    public RateLimiter rateLimiter(CacheBackend cache,
                                   CacheFactory factory,
                                   OptionLock lock,
                                   SettingsProvider settings) {
        // 카운터 fallback 은 항상 option store 위의 transient
        return new RateLimiter(cache, factory.createTransientCache(factory.getDefaultPrefix()), lock, settings);
    }

    @Bean
    @ConditionalOnMissingBean(TaskScheduler.class)
    public ThreadPoolTaskScheduler custodianTaskScheduler(CustodianProperties props) {
        var ts = new ThreadPoolTaskScheduler();
        ts.setPoolSize(Math.max(1, props.getScheduler().getPoolSize()));
        ts.setThreadNamePrefix("custodian-");
        return ts;
    }

    @Bean
    @ConditionalOnMissingBean(HostScheduler.class)
    public HostScheduler hostScheduler(TaskScheduler taskScheduler,
                                       Clock clock,
                                       ObjectProvider<TaskExecutor> executor) {
        // TaskExecutor 가 HostScheduler 를 필요로 하므로 발화 시점에 지연 조회
        return new SpringHostScheduler(taskScheduler, clock, taskId -> executor.getObject().run(taskId));
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulingService schedulingService(SettingsProvider settings,
                                               HostScheduler host,
                                               Clock clock,
                                               CustodianProperties props) {
        ZoneId zone = ZoneId.of(props.getScheduler().getZone());
        return new SchedulingService(settings, host, clock, zone, TaskCatalog.from(props));
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskExecutor taskExecutor(HostScheduler host, Clock clock, ObjectProvider<ScheduledTask> tasks) {
        var executor = new TaskExecutor(host, clock);
        tasks.orderedStream().forEach(executor::register);
        return executor;
    }

    @Bean
    @ConditionalOnMissingBean
    public MaintenanceService maintenance(ProgressStore progress, SchedulingService scheduling, Clock clock) {
        return new MaintenanceService(progress, scheduling, clock);
    }

    // --- 주기 점검 (프로퍼티로 주기 제어) ---

    @Configuration(proxyBeanMethods = false)
    @EnableScheduling
    @ConditionalOnProperty(prefix = "custodian.scheduler", name = "maintenance-enabled", havingValue = "true", matchIfMissing = true)
    static class MaintenanceSchedulingConfiguration {
        @Bean
        public CustodianSchedulers custodianSchedulers(MaintenanceService maintenance, CustodianProperties props) {
            var s = new CustodianSchedulers(maintenance);
            // 딜레이는 @Scheduled 가 custodian.scheduler.maintenance-delay-ms 에서 직접 읽음
            s.setStaleAfter(props.getProgress().getStaleAfter());
            return s;
        }
    }

    // --- 기동 시 등록 ---

    @Bean
    public InitialScheduleRegistrar initialScheduleRegistrar(SchedulingService scheduling, TaskExecutor executor) {
        return new InitialScheduleRegistrar(scheduling, executor);
    }

    @Bean
    @ConditionalOnProperty(prefix = "custodian.scheduler", name = "schedule-on-startup", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner initialScheduleRunner(InitialScheduleRegistrar registrar) {
        return args -> registrar.register();
    }
}

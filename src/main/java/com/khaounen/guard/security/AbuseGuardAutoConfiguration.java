package com.khaounen.guard.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.khaounen.guard.config.RequestContextFilter;
import com.khaounen.guard.security.counter.CounterStore;
import com.khaounen.guard.security.counter.FailoverCounterStore;
import com.khaounen.guard.security.counter.LocalCounterStore;
import com.khaounen.guard.security.counter.RedisCounterStore;
import com.khaounen.guard.security.decision.DecisionEngine;
import com.khaounen.guard.security.decision.DecisionStateStore;
import com.khaounen.guard.security.decision.FailoverDecisionStateStore;
import com.khaounen.guard.security.decision.LocalDecisionStateStore;
import com.khaounen.guard.security.decision.RedisDecisionStateStore;
import com.khaounen.guard.security.decision.TrafficRules;
import com.khaounen.guard.security.filters.AbuseGuardFilter;
import com.khaounen.guard.security.filters.ChallengeHandler;
import com.khaounen.guard.security.filters.DefaultChallengeHandler;
import com.khaounen.guard.security.identity.DefaultIdentityStrategy;
import com.khaounen.guard.security.identity.IdentityStrategy;
import com.khaounen.guard.security.intake.TrafficIntake;
import com.khaounen.guard.security.mitigation.CloudflareEdgeFirewall;
import com.khaounen.guard.security.mitigation.EdgeFirewall;
import com.khaounen.guard.security.mitigation.LoggingEdgeFirewall;
import com.khaounen.guard.security.mitigation.MitigationQueue;
import com.khaounen.guard.security.mitigation.MitigationSyncListener;
import com.khaounen.guard.security.mitigation.MitigationSyncWorker;
import com.khaounen.guard.security.reputation.FailoverReputationLedger;
import com.khaounen.guard.security.reputation.LocalReputationLedger;
import com.khaounen.guard.security.reputation.RedisReputationLedger;
import com.khaounen.guard.security.reputation.ReputationLedger;
import com.khaounen.guard.security.store.StoreCommandExecutor;
import com.khaounen.guard.security.store.StoreFailover;
import com.khaounen.guard.security.telemetry.DecisionTelemetry;
import com.khaounen.guard.security.telemetry.MicrometerDecisionTelemetry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.mail.javamail.JavaMailSender;

import java.time.Clock;
import java.time.Duration;
import java.util.stream.Collectors;

@Slf4j
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
})
@EnableConfigurationProperties({AbuseGuardProperties.class, GuardAlertProperties.class})
public class AbuseGuardAutoConfiguration {

    /** Runs after Spring Security's filter chain so authenticated principals are visible. */
    static final int REQUEST_CONTEXT_FILTER_ORDER = -90;
    static final int GUARD_FILTER_ORDER = -89;

    @Bean
    @ConditionalOnMissingBean
    public Clock abuseGuardClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public DecisionTelemetry decisionTelemetry() {
        return DecisionTelemetry.NOOP;
    }

    @Bean
    @ConditionalOnMissingBean
    public IdentityStrategy identityStrategy(AbuseGuardProperties properties) {
        return new DefaultIdentityStrategy(properties.getIdentityMode());
    }

    @Bean
    @ConditionalOnMissingBean
    public CounterStore counterStore(AbuseGuardProperties properties) {
        return new LocalCounterStore(properties.getWindow().getSeconds(), properties.getCache().getMaximumIdentities());
    }

    @Bean
    @ConditionalOnMissingBean
    public ReputationLedger reputationLedger(AbuseGuardProperties properties) {
        return localLedger(properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public DecisionStateStore decisionStateStore(AbuseGuardProperties properties) {
        return new LocalDecisionStateStore(properties.retention(), properties.getCache().getMaximumIdentities());
    }

    @Bean
    @ConditionalOnMissingBean
    public MitigationQueue mitigationQueue(AbuseGuardProperties properties) {
        AbuseGuardProperties.Mitigation mitigation = properties.getMitigation();
        return new MitigationQueue(mitigation.getQueueCapacity(),
                Duration.ofMinutes(mitigation.getDedupeRetentionMinutes()));
    }

    @Bean
    @ConditionalOnMissingBean
    public TrafficRules trafficRules(AbuseGuardProperties properties) {
        return properties.toTrafficRules();
    }

    @Bean
    @ConditionalOnMissingBean
    public DecisionEngine decisionEngine(
            AbuseGuardProperties properties,
            CounterStore counterStore,
            ReputationLedger reputationLedger,
            DecisionStateStore decisionStateStore,
            MitigationQueue mitigationQueue,
            DecisionTelemetry telemetry,
            TrafficRules trafficRules,
            Clock clock
    ) {
        properties.validate();
        log.info("abuse guard failure policies: store={}, decision={}",
                properties.getFailure().getStorePolicy(), properties.getFailure().getDecisionPolicy());
        return new DecisionEngine(
                counterStore,
                reputationLedger,
                decisionStateStore,
                mitigationQueue,
                telemetry,
                trafficRules,
                properties.toDecisionSettings(),
                clock
        );
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public TrafficIntake trafficIntake(AbuseGuardProperties properties, DecisionEngine engine, DecisionTelemetry telemetry) {
        AbuseGuardProperties.Intake intake = properties.getIntake();
        return new TrafficIntake(engine, telemetry, intake.getWorkerThreads(), intake.getQueueCapacity(),
                intake.getDecisionTimeoutMillis());
    }

    @Bean
    @ConditionalOnMissingBean
    public EdgeFirewall edgeFirewall(AbuseGuardProperties properties, ObjectProvider<ObjectMapper> objectMapperProvider) {
        AbuseGuardProperties.Cloudflare cloudflare = properties.getCloudflare();
        if (!cloudflare.isEnabled()) {
            return new LoggingEdgeFirewall();
        }
        return new CloudflareEdgeFirewall(
                cloudflare.getBaseUrl(),
                cloudflare.getZoneId(),
                cloudflare.getApiToken(),
                Duration.ofMillis(cloudflare.getConnectTimeoutMillis()),
                Duration.ofMillis(cloudflare.getRequestTimeoutMillis()),
                objectMapperProvider.getIfAvailable(ObjectMapper::new)
        );
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "abuse-guard.mitigation", name = "enabled", matchIfMissing = true)
    public MitigationSyncWorker mitigationSyncWorker(
            AbuseGuardProperties properties,
            MitigationQueue queue,
            EdgeFirewall edgeFirewall,
            ReputationLedger reputationLedger,
            DecisionTelemetry telemetry,
            ObjectProvider<MitigationSyncListener> listeners,
            Clock clock
    ) {
        return new MitigationSyncWorker(
                queue,
                edgeFirewall,
                reputationLedger,
                telemetry,
                listeners.orderedStream().collect(Collectors.toList()),
                properties.toMitigationSettings(),
                clock
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public GuardAdminService guardAdminService(DecisionEngine engine, Clock clock) {
        return new GuardAdminService(engine, clock);
    }

    private static LocalReputationLedger localLedger(AbuseGuardProperties properties) {
        return new LocalReputationLedger(properties.toDecayFunction(), properties.retention(),
                properties.getCache().getMaximumIdentities());
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "io.micrometer.core.instrument.MeterRegistry")
    @ConditionalOnBean(type = "io.micrometer.core.instrument.MeterRegistry")
    static class MicrometerTelemetryConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public DecisionTelemetry decisionTelemetry(MeterRegistry registry) {
            return new MicrometerDecisionTelemetry(registry);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "org.springframework.data.redis.core.StringRedisTemplate")
    @ConditionalOnBean(type = "org.springframework.data.redis.core.StringRedisTemplate")
    static class RedisStoreConfiguration {

        @Bean(destroyMethod = "close")
        @ConditionalOnMissingBean
        public StoreCommandExecutor storeCommandExecutor(AbuseGuardProperties properties) {
            AbuseGuardProperties.Failure failure = properties.getFailure();
            return new StoreCommandExecutor(failure.getStoreThreads(), failure.getStoreQueueCapacity(),
                    failure.getStoreTimeoutMillis());
        }

        @Bean
        @ConditionalOnMissingBean
        public CounterStore counterStore(
                AbuseGuardProperties properties,
                StringRedisTemplate redis,
                StoreCommandExecutor executor,
                ObjectProvider<DecisionTelemetry> telemetry
        ) {
            properties.validate();
            int windowSeconds = properties.getWindow().getSeconds();
            return new FailoverCounterStore(
                    new RedisCounterStore(redis, executor, windowSeconds),
                    new LocalCounterStore(windowSeconds, properties.getCache().getMaximumIdentities()),
                    failover("counter", properties, telemetry)
            );
        }

        @Bean
        @ConditionalOnMissingBean
        public ReputationLedger reputationLedger(
                AbuseGuardProperties properties,
                StringRedisTemplate redis,
                StoreCommandExecutor executor,
                ObjectProvider<ObjectMapper> objectMapperProvider,
                ObjectProvider<DecisionTelemetry> telemetry
        ) {
            properties.validate();
            return new FailoverReputationLedger(
                    new RedisReputationLedger(redis, executor, objectMapperProvider.getIfAvailable(ObjectMapper::new),
                            properties.toDecayFunction(), properties.retention()),
                    localLedger(properties),
                    failover("reputation", properties, telemetry)
            );
        }

        @Bean
        @ConditionalOnMissingBean
        public DecisionStateStore decisionStateStore(
                AbuseGuardProperties properties,
                StringRedisTemplate redis,
                StoreCommandExecutor executor,
                ObjectProvider<ObjectMapper> objectMapperProvider,
                ObjectProvider<DecisionTelemetry> telemetry
        ) {
            properties.validate();
            return new FailoverDecisionStateStore(
                    new RedisDecisionStateStore(redis, executor, objectMapperProvider.getIfAvailable(ObjectMapper::new),
                            properties.retention()),
                    new LocalDecisionStateStore(properties.retention(), properties.getCache().getMaximumIdentities()),
                    failover("state", properties, telemetry)
            );
        }

        private static StoreFailover failover(
                String component,
                AbuseGuardProperties properties,
                ObjectProvider<DecisionTelemetry> telemetry
        ) {
            return new StoreFailover(component, properties.getFailure().getStorePolicy(),
                    telemetry.getIfAvailable(() -> DecisionTelemetry.NOOP));
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "org.springframework.mail.javamail.JavaMailSender")
    static class AlertConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public BlockAlertDispatcher blockAlertDispatcher(
                GuardAlertProperties properties,
                ObjectProvider<ObjectMapper> objectMapperProvider,
                ObjectProvider<JavaMailSender> mailSenderProvider
        ) {
            return new BlockAlertDispatcher(properties, objectMapperProvider, mailSenderProvider);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    static class ServletConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public ChallengeHandler challengeHandler() {
            return new DefaultChallengeHandler();
        }

        @Bean
        @ConditionalOnMissingBean(name = "abuseGuardRequestContextFilter")
        public FilterRegistrationBean<RequestContextFilter> abuseGuardRequestContextFilter(IdentityStrategy identityStrategy) {
            FilterRegistrationBean<RequestContextFilter> registration =
                    new FilterRegistrationBean<>(new RequestContextFilter(identityStrategy));
            registration.setOrder(REQUEST_CONTEXT_FILTER_ORDER);
            return registration;
        }

        @Bean
        @ConditionalOnMissingBean(name = "abuseGuardFilter")
        public FilterRegistrationBean<AbuseGuardFilter> abuseGuardFilter(
                AbuseGuardProperties properties,
                TrafficIntake intake,
                ChallengeHandler challengeHandler,
                Clock clock
        ) {
            FilterRegistrationBean<AbuseGuardFilter> registration =
                    new FilterRegistrationBean<>(new AbuseGuardFilter(properties, intake, challengeHandler, clock));
            registration.setOrder(GUARD_FILTER_ORDER);
            return registration;
        }

        @Bean
        @ConditionalOnMissingBean
        @ConditionalOnProperty(prefix = "abuse-guard.admin", name = "enabled", havingValue = "true")
        public GuardAdminController guardAdminController(GuardAdminService service) {
            return new GuardAdminController(service);
        }
    }
}

package com.taskgateway.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskgateway.api.worker.LocalGatewayClient;
import com.taskgateway.client.credential.CredentialCache;
import com.taskgateway.client.credential.CredentialIssuer;
import com.taskgateway.client.credential.HttpCredentialIssuer;
import com.taskgateway.client.credential.InMemorySharedTokenStore;
import com.taskgateway.client.credential.SharedTokenStore;
import com.taskgateway.client.http.ApiAccount;
import com.taskgateway.client.http.ApiEndpoint;
import com.taskgateway.client.http.ApiTransport;
import com.taskgateway.client.http.CallClass;
import com.taskgateway.client.http.JdkHttpApiTransport;
import com.taskgateway.client.http.ResilientApiClient;
import com.taskgateway.client.http.Sleeper;
import com.taskgateway.core.model.RetryPolicy;
import com.taskgateway.core.repository.CallbackRecordRepository;
import com.taskgateway.core.repository.PendingCorrelationRepository;
import com.taskgateway.core.repository.TaskRecordRepository;
import com.taskgateway.engine.correlation.CallbackCorrelator;
import com.taskgateway.engine.correlation.CallbackSource;
import com.taskgateway.engine.correlation.CamundaMessageSignalSender;
import com.taskgateway.engine.correlation.PayloadFingerprint;
import com.taskgateway.engine.correlation.ResumeSignalSender;
import com.taskgateway.engine.dispatch.DispatchScheduler;
import com.taskgateway.engine.dispatch.TaskDispatcher;
import com.taskgateway.engine.handler.ExternalApiTopicHandler;
import com.taskgateway.engine.handler.TopicHandlerRegistry;
import com.taskgateway.engine.handler.TopicRoute;
import com.taskgateway.engine.health.GatewayHealthIndicator;
import com.taskgateway.engine.lifecycle.GracefulShutdownHandler;
import com.taskgateway.engine.metrics.GatewayMetrics;
import com.taskgateway.engine.persistence.InMemoryCallbackRecordRepository;
import com.taskgateway.engine.persistence.InMemoryPendingCorrelationRepository;
import com.taskgateway.engine.persistence.InMemoryTaskRecordRepository;
import com.taskgateway.engine.persistence.jdbc.JdbcCallbackRecordRepository;
import com.taskgateway.engine.persistence.jdbc.JdbcPendingCorrelationRepository;
import com.taskgateway.engine.persistence.jdbc.JdbcSharedTokenStore;
import com.taskgateway.engine.persistence.jdbc.JdbcTaskRecordRepository;
import com.taskgateway.recovery.RecoveryEngine;
import com.taskgateway.worker.ExternalTaskAdapter;
import com.taskgateway.worker.TopicSubscription;
import com.taskgateway.worker.engine.CamundaRestEngineClient;
import com.taskgateway.worker.engine.EngineClient;
import com.taskgateway.worker.gateway.GatewayClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the gateway components from {@link GatewayProperties}.
 *
 * <p>Background components (dispatch scheduler, recovery sweeps and, when enabled, the
 * embedded external-task adapter) start once the application is ready and are stopped by
 * the {@link GracefulShutdownHandler} on context close.
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(GatewayProperties.class)
public class GatewayConfiguration {

    private static final Logger log = LoggerFactory.getLogger(GatewayConfiguration.class);

    @Bean
    public Clock gatewayClock() {
        return Clock.systemUTC();
    }

    @Bean
    public GracefulShutdownHandler gracefulShutdownHandler(GatewayProperties props) {
        return new GracefulShutdownHandler(nodeId(props));
    }

    // ========== Stores ==========

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "gateway", name = "store", havingValue = "memory")
    static class MemoryStoreConfiguration {

        @Bean
        public TaskRecordRepository taskRecordRepository() {
            return new InMemoryTaskRecordRepository();
        }

        @Bean
        public CallbackRecordRepository callbackRecordRepository(PendingCorrelationRepository pendingCorrelationRepository) {
            return new InMemoryCallbackRecordRepository(pendingCorrelationRepository);
        }

        @Bean
        public PendingCorrelationRepository pendingCorrelationRepository() {
            return new InMemoryPendingCorrelationRepository();
        }

        @Bean
        public SharedTokenStore sharedTokenStore(Clock clock) {
            return new InMemorySharedTokenStore(clock);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "gateway", name = "store", havingValue = "jdbc", matchIfMissing = true)
    static class JdbcStoreConfiguration {

        @Bean
        public TaskRecordRepository taskRecordRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
            return new JdbcTaskRecordRepository(jdbcTemplate, objectMapper);
        }

        @Bean
        public CallbackRecordRepository callbackRecordRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
            return new JdbcCallbackRecordRepository(jdbcTemplate, objectMapper);
        }

        @Bean
        public PendingCorrelationRepository pendingCorrelationRepository(
                JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
            return new JdbcPendingCorrelationRepository(jdbcTemplate, transactionTemplate);
        }

        @Bean
        public SharedTokenStore sharedTokenStore(
                JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate, Clock clock) {
            return new JdbcSharedTokenStore(jdbcTemplate, transactionTemplate, clock);
        }
    }

    // ========== External APIs ==========

    @Bean
    public ApiTransport apiTransport() {
        return new JdkHttpApiTransport();
    }

    @Bean
    public CredentialIssuer credentialIssuer(
            GatewayProperties props, ApiTransport transport, ObjectMapper objectMapper, Clock clock) {
        return new HttpCredentialIssuer(endpoints(props), transport, objectMapper, clock);
    }

    @Bean
    public CredentialCache credentialCache(
            CredentialIssuer issuer,
            SharedTokenStore sharedTokenStore,
            GatewayProperties props,
            Clock clock,
            GatewayMetrics metrics) {
        CredentialCache cache = new CredentialCache(
            issuer, sharedTokenStore, props.getCredentials().getSafetyMargin(), clock);
        metrics.bindCredentialCache(cache);
        return cache;
    }

    @Bean
    public ResilientApiClient resilientApiClient(
            GatewayProperties props, CredentialCache credentialCache, ApiTransport transport, Clock clock) {
        return new ResilientApiClient(endpoints(props), credentialCache, transport, clock, Sleeper.SYSTEM);
    }

    @Bean
    public TopicHandlerRegistry topicHandlerRegistry(
            GatewayProperties props, ResilientApiClient apiClient, ObjectMapper objectMapper) {
        TopicHandlerRegistry registry = new TopicHandlerRegistry();
        props.getTopics().forEach((topic, route) -> {
            if (!props.getApis().containsKey(route.getApi())) {
                throw new IllegalStateException(
                    "Topic " + topic + " routes to unknown API " + route.getApi());
            }
            TopicRoute topicRoute = new TopicRoute(
                route.getApi(),
                route.getAccount(),
                route.getMethod(),
                route.getPath(),
                route.getCallClass(),
                route.getContentType(),
                route.getBodyField(),
                route.getSoapAction(),
                route.getRequiredFields()
            );
            registry.register(topic, new ExternalApiTopicHandler(topicRoute, apiClient, objectMapper));
        });
        return registry;
    }

    // ========== Tasks ==========

    @Bean
    public TaskDispatcher taskDispatcher(
            TaskRecordRepository taskRepository,
            TopicHandlerRegistry handlers,
            GatewayProperties props,
            Clock clock,
            GatewayMetrics metrics) {
        GatewayProperties.Dispatch dispatch = props.getDispatch();
        return new TaskDispatcher(
            taskRepository,
            handlers,
            retryPolicy(dispatch.getRetry()),
            dispatch.getMaxProcessingTime(),
            nodeId(props),
            clock,
            metrics
        );
    }

    @Bean
    public DispatchScheduler dispatchScheduler(
            TaskDispatcher dispatcher, TaskRecordRepository taskRepository, GatewayProperties props, Clock clock) {
        GatewayProperties.Dispatch dispatch = props.getDispatch();
        return new DispatchScheduler(
            dispatcher,
            taskRepository,
            clock,
            dispatch.getPoolSize(),
            dispatch.getPollInterval(),
            dispatch.getBatchSize()
        );
    }

    // ========== Callbacks ==========

    @Bean
    public HttpClient engineHttpClient() {
        return HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    }

    @Bean
    public ResumeSignalSender resumeSignalSender(
            GatewayProperties props, HttpClient engineHttpClient, ObjectMapper objectMapper) {
        GatewayProperties.Engine engine = props.getEngine();
        return new CamundaMessageSignalSender(
            engine.getUrl(),
            engine.getUsername(),
            engine.getPassword(),
            engine.getRequestTimeout(),
            engineHttpClient,
            objectMapper
        );
    }

    @Bean
    public CallbackCorrelator callbackCorrelator(
            CallbackRecordRepository callbackRepository,
            PendingCorrelationRepository pendingRepository,
            ResumeSignalSender signalSender,
            ObjectMapper objectMapper,
            GatewayProperties props,
            Clock clock,
            GatewayMetrics metrics,
            GracefulShutdownHandler shutdownHandler) {
        GatewayProperties.Callbacks callbacks = props.getCallbacks();
        ExecutorService processingExecutor = callbackExecutor(callbacks.getProcessingThreads());
        shutdownHandler.register("callback-processing", processingExecutor::shutdown);
        return new CallbackCorrelator(
            callbackRepository,
            pendingRepository,
            callbackSources(callbacks),
            new PayloadFingerprint(objectMapper),
            signalSender,
            processingExecutor,
            clock,
            callbacks.getRetention(),
            callbacks.getDefaultPendingTtl(),
            metrics
        );
    }

    // ========== Recovery & health ==========

    @Bean
    public RecoveryEngine recoveryEngine(
            TaskRecordRepository taskRepository,
            TaskDispatcher taskDispatcher,
            CallbackCorrelator correlator,
            GatewayProperties props,
            Clock clock) {
        GatewayProperties.Recovery recovery = props.getRecovery();
        return new RecoveryEngine(
            taskRepository,
            taskDispatcher,
            correlator,
            clock,
            new RecoveryEngine.Settings(
                recovery.getLeaseCheckInterval(),
                recovery.getReconcileInterval(),
                recovery.getExpiryInterval(),
                recovery.getBatchSize()
            )
        );
    }

    @Bean
    public GatewayHealthIndicator gatewayHealthIndicator(
            TaskDispatcher taskDispatcher,
            CredentialCache credentialCache,
            CallbackCorrelator correlator,
            GracefulShutdownHandler shutdownHandler) {
        return new GatewayHealthIndicator(taskDispatcher, credentialCache, correlator, shutdownHandler);
    }

    // ========== Embedded worker ==========

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "gateway.worker", name = "enabled", havingValue = "true")
    static class EmbeddedWorkerConfiguration {

        @Bean
        public EngineClient engineClient(GatewayProperties props, HttpClient engineHttpClient, ObjectMapper objectMapper) {
            GatewayProperties.Engine engine = props.getEngine();
            return new CamundaRestEngineClient(
                engine.getUrl(),
                engine.getUsername(),
                engine.getPassword(),
                engine.getRequestTimeout(),
                props.getWorker().getAsyncResponseTimeout(),
                engineHttpClient,
                objectMapper
            );
        }

        @Bean
        public GatewayClient localGatewayClient(TaskDispatcher taskDispatcher, CallbackCorrelator correlator) {
            return new LocalGatewayClient(taskDispatcher, correlator);
        }

        @Bean
        public ExternalTaskAdapter externalTaskAdapter(
                EngineClient engineClient, GatewayClient gatewayClient, GatewayProperties props) {
            GatewayProperties.Worker worker = props.getWorker();
            List<TopicSubscription> subscriptions = worker.getSubscriptions().entrySet().stream()
                .map(entry -> new TopicSubscription(
                    entry.getKey(),
                    entry.getValue().getGatewayTopic(),
                    entry.getValue().getRequiredVariables(),
                    entry.getValue().getAwaitCallback(),
                    entry.getValue().getMessageName()))
                .toList();
            return new ExternalTaskAdapter(
                engineClient,
                gatewayClient,
                subscriptions,
                new ExternalTaskAdapter.Settings(
                    worker.getWorkerId(),
                    worker.getMaxTasks(),
                    worker.getLockDuration(),
                    worker.getPollInterval(),
                    worker.getStatusPollInterval(),
                    worker.getEngineRetries(),
                    worker.getRetryTimeout(),
                    worker.getGatewayUnavailableTimeout()
                )
            );
        }
    }

    /**
     * Start background components and register them for shutdown.
     * Shutdown runs in reverse, so the adapter stops feeding work before recovery and dispatch stop.
     */
    @Bean
    public ApplicationRunner gatewayStarter(
            DispatchScheduler dispatchScheduler,
            RecoveryEngine recoveryEngine,
            ObjectProvider<ExternalTaskAdapter> adapter,
            GracefulShutdownHandler shutdownHandler,
            GatewayProperties props) {
        return args -> {
            dispatchScheduler.start();
            shutdownHandler.register("dispatch-scheduler", dispatchScheduler::stop);

            if (props.getRecovery().isEnabled()) {
                recoveryEngine.start();
                shutdownHandler.register("recovery-engine", recoveryEngine::stop);
            } else {
                log.warn("Recovery sweeps disabled on node {}", nodeId(props));
            }

            adapter.ifAvailable(externalTaskAdapter -> {
                externalTaskAdapter.start();
                shutdownHandler.register("external-task-adapter", externalTaskAdapter::stop);
            });
            log.info("Task gateway node {} started ({} store)", nodeId(props), props.getStore());
        };
    }

    // ========== Helper Methods ==========

    static synchronized String nodeId(GatewayProperties props) {
        if (props.getNodeId() == null || props.getNodeId().isBlank()) {
            props.setNodeId("gateway-" + UUID.randomUUID().toString().substring(0, 8));
        }
        return props.getNodeId();
    }

    static Map<String, ApiEndpoint> endpoints(GatewayProperties props) {
        Map<String, ApiEndpoint> endpoints = new LinkedHashMap<>();
        props.getApis().forEach((name, api) -> {
            Map<String, ApiAccount> accounts = new LinkedHashMap<>();
            api.getAccounts().forEach((accountId, account) ->
                accounts.put(accountId, new ApiAccount(accountId, account.getLogin(), account.getSecret())));

            Map<String, CallClass> callClasses = new LinkedHashMap<>();
            api.getCallClasses().forEach((className, callClass) ->
                callClasses.put(className, new CallClass(className, callClass.getTimeout(), new RetryPolicy(
                    callClass.getMaxAttempts(),
                    callClass.getInitialBackoff(),
                    callClass.getMaxBackoff(),
                    callClass.getMultiplier(),
                    callClass.getJitter(),
                    callClass.getMaxElapsed()))));

            endpoints.put(name, new ApiEndpoint(
                name,
                api.getBaseUrl(),
                api.getAuthPath(),
                api.getAuthTimeout(),
                api.getTokenLifetime(),
                accounts,
                callClasses
            ));
        });
        return endpoints;
    }

    static ExecutorService callbackExecutor(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "callback-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    static Map<String, CallbackSource> callbackSources(GatewayProperties.Callbacks callbacks) {
        Map<String, CallbackSource> sources = new LinkedHashMap<>();
        if (callbacks.getSources().isEmpty()) {
            CallbackSource dwLaw = CallbackSource.dwLaw();
            sources.put(dwLaw.name(), dwLaw);
            return sources;
        }
        callbacks.getSources().forEach((name, source) -> sources.put(name, new CallbackSource(
            name,
            source.getCorrelationKeyPointer(),
            source.getMessageName(),
            source.getVariablePrefix(),
            source.getSignalFields(),
            Set.copyOf(source.getIgnoredFields())
        )));
        return sources;
    }

    static RetryPolicy retryPolicy(GatewayProperties.Retry retry) {
        return new RetryPolicy(
            retry.getMaxAttempts(),
            retry.getInitialBackoff(),
            retry.getMaxBackoff(),
            retry.getMultiplier(),
            retry.getJitter(),
            retry.getMaxElapsed()
        );
    }
}

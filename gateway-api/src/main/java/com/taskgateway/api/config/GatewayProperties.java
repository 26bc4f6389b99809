package com.taskgateway.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the task gateway.
 *
 * @see GatewayConfiguration
 */
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    /**
     * Where tasks, callbacks and shared credentials are kept.
     */
    private StoreType store = StoreType.JDBC;

    /**
     * Identity of this instance, used as lease holder. Generated when blank.
     */
    private String nodeId;

    private final Dispatch dispatch = new Dispatch();
    private final Credentials credentials = new Credentials();
    private final Map<String, Api> apis = new LinkedHashMap<>();
    private final Map<String, Topic> topics = new LinkedHashMap<>();
    private final Callbacks callbacks = new Callbacks();
    private final Recovery recovery = new Recovery();
    private final Engine engine = new Engine();
    private final Worker worker = new Worker();

    public StoreType getStore() {
        return store;
    }

    public void setStore(StoreType store) {
        this.store = store;
    }

    public String getNodeId() {
        return nodeId;
    }

    public void setNodeId(String nodeId) {
        this.nodeId = nodeId;
    }

    public Dispatch getDispatch() {
        return dispatch;
    }

    public Credentials getCredentials() {
        return credentials;
    }

    public Map<String, Api> getApis() {
        return apis;
    }

    public Map<String, Topic> getTopics() {
        return topics;
    }

    public Callbacks getCallbacks() {
        return callbacks;
    }

    public Recovery getRecovery() {
        return recovery;
    }

    public Engine getEngine() {
        return engine;
    }

    public Worker getWorker() {
        return worker;
    }

    public enum StoreType {
        MEMORY,
        JDBC
    }

    public static class Dispatch {
        private int poolSize = 8;
        private Duration pollInterval = Duration.ofSeconds(1);
        private int batchSize = 50;

        /**
         * Lease length of one attempt. An attempt still running after this is reclaimed.
         */
        private Duration maxProcessingTime = Duration.ofMinutes(5);

        private final Retry retry = new Retry();

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getMaxProcessingTime() {
            return maxProcessingTime;
        }

        public void setMaxProcessingTime(Duration maxProcessingTime) {
            this.maxProcessingTime = maxProcessingTime;
        }

        public Retry getRetry() {
            return retry;
        }
    }

    /**
     * Retry budget. Defaults match the task-level policy.
     */
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(60);
        private Duration maxBackoff = Duration.ofMinutes(10);
        private double multiplier = 2.0;
        private double jitter = 0.1;

        /**
         * Total time budget across attempts; unset means unbounded.
         */
        private Duration maxElapsed;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }

        public Duration getMaxElapsed() {
            return maxElapsed;
        }

        public void setMaxElapsed(Duration maxElapsed) {
            this.maxElapsed = maxElapsed;
        }
    }

    public static class Credentials {
        /**
         * A token expiring within this margin is treated as expired.
         */
        private Duration safetyMargin = Duration.ofSeconds(60);

        public Duration getSafetyMargin() {
            return safetyMargin;
        }

        public void setSafetyMargin(Duration safetyMargin) {
            this.safetyMargin = safetyMargin;
        }
    }

    public static class Api {
        private String baseUrl;
        private String authPath = "/auth/login";
        private Duration authTimeout = Duration.ofSeconds(30);

        /**
         * Assumed lifetime of a token whose auth response carries no expiry.
         */
        private Duration tokenLifetime = Duration.ofMinutes(30);

        private final Map<String, Account> accounts = new LinkedHashMap<>();
        private final Map<String, CallClassProperties> callClasses = new LinkedHashMap<>();

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getAuthPath() {
            return authPath;
        }

        public void setAuthPath(String authPath) {
            this.authPath = authPath;
        }

        public Duration getAuthTimeout() {
            return authTimeout;
        }

        public void setAuthTimeout(Duration authTimeout) {
            this.authTimeout = authTimeout;
        }

        public Duration getTokenLifetime() {
            return tokenLifetime;
        }

        public void setTokenLifetime(Duration tokenLifetime) {
            this.tokenLifetime = tokenLifetime;
        }

        public Map<String, Account> getAccounts() {
            return accounts;
        }

        public Map<String, CallClassProperties> getCallClasses() {
            return callClasses;
        }
    }

    public static class Account {
        private String login;
        private String secret;

        public String getLogin() {
            return login;
        }

        public void setLogin(String login) {
            this.login = login;
        }

        public String getSecret() {
            return secret;
        }

        public void setSecret(String secret) {
            this.secret = secret;
        }
    }

    /**
     * Timeout and retry budget for a family of calls. Defaults match the call-level policy.
     */
    public static class CallClassProperties {
        private Duration timeout = Duration.ofSeconds(60);
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(30);
        private double multiplier = 2.0;
        private double jitter = 0.2;
        private Duration maxElapsed = Duration.ofSeconds(120);

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }

        public Duration getMaxElapsed() {
            return maxElapsed;
        }

        public void setMaxElapsed(Duration maxElapsed) {
            this.maxElapsed = maxElapsed;
        }
    }

    /**
     * Route of a topic onto an external API call.
     */
    public static class Topic {
        private String api;
        private String account;
        private String method = "POST";
        private String path;
        private String callClass;
        private String contentType = "application/json";
        private String bodyField;
        private String soapAction;
        private List<String> requiredFields = new ArrayList<>();

        public String getApi() {
            return api;
        }

        public void setApi(String api) {
            this.api = api;
        }

        public String getAccount() {
            return account;
        }

        public void setAccount(String account) {
            this.account = account;
        }

        public String getMethod() {
            return method;
        }

        public void setMethod(String method) {
            this.method = method;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getCallClass() {
            return callClass;
        }

        public void setCallClass(String callClass) {
            this.callClass = callClass;
        }

        public String getContentType() {
            return contentType;
        }

        public void setContentType(String contentType) {
            this.contentType = contentType;
        }

        public String getBodyField() {
            return bodyField;
        }

        public void setBodyField(String bodyField) {
            this.bodyField = bodyField;
        }

        public String getSoapAction() {
            return soapAction;
        }

        public void setSoapAction(String soapAction) {
            this.soapAction = soapAction;
        }

        public List<String> getRequiredFields() {
            return requiredFields;
        }

        public void setRequiredFields(List<String> requiredFields) {
            this.requiredFields = requiredFields;
        }
    }

    public static class Callbacks {
        /**
         * How long an unmatched callback waits for a registration before it expires.
         */
        private Duration retention = Duration.ofDays(7);

        /**
         * Validity of a pending correlation registered without its own TTL.
         */
        private Duration defaultPendingTtl = Duration.ofDays(30);

        /**
         * Threads correlating freshly received callbacks.
         */
        private int processingThreads = 4;

        /**
         * Sources accepted on the webhook. The DW LAW source is registered when empty.
         */
        private final Map<String, Source> sources = new LinkedHashMap<>();

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public Duration getDefaultPendingTtl() {
            return defaultPendingTtl;
        }

        public void setDefaultPendingTtl(Duration defaultPendingTtl) {
            this.defaultPendingTtl = defaultPendingTtl;
        }

        public int getProcessingThreads() {
            return processingThreads;
        }

        public void setProcessingThreads(int processingThreads) {
            this.processingThreads = processingThreads;
        }

        public Map<String, Source> getSources() {
            return sources;
        }
    }

    public static class Source {
        private String correlationKeyPointer;
        private String messageName;
        private String variablePrefix = "";
        private List<String> signalFields = new ArrayList<>();
        private List<String> ignoredFields = new ArrayList<>();

        public String getCorrelationKeyPointer() {
            return correlationKeyPointer;
        }

        public void setCorrelationKeyPointer(String correlationKeyPointer) {
            this.correlationKeyPointer = correlationKeyPointer;
        }

        public String getMessageName() {
            return messageName;
        }

        public void setMessageName(String messageName) {
            this.messageName = messageName;
        }

        public String getVariablePrefix() {
            return variablePrefix;
        }

        public void setVariablePrefix(String variablePrefix) {
            this.variablePrefix = variablePrefix;
        }

        public List<String> getSignalFields() {
            return signalFields;
        }

        public void setSignalFields(List<String> signalFields) {
            this.signalFields = signalFields;
        }

        public List<String> getIgnoredFields() {
            return ignoredFields;
        }

        public void setIgnoredFields(List<String> ignoredFields) {
            this.ignoredFields = ignoredFields;
        }
    }

    public static class Recovery {
        private boolean enabled = true;
        private Duration leaseCheckInterval = Duration.ofSeconds(5);
        private Duration reconcileInterval = Duration.ofSeconds(10);
        private Duration expiryInterval = Duration.ofMinutes(1);
        private int batchSize = 100;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getLeaseCheckInterval() {
            return leaseCheckInterval;
        }

        public void setLeaseCheckInterval(Duration leaseCheckInterval) {
            this.leaseCheckInterval = leaseCheckInterval;
        }

        public Duration getReconcileInterval() {
            return reconcileInterval;
        }

        public void setReconcileInterval(Duration reconcileInterval) {
            this.reconcileInterval = reconcileInterval;
        }

        public Duration getExpiryInterval() {
            return expiryInterval;
        }

        public void setExpiryInterval(Duration expiryInterval) {
            this.expiryInterval = expiryInterval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    /**
     * REST endpoint of the workflow engine.
     */
    public static class Engine {
        private String url = "http://localhost:8080/engine-rest";
        private String username;
        private String password;
        private Duration requestTimeout = Duration.ofSeconds(30);

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }
    }

    public static class Worker {
        /**
         * Run the external-task adapter inside this application.
         */
        private boolean enabled = false;

        private String workerId = "task-gateway-worker";
        private int maxTasks = 10;
        private Duration lockDuration = Duration.ofMinutes(5);
        private Duration pollInterval = Duration.ofSeconds(5);
        private Duration statusPollInterval = Duration.ofSeconds(2);

        /**
         * Long-polling wait on fetch-and-lock; zero disables long polling.
         */
        private Duration asyncResponseTimeout = Duration.ZERO;

        private int engineRetries = 3;
        private Duration retryTimeout = Duration.ofMinutes(1);

        /**
         * How long the gateway may stay unreachable while a task is watched before the engine task
         * is failed and its lock released.
         */
        private Duration gatewayUnavailableTimeout = Duration.ofMinutes(10);
        private final Map<String, Subscription> subscriptions = new LinkedHashMap<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getWorkerId() {
            return workerId;
        }

        public void setWorkerId(String workerId) {
            this.workerId = workerId;
        }

        public int getMaxTasks() {
            return maxTasks;
        }

        public void setMaxTasks(int maxTasks) {
            this.maxTasks = maxTasks;
        }

        public Duration getLockDuration() {
            return lockDuration;
        }

        public void setLockDuration(Duration lockDuration) {
            this.lockDuration = lockDuration;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getStatusPollInterval() {
            return statusPollInterval;
        }

        public void setStatusPollInterval(Duration statusPollInterval) {
            this.statusPollInterval = statusPollInterval;
        }

        public Duration getAsyncResponseTimeout() {
            return asyncResponseTimeout;
        }

        public void setAsyncResponseTimeout(Duration asyncResponseTimeout) {
            this.asyncResponseTimeout = asyncResponseTimeout;
        }

        public int getEngineRetries() {
            return engineRetries;
        }

        public void setEngineRetries(int engineRetries) {
            this.engineRetries = engineRetries;
        }

        public Duration getRetryTimeout() {
            return retryTimeout;
        }

        public void setRetryTimeout(Duration retryTimeout) {
            this.retryTimeout = retryTimeout;
        }

        public Duration getGatewayUnavailableTimeout() {
            return gatewayUnavailableTimeout;
        }

        public void setGatewayUnavailableTimeout(Duration gatewayUnavailableTimeout) {
            this.gatewayUnavailableTimeout = gatewayUnavailableTimeout;
        }

        public Map<String, Subscription> getSubscriptions() {
            return subscriptions;
        }
    }

    /**
     * An engine topic the embedded adapter fetches, keyed by engine topic name.
     */
    public static class Subscription {
        /**
         * Gateway topic the work is submitted to; defaults to the engine topic name.
         */
        private String gatewayTopic;

        private List<String> requiredVariables = new ArrayList<>();

        /**
         * Result field holding the correlation key when the process waits for a callback.
         */
        private String awaitCallback;

        private String messageName;

        public String getGatewayTopic() {
            return gatewayTopic;
        }

        public void setGatewayTopic(String gatewayTopic) {
            this.gatewayTopic = gatewayTopic;
        }

        public List<String> getRequiredVariables() {
            return requiredVariables;
        }

        public void setRequiredVariables(List<String> requiredVariables) {
            this.requiredVariables = requiredVariables;
        }

        public String getAwaitCallback() {
            return awaitCallback;
        }

        public void setAwaitCallback(String awaitCallback) {
            this.awaitCallback = awaitCallback;
        }

        public String getMessageName() {
            return messageName;
        }

        public void setMessageName(String messageName) {
            this.messageName = messageName;
        }
    }
}

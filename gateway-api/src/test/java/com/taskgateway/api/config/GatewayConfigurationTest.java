package com.taskgateway.api.config;

import com.taskgateway.client.http.ApiEndpoint;
import com.taskgateway.client.http.CallClass;
import com.taskgateway.core.model.RetryPolicy;
import com.taskgateway.engine.correlation.CallbackSource;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class GatewayConfigurationTest {

    @Test
    void endpoints_shouldMapAccountsAndCallClasses() {
        GatewayProperties props = new GatewayProperties();
        GatewayProperties.Api api = new GatewayProperties.Api();
        api.setBaseUrl("https://api.example.com");
        GatewayProperties.Account account = new GatewayProperties.Account();
        account.setLogin("svc");
        account.setSecret("s3cret");
        api.getAccounts().put("main", account);
        GatewayProperties.CallClassProperties slow = new GatewayProperties.CallClassProperties();
        slow.setTimeout(Duration.ofSeconds(120));
        slow.setMaxAttempts(5);
        api.getCallClasses().put("slow-query", slow);
        props.getApis().put("search", api);

        Map<String, ApiEndpoint> endpoints = GatewayConfiguration.endpoints(props);

        ApiEndpoint endpoint = endpoints.get("search");
        assertThat(endpoint.apiName()).isEqualTo("search");
        assertThat(endpoint.authPath()).isEqualTo("/auth/login");
        assertThat(endpoint.account("main")).hasValueSatisfying(a -> {
            assertThat(a.login()).isEqualTo("svc");
            assertThat(a.secret()).isEqualTo("s3cret");
        });
        CallClass callClass = endpoint.callClass("slow-query");
        assertThat(callClass.timeout()).isEqualTo(Duration.ofSeconds(120));
        assertThat(callClass.retryPolicy().maxAttempts()).isEqualTo(5);
        assertThat(callClass.retryPolicy().maxElapsed()).isEqualTo(Duration.ofSeconds(120));
        assertThat(endpoint.callClass("unknown").name()).isEqualTo(CallClass.DEFAULT);
    }

    @Test
    void callbackSources_withNoneConfigured_shouldRegisterDwLaw() {
        Map<String, CallbackSource> sources = GatewayConfiguration.callbackSources(new GatewayProperties.Callbacks());

        assertThat(sources).containsOnlyKeys(CallbackSource.DW_LAW);
        assertThat(sources.get(CallbackSource.DW_LAW).correlationKeyPointer()).isEqualTo("/chave_de_pesquisa");
    }

    @Test
    void callbackSources_shouldUseConfiguredSources() {
        GatewayProperties.Callbacks callbacks = new GatewayProperties.Callbacks();
        GatewayProperties.Source source = new GatewayProperties.Source();
        source.setCorrelationKeyPointer("/protocol");
        source.setMessageName("court_reply");
        source.setVariablePrefix("court_");
        source.setSignalFields(List.of("protocol", "/decision/outcome"));
        source.setIgnoredFields(List.of("sent_at"));
        callbacks.getSources().put("court", source);

        Map<String, CallbackSource> sources = GatewayConfiguration.callbackSources(callbacks);

        assertThat(sources).containsOnlyKeys("court");
        CallbackSource court = sources.get("court");
        assertThat(court.messageName()).isEqualTo("court_reply");
        assertThat(court.signalFields()).containsExactly("protocol", "/decision/outcome");
        assertThat(court.ignoredFields()).containsExactly("sent_at");
    }

    @Test
    void retryPolicy_shouldMirrorProperties() {
        GatewayProperties.Retry retry = new GatewayProperties.Retry();
        retry.setMaxAttempts(4);
        retry.setInitialBackoff(Duration.ofSeconds(5));
        retry.setMaxBackoff(Duration.ofMinutes(1));

        RetryPolicy policy = GatewayConfiguration.retryPolicy(retry);

        assertThat(policy.maxAttempts()).isEqualTo(4);
        assertThat(policy.initialBackoff()).isEqualTo(Duration.ofSeconds(5));
        assertThat(policy.maxBackoff()).isEqualTo(Duration.ofMinutes(1));
        assertThat(policy.backoffMultiplier()).isEqualTo(2.0);
        assertThat(policy.maxElapsed()).isNull();
    }

    @Test
    void retryPolicy_defaults_shouldMatchTaskLevelPolicy() {
        assertThat(GatewayConfiguration.retryPolicy(new GatewayProperties.Retry()))
            .isEqualTo(RetryPolicy.defaultPolicy());
    }

    @Test
    void nodeId_shouldBeGeneratedOnceWhenBlank() {
        GatewayProperties props = new GatewayProperties();
        props.setNodeId(" ");

        String first = GatewayConfiguration.nodeId(props);
        String second = GatewayConfiguration.nodeId(props);

        assertThat(first).startsWith("gateway-").isEqualTo(second);
    }

    @Test
    void nodeId_shouldKeepConfiguredValue() {
        GatewayProperties props = new GatewayProperties();
        props.setNodeId("node-a");

        assertThat(GatewayConfiguration.nodeId(props)).isEqualTo("node-a");
    }
}

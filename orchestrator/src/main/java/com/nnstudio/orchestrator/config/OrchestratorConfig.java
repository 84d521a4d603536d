package com.nnstudio.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nnstudio.orchestrator.batch.BatchSettings;
import com.nnstudio.orchestrator.client.BatchRelayClient;
import com.nnstudio.orchestrator.client.SyncClientFactory;
import com.nnstudio.orchestrator.client.VertexImageClient;
import com.nnstudio.orchestrator.model.ProviderName;
import com.nnstudio.orchestrator.preflight.PreflightBudgets;
import com.nnstudio.orchestrator.probe.AccessTokenProvider;
import com.nnstudio.orchestrator.probe.PublisherHealthCache;
import com.nnstudio.orchestrator.probe.ReachabilityCache;
import com.nnstudio.orchestrator.provider.ProviderContext;
import com.nnstudio.orchestrator.provider.ProviderSettings;
import com.nnstudio.orchestrator.render.RenderSettings;
import com.nnstudio.orchestrator.retry.Sleeper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

/**
 * Infrastructure beans and the settings records read from {@code nn.*}
 * properties (see application.yml for the environment variables behind
 * each one). Services pick up their own {@code @Value}s.
 */
@Configuration
public class OrchestratorConfig {

    // ------------------------------------------------------------------
    // Infrastructure
    // ------------------------------------------------------------------

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    /** No actuator on the classpath; keep counters in memory. */
    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public HttpClient googleHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public AccessTokenProvider accessTokenProvider(@Value("${nn.google.access-token:}") String staticToken) {
        return staticToken.isBlank() ? AccessTokenProvider.gcloud() : AccessTokenProvider.fixed(staticToken);
    }

    // ------------------------------------------------------------------
    // Preflight
    // ------------------------------------------------------------------

    @Bean
    public PreflightBudgets preflightBudgets(@Value("${nn.preflight.job-max-bytes:209715200}") long jobMaxBytes,
                                             @Value("${nn.preflight.item-max-bytes:8388608}") long itemMaxBytes,
                                             @Value("${nn.preflight.max-refs-per-item:8}") int maxRefsPerItem,
                                             @Value("${nn.preflight.max-images-per-job:2000}") int maxImagesPerJob,
                                             @Value("${nn.preflight.compress:true}") boolean compress,
                                             @Value("${nn.preflight.split:true}") boolean split) {
        return new PreflightBudgets(jobMaxBytes, itemMaxBytes, maxRefsPerItem, maxImagesPerJob, compress, split);
    }

    // ------------------------------------------------------------------
    // Providers
    // ------------------------------------------------------------------

    @Bean
    public ProviderSettings providerSettings(@Value("${nn.provider:batch}") String provider,
                                             @Value("${nn.google.project:}") String project,
                                             @Value("${nn.google.location:us-central1}") String location,
                                             @Value("${nn.google.primary-model:gemini-1.5-flash}") String primaryModel) {
        return new ProviderSettings(ProviderName.fromConfig(provider), project, location, primaryModel);
    }

    @Bean
    public ProviderContext providerContext(ProviderSettings settings,
                                           @Value("${nn.batch.relay-url:http://127.0.0.1:8787}") String relayUrl,
                                           @Value("${nn.google.image-model:gemini-2.5-flash-image-preview}") String imageModel,
                                           HttpClient googleHttpClient, AccessTokenProvider tokens,
                                           ObjectMapper objectMapper,
                                           PublisherHealthCache publisherHealth, ReachabilityCache reachability) {
        SyncClientFactory syncClients = (project, location) ->
                new VertexImageClient(googleHttpClient, objectMapper, tokens, project, location, imageModel);
        return new ProviderContext(settings, new BatchRelayClient(relayUrl, objectMapper),
                syncClients, publisherHealth, reachability);
    }

    // ------------------------------------------------------------------
    // Jobs
    // ------------------------------------------------------------------

    @Bean
    public BatchSettings batchSettings(@Value("${nn.pricing.per-image-usd:}") Double pricePerImage,
                                       @Value("${nn.style-guard.enabled:true}") boolean styleGuardEnabled,
                                       @Value("${nn.batch.max-polls:1000}") int maxPolls,
                                       @Value("${nn.batch.watch-base-delay-ms:2000}") long watchBase,
                                       @Value("${nn.batch.watch-max-delay-ms:30000}") long watchMax) {
        return new BatchSettings(pricePerImage, styleGuardEnabled, maxPolls, watchBase, watchMax);
    }

    @Bean
    public RenderSettings renderSettings(@Value("${nn.render.max-concurrency:2}") int maxConcurrency,
                                         @Value("${nn.style-guard.enabled:true}") boolean styleGuardEnabled) {
        return new RenderSettings(maxConcurrency, styleGuardEnabled, 2, 2000);
    }
}

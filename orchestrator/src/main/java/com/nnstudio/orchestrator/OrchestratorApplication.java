package com.nnstudio.orchestrator;

import com.nnstudio.orchestrator.client.RemoteCallException;
import com.nnstudio.orchestrator.client.dto.HealthResponse;
import com.nnstudio.orchestrator.probe.PublisherProbe;
import com.nnstudio.orchestrator.probe.PublisherHealthCache;
import com.nnstudio.orchestrator.provider.ProviderContext;
import com.nnstudio.orchestrator.provider.ProviderSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
public class OrchestratorApplication {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }

    /**
     * Refresh the publisher probe snapshot once at startup and report
     * whether the batch relay answers.
     *
     * To run:
     *   GOOGLE_CLOUD_PROJECT=my-project NN_PROBE_ON_STARTUP=true mvn spring-boot:run
     */
    @Bean
    @ConditionalOnProperty(name = "nn.probe.on-startup", havingValue = "true")
    CommandLineRunner probeOnStartup(PublisherProbe probe, PublisherHealthCache health, ProviderSettings settings,
                                     ProviderContext providers) {
        return args -> {
            try {
                HealthResponse relayHealth = providers.batchClient().health();
                log.info("Batch relay ok={} apiKeyConfigured={}", relayHealth.ok(), relayHealth.apiKeyConfigured());
            } catch (RemoteCallException e) {
                log.warn("Batch relay not reachable (status {}): {}", e.statusCode(), e.getMessage());
            }
            probe.run(settings.project(), settings.location(), PublisherProbe.DEFAULT_TARGETS, health.snapshotFile());
            health.invalidate();
            log.info("Primary model {} health: {}", settings.primaryModel(), health.check(settings.primaryModel()));
        };
    }
}

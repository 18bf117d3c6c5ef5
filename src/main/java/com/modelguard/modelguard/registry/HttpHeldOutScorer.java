package com.modelguard.modelguard.registry;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link HeldOutScorer} that asks the evaluation service to re-score a model version on a held-out set.
 */
@Component
public class HttpHeldOutScorer implements HeldOutScorer {

    private static final Logger log = LoggerFactory.getLogger(HttpHeldOutScorer.class);

    private final WebClient webClient;
    private final ScoringProperties scoringProperties;
    private final RegistryProperties registryProperties;

    public HttpHeldOutScorer(
            @Qualifier("scoringWebClient") WebClient webClient,
            ScoringProperties scoringProperties,
            RegistryProperties registryProperties
    ) {
        this.webClient = webClient;
        this.scoringProperties = scoringProperties;
        this.registryProperties = registryProperties;
    }

    @Override
    public double score(String modelName, String version, String heldOutSetId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model_name", modelName);
        body.put("model_version", version);
        body.put("held_out_set", heldOutSetId);
        body.put("metric", registryProperties.getMetricKey());

        JsonNode response;
        try {
            response = webClient.post()
                    .uri(scoringProperties.getPath())
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(Duration.ofMillis(scoringProperties.getTimeoutMs()))
                    .retryWhen(Retry.backoff(scoringProperties.getMaxRetries(), Duration.ofMillis(scoringProperties.getBackoffMs()))
                            .filter(MlflowRegistryClient::isRetryable)
                            .doBeforeRetry(signal -> log.warn("Held-out scoring failed (retry {}): {}",
                                    signal.totalRetries() + 1, signal.failure().getMessage()))
                            .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                    .onErrorMap(MlflowRegistryClient::isRetryable,
                            ex -> new ScoringUnavailableException(modelName, version, ex))
                    .block();
        } catch (WebClientResponseException ex) {
            throw new IllegalStateException("Scoring service rejected %s version %s: %s"
                    .formatted(modelName, version, ex.getStatusCode()), ex);
        }

        if (response == null || !response.path("metric").isNumber()) {
            throw new IllegalStateException("Scoring service returned no numeric metric for %s version %s"
                    .formatted(modelName, version));
        }
        double metric = response.path("metric").asDouble();
        log.info("Held-out score. model={}, version={}, heldOutSet={}, {}={}",
                modelName, version, heldOutSetId, registryProperties.getMetricKey(), metric);
        return metric;
    }
}

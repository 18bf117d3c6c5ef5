package com.modelguard.modelguard.registry;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.stream.StreamSupport;

/**
 * {@link ModelRegistryClient} over the MLflow model registry REST API.
 * <p>
 * Every call is bounded by {@code registry.timeout-ms} and retried with backoff on connection failures,
 * timeouts and 5xx responses; when retries run out a {@link RegistryUnavailableException} is raised.
 */
@Component
public class MlflowRegistryClient implements ModelRegistryClient {

    private static final Logger log = LoggerFactory.getLogger(MlflowRegistryClient.class);

    private final WebClient webClient;
    private final RegistryProperties registryProperties;

    public MlflowRegistryClient(
            @Qualifier("registryWebClient") WebClient webClient,
            RegistryProperties registryProperties
    ) {
        this.webClient = webClient;
        this.registryProperties = registryProperties;
    }

    @Override
    public double getMetric(String modelName, String version) {
        String metricKey = registryProperties.getMetricKey();
        String runId = getModelVersion(modelName, version).path("run_id").asText("");
        if (runId.isBlank()) {
            throw new MetricUnavailableException(modelName, version, metricKey);
        }
        JsonNode response = execute("runs/get", webClient.get()
                .uri(uriBuilder -> uriBuilder.path(RegistryConstants.PATH_GET_RUN)
                        .queryParam("run_id", runId)
                        .build())
                .retrieve()
                .bodyToMono(JsonNode.class));
        for (JsonNode metric : response.path("run").path("data").path("metrics")) {
            if (metricKey.equals(metric.path("key").asText()) && metric.path("value").isNumber()) {
                return metric.path("value").asDouble();
            }
        }
        throw new MetricUnavailableException(modelName, version, metricKey);
    }

    @Override
    public ModelStage getStage(String modelName, String version) {
        return ModelStage.fromRegistryName(getModelVersion(modelName, version).path("current_stage").asText());
    }

    @Override
    public Optional<ModelVersion> findVersionInStage(String modelName, ModelStage stage) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", modelName);
        body.put("stages", List.of(stage.registryName()));
        JsonNode response;
        try {
            response = execute("get-latest-versions", webClient.post()
                    .uri(RegistryConstants.PATH_LATEST_VERSIONS)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class));
        } catch (WebClientResponseException.NotFound ex) {
            log.info("Registered model {} not found; treating as no version in {}", modelName, stage.registryName());
            return Optional.empty();
        }
        return StreamSupport.stream(response.path("model_versions").spliterator(), false)
                .map(this::toModelVersion)
                .filter(modelVersion -> modelVersion.stage() == stage)
                .max(Comparator.comparingLong(modelVersion -> parseVersion(modelVersion.version())));
    }

    @Override
    public void requestStageTransition(String modelName, String version, ModelStage targetStage,
                                       boolean archiveExistingVersions) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", modelName);
        body.put("version", version);
        body.put("stage", targetStage.registryName());
        body.put("archive_existing_versions", archiveExistingVersions);
        execute("transition-stage", webClient.post()
                .uri(RegistryConstants.PATH_TRANSITION_STAGE)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class));
        log.info("Requested registry transition. model={}, version={}, stage={}, archiveExisting={}",
                modelName, version, targetStage.registryName(), archiveExistingVersions);
    }

    private JsonNode getModelVersion(String modelName, String version) {
        try {
            JsonNode response = execute("model-versions/get", webClient.get()
                    .uri(uriBuilder -> uriBuilder.path(RegistryConstants.PATH_GET_VERSION)
                            .queryParam("name", modelName)
                            .queryParam("version", version)
                            .build())
                    .retrieve()
                    .bodyToMono(JsonNode.class));
            JsonNode modelVersion = response.path("model_version");
            if (modelVersion.isMissingNode()) {
                throw new IllegalStateException(RegistryConstants.MSG_BAD_RESPONSE.formatted("model-versions/get", response));
            }
            return modelVersion;
        } catch (WebClientResponseException.NotFound ex) {
            throw new ModelVersionNotFoundException(modelName, version);
        }
    }

    private JsonNode execute(String operation, Mono<JsonNode> call) {
        JsonNode response = call
                .timeout(Duration.ofMillis(registryProperties.getTimeoutMs()))
                .retryWhen(Retry.backoff(registryProperties.getMaxRetries(), Duration.ofMillis(registryProperties.getBackoffMs()))
                        .filter(MlflowRegistryClient::isRetryable)
                        .doBeforeRetry(signal -> log.warn("Registry call {} failed (retry {}): {}",
                                operation, signal.totalRetries() + 1, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .onErrorMap(MlflowRegistryClient::isRetryable, ex -> new RegistryUnavailableException(operation, ex))
                .block();
        if (response == null) {
            throw new IllegalStateException(RegistryConstants.MSG_BAD_RESPONSE.formatted(operation, "empty body"));
        }
        return response;
    }

    private ModelVersion toModelVersion(JsonNode node) {
        String runId = node.path("run_id").asText("");
        return new ModelVersion(
                node.path("name").asText(),
                node.path("version").asText(),
                ModelStage.fromRegistryName(node.path("current_stage").asText()),
                runId.isBlank() ? null : runId
        );
    }

    private static long parseVersion(String version) {
        try {
            return Long.parseLong(version);
        } catch (NumberFormatException ex) {
            return Long.MIN_VALUE;
        }
    }

    static boolean isRetryable(Throwable failure) {
        if (failure instanceof WebClientResponseException responseException) {
            return responseException.getStatusCode().is5xxServerError()
                    || responseException.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value();
        }
        return failure instanceof WebClientRequestException || failure instanceof TimeoutException;
    }
}

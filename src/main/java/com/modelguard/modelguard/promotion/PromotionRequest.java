package com.modelguard.modelguard.promotion;

/**
 * Promotion evaluation request. {@code modelName} defaults to {@code registry.model-name}; without
 * {@code challengerMetric} the metric recorded in the registry is used.
 */
public record PromotionRequest(String modelName, String challengerVersion, Double challengerMetric) {
}

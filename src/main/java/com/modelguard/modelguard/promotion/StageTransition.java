package com.modelguard.modelguard.promotion;

import com.modelguard.modelguard.registry.ModelStage;

/**
 * One requested registry stage change.
 */
public record StageTransition(String version, ModelStage targetStage) {
}

package com.modelguard.modelguard.registry;

/**
 * Re-scores a registered model on a fixed held-out set with the same metric the registry records.
 */
public interface HeldOutScorer {

    double score(String modelName, String version, String heldOutSetId);
}

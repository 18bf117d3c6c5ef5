package com.modelguard.modelguard.promotion;

public enum PromotionOutcome {
    PROMOTE,
    REJECT
}

package com.modelguard.modelguard.promotion;

import com.modelguard.modelguard.common.ModelGuardException;

public class PromotionDecisionNotFoundException extends ModelGuardException {

    public PromotionDecisionNotFoundException(long decisionId) {
        super("PROMOTION_DECISION_NOT_FOUND", PromotionConstants.MSG_DECISION_NOT_FOUND.formatted(decisionId));
    }
}

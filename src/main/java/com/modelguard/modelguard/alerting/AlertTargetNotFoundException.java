package com.modelguard.modelguard.alerting;

import com.modelguard.modelguard.common.ModelGuardException;

public class AlertTargetNotFoundException extends ModelGuardException {

    public AlertTargetNotFoundException(AlertSubjectType targetType, long targetId) {
        super("ALERT_TARGET_NOT_FOUND", AlertingConstants.MSG_TARGET_NOT_FOUND.formatted(targetType, targetId));
    }
}

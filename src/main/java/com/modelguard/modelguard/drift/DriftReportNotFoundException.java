package com.modelguard.modelguard.drift;

import com.modelguard.modelguard.common.ModelGuardException;

public class DriftReportNotFoundException extends ModelGuardException {

    public DriftReportNotFoundException(long reportId) {
        super("DRIFT_REPORT_NOT_FOUND", DriftConstants.MSG_REPORT_NOT_FOUND.formatted(reportId));
    }
}

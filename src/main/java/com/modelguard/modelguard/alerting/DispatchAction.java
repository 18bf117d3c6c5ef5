package com.modelguard.modelguard.alerting;

public enum DispatchAction {
    /** Write the dispatch record. Always present. */
    RECORD,
    /** Emit one structured warning log line. */
    LOG,
    /** Send to every configured notification channel. */
    NOTIFY,
    /** Flag the notification for on-call paging. */
    ESCALATE
}

package com.taskherd.engine.model;

/**
 * Delivery state of a ReportTask.
 *
 *   PENDING → DELIVERED
 *   PENDING → FAILED     (attempts exhausted or non-retryable rejection)
 *   FAILED  → PENDING    (operator-requested retry)
 */
public enum ReportStatus {
    PENDING,
    DELIVERED,
    FAILED
}

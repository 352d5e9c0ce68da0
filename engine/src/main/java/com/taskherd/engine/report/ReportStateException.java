package com.taskherd.engine.report;

import com.taskherd.engine.model.ReportStatus;

import java.util.UUID;

/** Only FAILED report tasks can be put back in the delivery queue. */
public class ReportStateException extends RuntimeException {
    public ReportStateException(UUID id, ReportStatus status) {
        super("Report task " + id + " is " + status + "; only FAILED tasks can be retried");
    }
}

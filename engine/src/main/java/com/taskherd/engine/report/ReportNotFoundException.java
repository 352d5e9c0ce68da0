package com.taskherd.engine.report;

import java.util.UUID;

public class ReportNotFoundException extends RuntimeException {
    public ReportNotFoundException(UUID id) {
        super("Report task not found: " + id);
    }
}

package com.taskherd.engine.model;

/** Who created a Job. Only WEBHOOK jobs normally carry a report target. */
public enum JobOrigin {
    MANUAL,
    SCHEDULE,
    WEBHOOK
}

package com.taskherd.engine.scheduler;

public class ScheduleNotFoundException extends RuntimeException {
    public ScheduleNotFoundException(String name) {
        super("Schedule not found: '" + name + "'");
    }
}

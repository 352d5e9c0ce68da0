package com.taskherd.engine.scheduler;

/** A schedule definition was rejected (bad recurrence, unknown plugin, name taken). */
public class InvalidScheduleException extends RuntimeException {
    public InvalidScheduleException(String message) {
        super(message);
    }
}

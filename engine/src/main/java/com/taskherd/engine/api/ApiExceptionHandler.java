package com.taskherd.engine.api;

import com.taskherd.engine.plugin.InvalidParametersException;
import com.taskherd.engine.plugin.PluginNotFoundException;
import com.taskherd.engine.report.ReportNotFoundException;
import com.taskherd.engine.report.ReportStateException;
import com.taskherd.engine.scheduler.InvalidScheduleException;
import com.taskherd.engine.scheduler.ScheduleNotFoundException;
import com.taskherd.engine.service.InvalidTransitionException;
import com.taskherd.engine.service.JobNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps domain exceptions to RFC 7807 problem responses for the dashboard API.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({JobNotFoundException.class, PluginNotFoundException.class,
                       ScheduleNotFoundException.class, ReportNotFoundException.class})
    public ProblemDetail notFound(RuntimeException e) {
        return ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(InvalidParametersException.class)
    public ProblemDetail invalidParams(InvalidParametersException e) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, e.getMessage());
        pd.setProperty("missing", e.getMissing());
        return pd;
    }

    @ExceptionHandler(InvalidScheduleException.class)
    public ProblemDetail invalidSchedule(InvalidScheduleException e) {
        return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler({InvalidTransitionException.class, ReportStateException.class})
    public ProblemDetail conflict(RuntimeException e) {
        log.info("Rejected state change: {}", e.getMessage());
        return ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, e.getMessage());
    }
}

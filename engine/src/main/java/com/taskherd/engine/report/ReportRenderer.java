package com.taskherd.engine.report;

import com.taskherd.engine.config.TaskherdProperties;
import com.taskherd.engine.model.Job;
import com.taskherd.engine.model.JobStatus;
import com.taskherd.engine.service.JsonColumns;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a terminal job as a Markdown comment.
 *
 * Diagnostic output is cut to its last {@code max-output-chars} characters;
 * for test runs and linters the tail is where the verdict is.
 */
@Component
public class ReportRenderer {

    private final JsonColumns json;
    private final int         maxOutputChars;

    public ReportRenderer(JsonColumns json, TaskherdProperties props) {
        this.json           = json;
        this.maxOutputChars = props.reporter().maxOutputChars();
    }

    public String render(Job job) {
        StringBuilder sb = new StringBuilder();
        sb.append("**taskherd** `").append(job.getPluginName()).append("` ")
          .append(headline(job.getStatus())).append('\n').append('\n');
        sb.append("- Job: `").append(job.getId()).append("`\n");
        sb.append("- Attempts: ").append(job.getAttempts()).append('/').append(job.getMaxAttempts()).append('\n');
        Duration d = duration(job);
        if (d != null) {
            sb.append("- Duration: ").append(formatDuration(d)).append('\n');
        }

        if (job.getStatus() == JobStatus.SUCCEEDED) {
            Map<String, Object> result = json.readMap(job.getResultJson());
            Object summary = result.containsKey("return_value") ? result.get("return_value") : result;
            sb.append("- Result: ").append(summary).append('\n');
        } else if (job.getErrorKind() != null) {
            sb.append("- Error: ").append(job.getErrorKind());
            if (job.getErrorMessage() != null) {
                sb.append(": ").append(job.getErrorMessage());
            }
            sb.append('\n');
        }

        if (job.getErrorDetail() != null && !job.getErrorDetail().isBlank()) {
            sb.append("\n```\n").append(tail(job.getErrorDetail(), maxOutputChars)).append("\n```\n");
        }
        return sb.toString();
    }

    static String tail(String text, int max) {
        if (text.length() <= max) {
            return text;
        }
        return "[... " + (text.length() - max) + " chars truncated]\n" + text.substring(text.length() - max);
    }

    private static String headline(JobStatus status) {
        return switch (status) {
            case SUCCEEDED -> "succeeded";
            case ABANDONED -> "failed";
            case CANCELLED -> "was cancelled";
            default        -> status.name().toLowerCase();
        };
    }

    private static Duration duration(Job job) {
        if (job.getFinishedAt() == null) return null;
        return Duration.between(job.getStartedAt() != null ? job.getStartedAt() : job.getCreatedAt(),
                                job.getFinishedAt());
    }

    private static String formatDuration(Duration d) {
        long ms = d.toMillis();
        if (ms < 1000) return ms + "ms";
        if (ms < 60_000) return String.format(Locale.ROOT, "%.1fs", ms / 1000.0);
        return (ms / 60_000) + "m " + ((ms / 1000) % 60) + "s";
    }
}

package com.taskherd.engine.service;

import com.taskherd.engine.model.Job;
import com.taskherd.engine.model.JobStatus;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;

/**
 * Dashboard filter. Every field is optional; {@code from} is inclusive and
 * {@code to} exclusive, both applied to the creation time.
 */
public record JobFilter(JobStatus status, String plugin, Instant from, Instant to) {

    public static JobFilter all() {
        return new JobFilter(null, null, null, null);
    }

    Specification<Job> toSpecification() {
        Specification<Job> spec = Specification.where(null);
        if (status != null) {
            spec = spec.and((root, q, cb) -> cb.equal(root.get("status"), status));
        }
        if (plugin != null && !plugin.isBlank()) {
            spec = spec.and((root, q, cb) -> cb.equal(root.get("pluginName"), plugin));
        }
        if (from != null) {
            spec = spec.and((root, q, cb) -> cb.greaterThanOrEqualTo(root.get("createdAt"), from));
        }
        if (to != null) {
            spec = spec.and((root, q, cb) -> cb.lessThan(root.get("createdAt"), to));
        }
        return spec;
    }
}

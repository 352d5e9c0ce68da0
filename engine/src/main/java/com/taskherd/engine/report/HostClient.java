package com.taskherd.engine.report;

/** Outbound side of the version-control host. */
public interface HostClient {

    /**
     * Post {@code message} as a comment on {@code target}.
     *
     * @throws DeliveryException if the host did not accept the comment
     */
    void postComment(TargetRef target, String message);
}

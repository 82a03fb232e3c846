package de.bycsitsm.meetingcost.annotation;

import org.jspecify.annotations.Nullable;

/**
 * Result of annotating one event.
 *
 * @param status        what happened
 * @param failureReason why the write failed, only set for {@link Status#FAILED}
 */
public record AnnotationOutcome(
        Status status,
        @Nullable String failureReason
) {

    private static final AnnotationOutcome UPDATED = new AnnotationOutcome(Status.UPDATED, null);
    private static final AnnotationOutcome UNCHANGED = new AnnotationOutcome(Status.UNCHANGED, null);

    public enum Status {
        /** The annotation was written. */
        UPDATED,
        /** The annotation already reflected the cost; nothing was written. */
        UNCHANGED,
        /** The write failed and will be retried on the next run. */
        FAILED
    }

    public static AnnotationOutcome updated() {
        return UPDATED;
    }

    public static AnnotationOutcome unchanged() {
        return UNCHANGED;
    }

    public static AnnotationOutcome failed(String reason) {
        return new AnnotationOutcome(Status.FAILED, reason);
    }
}

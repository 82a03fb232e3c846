package de.bycsitsm.meetingcost.cost;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of the eligibility check: either annotatable, or skipped for exactly one reason.
 *
 * @param skipReason the reason the event is skipped, or {@code null} if it is eligible
 */
public record EligibilityDecision(@Nullable SkipReason skipReason) {

    private static final EligibilityDecision OK = new EligibilityDecision(null);

    public static EligibilityDecision ok() {
        return OK;
    }

    public static EligibilityDecision skip(SkipReason reason) {
        return new EligibilityDecision(reason);
    }

    public boolean eligible() {
        return skipReason == null;
    }

    @Override
    public String toString() {
        return skipReason == null ? "ok" : "skip(" + skipReason.key() + ")";
    }
}

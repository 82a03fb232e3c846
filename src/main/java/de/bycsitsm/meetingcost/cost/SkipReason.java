package de.bycsitsm.meetingcost.cost;

/**
 * Why an event was not annotated. The eligibility reasons are listed in evaluation order.
 */
public enum SkipReason {
    ALL_DAY("all_day"),
    NO_DURATION("no_duration"),
    SOLO("solo"),
    NO_INTERNAL("no_internal"),
    MIXED("mixed"),
    /** The event was deleted or cancelled. */
    CANCELLED("cancelled"),
    /** The annotation already reflects the current cost. */
    UNCHANGED("unchanged");

    private final String key;

    SkipReason(String key) {
        this.key = key;
    }

    /**
     * Returns the name used in run results and log output.
     */
    public String key() {
        return key;
    }
}

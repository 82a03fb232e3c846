package de.bycsitsm.meetingcost.cost;

/**
 * Estimated cost of one meeting.
 *
 * @param invitedCost    cost over all internal invitees, whatever their response
 * @param effectiveCost  cost over internal invitees that did not decline
 * @param invitedCount   number of internal invitees
 * @param effectiveCount number of internal invitees that did not decline
 * @param durationHours  duration of the meeting in hours
 */
public record CostResult(
        long invitedCost,
        long effectiveCost,
        int invitedCount,
        int effectiveCount,
        double durationHours
) {

    /**
     * Returns whether invited and effective cost differ, i.e. somebody declined.
     */
    public boolean hasDeclines() {
        return invitedCost != effectiveCost;
    }
}

package de.bycsitsm.meetingcost.sync;

import de.bycsitsm.meetingcost.MeetingCostException;

/**
 * Thrown when a run is triggered while another one is still in progress.
 */
public class RunInProgressException extends MeetingCostException {

    public RunInProgressException(String message) {
        super(message);
    }
}

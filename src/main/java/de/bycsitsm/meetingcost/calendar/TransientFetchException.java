package de.bycsitsm.meetingcost.calendar;

import de.bycsitsm.meetingcost.MeetingCostException;

/**
 * Thrown when events could not be listed. The member is retried on the next run.
 */
public class TransientFetchException extends MeetingCostException {

    public TransientFetchException(String message) {
        super(message);
    }

    public TransientFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}

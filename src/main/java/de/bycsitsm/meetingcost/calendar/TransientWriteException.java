package de.bycsitsm.meetingcost.calendar;

import de.bycsitsm.meetingcost.MeetingCostException;

/**
 * Thrown when an annotation could not be written. The event is retried on the next run.
 */
public class TransientWriteException extends MeetingCostException {

    public TransientWriteException(String message) {
        super(message);
    }

    public TransientWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}

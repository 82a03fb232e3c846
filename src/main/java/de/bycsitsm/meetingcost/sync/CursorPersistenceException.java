package de.bycsitsm.meetingcost.sync;

import de.bycsitsm.meetingcost.MeetingCostException;

/**
 * Thrown when a sync cursor cannot be read or written.
 */
public class CursorPersistenceException extends MeetingCostException {

    public CursorPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}

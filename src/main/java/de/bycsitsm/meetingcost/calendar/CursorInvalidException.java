package de.bycsitsm.meetingcost.calendar;

import de.bycsitsm.meetingcost.MeetingCostException;

/**
 * Thrown when the calendar no longer accepts a sync token and a full sync is required.
 */
public class CursorInvalidException extends MeetingCostException {

    public CursorInvalidException(String message) {
        super(message);
    }
}

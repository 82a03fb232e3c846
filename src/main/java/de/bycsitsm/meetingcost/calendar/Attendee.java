package de.bycsitsm.meetingcost.calendar;

/**
 * An attendee of a calendar event.
 *
 * @param address the attendee's mail address
 * @param status  the attendee's response to the invitation
 */
public record Attendee(
        String address,
        ResponseStatus status
) {
}

package de.bycsitsm.meetingcost.calendar;

import java.util.Map;

/**
 * The fields written back to an event.
 *
 * @param description       the complete new description
 * @param privateProperties the complete new private metadata
 * @param notifyAttendees   whether attendees should be notified of the change
 */
public record EventPatch(
        String description,
        Map<String, String> privateProperties,
        boolean notifyAttendees
) {

    public EventPatch {
        privateProperties = Map.copyOf(privateProperties);
    }
}

package de.bycsitsm.meetingcost;

import de.bycsitsm.meetingcost.calendar.Attendee;
import de.bycsitsm.meetingcost.calendar.CalendarEvent;
import de.bycsitsm.meetingcost.calendar.ResponseStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Shared test data: organization {@code co.com}, rate 125, tag {@code [[COST]]}.
 */
public final class Fixtures {

    public static final Instant START = Instant.parse("2025-02-10T14:00:00Z");

    private Fixtures() {
    }

    public static MeetingCostProperties properties() {
        return properties(true, false);
    }

    public static MeetingCostProperties properties(boolean internalOnly, boolean excludeDeclined) {
        return new MeetingCostProperties("co.com", 125, "[[COST]]", internalOnly, excludeDeclined,
                35, 10000, 500, 1000, 4, 1000, null);
    }

    public static CalendarEvent meeting(String id, Duration duration, Attendee... attendees) {
        return new CalendarEvent(id, null, START, START.plus(duration), false, "a@co.com",
                List.of(attendees), null, Map.of(), false, "\"1\"");
    }

    public static CalendarEvent allDay(String id, Attendee... attendees) {
        return new CalendarEvent(id, null, null, null, true, null, List.of(attendees), null, Map.of(), false, null);
    }

    public static CalendarEvent withDescription(CalendarEvent event, String description,
                                                Map<String, String> privateProperties) {
        return new CalendarEvent(event.id(), event.recurringEventId(), event.start(), event.end(), event.allDay(),
                event.organizer(), event.attendees(), description, privateProperties, event.cancelled(),
                event.etag());
    }

    public static Attendee accepted(String address) {
        return new Attendee(address, ResponseStatus.ACCEPTED);
    }

    public static Attendee declined(String address) {
        return new Attendee(address, ResponseStatus.DECLINED);
    }

    public static Attendee tentative(String address) {
        return new Attendee(address, ResponseStatus.TENTATIVE);
    }

    public static Attendee noResponse(String address) {
        return new Attendee(address, ResponseStatus.NEEDS_ACTION);
    }
}

package de.bycsitsm.meetingcost.calendar;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * In-memory projection of one meeting occurrence, valid for a single processing pass.
 *
 * @param id                the event identifier, unique within the owner's calendar
 * @param recurringEventId  the series identifier for occurrences of a recurring meeting, or {@code null}
 * @param start             the start instant, or {@code null} for all-day events
 * @param end               the end instant, or {@code null} for all-day events
 * @param allDay            whether the event is date-only
 * @param organizer         the organizer's address, if known
 * @param attendees         the attendees of the event
 * @param description       the free-text description, or {@code null} if empty
 * @param privateProperties private key-value metadata attached to the event
 * @param cancelled         whether the event was deleted or cancelled
 * @param etag              the version of the event used for conditional writes, if known
 */
public record CalendarEvent(
        String id,
        @Nullable String recurringEventId,
        @Nullable Instant start,
        @Nullable Instant end,
        boolean allDay,
        @Nullable String organizer,
        List<Attendee> attendees,
        @Nullable String description,
        Map<String, String> privateProperties,
        boolean cancelled,
        @Nullable String etag
) {

    public CalendarEvent {
        attendees = attendees == null ? List.of() : List.copyOf(attendees);
        privateProperties = privateProperties == null ? Map.of() : Map.copyOf(privateProperties);
    }

    /**
     * Creates a placeholder for an event that was removed from the calendar.
     */
    public static CalendarEvent deleted(String id) {
        return new CalendarEvent(id, null, null, null, false, null, List.of(), null, Map.of(), true, null);
    }

    /**
     * Returns the identity of this occurrence. Occurrences of one series share a series id
     * but differ in their start instant.
     */
    public OccurrenceKey occurrenceKey() {
        return new OccurrenceKey(id, start);
    }

    /**
     * Returns the duration of the event, or {@link Duration#ZERO} if start or end is missing.
     */
    public Duration duration() {
        if (start == null || end == null) {
            return Duration.ZERO;
        }
        return Duration.between(start, end);
    }

    /**
     * Identity of a single occurrence.
     *
     * @param eventId the event identifier
     * @param start   the occurrence start, or {@code null} for all-day events
     */
    public record OccurrenceKey(String eventId, @Nullable Instant start) {
    }
}

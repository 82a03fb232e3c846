package de.bycsitsm.meetingcost.sync;

import de.bycsitsm.meetingcost.calendar.CalendarEvent;

import java.util.List;

/**
 * Outcome of a complete fetch for one member.
 *
 * @param events       the changed events, de-duplicated by occurrence
 * @param newCursor    the cursor to store once the events are processed
 * @param usedFallback whether the fetch fell back to the time window
 */
public record FetchResult(
        List<CalendarEvent> events,
        SyncCursor newCursor,
        boolean usedFallback
) {
}

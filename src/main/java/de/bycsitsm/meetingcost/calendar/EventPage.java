package de.bycsitsm.meetingcost.calendar;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One page of a listing.
 *
 * @param items         the events on this page
 * @param nextPageToken the token of the following page, or {@code null} on the last page
 * @param nextSyncToken the sync token for the next run, only present on the last page
 */
public record EventPage(
        List<CalendarEvent> items,
        @Nullable String nextPageToken,
        @Nullable String nextSyncToken
) {

    public EventPage {
        items = items == null ? List.of() : List.copyOf(items);
    }
}

package de.bycsitsm.meetingcost.calendar;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * A request for one page of events. Either a sync token (incremental) or a time window
 * (full scan) is set, never both.
 *
 * @param syncToken the cursor of the previous run, for an incremental request
 * @param timeMin   the window start, for a full scan
 * @param timeMax   the window end, for a full scan
 * @param pageToken the token of the page to fetch, or {@code null} for the first page
 */
public record EventQuery(
        @Nullable String syncToken,
        @Nullable Instant timeMin,
        @Nullable Instant timeMax,
        @Nullable String pageToken
) {

    public static EventQuery incremental(String syncToken) {
        return new EventQuery(syncToken, null, null, null);
    }

    public static EventQuery window(Instant timeMin, Instant timeMax) {
        return new EventQuery(null, timeMin, timeMax, null);
    }

    public boolean isIncremental() {
        return syncToken != null;
    }

    public EventQuery withPageToken(String nextPageToken) {
        return new EventQuery(syncToken, timeMin, timeMax, nextPageToken);
    }
}

package de.bycsitsm.meetingcost.sync;

import de.bycsitsm.meetingcost.MeetingCostProperties;
import de.bycsitsm.meetingcost.calendar.CalendarEvent;
import de.bycsitsm.meetingcost.calendar.CalendarGateway;
import de.bycsitsm.meetingcost.calendar.CursorInvalidException;
import de.bycsitsm.meetingcost.calendar.EventQuery;
import de.bycsitsm.meetingcost.calendar.Member;
import de.bycsitsm.meetingcost.calendar.TransientFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Optional;

/**
 * Fetches the events of a member that changed since the member's cursor.
 * <p>
 * With a cursor, only changes are requested. If the calendar rejects the cursor, the fetch
 * starts over with a full scan of the window {@code [now - windowDays, now + windowDays]}.
 * Either way all pages are read and the new cursor is only taken from the last page. A
 * failure on any page aborts the whole fetch without producing a cursor.
 */
@Component
public class ChangeFetcher {

    private static final Logger log = LoggerFactory.getLogger(ChangeFetcher.class);

    private final CalendarGateway calendarGateway;
    private final Clock clock;
    private final Duration window;
    private final int maxPages;

    public ChangeFetcher(CalendarGateway calendarGateway, Clock clock, MeetingCostProperties properties) {
        this.calendarGateway = calendarGateway;
        this.clock = clock;
        this.window = Duration.ofDays(properties.windowDays());
        this.maxPages = properties.maxPages();
    }

    public FetchResult fetch(Member member, Optional<SyncCursor> cursor) {
        if (cursor.isPresent()) {
            try {
                return fetchAll(member, EventQuery.incremental(cursor.get().token()), false);
            } catch (CursorInvalidException e) {
                log.info("Sync token of {} is no longer valid ({}), falling back to a {} day window",
                        member.address(), e.getMessage(), window.toDays());
            }
        }

        var now = clock.instant();
        try {
            return fetchAll(member, EventQuery.window(now.minus(window), now.plus(window)), true);
        } catch (CursorInvalidException e) {
            throw new TransientFetchException("Windowed fetch for " + member.address() + " was rejected: "
                    + e.getMessage(), e);
        }
    }

    private FetchResult fetchAll(Member member, EventQuery query, boolean fallback) {
        var events = new ArrayList<CalendarEvent>();
        var seen = new HashSet<CalendarEvent.OccurrenceKey>();
        var duplicates = 0;
        var pages = 0;
        var pageQuery = query;

        while (true) {
            if (++pages > maxPages) {
                throw new TransientFetchException("Fetch for " + member.address() + " exceeded " + maxPages + " pages.");
            }
            var page = calendarGateway.listEvents(member, pageQuery);
            for (var event : page.items()) {
                if (seen.add(event.occurrenceKey())) {
                    events.add(event);
                } else {
                    duplicates++;
                }
            }

            if (page.nextPageToken() != null) {
                pageQuery = query.withPageToken(page.nextPageToken());
                continue;
            }
            if (page.nextSyncToken() == null) {
                throw new TransientFetchException("Calendar of " + member.address()
                        + " returned no sync token on the last page.");
            }

            log.debug("Fetched {} event(s) in {} page(s) for {} ({} duplicate occurrence(s) dropped, fallback: {})",
                    events.size(), pages, member.address(), duplicates, fallback);
            var cursor = new SyncCursor(member.address(), page.nextSyncToken(), clock.instant());
            return new FetchResult(events, cursor, fallback);
        }
    }
}

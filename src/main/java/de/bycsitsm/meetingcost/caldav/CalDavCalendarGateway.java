package de.bycsitsm.meetingcost.caldav;

import de.bycsitsm.meetingcost.calendar.CalendarEvent;
import de.bycsitsm.meetingcost.calendar.CalendarGateway;
import de.bycsitsm.meetingcost.calendar.CursorInvalidException;
import de.bycsitsm.meetingcost.calendar.EventPage;
import de.bycsitsm.meetingcost.calendar.EventPatch;
import de.bycsitsm.meetingcost.calendar.EventQuery;
import de.bycsitsm.meetingcost.calendar.Member;
import de.bycsitsm.meetingcost.calendar.TransientFetchException;
import de.bycsitsm.meetingcost.calendar.TransientWriteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link CalendarGateway} backed by a CalDAV server.
 * <p>
 * Incremental listing uses the {@code sync-collection} report. When the server truncates the
 * result, the intermediate sync token is handed out as page token and the next page continues
 * from it; only the last page yields the sync token for the next run. A full scan reads the
 * collection's sync token first and then queries the window with {@code calendar-query}, so
 * changes made during the scan are picked up by the next incremental run.
 * <p>
 * Writes re-read the resource, verify that it still has the entity tag seen during the fetch
 * and replace it with a conditional {@code PUT}. Unless attendees are to be notified, the
 * written event opts out of server-side scheduling.
 */
@Component
class CalDavCalendarGateway implements CalendarGateway {

    private static final Logger log = LoggerFactory.getLogger(CalDavCalendarGateway.class);

    private final CalDavClient calDavClient;
    private final ICalendarCodec codec;
    private final String baseUrl;
    private final int pageSize;

    CalDavCalendarGateway(CalDavClient calDavClient, CalDavProperties properties) {
        this.calDavClient = calDavClient;
        this.codec = new ICalendarCodec(properties.zone());
        this.baseUrl = CalDavClient.normalizeUrl(Objects.requireNonNull(properties.url()));
        this.pageSize = properties.pageSize();
    }

    @Override
    public EventPage listEvents(Member owner, EventQuery query) {
        var calendarUrl = calendarUrl(owner);
        try {
            if (query.isIncremental()) {
                var token = query.pageToken() != null ? query.pageToken() : query.syncToken();
                var report = calDavClient.syncCollection(calendarUrl, token, pageSize);
                var events = toEvents(calendarUrl, report.resources());
                if (report.truncated() && report.syncToken() != null) {
                    return new EventPage(events, report.syncToken(), null);
                }
                return new EventPage(events, null, report.syncToken());
            }

            var syncToken = calDavClient.fetchSyncToken(calendarUrl);
            var report = calDavClient.calendarQuery(calendarUrl,
                    Objects.requireNonNull(query.timeMin()), Objects.requireNonNull(query.timeMax()));
            return new EventPage(toEvents(calendarUrl, report.resources()), null, syncToken);
        } catch (CalDavException e) {
            if (e.isInvalidSyncToken()) {
                throw new CursorInvalidException(e.getMessage());
            }
            throw new TransientFetchException("Failed to list events of " + owner.address() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void patch(Member owner, CalendarEvent event, EventPatch patch) {
        var resourceUrl = CalDavClient.resolveHref(calendarUrl(owner), event.id());
        try {
            var current = calDavClient.get(resourceUrl);
            if (current.deleted() || current.calendarData() == null) {
                throw new TransientWriteException("Event " + event.id() + " no longer exists.");
            }
            if (event.etag() != null && current.etag() != null && !event.etag().equals(current.etag())) {
                throw new TransientWriteException("Event " + event.id() + " was modified since it was fetched.");
            }
            var calendarData = codec.rewrite(current.calendarData(), patch.description(), patch.privateProperties(),
                    patch.notifyAttendees());
            calDavClient.put(resourceUrl, calendarData, current.etag());
        } catch (CalDavException e) {
            throw new TransientWriteException("Failed to write event " + event.id() + " of " + owner.address()
                    + ": " + e.getMessage(), e);
        }
    }

    private List<CalendarEvent> toEvents(String calendarUrl, List<CalDavClient.Resource> resources) {
        var events = new ArrayList<CalendarEvent>(resources.size());
        for (var resource : resources) {
            if (resource.deleted()) {
                events.add(CalendarEvent.deleted(resource.href()));
                continue;
            }
            var calendarData = resource.calendarData();
            var etag = resource.etag();
            if (calendarData == null) {
                // Some servers report only the entity tag in sync reports
                var fetched = calDavClient.get(CalDavClient.resolveHref(calendarUrl, resource.href()));
                if (fetched.deleted() || fetched.calendarData() == null) {
                    events.add(CalendarEvent.deleted(resource.href()));
                    continue;
                }
                calendarData = fetched.calendarData();
                etag = fetched.etag();
            }
            try {
                codec.parse(resource.href(), etag, calendarData).ifPresent(events::add);
            } catch (CalDavException e) {
                log.warn("Ignoring unreadable calendar object {}: {}", resource.href(), e.getMessage());
            }
        }
        return events;
    }

    private String calendarUrl(Member owner) {
        if (owner.calendarHref() == null) {
            throw new TransientFetchException("No calendar known for " + owner.address() + ".");
        }
        return CalDavClient.normalizeUrl(CalDavClient.resolveHref(baseUrl, owner.calendarHref()));
    }
}

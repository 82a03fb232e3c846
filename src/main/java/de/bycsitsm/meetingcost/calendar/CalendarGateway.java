package de.bycsitsm.meetingcost.calendar;

/**
 * Remote calendar operations used by a run.
 */
public interface CalendarGateway {

    /**
     * Fetches one page of events of the member's calendar.
     *
     * @throws CursorInvalidException  if the sync token in the query is no longer accepted
     * @throws TransientFetchException if the page could not be fetched
     */
    EventPage listEvents(Member owner, EventQuery query);

    /**
     * Writes description and private metadata of an event. The write is conditional on
     * {@link CalendarEvent#etag()} when the event carries one.
     *
     * @throws TransientWriteException if the event could not be written
     */
    void patch(Member owner, CalendarEvent event, EventPatch patch);
}

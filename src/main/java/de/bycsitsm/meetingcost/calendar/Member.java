package de.bycsitsm.meetingcost.calendar;

import org.jspecify.annotations.Nullable;

/**
 * An active member of the organization whose calendar is scanned.
 *
 * @param address      the member's unique mail address, also the key of its sync cursor
 * @param calendarHref the location of the member's default calendar, or {@code null}
 *                     if the calendar source resolves it from the address
 */
public record Member(
        String address,
        @Nullable String calendarHref
) {
}

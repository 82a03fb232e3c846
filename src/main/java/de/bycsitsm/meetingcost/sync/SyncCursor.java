package de.bycsitsm.meetingcost.sync;

import java.time.Instant;

/**
 * The last observed state of one member's calendar.
 *
 * @param memberAddress the member the cursor belongs to
 * @param token         the opaque sync token handed out by the calendar
 * @param updatedAt     when the token was obtained
 */
public record SyncCursor(
        String memberAddress,
        String token,
        Instant updatedAt
) {
}

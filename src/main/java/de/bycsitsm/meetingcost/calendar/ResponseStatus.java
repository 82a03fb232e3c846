package de.bycsitsm.meetingcost.calendar;

import org.jspecify.annotations.Nullable;

import java.util.Locale;

/**
 * An attendee's reply to a meeting invitation.
 */
public enum ResponseStatus {
    ACCEPTED,
    DECLINED,
    TENTATIVE,
    NEEDS_ACTION;

    /**
     * Maps an iCalendar {@code PARTSTAT} value (or a Google-style {@code responseStatus})
     * to a response status. Unknown or missing values count as no response.
     */
    public static ResponseStatus fromPartStat(@Nullable String value) {
        if (value == null) {
            return NEEDS_ACTION;
        }
        return switch (value.strip().toUpperCase(Locale.ROOT).replace("-", "").replace("_", "")) {
            case "ACCEPTED" -> ACCEPTED;
            case "DECLINED" -> DECLINED;
            case "TENTATIVE" -> TENTATIVE;
            default -> NEEDS_ACTION;
        };
    }
}

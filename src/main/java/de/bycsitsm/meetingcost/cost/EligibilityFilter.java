package de.bycsitsm.meetingcost.cost;

import de.bycsitsm.meetingcost.MeetingCostProperties;
import de.bycsitsm.meetingcost.calendar.Attendee;
import de.bycsitsm.meetingcost.calendar.CalendarEvent;
import de.bycsitsm.meetingcost.calendar.ResponseStatus;
import org.springframework.stereotype.Component;

/**
 * Decides whether an event is annotated, based on its structure only.
 * <p>
 * Rules are evaluated in a fixed order and the first matching rule wins:
 * all-day, no duration, solo, no internal attendee, mixed (internal-only mode), and finally
 * solo again when fewer than two internal attendees remain to be priced.
 */
@Component
public class EligibilityFilter {

    private final MeetingCostProperties properties;

    public EligibilityFilter(MeetingCostProperties properties) {
        this.properties = properties;
    }

    public EligibilityDecision evaluate(CalendarEvent event) {
        if (event.allDay() || event.start() == null || event.end() == null) {
            return EligibilityDecision.skip(SkipReason.ALL_DAY);
        }
        var duration = event.duration();
        if (duration.isZero() || duration.isNegative()) {
            return EligibilityDecision.skip(SkipReason.NO_DURATION);
        }

        var counted = event.attendees().stream()
                .filter(attendee -> attendee.address() != null && !attendee.address().isBlank())
                .filter(attendee -> !properties.excludeDeclined() || attendee.status() != ResponseStatus.DECLINED)
                .toList();
        if (counted.size() < 2) {
            return EligibilityDecision.skip(SkipReason.SOLO);
        }

        var internal = counted.stream().map(Attendee::address).filter(properties::isInternal).count();
        if (internal == 0) {
            return EligibilityDecision.skip(SkipReason.NO_INTERNAL);
        }
        if (properties.internalOnly() && internal != counted.size()) {
            return EligibilityDecision.skip(SkipReason.MIXED);
        }
        if (internal < 2) {
            // Only internal attendees are priced, one of them alone is still a solo meeting.
            return EligibilityDecision.skip(SkipReason.SOLO);
        }
        return EligibilityDecision.ok();
    }
}

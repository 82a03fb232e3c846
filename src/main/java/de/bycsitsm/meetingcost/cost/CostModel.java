package de.bycsitsm.meetingcost.cost;

import de.bycsitsm.meetingcost.MeetingCostProperties;
import de.bycsitsm.meetingcost.calendar.Attendee;
import de.bycsitsm.meetingcost.calendar.CalendarEvent;
import de.bycsitsm.meetingcost.calendar.ResponseStatus;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Computes invited and effective cost of an eligible meeting.
 * <p>
 * Only internal attendees are priced. The effective set is the invited set without the
 * attendees that declined, so the effective cost never exceeds the invited cost. Both
 * figures are rounded to whole currency units, halves away from zero.
 */
@Component
public class CostModel {

    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    private final MeetingCostProperties properties;

    public CostModel(MeetingCostProperties properties) {
        this.properties = properties;
    }

    public CostResult cost(CalendarEvent event, RateResolver.RateLookup rates) {
        var hours = Math.max(0.0, event.duration().toMillis() / MILLIS_PER_HOUR);

        var invited = event.attendees().stream()
                .filter(attendee -> properties.isInternal(attendee.address()))
                .toList();
        var effective = invited.stream()
                .filter(attendee -> attendee.status() != ResponseStatus.DECLINED)
                .toList();

        return new CostResult(
                price(hours, invited, rates),
                price(hours, effective, rates),
                invited.size(),
                effective.size(),
                hours);
    }

    private static long price(double hours, List<Attendee> attendees, RateResolver.RateLookup rates) {
        var hourlyTotal = BigDecimal.ZERO;
        for (var attendee : attendees) {
            hourlyTotal = hourlyTotal.add(BigDecimal.valueOf(rates.rate(attendee.address())));
        }
        return BigDecimal.valueOf(hours)
                .multiply(hourlyTotal)
                .setScale(0, RoundingMode.HALF_UP)
                .longValueExact();
    }
}

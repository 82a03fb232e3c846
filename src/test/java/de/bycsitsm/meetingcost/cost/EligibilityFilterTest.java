package de.bycsitsm.meetingcost.cost;

import de.bycsitsm.meetingcost.calendar.CalendarEvent;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static de.bycsitsm.meetingcost.Fixtures.START;
import static de.bycsitsm.meetingcost.Fixtures.accepted;
import static de.bycsitsm.meetingcost.Fixtures.allDay;
import static de.bycsitsm.meetingcost.Fixtures.declined;
import static de.bycsitsm.meetingcost.Fixtures.meeting;
import static de.bycsitsm.meetingcost.Fixtures.properties;
import static org.assertj.core.api.Assertions.assertThat;

class EligibilityFilterTest {

    private final EligibilityFilter filter = new EligibilityFilter(properties());

    @Test
    void internal_meeting_with_two_attendees_is_eligible() {
        var event = meeting("e1", Duration.ofHours(1), accepted("a@co.com"), declined("b@co.com"));

        assertThat(filter.evaluate(event)).isEqualTo(EligibilityDecision.ok());
        assertThat(filter.evaluate(event).eligible()).isTrue();
    }

    @Test
    void all_day_event_without_attendees_is_skipped_as_all_day() {
        var decision = filter.evaluate(allDay("e1"));

        assertThat(decision.skipReason()).isEqualTo(SkipReason.ALL_DAY);
        assertThat(decision).hasToString("skip(all_day)");
    }

    @Test
    void event_without_end_is_skipped_as_all_day() {
        var event = new CalendarEvent("e1", null, START, null, false, null,
                List.of(accepted("a@co.com"), accepted("b@co.com")), null, Map.of(), false, null);

        assertThat(filter.evaluate(event).skipReason()).isEqualTo(SkipReason.ALL_DAY);
    }

    @Test
    void zero_and_negative_durations_are_skipped() {
        var zero = meeting("e1", Duration.ZERO, accepted("a@co.com"), accepted("b@co.com"));
        var negative = meeting("e2", Duration.ofMinutes(-30), accepted("a@co.com"), accepted("b@co.com"));

        assertThat(filter.evaluate(zero).skipReason()).isEqualTo(SkipReason.NO_DURATION);
        assertThat(filter.evaluate(negative).skipReason()).isEqualTo(SkipReason.NO_DURATION);
    }

    @Test
    void single_internal_attendee_is_solo() {
        var event = meeting("e1", Duration.ofHours(1), accepted("a@co.com"));

        assertThat(filter.evaluate(event).skipReason()).isEqualTo(SkipReason.SOLO);
    }

    @Test
    void solo_takes_precedence_over_missing_internal_attendees() {
        var event = meeting("e1", Duration.ofHours(1), accepted("x@other.com"));

        assertThat(filter.evaluate(event).skipReason()).isEqualTo(SkipReason.SOLO);
    }

    @Test
    void declined_attendees_count_for_solo_unless_excluded() {
        var event = meeting("e1", Duration.ofHours(1), accepted("a@co.com"), declined("b@co.com"));
        var excluding = new EligibilityFilter(properties(true, true));

        assertThat(filter.evaluate(event).eligible()).isTrue();
        assertThat(excluding.evaluate(event).skipReason()).isEqualTo(SkipReason.SOLO);
    }

    @Test
    void external_only_meeting_has_no_internal_attendees() {
        var event = meeting("e1", Duration.ofHours(1), accepted("x@other.com"), accepted("y@other.com"));

        assertThat(filter.evaluate(event).skipReason()).isEqualTo(SkipReason.NO_INTERNAL);
    }

    @Test
    void mixed_meeting_is_skipped_in_internal_only_mode() {
        var event = meeting("e1", Duration.ofHours(1), accepted("a@co.com"), accepted("x@other.com"));

        assertThat(filter.evaluate(event).skipReason()).isEqualTo(SkipReason.MIXED);
    }

    @Test
    void mixed_meeting_is_eligible_when_internal_only_is_off() {
        var event = meeting("e1", Duration.ofHours(1),
                accepted("a@co.com"), accepted("b@co.com"), accepted("x@other.com"));

        assertThat(new EligibilityFilter(properties(false, false)).evaluate(event).eligible()).isTrue();
    }

    @Test
    void single_internal_attendee_with_externals_is_solo_when_internal_only_is_off() {
        var mixedFilter = new EligibilityFilter(properties(false, false));
        var event = meeting("e1", Duration.ofHours(1), accepted("a@co.com"), accepted("x@other.com"));

        assertThat(mixedFilter.evaluate(event).skipReason()).isEqualTo(SkipReason.SOLO);
        assertThat(filter.evaluate(event).skipReason()).isEqualTo(SkipReason.MIXED);
    }

    @Test
    void declined_internal_attendee_leaves_a_solo_meeting_when_excluded() {
        var event = meeting("e1", Duration.ofHours(1),
                accepted("a@co.com"), declined("b@co.com"), accepted("x@other.com"));

        assertThat(new EligibilityFilter(properties(false, false)).evaluate(event).eligible()).isTrue();
        assertThat(new EligibilityFilter(properties(false, true)).evaluate(event).skipReason())
                .isEqualTo(SkipReason.SOLO);
    }

    @Test
    void attendees_without_address_are_ignored() {
        var event = meeting("e1", Duration.ofHours(1), accepted("a@co.com"), accepted(" "));

        assertThat(filter.evaluate(event).skipReason()).isEqualTo(SkipReason.SOLO);
    }
}

package de.bycsitsm.meetingcost.cost;

import de.bycsitsm.meetingcost.calendar.Attendee;
import de.bycsitsm.meetingcost.calendar.ResponseStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static de.bycsitsm.meetingcost.Fixtures.accepted;
import static de.bycsitsm.meetingcost.Fixtures.declined;
import static de.bycsitsm.meetingcost.Fixtures.meeting;
import static de.bycsitsm.meetingcost.Fixtures.noResponse;
import static de.bycsitsm.meetingcost.Fixtures.properties;
import static de.bycsitsm.meetingcost.Fixtures.tentative;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

class CostModelTest {

    private final CostModel costModel = new CostModel(properties());
    private final RateResolver rates = new FlatRateResolver(properties());

    @Test
    void declined_attendee_lowers_effective_cost_only() {
        var event = meeting("e1", Duration.ofHours(1), accepted("a@co.com"), declined("b@co.com"));

        var cost = costModel.cost(event, rates.newLookup());

        assertThat(cost.invitedCost()).isEqualTo(250);
        assertThat(cost.effectiveCost()).isEqualTo(125);
        assertThat(cost.invitedCount()).isEqualTo(2);
        assertThat(cost.effectiveCount()).isEqualTo(1);
        assertThat(cost.durationHours()).isEqualTo(1.0);
        assertThat(cost.hasDeclines()).isTrue();
    }

    @Test
    void tentative_and_unanswered_attendees_count_as_attending() {
        var event = meeting("e1", Duration.ofMinutes(30),
                accepted("a@co.com"), tentative("b@co.com"), noResponse("c@co.com"));

        var cost = costModel.cost(event, rates.newLookup());

        assertThat(cost.invitedCost()).isEqualTo(cost.effectiveCost());
        assertThat(cost.hasDeclines()).isFalse();
    }

    @Test
    void half_units_are_rounded_away_from_zero() {
        // 0.5h x 3 x 125 = 187.5
        var event = meeting("e1", Duration.ofMinutes(30),
                accepted("a@co.com"), accepted("b@co.com"), accepted("c@co.com"));

        assertThat(costModel.cost(event, rates.newLookup()).invitedCost()).isEqualTo(188);
    }

    @Test
    void fractional_hours_are_kept() {
        // 50 minutes x 2 x 125 = 208.33
        var event = meeting("e1", Duration.ofMinutes(50), accepted("a@co.com"), accepted("b@co.com"));

        var cost = costModel.cost(event, rates.newLookup());

        assertThat(cost.durationHours()).isCloseTo(0.8333, offset(0.0001));
        assertThat(cost.invitedCost()).isEqualTo(208);
    }

    @Test
    void external_attendees_are_never_priced() {
        var costModel = new CostModel(properties(false, false));
        var event = meeting("e1", Duration.ofHours(2), accepted("a@co.com"), accepted("b@co.com"),
                accepted("x@other.com"));

        var cost = costModel.cost(event, rates.newLookup());

        assertThat(cost.invitedCount()).isEqualTo(2);
        assertThat(cost.invitedCost()).isEqualTo(500);
    }

    @Test
    void everybody_declining_yields_zero_effective_cost() {
        var event = meeting("e1", Duration.ofHours(1), declined("a@co.com"), declined("b@co.com"));

        var cost = costModel.cost(event, rates.newLookup());

        assertThat(cost.invitedCost()).isEqualTo(250);
        assertThat(cost.effectiveCost()).isZero();
        assertThat(cost.effectiveCount()).isZero();
    }

    @Test
    void effective_cost_never_exceeds_invited_cost() {
        var statuses = new ResponseStatus[]{
                ResponseStatus.ACCEPTED,
                ResponseStatus.DECLINED,
                ResponseStatus.TENTATIVE,
                ResponseStatus.NEEDS_ACTION};
        for (var minutes : new int[]{1, 15, 45, 90, 601}) {
            for (var first : statuses) {
                for (var second : statuses) {
                    var event = meeting("e1", Duration.ofMinutes(minutes),
                            new Attendee("a@co.com", first),
                            new Attendee("b@co.com", second),
                            accepted("c@co.com"));

                    var cost = costModel.cost(event, rates.newLookup());

                    assertThat(cost.effectiveCost()).isLessThanOrEqualTo(cost.invitedCost());
                }
            }
        }
    }

    @Test
    void rates_are_resolved_per_attendee_through_the_lookup() {
        RateResolver tiered = address -> address.startsWith("boss") ? 300 : 100;
        var event = meeting("e1", Duration.ofHours(1), accepted("boss@co.com"), accepted("b@co.com"));

        assertThat(costModel.cost(event, tiered.newLookup()).invitedCost()).isEqualTo(400);
    }

    @Test
    void rate_lookup_resolves_each_address_once_and_stays_bounded() {
        var calls = new AtomicInteger();
        RateResolver counting = address -> {
            calls.incrementAndGet();
            return 125;
        };
        var lookup = new RateResolver.RateLookup(counting, 2);

        lookup.rate("a@co.com");
        lookup.rate("A@co.com");
        lookup.rate("b@co.com");
        lookup.rate("c@co.com");

        assertThat(calls).hasValue(3);
        assertThat(lookup.size()).isEqualTo(2);
    }
}

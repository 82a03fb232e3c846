package de.bycsitsm.meetingcost.annotation;

import de.bycsitsm.meetingcost.calendar.CalendarEvent;
import de.bycsitsm.meetingcost.calendar.FakeCalendarGateway;
import de.bycsitsm.meetingcost.calendar.Member;
import de.bycsitsm.meetingcost.calendar.TransientWriteException;
import de.bycsitsm.meetingcost.cost.CostResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static de.bycsitsm.meetingcost.Fixtures.accepted;
import static de.bycsitsm.meetingcost.Fixtures.declined;
import static de.bycsitsm.meetingcost.Fixtures.meeting;
import static de.bycsitsm.meetingcost.Fixtures.properties;
import static de.bycsitsm.meetingcost.Fixtures.withDescription;
import static org.assertj.core.api.Assertions.assertThat;

class AnnotationWriterTest {

    private static final Member OWNER = new Member("a@co.com", "/caldav.php/a/calendar/");
    private static final CostResult COST = new CostResult(250, 125, 2, 1, 1.0);

    private final FakeCalendarGateway gateway = new FakeCalendarGateway();
    private final AnnotationWriter writer = new AnnotationWriter(gateway, new AnnotationRenderer(properties()));

    private final CalendarEvent event = withDescription(
            meeting("e1", Duration.ofHours(1), accepted("a@co.com"), declined("b@co.com")),
            "Weekly sync", Map.of("source", "import"));

    @Test
    void first_write_adds_annotation_and_metadata_without_notifications() {
        var outcome = writer.annotate(OWNER, event, COST);

        assertThat(outcome).isEqualTo(AnnotationOutcome.updated());
        assertThat(gateway.patches()).hasSize(1);
        var patch = gateway.patches().get(0).patch();
        assertThat(patch.description()).isEqualTo(
                "[[COST]]: 🟢 $125\n└─ Invited cost: 🟢 $250 (2 invited → 1 attending)\n\nWeekly sync");
        assertThat(patch.privateProperties()).containsOnly(
                Map.entry("source", "import"),
                Map.entry("meetingCost", "125"),
                Map.entry("effectiveCost", "125"),
                Map.entry("invitedCost", "250"));
        assertThat(patch.notifyAttendees()).isFalse();
    }

    @Test
    void second_write_with_same_cost_is_unchanged() {
        writer.annotate(OWNER, event, COST);
        var patch = gateway.patches().get(0).patch();
        var annotated = withDescription(event, patch.description(), patch.privateProperties());

        var outcome = writer.annotate(OWNER, annotated, COST);

        assertThat(outcome).isEqualTo(AnnotationOutcome.unchanged());
        assertThat(gateway.patches()).hasSize(1);
    }

    @Test
    void changed_cost_rewrites_the_annotation() {
        writer.annotate(OWNER, event, COST);
        var patch = gateway.patches().get(0).patch();
        var annotated = withDescription(event, patch.description(), patch.privateProperties());

        var outcome = writer.annotate(OWNER, annotated, new CostResult(250, 250, 2, 2, 1.0));

        assertThat(outcome).isEqualTo(AnnotationOutcome.updated());
        assertThat(gateway.patches().get(1).patch().description()).isEqualTo("[[COST]]: 🟢 $250\n\nWeekly sync");
        assertThat(gateway.patches().get(1).patch().privateProperties()).containsEntry("meetingCost", "250");
    }

    @Test
    void missing_metadata_alone_triggers_a_write() {
        writer.annotate(OWNER, event, COST);
        var patch = gateway.patches().get(0).patch();
        var descriptionOnly = withDescription(event, patch.description(), Map.of("source", "import"));

        assertThat(writer.annotate(OWNER, descriptionOnly, COST)).isEqualTo(AnnotationOutcome.updated());
    }

    @Test
    void write_failure_is_reported_as_failed() {
        gateway.failPatch("e1", new TransientWriteException("Event was modified concurrently."));

        var outcome = writer.annotate(OWNER, event, COST);

        assertThat(outcome.status()).isEqualTo(AnnotationOutcome.Status.FAILED);
        assertThat(outcome.failureReason()).contains("modified concurrently");
    }
}

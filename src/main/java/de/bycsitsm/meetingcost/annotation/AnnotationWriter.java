package de.bycsitsm.meetingcost.annotation;

import de.bycsitsm.meetingcost.calendar.CalendarEvent;
import de.bycsitsm.meetingcost.calendar.CalendarGateway;
import de.bycsitsm.meetingcost.calendar.EventPatch;
import de.bycsitsm.meetingcost.calendar.Member;
import de.bycsitsm.meetingcost.calendar.TransientWriteException;
import de.bycsitsm.meetingcost.cost.CostResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Objects;

/**
 * Writes the cost annotation into an event, at most once per change of cost.
 * <p>
 * The new description and metadata are computed up front and compared with the current
 * values. If both are identical nothing is written, so repeated runs over an unchanged
 * event cause neither a write nor a notification. Writes never notify attendees.
 */
@Component
public class AnnotationWriter {

    private static final Logger log = LoggerFactory.getLogger(AnnotationWriter.class);

    /** Private metadata key holding the effective cost. */
    public static final String MEETING_COST_KEY = "meetingCost";
    public static final String EFFECTIVE_COST_KEY = "effectiveCost";
    public static final String INVITED_COST_KEY = "invitedCost";

    private final CalendarGateway calendarGateway;
    private final AnnotationRenderer renderer;
    private final DescriptionEditor editor;

    public AnnotationWriter(CalendarGateway calendarGateway, AnnotationRenderer renderer) {
        this.calendarGateway = calendarGateway;
        this.renderer = renderer;
        this.editor = new DescriptionEditor(renderer.tag());
    }

    public AnnotationOutcome annotate(Member owner, CalendarEvent event, CostResult cost) {
        var edit = editor.apply(event.description(), renderer.render(cost));
        if (edit.blocksFound() > 1) {
            log.warn("Event {} of {} contains {} cost annotations, only the first one is updated",
                    event.id(), owner.address(), edit.blocksFound());
        }

        var properties = new HashMap<>(event.privateProperties());
        properties.put(MEETING_COST_KEY, Long.toString(cost.effectiveCost()));
        properties.put(EFFECTIVE_COST_KEY, Long.toString(cost.effectiveCost()));
        properties.put(INVITED_COST_KEY, Long.toString(cost.invitedCost()));

        var currentDescription = Objects.requireNonNullElse(event.description(), "");
        if (edit.description().equals(currentDescription) && properties.equals(event.privateProperties())) {
            log.debug("Annotation of event {} of {} is up to date", event.id(), owner.address());
            return AnnotationOutcome.unchanged();
        }

        try {
            calendarGateway.patch(owner, event, new EventPatch(edit.description(), properties, false));
        } catch (TransientWriteException e) {
            return AnnotationOutcome.failed(Objects.requireNonNullElse(e.getMessage(), "write failed"));
        }
        log.debug("Annotated event {} of {} with effective cost {} (invited {})",
                event.id(), owner.address(), cost.effectiveCost(), cost.invitedCost());
        return AnnotationOutcome.updated();
    }
}

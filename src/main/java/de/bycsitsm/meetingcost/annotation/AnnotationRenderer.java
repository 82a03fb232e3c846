package de.bycsitsm.meetingcost.annotation;

import de.bycsitsm.meetingcost.MeetingCostProperties;
import de.bycsitsm.meetingcost.cost.CostResult;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Renders the annotation block written into event descriptions.
 * <p>
 * The first line carries the tag and the effective cost with a severity indicator. When
 * somebody declined, a detail line with the invited cost follows:
 * <pre>
 * [[MEETING_COST]]: 🟢 $125
 * └─ Invited cost: 🟢 $250 (2 invited → 1 attending)
 * </pre>
 */
@Component
public class AnnotationRenderer {

    static final String DETAIL_PREFIX = "└─";

    private static final String LOW = "🟢";
    private static final String MEDIUM = "🟠";
    private static final String HIGH = "🔴";

    private final String tag;
    private final long lowCostThreshold;
    private final long highCostThreshold;

    public AnnotationRenderer(MeetingCostProperties properties) {
        this.tag = properties.costTag();
        this.lowCostThreshold = properties.lowCostThreshold();
        this.highCostThreshold = properties.highCostThreshold();
    }

    public String render(CostResult cost) {
        var line = tag + ": " + formatCost(cost.effectiveCost());
        if (!cost.hasDeclines()) {
            return line;
        }
        return line + "\n"
                + DETAIL_PREFIX + " Invited cost: " + formatCost(cost.invitedCost())
                + " (" + cost.invitedCount() + " invited → " + cost.effectiveCount() + " attending)";
    }

    String formatCost(long cost) {
        return indicator(cost) + " $" + String.format(Locale.US, "%,d", cost);
    }

    String indicator(long cost) {
        if (cost > highCostThreshold) {
            return HIGH;
        }
        if (cost > lowCostThreshold) {
            return MEDIUM;
        }
        return LOW;
    }

    String tag() {
        return tag;
    }
}

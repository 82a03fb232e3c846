package de.bycsitsm.meetingcost;

import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.Locale;

/**
 * Configuration properties for the meeting cost run.
 *
 * @param domain            the organization domain; attendees whose address ends in {@code @domain} are internal
 * @param defaultRate       the hourly rate applied to every internal attendee
 * @param costTag           the literal that marks the annotation line in an event description
 * @param internalOnly      whether meetings with external attendees are skipped
 * @param excludeDeclined   whether declined attendees are dropped before the solo check
 * @param windowDays        look-back and look-ahead of the fallback window, in days
 * @param maxMembers        the maximum number of members processed per run
 * @param lowCostThreshold  effective costs up to this amount are shown as low
 * @param highCostThreshold effective costs above this amount are shown as high
 * @param memberConcurrency the number of members processed in parallel
 * @param maxPages          the maximum number of result pages fetched for one member
 * @param cursorDirectory   directory for persisted sync cursors, or {@code null} to keep them in memory
 */
@ConfigurationProperties(prefix = "meeting-cost")
public record MeetingCostProperties(
        @Nullable String domain,
        @DefaultValue("125") double defaultRate,
        @DefaultValue("[[MEETING_COST]]") String costTag,
        @DefaultValue("true") boolean internalOnly,
        @DefaultValue("false") boolean excludeDeclined,
        @DefaultValue("35") int windowDays,
        @DefaultValue("10000") int maxMembers,
        @DefaultValue("500") long lowCostThreshold,
        @DefaultValue("1000") long highCostThreshold,
        @DefaultValue("4") int memberConcurrency,
        @DefaultValue("1000") int maxPages,
        @Nullable String cursorDirectory
) {

    public MeetingCostProperties {
        if (domain == null || domain.isBlank()) {
            throw new ConfigurationException("meeting-cost.domain must not be empty.");
        }
        domain = domain.strip().toLowerCase(Locale.ROOT);
        if (domain.startsWith("@")) {
            domain = domain.substring(1);
        }
        if (!(defaultRate > 0)) {
            throw new ConfigurationException("meeting-cost.default-rate must be positive, was " + defaultRate + ".");
        }
        if (costTag == null || costTag.isBlank()) {
            throw new ConfigurationException("meeting-cost.cost-tag must not be empty.");
        }
        requirePositive("meeting-cost.window-days", windowDays);
        requirePositive("meeting-cost.max-members", maxMembers);
        requirePositive("meeting-cost.member-concurrency", memberConcurrency);
        requirePositive("meeting-cost.max-pages", maxPages);
        if (lowCostThreshold <= 0 || highCostThreshold <= lowCostThreshold) {
            throw new ConfigurationException("Cost thresholds must be positive and ascending, were "
                    + lowCostThreshold + " and " + highCostThreshold + ".");
        }
        if (cursorDirectory != null && cursorDirectory.isBlank()) {
            cursorDirectory = null;
        }
    }

    /**
     * Returns whether the given address belongs to the organization domain.
     * The comparison is a case-insensitive suffix match on {@code "@" + domain}.
     */
    public boolean isInternal(@Nullable String address) {
        return address != null && address.toLowerCase(Locale.ROOT).endsWith("@" + domain);
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new ConfigurationException(name + " must be positive, was " + value + ".");
        }
    }
}

package de.bycsitsm.meetingcost.cost;

import de.bycsitsm.meetingcost.MeetingCostProperties;
import org.springframework.stereotype.Component;

/**
 * Applies the configured default rate to everybody.
 */
@Component
class FlatRateResolver implements RateResolver {

    private final double defaultRate;

    FlatRateResolver(MeetingCostProperties properties) {
        this.defaultRate = properties.defaultRate();
    }

    @Override
    public double hourlyRate(String address) {
        return defaultRate;
    }
}

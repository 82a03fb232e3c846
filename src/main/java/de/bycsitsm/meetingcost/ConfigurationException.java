package de.bycsitsm.meetingcost;

/**
 * Thrown at startup when the configuration is invalid. This is the only failure that
 * prevents a run from starting at all.
 */
public class ConfigurationException extends MeetingCostException {

    public ConfigurationException(String message) {
        super(message);
    }
}

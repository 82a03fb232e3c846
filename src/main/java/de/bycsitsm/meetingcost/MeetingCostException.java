package de.bycsitsm.meetingcost;

/**
 * Base class of all failures raised while computing or writing meeting costs.
 */
public class MeetingCostException extends RuntimeException {

    public MeetingCostException(String message) {
        super(message);
    }

    public MeetingCostException(String message, Throwable cause) {
        super(message, cause);
    }
}

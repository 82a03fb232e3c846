package de.bycsitsm.meetingcost.caldav;

import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when a CalDAV request fails.
 */
public class CalDavException extends RuntimeException {

    /** Precondition reported by the server when a sync token is no longer accepted (RFC 6578). */
    static final String VALID_SYNC_TOKEN = "valid-sync-token";

    private final int statusCode;
    private final @Nullable String precondition;

    public CalDavException(String message) {
        this(message, 0, null);
    }

    public CalDavException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.precondition = null;
    }

    public CalDavException(String message, int statusCode, @Nullable String precondition) {
        super(message);
        this.statusCode = statusCode;
        this.precondition = precondition;
    }

    /**
     * Returns the HTTP status of the failed request, or {@code 0} if no response was received.
     */
    public int statusCode() {
        return statusCode;
    }

    /**
     * Returns the name of the violated DAV precondition, if the server reported one.
     */
    public @Nullable String precondition() {
        return precondition;
    }

    public boolean isInvalidSyncToken() {
        return VALID_SYNC_TOKEN.equals(precondition);
    }
}

package de.bycsitsm.meetingcost.sync;

import java.util.Map;

/**
 * Aggregate result of one run.
 *
 * @param processed       events whose annotation was written
 * @param skipped         events left unchanged, for any reason other than an error
 * @param errored         failed members and events
 * @param skippedByReason {@code skipped} broken down by reason; only non-zero reasons are listed
 */
public record RunResult(
        long processed,
        long skipped,
        long errored,
        Map<String, Long> skippedByReason
) {
}

package de.bycsitsm.meetingcost.sync;

import de.bycsitsm.meetingcost.cost.SkipReason;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Outcome counters shared by all member passes of a run. Safe for concurrent increments.
 */
final class RunCounters {

    private final LongAdder processed = new LongAdder();
    private final LongAdder errored = new LongAdder();
    private final Map<SkipReason, LongAdder> skipped;

    RunCounters() {
        var counters = new EnumMap<SkipReason, LongAdder>(SkipReason.class);
        for (var reason : SkipReason.values()) {
            counters.put(reason, new LongAdder());
        }
        // Never modified after construction, only the adders change.
        this.skipped = Collections.unmodifiableMap(counters);
    }

    void processed() {
        processed.increment();
    }

    void skipped(SkipReason reason) {
        skipped.get(reason).increment();
    }

    void errored() {
        errored.increment();
    }

    RunResult snapshot() {
        var byReason = new LinkedHashMap<String, Long>();
        var total = 0L;
        for (var entry : skipped.entrySet()) {
            var count = entry.getValue().sum();
            if (count > 0) {
                byReason.put(entry.getKey().key(), count);
                total += count;
            }
        }
        return new RunResult(processed.sum(), total, errored.sum(), Collections.unmodifiableMap(byReason));
    }
}

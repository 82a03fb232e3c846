package de.bycsitsm.meetingcost.sync;

import de.bycsitsm.meetingcost.MeetingCostProperties;
import de.bycsitsm.meetingcost.annotation.AnnotationWriter;
import de.bycsitsm.meetingcost.calendar.CalendarEvent;
import de.bycsitsm.meetingcost.calendar.Member;
import de.bycsitsm.meetingcost.calendar.MemberDirectory;
import de.bycsitsm.meetingcost.cost.CostModel;
import de.bycsitsm.meetingcost.cost.EligibilityFilter;
import de.bycsitsm.meetingcost.cost.RateResolver;
import de.bycsitsm.meetingcost.cost.SkipReason;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one complete pass over all members.
 * <p>
 * For every member the cursor is loaded, changed events are fetched, each event is checked,
 * priced and annotated, and finally the new cursor is stored. Members are processed in
 * parallel on the member executor. A failure is confined to the member or event it occurs in:
 * it is logged, counted as errored and the run goes on. The cursor of a member is only
 * replaced after its fetch succeeded and all of its events were handled without error.
 */
@Service
public class SyncOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);

    static final String MDC_MEMBER = "member";

    private final MemberDirectory memberDirectory;
    private final CursorStore cursorStore;
    private final ChangeFetcher changeFetcher;
    private final EligibilityFilter eligibilityFilter;
    private final CostModel costModel;
    private final RateResolver rateResolver;
    private final AnnotationWriter annotationWriter;
    private final Executor memberExecutor;
    private final int maxMembers;

    private final AtomicBoolean running = new AtomicBoolean();

    public SyncOrchestrator(MemberDirectory memberDirectory,
                            CursorStore cursorStore,
                            ChangeFetcher changeFetcher,
                            EligibilityFilter eligibilityFilter,
                            CostModel costModel,
                            RateResolver rateResolver,
                            AnnotationWriter annotationWriter,
                            @Qualifier(SyncConfiguration.MEMBER_EXECUTOR) Executor memberExecutor,
                            MeetingCostProperties properties) {
        this.memberDirectory = memberDirectory;
        this.cursorStore = cursorStore;
        this.changeFetcher = changeFetcher;
        this.eligibilityFilter = eligibilityFilter;
        this.costModel = costModel;
        this.rateResolver = rateResolver;
        this.annotationWriter = annotationWriter;
        this.memberExecutor = memberExecutor;
        this.maxMembers = properties.maxMembers();
    }

    /**
     * Executes one run.
     *
     * @return the aggregated counters of the run
     * @throws RunInProgressException if another run has not finished yet
     */
    public RunResult run() {
        if (!running.compareAndSet(false, true)) {
            throw new RunInProgressException("A run is already in progress.");
        }
        try {
            var counters = new RunCounters();
            List<Member> members;
            try {
                members = memberDirectory.listActiveMembers(maxMembers);
            } catch (RuntimeException e) {
                log.error("Failed to list members, nothing was processed: {}", e.getMessage(), e);
                counters.errored();
                return counters.snapshot();
            }
            if (members.size() > maxMembers) {
                members = members.subList(0, maxMembers);
            }

            log.info("Starting run for {} member(s)", members.size());
            var passes = members.stream()
                    .map(member -> CompletableFuture.runAsync(() -> processMember(member, counters), memberExecutor))
                    .toArray(CompletableFuture[]::new);
            CompletableFuture.allOf(passes).join();

            var result = counters.snapshot();
            log.info("Run finished: {} processed, {} skipped {}, {} errored",
                    result.processed(), result.skipped(), result.skippedByReason(), result.errored());
            return result;
        } finally {
            running.set(false);
        }
    }

    private void processMember(Member member, RunCounters counters) {
        MDC.put(MDC_MEMBER, member.address());
        try {
            Optional<SyncCursor> cursor;
            try {
                cursor = cursorStore.get(member.address());
            } catch (RuntimeException e) {
                fail(counters, member, null, "load", e);
                return;
            }

            FetchResult fetched;
            try {
                fetched = changeFetcher.fetch(member, cursor);
            } catch (RuntimeException e) {
                fail(counters, member, null, "fetch", e);
                return;
            }

            var rates = rateResolver.newLookup();
            var failedEvents = 0;
            for (var event : fetched.events()) {
                if (!processEvent(member, event, rates, counters)) {
                    failedEvents++;
                }
            }
            if (failedEvents > 0) {
                // Keeping the old cursor makes the next run fetch the failed events again.
                log.warn("Member {} done with {} failed event(s), cursor left unchanged",
                        member.address(), failedEvents);
                return;
            }

            try {
                cursorStore.put(fetched.newCursor());
            } catch (RuntimeException e) {
                fail(counters, member, null, "persist", e);
                return;
            }
            log.info("Member {} done: {} event(s) checked{}", member.address(), fetched.events().size(),
                    fetched.usedFallback() ? " (windowed resync)" : "");
        } finally {
            MDC.remove(MDC_MEMBER);
        }
    }

    /**
     * Handles one event and returns {@code false} if it failed.
     */
    private boolean processEvent(Member member, CalendarEvent event, RateResolver.RateLookup rates,
                                 RunCounters counters) {
        if (event.cancelled()) {
            counters.skipped(SkipReason.CANCELLED);
            return true;
        }

        var stage = "eligibility";
        try {
            var decision = eligibilityFilter.evaluate(event);
            if (!decision.eligible()) {
                log.debug("Skipping event {} of {}: {}", event.id(), member.address(), decision);
                counters.skipped(decision.skipReason());
                return true;
            }

            stage = "cost";
            var cost = costModel.cost(event, rates);

            stage = "annotate";
            var outcome = annotationWriter.annotate(member, event, cost);
            switch (outcome.status()) {
                case UPDATED -> counters.processed();
                case UNCHANGED -> counters.skipped(SkipReason.UNCHANGED);
                case FAILED -> {
                    counters.errored();
                    log.warn("Stage annotate failed for event {} of {}: {}",
                            event.id(), member.address(), outcome.failureReason());
                    return false;
                }
            }
            return true;
        } catch (RuntimeException e) {
            fail(counters, member, event.id(), stage, e);
            return false;
        }
    }

    private void fail(RunCounters counters, Member member, @Nullable String eventId, String stage, RuntimeException e) {
        counters.errored();
        if (eventId == null) {
            log.warn("Stage {} failed for {}, cursor left unchanged: {}", stage, member.address(), e.getMessage(), e);
        } else {
            log.warn("Stage {} failed for event {} of {}: {}", stage, eventId, member.address(), e.getMessage(), e);
        }
    }
}

package de.bycsitsm.meetingcost.web;

import de.bycsitsm.meetingcost.sync.RunInProgressException;
import de.bycsitsm.meetingcost.sync.RunResult;
import de.bycsitsm.meetingcost.sync.SyncOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Objects;

/**
 * Trigger endpoint for the scheduler. Each request executes one complete run and answers
 * with its counters.
 */
@RestController
class MeetingCostController {

    private static final Logger log = LoggerFactory.getLogger(MeetingCostController.class);

    private final SyncOrchestrator syncOrchestrator;

    MeetingCostController(SyncOrchestrator syncOrchestrator) {
        this.syncOrchestrator = syncOrchestrator;
    }

    @GetMapping("/cron")
    RunResult cron() {
        return syncOrchestrator.run();
    }

    @PostMapping("/runs")
    RunResult run() {
        return syncOrchestrator.run();
    }

    @ExceptionHandler(RunInProgressException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    Map<String, String> runInProgress(RunInProgressException e) {
        log.info("Rejected trigger: {}", e.getMessage());
        return Map.of("error", Objects.requireNonNullElse(e.getMessage(), "A run is already in progress."));
    }
}

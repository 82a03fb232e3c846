package de.bycsitsm.meetingcost.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.bycsitsm.meetingcost.MeetingCostProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the run infrastructure: the member executor, the cursor store and the clock.
 */
@Configuration
class SyncConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SyncConfiguration.class);

    static final String MEMBER_EXECUTOR = "memberSyncExecutor";

    @Bean(name = MEMBER_EXECUTOR)
    ThreadPoolTaskExecutor memberSyncExecutor(MeetingCostProperties properties) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.memberConcurrency());
        executor.setMaxPoolSize(properties.memberConcurrency());
        executor.setThreadNamePrefix("member-sync-");
        executor.initialize();
        return executor;
    }

    @Bean
    CursorStore cursorStore(MeetingCostProperties properties, ObjectMapper objectMapper) {
        if (properties.cursorDirectory() == null) {
            log.warn("No meeting-cost.cursor-directory configured, sync cursors are kept in memory only");
            return new InMemoryCursorStore();
        }
        log.info("Storing sync cursors in {}", properties.cursorDirectory());
        return new FileCursorStore(Path.of(properties.cursorDirectory()), objectMapper);
    }

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}

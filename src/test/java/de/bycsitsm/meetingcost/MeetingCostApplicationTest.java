package de.bycsitsm.meetingcost;

import de.bycsitsm.meetingcost.sync.CursorStore;
import de.bycsitsm.meetingcost.sync.InMemoryCursorStore;
import de.bycsitsm.meetingcost.sync.SyncOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "meeting-cost.domain=@Co.com",
        "caldav.url=https://cal.co.com/caldav.php/",
        "caldav.username=service",
        "caldav.password=secret"
})
class MeetingCostApplicationTest {

    @Autowired
    private MeetingCostProperties properties;

    @Autowired
    private CursorStore cursorStore;

    @Autowired
    private SyncOrchestrator syncOrchestrator;

    @Test
    void context_binds_properties_and_wires_the_run() {
        assertThat(properties.domain()).isEqualTo("co.com");
        assertThat(properties.costTag()).isEqualTo("[[MEETING_COST]]");
        assertThat(properties.maxPages()).isEqualTo(1000);
        assertThat(properties.cursorDirectory()).isNull();
        assertThat(cursorStore).isInstanceOf(InMemoryCursorStore.class);
        assertThat(syncOrchestrator).isNotNull();
    }
}

package de.bycsitsm.meetingcost.caldav;

import de.bycsitsm.meetingcost.calendar.Member;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CalDavMemberDirectoryTest {

    private final StubCalDavClient client = new StubCalDavClient();
    private final CalDavMemberDirectory directory = new CalDavMemberDirectory(client,
            new CalDavProperties("https://cal.co.com/caldav.php/", "service", "secret", "/calendar/", false, 50, "UTC"));

    @Test
    void principals_with_an_address_become_members_sorted_by_address() {
        client.principals = List.of(
                new CalDavClient.Principal("Zoe", "/caldav.php/zoe/", "zoe@co.com"),
                new CalDavClient.Principal("Meeting room", "/caldav.php/room1/", null),
                new CalDavClient.Principal("Alice", "/caldav.php/alice", "Alice@co.com"));

        assertThat(directory.listActiveMembers(10)).containsExactly(
                new Member("Alice@co.com", "/caldav.php/alice/calendar/"),
                new Member("zoe@co.com", "/caldav.php/zoe/calendar/"));
    }

    @Test
    void member_list_is_limited() {
        client.principals = List.of(
                new CalDavClient.Principal("B", "/caldav.php/b/", "b@co.com"),
                new CalDavClient.Principal("A", "/caldav.php/a/", "a@co.com"));

        assertThat(directory.listActiveMembers(1)).extracting(Member::address).containsExactly("a@co.com");
    }
}

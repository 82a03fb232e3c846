package de.bycsitsm.meetingcost.caldav;

import de.bycsitsm.meetingcost.calendar.Member;
import de.bycsitsm.meetingcost.calendar.MemberDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Lists members by searching all principals of the CalDAV server. Principals without a
 * {@code mailto:} calendar user address (resources, groups) are not members.
 */
@Component
class CalDavMemberDirectory implements MemberDirectory {

    private static final Logger log = LoggerFactory.getLogger(CalDavMemberDirectory.class);

    private final CalDavClient calDavClient;
    private final String url;
    private final String calendarPath;

    CalDavMemberDirectory(CalDavClient calDavClient, CalDavProperties properties) {
        this.calDavClient = calDavClient;
        this.url = Objects.requireNonNull(properties.url());
        this.calendarPath = properties.calendarPath();
    }

    @Override
    public List<Member> listActiveMembers(int maxMembers) {
        log.info("Discovering members at {}", url);
        var principals = calDavClient.discoverPrincipals(url);
        var members = principals.stream()
                .filter(principal -> principal.address() != null)
                .map(principal -> new Member(principal.address(), calendarHref(principal.href())))
                .sorted(Comparator.comparing(Member::address, String.CASE_INSENSITIVE_ORDER))
                .limit(maxMembers)
                .toList();
        log.info("Discovered {} member(s) among {} principal(s) at {}", members.size(), principals.size(), url);
        return members;
    }

    private String calendarHref(String principalHref) {
        var base = principalHref.endsWith("/") ? principalHref : principalHref + "/";
        var path = calendarPath.startsWith("/") ? calendarPath.substring(1) : calendarPath;
        return base + path;
    }
}

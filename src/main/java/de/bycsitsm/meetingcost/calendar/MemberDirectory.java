package de.bycsitsm.meetingcost.calendar;

import java.util.List;

/**
 * Enumerates the active members of the organization.
 */
public interface MemberDirectory {

    /**
     * Lists active members.
     *
     * @param maxMembers the maximum number of members to return
     * @return at most {@code maxMembers} members
     */
    List<Member> listActiveMembers(int maxMembers);
}

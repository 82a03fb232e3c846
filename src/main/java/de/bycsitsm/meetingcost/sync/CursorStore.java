package de.bycsitsm.meetingcost.sync;

import java.util.Optional;

/**
 * Durable storage of one sync cursor per member, keyed by member address.
 * <p>
 * Implementations must replace a cursor atomically: a concurrent {@link #get} returns
 * either the previous or the new cursor, never a partially written one.
 */
public interface CursorStore {

    /**
     * Returns the cursor of the member, if one was stored.
     *
     * @throws CursorPersistenceException if the store cannot be read
     */
    Optional<SyncCursor> get(String memberAddress);

    /**
     * Stores the cursor, replacing the member's previous one.
     *
     * @throws CursorPersistenceException if the cursor could not be stored
     */
    void put(SyncCursor cursor);
}

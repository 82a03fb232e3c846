package de.bycsitsm.meetingcost.sync;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps cursors for the lifetime of the process. Every restart begins with a windowed sync.
 */
public class InMemoryCursorStore implements CursorStore {

    private final Map<String, SyncCursor> cursors = new ConcurrentHashMap<>();

    @Override
    public Optional<SyncCursor> get(String memberAddress) {
        return Optional.ofNullable(cursors.get(memberAddress));
    }

    @Override
    public void put(SyncCursor cursor) {
        cursors.put(cursor.memberAddress(), cursor);
    }
}

package de.bycsitsm.meetingcost.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Stores each member's cursor as a JSON document in its own file.
 * <p>
 * A cursor is written to a temporary file in the same directory and then moved over the
 * previous one with an atomic rename, so readers never see a half-written file. Files of
 * different members are independent.
 */
public class FileCursorStore implements CursorStore {

    private static final Logger log = LoggerFactory.getLogger(FileCursorStore.class);

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileCursorStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<SyncCursor> get(String memberAddress) {
        var file = fileOf(memberAddress);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), SyncCursor.class));
        } catch (JsonProcessingException e) {
            // Treated as absent, the next fetch falls back to the window.
            log.warn("Ignoring corrupt cursor file {}: {}", file, e.getOriginalMessage());
            return Optional.empty();
        } catch (IOException e) {
            throw new CursorPersistenceException("Failed to read cursor of " + memberAddress + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void put(SyncCursor cursor) {
        @Nullable Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, ".cursor-", ".tmp");
            objectMapper.writeValue(temp.toFile(), cursor);
            Files.move(temp, fileOf(cursor.memberAddress()),
                    StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new CursorPersistenceException(
                    "Failed to store cursor of " + cursor.memberAddress() + ": " + e.getMessage(), e);
        }
    }

    Path fileOf(String memberAddress) {
        return directory.resolve(URLEncoder.encode(memberAddress, StandardCharsets.UTF_8) + ".json");
    }

    private void deleteQuietly(@Nullable Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.debug("Could not delete temporary cursor file {}: {}", temp, e.getMessage());
        }
    }
}

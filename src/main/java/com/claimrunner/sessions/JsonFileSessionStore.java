package com.claimrunner.sessions;

import com.claimrunner.shared.model.Session;
import com.claimrunner.shared.model.SessionPatch;
import com.claimrunner.shared.model.SessionStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Session store backed by a JSON array on local disk.
 *
 * <p>Records are patched in place so fields this worker does not know about survive a
 * rewrite. A missing file is treated as an empty store. A row whose timestamps cannot be
 * read is logged and left out of listings; the rest of the file is still served.
 */
public class JsonFileSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileSessionStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path file;

    public JsonFileSessionStore(Path file) {
        this.file = file;
    }

    @Override
    public synchronized List<Session> listByStatus(SessionStatus status) {
        var rows = readRows();
        var sessions = new ArrayList<Session>();
        for (var row : rows) {
            if (!status.wireValue().equals(row.path("status").asText(null))) {
                continue;
            }
            try {
                sessions.add(toSession(row));
            } catch (DateTimeParseException e) {
                log.warn("session_skipped id={} reason=malformed_timestamp value={}",
                        row.path("id").asText(), e.getParsedString());
            }
        }
        sessions.sort(Comparator.comparingLong(Session::id));
        return sessions;
    }

    @Override
    public synchronized boolean update(long id, SessionPatch patch) {
        var rows = readRows();
        for (var row : rows) {
            if (row.path("id").asLong() == id && row.isObject()) {
                apply((ObjectNode) row, patch);
                writeRows(rows);
                return true;
            }
        }
        return false;
    }

    @Override
    public synchronized int resetStaleInProgress(Instant cutoff) {
        var rows = readRows();
        int reset = 0;
        for (var row : rows) {
            if (!row.isObject()
                    || !SessionStatus.IN_PROGRESS.wireValue().equals(row.path("status").asText(null))) {
                continue;
            }
            Instant since;
            try {
                since = parseInstant(row.get("in_progress_since"));
            } catch (DateTimeParseException e) {
                log.warn("stale_check_skipped id={} reason=malformed_timestamp", row.path("id").asText());
                continue;
            }
            if (since != null && since.isBefore(cutoff)) {
                apply((ObjectNode) row, SessionPatch.release());
                reset++;
                log.info("stale_in_progress_reset id={}", row.path("id").asText());
            }
        }
        if (reset > 0) {
            writeRows(rows);
        }
        return reset;
    }

    private ArrayNode readRows() {
        if (!Files.exists(file)) {
            return MAPPER.createArrayNode();
        }
        try {
            var content = Files.readString(file);
            if (content.isBlank()) {
                return MAPPER.createArrayNode();
            }
            var root = MAPPER.readTree(content);
            if (root == null || root.isNull()) {
                return MAPPER.createArrayNode();
            }
            if (!root.isArray()) {
                throw new SessionStoreException("Sessions file is not a JSON array: " + file, null);
            }
            return (ArrayNode) root;
        } catch (IOException e) {
            throw new SessionStoreException("Failed to read sessions file: " + file, e);
        }
    }

    private void writeRows(ArrayNode rows) {
        try {
            var parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            var tmp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            Files.writeString(tmp, MAPPER.writeValueAsString(rows));
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new SessionStoreException("Failed to write sessions file: " + file, e);
        }
    }

    private static void apply(ObjectNode row, SessionPatch patch) {
        row.put("status", patch.status().wireValue());
        putInstant(row, "in_progress_since", patch.inProgressSince());
        if (patch.errorReason() != null) {
            row.put("error_reason", patch.errorReason());
        } else {
            row.putNull("error_reason");
        }
        if (patch.lastSuccessAt() != null) {
            putInstant(row, "last_click", patch.lastSuccessAt());
        }
    }

    private static Session toSession(JsonNode row) {
        return new Session(
                row.path("id").asLong(),
                row.path("phone").asText(null),
                row.path("session_string").asText(""),
                parseInstant(row.get("last_click")),
                SessionStatus.fromWire(row.path("status").asText()),
                parseInstant(row.get("in_progress_since")),
                row.path("error_reason").asText(null));
    }

    private static Instant parseInstant(JsonNode node) {
        if (node == null || node.isNull() || node.asText().isBlank()) {
            return null;
        }
        return Instant.parse(node.asText());
    }

    private static void putInstant(ObjectNode row, String field, Instant value) {
        if (value == null) {
            row.putNull(field);
        } else {
            row.put(field, value.toString());
        }
    }
}

package com.claimrunner.sessions;

import com.claimrunner.shared.model.Session;
import com.claimrunner.shared.model.SessionPatch;
import com.claimrunner.shared.model.SessionStatus;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

public class PostgresSessionStore implements SessionStore {

    private static final String SELECT_BY_STATUS =
            "SELECT id, phone, session_string, last_click, status, in_progress_since, error_reason "
            + "FROM sessions WHERE status = ? ORDER BY id ASC";
    private static final String UPDATE_STATE =
            "UPDATE sessions SET status = ?, in_progress_since = ?, error_reason = ?, updated_at = now() "
            + "WHERE id = ?";
    private static final String UPDATE_STATE_AND_LAST_CLICK =
            "UPDATE sessions SET status = ?, in_progress_since = ?, error_reason = ?, last_click = ?, "
            + "updated_at = now() WHERE id = ?";
    private static final String RESET_STALE =
            "UPDATE sessions SET status = ?, in_progress_since = NULL, updated_at = now() "
            + "WHERE status = ? AND in_progress_since < ?";

    private final DataSource dataSource;

    public PostgresSessionStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<Session> listByStatus(SessionStatus status) {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(SELECT_BY_STATUS)) {
            ps.setString(1, status.wireValue());
            try (var rs = ps.executeQuery()) {
                var sessions = new ArrayList<Session>();
                while (rs.next()) {
                    sessions.add(readSession(rs));
                }
                return sessions;
            }
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to list sessions with status " + status.wireValue(), e);
        }
    }

    @Override
    public boolean update(long id, SessionPatch patch) {
        var sql = patch.lastSuccessAt() != null ? UPDATE_STATE_AND_LAST_CLICK : UPDATE_STATE;
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            int i = 1;
            ps.setString(i++, patch.status().wireValue());
            setInstant(ps, i++, patch.inProgressSince());
            ps.setString(i++, patch.errorReason());
            if (patch.lastSuccessAt() != null) {
                setInstant(ps, i++, patch.lastSuccessAt());
            }
            ps.setLong(i, id);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to update session " + id, e);
        }
    }

    @Override
    public int resetStaleInProgress(Instant cutoff) {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(RESET_STALE)) {
            ps.setString(1, SessionStatus.ACTIVE.wireValue());
            ps.setString(2, SessionStatus.IN_PROGRESS.wireValue());
            setInstant(ps, 3, cutoff);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to reset stale in_progress sessions", e);
        }
    }

    private static Session readSession(ResultSet rs) throws SQLException {
        return new Session(
                rs.getLong("id"),
                rs.getString("phone"),
                rs.getString("session_string"),
                readInstant(rs, "last_click"),
                SessionStatus.fromWire(rs.getString("status")),
                readInstant(rs, "in_progress_since"),
                rs.getString("error_reason"));
    }

    private static Instant readInstant(ResultSet rs, String column) throws SQLException {
        var value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }

    private static void setInstant(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            ps.setObject(index, OffsetDateTime.ofInstant(value, ZoneOffset.UTC));
        }
    }
}

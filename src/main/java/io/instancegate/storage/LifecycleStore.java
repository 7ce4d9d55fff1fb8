package io.instancegate.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.instancegate.model.IdentityInfo;
import io.instancegate.model.LifecycleRecord;
import io.instancegate.model.LifecycleState;
import io.instancegate.model.OwnerToken;
import io.instancegate.model.WorkloadConfig;
import io.instancegate.util.HexCodec;
import io.instancegate.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class LifecycleStore {
    private static final String SELECT_COLUMNS =
            "instance_pubkey,state,operator_json,owner_token,owner_token_consumed,owner_json,"
                    + "workload_json,workload_exposed,version,updated_at_ms";

    private final Database database;

    public LifecycleStore(Database database) {
        this.database = database;
    }

    public LifecycleRecord get(String instancePubkey) {
        String key = HexCodec.normalize(instancePubkey);
        return find(key).orElseGet(() -> LifecycleRecord.unregistered(key));
    }

    public Optional<LifecycleRecord> find(String instancePubkey) {
        String key = HexCodec.normalize(instancePubkey);
        String sql = "SELECT " + SELECT_COLUMNS + " FROM lifecycle_records WHERE instance_pubkey=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(mapRecord(rs));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to read lifecycle record: " + key, e);
        }
    }

    public boolean compareAndSwap(String instancePubkey, long expectedVersion, LifecycleRecord next) {
        String key = HexCodec.normalize(instancePubkey);
        if (!key.equals(next.instancePubkey())) {
            throw new IllegalArgumentException("record key mismatch: " + key + " vs " + next.instancePubkey());
        }
        if (next.version() != expectedVersion + 1L) {
            throw new IllegalArgumentException("next version must be expectedVersion + 1, got "
                    + next.version() + " after " + expectedVersion);
        }
        String insert = "INSERT OR IGNORE INTO lifecycle_records(instance_pubkey,state,operator_json,owner_token,"
                + "owner_token_consumed,owner_json,workload_json,workload_exposed,version,created_at_ms,updated_at_ms) "
                + "VALUES(?,?,?,?,?,?,?,?,?,?,?)";
        String update = "UPDATE lifecycle_records SET state=?,operator_json=?,owner_token=?,owner_token_consumed=?,"
                + "owner_json=?,workload_json=?,workload_exposed=?,version=?,updated_at_ms=? "
                + "WHERE instance_pubkey=? AND version=?";
        try (Connection c = database.openConnection()) {
            if (expectedVersion == 0L) {
                try (PreparedStatement ps = c.prepareStatement(insert)) {
                    ps.setString(1, key);
                    ps.setString(2, next.state().name());
                    setJson(ps, 3, next.operator());
                    ps.setString(4, next.ownerToken() == null ? null : next.ownerToken().value());
                    ps.setInt(5, next.ownerToken() != null && next.ownerToken().consumed() ? 1 : 0);
                    setJson(ps, 6, next.owner());
                    setJson(ps, 7, next.workloadConfig());
                    ps.setInt(8, next.workloadExposed() ? 1 : 0);
                    ps.setLong(9, next.version());
                    ps.setLong(10, next.updatedAtMs());
                    ps.setLong(11, next.updatedAtMs());
                    return ps.executeUpdate() == 1;
                }
            }
            try (PreparedStatement ps = c.prepareStatement(update)) {
                ps.setString(1, next.state().name());
                setJson(ps, 2, next.operator());
                ps.setString(3, next.ownerToken() == null ? null : next.ownerToken().value());
                ps.setInt(4, next.ownerToken() != null && next.ownerToken().consumed() ? 1 : 0);
                setJson(ps, 5, next.owner());
                setJson(ps, 6, next.workloadConfig());
                ps.setInt(7, next.workloadExposed() ? 1 : 0);
                ps.setLong(8, next.version());
                ps.setLong(9, next.updatedAtMs());
                ps.setString(10, key);
                ps.setLong(11, expectedVersion);
                return ps.executeUpdate() == 1;
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to commit lifecycle record: " + key, e);
        }
    }

    public boolean delete(String instancePubkey) {
        String key = HexCodec.normalize(instancePubkey);
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM lifecycle_records WHERE instance_pubkey=?")) {
            ps.setString(1, key);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StorageException("Failed to delete lifecycle record: " + key, e);
        }
    }

    public List<LifecycleRecord> list(int limit) {
        String sql = "SELECT " + SELECT_COLUMNS + " FROM lifecycle_records ORDER BY updated_at_ms DESC, instance_pubkey LIMIT ?";
        List<LifecycleRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapRecord(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StorageException("Failed to list lifecycle records", e);
        }
    }

    private LifecycleRecord mapRecord(ResultSet rs) throws SQLException {
        String tokenValue = rs.getString("owner_token");
        OwnerToken token = tokenValue == null
                ? null
                : new OwnerToken(tokenValue, rs.getInt("owner_token_consumed") == 1);
        return new LifecycleRecord(
                rs.getString("instance_pubkey"),
                LifecycleState.fromString(rs.getString("state")),
                readJson(rs.getString("operator_json"), IdentityInfo.class),
                token,
                readJson(rs.getString("owner_json"), IdentityInfo.class),
                readJson(rs.getString("workload_json"), WorkloadConfig.class),
                rs.getInt("workload_exposed") == 1,
                rs.getLong("version"),
                rs.getLong("updated_at_ms")
        );
    }

    private static void setJson(PreparedStatement ps, int index, Object value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
            return;
        }
        ps.setString(index, Jsons.toCompactJson(value));
    }

    private static <T> T readJson(String raw, Class<T> type) throws SQLException {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Jsons.compactMapper().readValue(raw, type);
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt " + type.getSimpleName() + " column", e);
        }
    }
}

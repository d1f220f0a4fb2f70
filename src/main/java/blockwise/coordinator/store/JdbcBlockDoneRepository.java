package blockwise.coordinator.store;

import blockwise.coordinator.model.Block;
import blockwise.coordinator.model.BlockKey;
import blockwise.coordinator.model.Roi;
import blockwise.coordinator.repository.BlockDoneRecord;
import blockwise.coordinator.repository.BlockDoneRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

/**
 * JDBC implementation of BlockDoneRepository.
 * Write regions are stored as JSON so a record can be checked against the
 * block it claims to cover.
 */
public class JdbcBlockDoneRepository implements BlockDoneRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcBlockDoneRepository.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Database db;

    public JdbcBlockDoneRepository(Database db) {
        this.db = db;
    }

    @Override
    public boolean isDone(Block block) {
        Optional<BlockDoneRecord> record = find(block.key());
        if (record.isEmpty()) {
            return false;
        }
        if (record.get().writeRoi().equals(block.writeRoi())) {
            return true;
        }
        log.warn("Stale completion record for block {}: stored {}, block writes {}",
                block.key(), record.get().writeRoi(), block.writeRoi());
        delete(block.key());
        return false;
    }

    private void delete(BlockKey key) {
        String sql = "DELETE FROM block_done WHERE task_id = ? AND block_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key.taskId());
            ps.setLong(2, key.blockId());
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete block: " + key, e);
        }
    }

    @Override
    public void markDone(Block block) {
        String sql = """
                    MERGE INTO block_done (task_id, block_id, write_roi, finished_at)
                    KEY (task_id, block_id)
                    VALUES (?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, block.taskId());
            ps.setLong(2, block.blockId());
            ps.setString(3, toJson(block.writeRoi()));
            ps.setTimestamp(4, Timestamp.from(Instant.now()));

            ps.executeUpdate();
            conn.commit();
            log.debug("Recorded block {} as done", block.key());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record block: " + block.key(), e);
        }
    }

    @Override
    public Optional<BlockDoneRecord> find(BlockKey key) {
        String sql = "SELECT write_roi, finished_at FROM block_done WHERE task_id = ? AND block_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key.taskId());
            ps.setLong(2, key.blockId());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    Timestamp finished = rs.getTimestamp("finished_at");
                    return Optional.of(new BlockDoneRecord(key, fromJson(rs.getString("write_roi")),
                            finished != null ? finished.toInstant() : null));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find block: " + key, e);
        }
    }

    @Override
    public int countByTask(String taskId) {
        String sql = "SELECT COUNT(*) FROM block_done WHERE task_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count blocks for task: " + taskId, e);
        }
    }

    @Override
    public int clear(String taskId) {
        String sql = "DELETE FROM block_done WHERE task_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            int removed = ps.executeUpdate();
            conn.commit();
            log.info("Cleared {} completion record(s) of task {}", removed, taskId);
            return removed;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to clear task: " + taskId, e);
        }
    }

    // ==================== Helper Methods ====================

    static String toJson(Roi roi) {
        try {
            return MAPPER.writeValueAsString(new RoiJson(roi.offset(), roi.shape()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise roi " + roi, e);
        }
    }

    static Roi fromJson(String json) {
        try {
            RoiJson parsed = MAPPER.readValue(json, RoiJson.class);
            return Roi.of(parsed.offset(), parsed.shape());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt roi record: " + json, e);
        }
    }

    public record RoiJson(long[] offset, long[] shape) {
    }
}

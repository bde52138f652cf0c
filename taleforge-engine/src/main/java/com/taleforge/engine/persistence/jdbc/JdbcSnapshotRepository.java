package com.taleforge.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taleforge.core.exception.PersistenceException;
import com.taleforge.core.model.CampaignState;
import com.taleforge.core.model.CanonicalCampaignState;
import com.taleforge.core.repository.SnapshotRepository;
import com.taleforge.engine.persistence.TurnRecordCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of SnapshotRepository.
 * Saving at an existing (campaign, index) replaces that snapshot.
 */
public class JdbcSnapshotRepository implements SnapshotRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcSnapshotRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final TurnRecordCodec codec;
    private final SnapshotRowMapper rowMapper = new SnapshotRowMapper();

    public JdbcSnapshotRepository(JdbcTemplate jdbcTemplate, TurnRecordCodec codec) {
        this.jdbcTemplate = jdbcTemplate;
        this.codec = codec;
    }

    @Override
    public void save(CanonicalCampaignState snapshot) {
        String sql = """
            INSERT INTO campaign_snapshots (
                snapshot_id, campaign_id, turn_index,
                universe_time, state_json, state_hash, created_at
            ) VALUES (?, ?, ?, ?::jsonb, ?::jsonb, ?, ?)
            ON CONFLICT (campaign_id, turn_index) DO UPDATE SET
                snapshot_id = EXCLUDED.snapshot_id,
                universe_time = EXCLUDED.universe_time,
                state_json = EXCLUDED.state_json,
                state_hash = EXCLUDED.state_hash,
                created_at = EXCLUDED.created_at
            """;
        try {
            jdbcTemplate.update(sql,
                snapshot.snapshotId(),
                snapshot.campaignId(),
                snapshot.turnIndex(),
                codec.write(codec.encodeTime(snapshot.state().universeTime())),
                codec.write(snapshot.state().document()),
                snapshot.stateHash(),
                Timestamp.from(snapshot.createdAt())
            );
        } catch (DataAccessException e) {
            log.error("Failed to save snapshot at turn {} for campaign {}: {}",
                snapshot.turnIndex(), snapshot.campaignId(), e.getMessage());
            throw new PersistenceException("Failed to save snapshot", e);
        }
    }

    @Override
    public Optional<CanonicalCampaignState> findLatestAtOrBefore(UUID campaignId, int turnIndex) {
        String sql = """
            SELECT * FROM campaign_snapshots
            WHERE campaign_id = ? AND turn_index <= ?
            ORDER BY turn_index DESC
            LIMIT 1
            """;
        List<CanonicalCampaignState> results = jdbcTemplate.query(sql, rowMapper, campaignId, turnIndex);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<CanonicalCampaignState> findByCampaign(UUID campaignId) {
        String sql = """
            SELECT * FROM campaign_snapshots
            WHERE campaign_id = ?
            ORDER BY turn_index ASC
            """;
        return jdbcTemplate.query(sql, rowMapper, campaignId);
    }

    @Override
    public int deleteAfter(UUID campaignId, int afterIndex) {
        return jdbcTemplate.update(
            "DELETE FROM campaign_snapshots WHERE campaign_id = ? AND turn_index > ?",
            campaignId, afterIndex);
    }

    @Override
    public int deleteAll(UUID campaignId) {
        return jdbcTemplate.update("DELETE FROM campaign_snapshots WHERE campaign_id = ?", campaignId);
    }

    private class SnapshotRowMapper implements RowMapper<CanonicalCampaignState> {

        @Override
        public CanonicalCampaignState mapRow(ResultSet rs, int rowNum) throws SQLException {
            UUID campaignId = UUID.fromString(rs.getString("campaign_id"));
            int turnIndex = rs.getInt("turn_index");
            JsonNode document = codec.read(rs.getString("state_json"));
            CampaignState state = new CampaignState(
                campaignId,
                turnIndex,
                codec.decodeTime(codec.read(rs.getString("universe_time"))),
                (ObjectNode) document
            );
            return new CanonicalCampaignState(
                UUID.fromString(rs.getString("snapshot_id")),
                campaignId,
                turnIndex,
                state,
                rs.getString("state_hash"),
                rs.getTimestamp("created_at").toInstant()
            );
        }
    }
}

package com.taleforge.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.JsonNode;
import com.taleforge.core.exception.PersistenceException;
import com.taleforge.core.model.TurnEvent;
import com.taleforge.core.repository.TurnEventRepository;
import com.taleforge.engine.persistence.TurnRecordCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * PostgreSQL-backed implementation of TurnEventRepository.
 *
 * The unique (campaign_id, turn_index) constraint makes a second append
 * at the same index fail instead of forking the log.
 */
public class JdbcTurnEventRepository implements TurnEventRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTurnEventRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final TurnRecordCodec codec;
    private final TurnEventRowMapper rowMapper = new TurnEventRowMapper();

    public JdbcTurnEventRepository(JdbcTemplate jdbcTemplate, TurnRecordCodec codec) {
        this.jdbcTemplate = jdbcTemplate;
        this.codec = codec;
    }

    @Override
    public void append(TurnEvent event) {
        String sql = """
            INSERT INTO turn_events (
                event_id, campaign_id, turn_index,
                player_input, narrator_text,
                roll_spec, roll_results, dice_seed,
                state_patch, state_hash, universe_time_after,
                lore_deltas, created_at
            ) VALUES (?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?, ?::jsonb, ?, ?::jsonb, ?::jsonb, ?)
            """;

        try {
            jdbcTemplate.update(sql,
                event.eventId(),
                event.campaignId(),
                event.turnIndex(),
                event.playerInput(),
                event.narratorText(),
                event.rollSpec() != null ? codec.write(event.rollSpec()) : "[]",
                codec.write(codec.encodeRollResults(event.rollResults())),
                event.diceSeed(),
                codec.write(codec.encodePatch(event.patch())),
                event.stateHash(),
                codec.write(codec.encodeTime(event.universeTimeAfter())),
                codec.write(codec.encodeLoreDeltas(event.loreDeltas())),
                Timestamp.from(event.createdAt())
            );
            log.debug("Appended turn {} for campaign {}", event.turnIndex(), event.campaignId());
        } catch (DuplicateKeyException e) {
            throw PersistenceException.duplicateTurn(event.campaignId(), event.turnIndex());
        } catch (DataAccessException e) {
            log.error("Failed to append turn {} for campaign {}: {}",
                event.turnIndex(), event.campaignId(), e.getMessage());
            throw new PersistenceException("Failed to append turn event", e);
        }
    }

    @Override
    public List<TurnEvent> findByCampaign(UUID campaignId) {
        String sql = """
            SELECT * FROM turn_events
            WHERE campaign_id = ?
            ORDER BY turn_index ASC
            """;
        return jdbcTemplate.query(sql, rowMapper, campaignId);
    }

    @Override
    public List<TurnEvent> findRange(UUID campaignId, int fromIndex, int toIndex) {
        String sql = """
            SELECT * FROM turn_events
            WHERE campaign_id = ? AND turn_index >= ? AND turn_index <= ?
            ORDER BY turn_index ASC
            """;
        return jdbcTemplate.query(sql, rowMapper, campaignId, fromIndex, toIndex);
    }

    @Override
    public Optional<TurnEvent> findByIndex(UUID campaignId, int turnIndex) {
        String sql = "SELECT * FROM turn_events WHERE campaign_id = ? AND turn_index = ?";
        List<TurnEvent> results = jdbcTemplate.query(sql, rowMapper, campaignId, turnIndex);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<TurnEvent> findLatest(UUID campaignId) {
        String sql = """
            SELECT * FROM turn_events
            WHERE campaign_id = ?
            ORDER BY turn_index DESC
            LIMIT 1
            """;
        List<TurnEvent> results = jdbcTemplate.query(sql, rowMapper, campaignId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<TurnEvent> findRecent(UUID campaignId, int limit) {
        String sql = """
            SELECT * FROM turn_events
            WHERE campaign_id = ?
            ORDER BY turn_index DESC
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, campaignId, limit);
    }

    @Override
    @Transactional
    public List<TurnEvent> deleteAfter(UUID campaignId, int afterIndex) {
        String sql = """
            DELETE FROM turn_events
            WHERE campaign_id = ? AND turn_index > ?
            RETURNING *
            """;
        List<TurnEvent> deleted = jdbcTemplate.query(sql, rowMapper, campaignId, afterIndex);
        log.info("Deleted {} turn events after index {} for campaign {}", deleted.size(), afterIndex, campaignId);
        return deleted.stream()
            .sorted(Comparator.comparingInt(TurnEvent::turnIndex))
            .collect(Collectors.toList());
    }

    private class TurnEventRowMapper implements RowMapper<TurnEvent> {

        @Override
        public TurnEvent mapRow(ResultSet rs, int rowNum) throws SQLException {
            JsonNode rollSpec = codec.read(rs.getString("roll_spec"));
            return new TurnEvent(
                UUID.fromString(rs.getString("event_id")),
                UUID.fromString(rs.getString("campaign_id")),
                rs.getInt("turn_index"),
                rs.getString("player_input"),
                rs.getString("narrator_text"),
                rollSpec,
                codec.decodeRollResults(codec.read(rs.getString("roll_results"))),
                rs.getLong("dice_seed"),
                codec.decodePatch(codec.read(rs.getString("state_patch"))),
                rs.getString("state_hash"),
                codec.decodeTime(codec.read(rs.getString("universe_time_after"))),
                codec.decodeLoreDeltas(codec.read(rs.getString("lore_deltas"))),
                rs.getTimestamp("created_at").toInstant()
            );
        }
    }
}

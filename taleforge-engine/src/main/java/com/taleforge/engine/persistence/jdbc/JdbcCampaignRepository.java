package com.taleforge.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taleforge.core.exception.PersistenceException;
import com.taleforge.core.model.Campaign;
import com.taleforge.core.model.CampaignStatus;
import com.taleforge.core.model.ContentRating;
import com.taleforge.core.model.FailureStyle;
import com.taleforge.core.repository.CampaignRepository;
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
 * PostgreSQL-backed implementation of CampaignRepository.
 */
public class JdbcCampaignRepository implements CampaignRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcCampaignRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final TurnRecordCodec codec;
    private final CampaignRowMapper rowMapper = new CampaignRowMapper();

    public JdbcCampaignRepository(JdbcTemplate jdbcTemplate, TurnRecordCodec codec) {
        this.jdbcTemplate = jdbcTemplate;
        this.codec = codec;
    }

    @Override
    public void save(Campaign campaign) {
        String sql = """
            INSERT INTO campaigns (
                campaign_id, name, status, failure_style, content_rating,
                start_universe_time, dice_seed, initial_party, initial_world, created_at
            ) VALUES (?, ?, ?, ?, ?, ?::jsonb, ?, ?::jsonb, ?::jsonb, ?)
            ON CONFLICT (campaign_id) DO UPDATE SET
                name = EXCLUDED.name,
                status = EXCLUDED.status
            """;
        try {
            jdbcTemplate.update(sql,
                campaign.campaignId(),
                campaign.name(),
                campaign.status().name(),
                campaign.failureStyle().name(),
                campaign.contentRating().name(),
                codec.write(codec.encodeTime(campaign.startUniverseTime())),
                campaign.diceSeed(),
                codec.write(campaign.initialParty()),
                codec.write(campaign.initialWorld()),
                Timestamp.from(campaign.createdAt())
            );
            log.debug("Saved campaign {} ({})", campaign.campaignId(), campaign.status());
        } catch (DataAccessException e) {
            log.error("Failed to save campaign {}: {}", campaign.campaignId(), e.getMessage());
            throw new PersistenceException("Failed to save campaign", e);
        }
    }

    @Override
    public Optional<Campaign> findById(UUID campaignId) {
        String sql = "SELECT * FROM campaigns WHERE campaign_id = ?";
        List<Campaign> results = jdbcTemplate.query(sql, rowMapper, campaignId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    private class CampaignRowMapper implements RowMapper<Campaign> {

        @Override
        public Campaign mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new Campaign(
                UUID.fromString(rs.getString("campaign_id")),
                rs.getString("name"),
                CampaignStatus.valueOf(rs.getString("status")),
                FailureStyle.valueOf(rs.getString("failure_style")),
                ContentRating.valueOf(rs.getString("content_rating")),
                codec.decodeTime(codec.read(rs.getString("start_universe_time"))),
                rs.getLong("dice_seed"),
                (ObjectNode) codec.read(rs.getString("initial_party")),
                (ObjectNode) codec.read(rs.getString("initial_world")),
                rs.getTimestamp("created_at").toInstant()
            );
        }
    }
}

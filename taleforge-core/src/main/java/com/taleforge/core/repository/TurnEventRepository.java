package com.taleforge.core.repository;

import com.taleforge.core.model.TurnEvent;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for the per-campaign turn log.
 * Events are append-only; only rewind deletes, and only from the tail.
 */
public interface TurnEventRepository {

    /**
     * Append a turn event as a single atomic write.
     *
     * @param event The event to append
     * @throws com.taleforge.core.exception.PersistenceException if the
     *         (campaignId, turnIndex) pair already exists or the write fails
     */
    void append(TurnEvent event);

    /**
     * All events for a campaign ordered by turn index.
     */
    List<TurnEvent> findByCampaign(UUID campaignId);

    /**
     * Events with fromIndex <= turnIndex <= toIndex, ordered by turn index.
     */
    List<TurnEvent> findRange(UUID campaignId, int fromIndex, int toIndex);

    Optional<TurnEvent> findByIndex(UUID campaignId, int turnIndex);

    /**
     * The event with the highest turn index, if any.
     */
    Optional<TurnEvent> findLatest(UUID campaignId);

    /**
     * The most recent events, newest first.
     */
    List<TurnEvent> findRecent(UUID campaignId, int limit);

    /**
     * Delete every event with turnIndex > afterIndex.
     *
     * @return the deleted events ordered by turn index
     */
    List<TurnEvent> deleteAfter(UUID campaignId, int afterIndex);
}

package com.taleforge.engine.persistence;

import com.taleforge.core.exception.PersistenceException;
import com.taleforge.core.model.TurnEvent;
import com.taleforge.core.repository.TurnEventRepository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of TurnEventRepository.
 * Default persistence mode and the store used by tests.
 */
public class InMemoryTurnEventRepository implements TurnEventRepository {

    private final Map<UUID, ConcurrentNavigableMap<Integer, TurnEvent>> logs = new ConcurrentHashMap<>();

    @Override
    public void append(TurnEvent event) {
        TurnEvent existing = log(event.campaignId()).putIfAbsent(event.turnIndex(), event);
        if (existing != null) {
            throw PersistenceException.duplicateTurn(event.campaignId(), event.turnIndex());
        }
    }

    @Override
    public List<TurnEvent> findByCampaign(UUID campaignId) {
        return new ArrayList<>(log(campaignId).values());
    }

    @Override
    public List<TurnEvent> findRange(UUID campaignId, int fromIndex, int toIndex) {
        if (fromIndex > toIndex) {
            return List.of();
        }
        return new ArrayList<>(log(campaignId).subMap(fromIndex, true, toIndex, true).values());
    }

    @Override
    public Optional<TurnEvent> findByIndex(UUID campaignId, int turnIndex) {
        return Optional.ofNullable(log(campaignId).get(turnIndex));
    }

    @Override
    public Optional<TurnEvent> findLatest(UUID campaignId) {
        Map.Entry<Integer, TurnEvent> last = log(campaignId).lastEntry();
        return last != null ? Optional.of(last.getValue()) : Optional.empty();
    }

    @Override
    public List<TurnEvent> findRecent(UUID campaignId, int limit) {
        return log(campaignId).descendingMap().values().stream()
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public List<TurnEvent> deleteAfter(UUID campaignId, int afterIndex) {
        ConcurrentNavigableMap<Integer, TurnEvent> tail = log(campaignId).tailMap(afterIndex, false);
        List<TurnEvent> deleted = new ArrayList<>(tail.values());
        tail.clear();
        return deleted;
    }

    private ConcurrentNavigableMap<Integer, TurnEvent> log(UUID campaignId) {
        return logs.computeIfAbsent(campaignId, k -> new ConcurrentSkipListMap<>());
    }
}

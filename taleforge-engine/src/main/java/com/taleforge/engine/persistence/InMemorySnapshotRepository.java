package com.taleforge.engine.persistence;

import com.taleforge.core.model.CanonicalCampaignState;
import com.taleforge.core.repository.SnapshotRepository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory implementation of SnapshotRepository.
 */
public class InMemorySnapshotRepository implements SnapshotRepository {

    private final Map<UUID, ConcurrentNavigableMap<Integer, CanonicalCampaignState>> snapshots =
        new ConcurrentHashMap<>();

    @Override
    public void save(CanonicalCampaignState snapshot) {
        byCampaign(snapshot.campaignId()).put(snapshot.turnIndex(), snapshot);
    }

    @Override
    public Optional<CanonicalCampaignState> findLatestAtOrBefore(UUID campaignId, int turnIndex) {
        Map.Entry<Integer, CanonicalCampaignState> entry = byCampaign(campaignId).floorEntry(turnIndex);
        return entry != null ? Optional.of(entry.getValue()) : Optional.empty();
    }

    @Override
    public List<CanonicalCampaignState> findByCampaign(UUID campaignId) {
        return new ArrayList<>(byCampaign(campaignId).values());
    }

    @Override
    public int deleteAfter(UUID campaignId, int afterIndex) {
        ConcurrentNavigableMap<Integer, CanonicalCampaignState> tail = byCampaign(campaignId).tailMap(afterIndex, false);
        int count = tail.size();
        tail.clear();
        return count;
    }

    @Override
    public int deleteAll(UUID campaignId) {
        ConcurrentNavigableMap<Integer, CanonicalCampaignState> removed = snapshots.remove(campaignId);
        return removed != null ? removed.size() : 0;
    }

    private ConcurrentNavigableMap<Integer, CanonicalCampaignState> byCampaign(UUID campaignId) {
        return snapshots.computeIfAbsent(campaignId, k -> new ConcurrentSkipListMap<>());
    }
}

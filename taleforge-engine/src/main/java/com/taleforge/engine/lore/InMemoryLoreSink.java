package com.taleforge.engine.lore;

import com.taleforge.core.model.LoreDelta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory lore store. Used when no external lore service is configured
 * and in tests.
 */
public class InMemoryLoreSink implements LoreSink {

    private static final Logger log = LoggerFactory.getLogger(InMemoryLoreSink.class);

    private final Map<UUID, List<LoreEntry>> entries = new ConcurrentHashMap<>();

    @Override
    public void publish(UUID campaignId, int turnIndex, UUID eventId, List<LoreDelta> deltas) {
        List<LoreEntry> campaignEntries = entries.computeIfAbsent(campaignId, id -> new CopyOnWriteArrayList<>());
        for (LoreDelta delta : deltas) {
            campaignEntries.add(new LoreEntry(turnIndex, eventId, delta));
        }
        log.debug("Stored {} lore deltas from turn {}", deltas.size(), turnIndex);
    }

    @Override
    public int invalidateAfter(UUID campaignId, int turnIndex) {
        List<LoreEntry> campaignEntries = entries.get(campaignId);
        if (campaignEntries == null) {
            return 0;
        }
        List<LoreEntry> stale = campaignEntries.stream()
            .filter(e -> e.turnIndex() > turnIndex)
            .collect(Collectors.toList());
        campaignEntries.removeAll(stale);
        return stale.size();
    }

    /**
     * Current lore of a campaign in publication order.
     */
    public List<LoreEntry> findByCampaign(UUID campaignId) {
        return new ArrayList<>(entries.getOrDefault(campaignId, List.of()));
    }

    public void clear() {
        entries.clear();
    }

    public record LoreEntry(int turnIndex, UUID eventId, LoreDelta delta) {}
}

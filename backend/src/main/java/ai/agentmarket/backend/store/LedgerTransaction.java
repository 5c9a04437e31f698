package ai.agentmarket.backend.store;

import ai.agentmarket.backend.event.MarketplaceEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Change set of one mutation: the versions it depends on, the records it writes and the events
 * to publish once it is committed.
 *
 * A written record's current version is its expected version; 0 means "must not exist yet".
 */
public class LedgerTransaction {

    private final Map<String, Long> guards = new LinkedHashMap<>();
    private final Map<String, LedgerRecord> writes = new LinkedHashMap<>();
    private final List<MarketplaceEvent> events = new ArrayList<>();

    /**
     * Requires the record to still be at the version it was read at, without writing it.
     */
    public LedgerTransaction guard(LedgerRecord record) {
        guards.put(record.ledgerKey(), record.getVersion());
        return this;
    }

    public LedgerTransaction save(LedgerRecord record) {
        String key = record.ledgerKey();
        if (writes.containsKey(key)) {
            throw new IllegalStateException("Record " + key + " written twice in one transaction");
        }
        writes.put(key, record);
        guards.put(key, record.getVersion());
        return this;
    }

    public LedgerTransaction publish(MarketplaceEvent event) {
        events.add(event);
        return this;
    }

    /**
     * Expected version per key for every guarded or written record.
     */
    public Map<String, Long> getExpectedVersions() {
        return Collections.unmodifiableMap(guards);
    }

    public List<LedgerRecord> getWrites() {
        return List.copyOf(writes.values());
    }

    public List<MarketplaceEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public boolean isEmpty() {
        return writes.isEmpty();
    }
}

package ai.agentmarket.backend.store;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

public class InMemorySequenceGenerator implements SequenceGenerator {

    private final Map<String, AtomicLong> sequences = new ConcurrentHashMap<>();

    @Override
    public long next(String sequence) {
        return sequences.computeIfAbsent(sequence, name -> new AtomicLong()).incrementAndGet();
    }
}

package ai.agentmarket.backend.store;

/**
 * Issues monotonically increasing identifiers per named sequence, starting at 1.
 */
public interface SequenceGenerator {

    long next(String sequence);
}

package com.rms.weather.core.quorum;

/**
 * How many replicas must take part in a store operation before it completes.
 *
 * <p>For a write this is the number of replicas that must acknowledge it; for
 * a read it is the number of replicas whose data is gathered and reconciled
 * before the result is returned.</p>
 *
 * <p>Passed into every store call, so consistency is chosen per operation and
 * never hard-coded in the store adapters.</p>
 */
public record QuorumPolicy(int requiredAcks) {

    public QuorumPolicy {
        if (requiredAcks < 1) {
            throw new IllegalArgumentException("requiredAcks must be >= 1 (was " + requiredAcks + ")");
        }
    }

    public static QuorumPolicy of(int requiredAcks) {
        return new QuorumPolicy(requiredAcks);
    }

    /** A single replica is enough. */
    public static QuorumPolicy one() {
        return new QuorumPolicy(1);
    }

    /** Every replica of the replication set. */
    public static QuorumPolicy all(int replicationFactor) {
        return new QuorumPolicy(replicationFactor);
    }

    public boolean isSatisfiedBy(int respondingReplicas) {
        return respondingReplicas >= requiredAcks;
    }

    @Override
    public String toString() {
        return "Quorum(" + requiredAcks + ")";
    }
}

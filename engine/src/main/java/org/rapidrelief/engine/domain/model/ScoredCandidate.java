package org.rapidrelief.engine.domain.model;

import java.util.Objects;

/**
 * Immutable candidate resource with its computed match score.
 * Natural order puts the best match first.
 */
public final class ScoredCandidate implements Comparable<ScoredCandidate> {

    private final ResourceCandidate candidate;
    private final double capabilityOverlap;
    private final double availabilityWeight;
    private final double proximityWeight;
    private final double score;

    public ScoredCandidate(ResourceCandidate candidate, double capabilityOverlap,
                           double availabilityWeight, double proximityWeight) {
        this.candidate = Objects.requireNonNull(candidate, "candidate must not be null");
        this.capabilityOverlap = capabilityOverlap;
        this.availabilityWeight = availabilityWeight;
        this.proximityWeight = proximityWeight;
        this.score = capabilityOverlap * availabilityWeight * proximityWeight;
    }

    public ResourceCandidate getCandidate() {
        return candidate;
    }

    public String getId() {
        return candidate.getId();
    }

    /**
     * Fraction of required capabilities this resource provides.
     */
    public double getCapabilityOverlap() {
        return capabilityOverlap;
    }

    public double getAvailabilityWeight() {
        return availabilityWeight;
    }

    public double getProximityWeight() {
        return proximityWeight;
    }

    /**
     * overlap x availability x proximity, in [0, 1]. Higher is better.
     */
    public double getScore() {
        return score;
    }

    @Override
    public int compareTo(ScoredCandidate other) {
        int byScore = Double.compare(other.score, this.score);
        return byScore != 0 ? byScore : candidate.getId().compareTo(other.candidate.getId());
    }

    @Override
    public String toString() {
        return String.format("ScoredCandidate{id='%s', score=%.3f, overlap=%.2f, eta=%.1fmin}",
                candidate.getId(), score, capabilityOverlap, candidate.getEtaMinutes());
    }
}

package org.rapidrelief.engine.domain.service;

import org.rapidrelief.engine.config.AllocationConfig;
import org.rapidrelief.engine.domain.model.ResourceStatus;
import org.rapidrelief.engine.domain.model.ScoredCandidate;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.rapidrelief.engine.support.TestCandidates.builder;
import static org.rapidrelief.engine.support.TestCandidates.team;

class ScoringServiceImplTest {

    private final ScoringService scoring = new ScoringServiceImpl();
    private final AllocationConfig config = AllocationConfig.defaults();

    @Test
    void multipliesOverlapAvailabilityAndProximity() {
        ScoredCandidate scored = scoring.score(
                builder("x", "a", "b").rescueCapacity(5).etaMinutes(60).status(ResourceStatus.STANDBY).build(),
                Set.of("a", "b", "c", "d"), config);

        assertThat(scored.getCapabilityOverlap()).isEqualTo(0.5);
        assertThat(scored.getAvailabilityWeight()).isEqualTo(0.7);
        assertThat(scored.getProximityWeight()).isEqualTo(0.5);
        assertThat(scored.getScore()).isCloseTo(0.175, within(1e-9));
    }

    @Test
    void fullOverlapWhenNothingIsRequired() {
        ScoredCandidate scored = scoring.score(team("y", 5, 0), Set.of(), config);

        assertThat(scored.getCapabilityOverlap()).isEqualTo(1.0);
        assertThat(scored.getScore()).isEqualTo(1.0);
    }

    @Test
    void closerCandidatesRankFirst() {
        ScoredCandidate near = scoring.score(team("near", 5, 10, "a"), Set.of("a"), config);
        ScoredCandidate far = scoring.score(team("far", 5, 90, "a"), Set.of("a"), config);

        assertThat(near).isLessThan(far);
    }
}

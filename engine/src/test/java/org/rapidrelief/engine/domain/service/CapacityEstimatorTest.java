package org.rapidrelief.engine.domain.service;

import org.rapidrelief.engine.config.AllocationConfig;
import org.rapidrelief.engine.domain.model.ResourceCandidate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.rapidrelief.engine.support.TestCandidates.builder;

class CapacityEstimatorTest {

    private final CapacityEstimator estimator = new CapacityEstimator(AllocationConfig.defaults());

    @Test
    @DisplayName("missing capacity is personnel times the type coefficient")
    void estimatesFromPersonnelAndType() {
        assertThat(estimator.estimate(candidate("medical", 10))).isEqualTo(50);
        assertThat(estimator.estimate(candidate("fire_rescue", 8))).isEqualTo(16);
        assertThat(estimator.estimate(candidate("search_rescue", 5))).isEqualTo(7);
        assertThat(estimator.estimate(candidate("engineering", 20))).isZero();
        assertThat(estimator.estimate(candidate("logistics", 6))).isEqualTo(6);
        assertThat(estimator.estimate(candidate(null, 6))).isEqualTo(6);
    }

    @Test
    @DisplayName("a staffed resource with a positive coefficient never estimates to zero")
    void roundsSmallEstimatesUpToOne() {
        assertThat(estimator.estimate(candidate("hazmat", 1))).isEqualTo(1);
        assertThat(estimator.estimate(candidate("hazmat", 0))).isZero();
    }

    @Test
    @DisplayName("supplied capacities are kept and estimated ones are flagged")
    void resolvesOnlyMissingCapacities() {
        ResourceCandidate supplied = builder("s").resourceType("medical").rescueCapacity(3).build();
        ResourceCandidate missing = candidate("medical", 4);

        List<ResourceCandidate> resolved = estimator.resolve(List.of(supplied, missing));

        assertThat(resolved).allSatisfy(c -> assertThat(c.hasRescueCapacity()).isTrue());
        assertThat(resolved.get(0).requireRescueCapacity()).isEqualTo(3);
        assertThat(resolved.get(0).isCapacityEstimated()).isFalse();
        assertThat(resolved.get(1).requireRescueCapacity()).isEqualTo(20);
        assertThat(resolved.get(1).isCapacityEstimated()).isTrue();
    }

    private static ResourceCandidate candidate(String type, int personnel) {
        return builder("c-" + type).resourceType(type).availablePersonnel(personnel).build();
    }
}

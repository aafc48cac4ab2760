package com.rms.weather.core.quorum;

import com.rms.weather.config.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuorumSettingsTest {

    @Test
    void defaultDeploymentGuaranteesReadAfterWrite() {
        QuorumSettings q = QuorumSettings.writeOneReadAll(3);

        assertThat(q.write().requiredAcks()).isEqualTo(1);
        assertThat(q.read().requiredAcks()).isEqualTo(3);
        assertThat(q.guaranteesReadAfterWrite()).isTrue();
        assertThat(q.writeFailureTolerance()).isEqualTo(2);
        assertThat(q.readFailureTolerance()).isZero();
    }

    @ParameterizedTest
    @CsvSource({
            "3, 1, 3, true",
            "3, 2, 2, true",
            "3, 3, 1, true",
            "3, 1, 2, false",
            "3, 1, 1, false",
            "5, 3, 3, true",
            "5, 2, 3, false",
            "1, 1, 1, true",
    })
    void overlapIsStrictlyGreaterThanReplicationFactor(int rf, int w, int r, boolean expected) {
        assertThat(QuorumSettings.of(rf, w, r).guaranteesReadAfterWrite()).isEqualTo(expected);
        assertThat(QuorumSettings.overlaps(w, r, rf)).isEqualTo(expected);
    }

    @Test
    void rejectsQuorumAboveReplicationFactor() {
        assertThatThrownBy(() -> QuorumSettings.of(3, 4, 1))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("write quorum 4");
        assertThatThrownBy(() -> QuorumSettings.of(3, 1, 4))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("read quorum 4");
        assertThatThrownBy(() -> QuorumSettings.of(0, 1, 1))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void policyRequiresAtLeastOneReplica() {
        assertThatThrownBy(() -> QuorumPolicy.of(0)).isInstanceOf(IllegalArgumentException.class);
        assertThat(QuorumPolicy.of(2).isSatisfiedBy(2)).isTrue();
        assertThat(QuorumPolicy.of(2).isSatisfiedBy(1)).isFalse();
        assertThat(QuorumPolicy.all(3)).isEqualTo(QuorumPolicy.of(3));
        assertThat(QuorumPolicy.one()).hasToString("Quorum(1)");
    }
}

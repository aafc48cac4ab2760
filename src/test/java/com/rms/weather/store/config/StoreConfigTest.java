package com.rms.weather.store.config;

import com.rms.weather.config.ConfigurationException;
import com.rms.weather.core.model.Observation;
import com.rms.weather.core.quorum.QuorumPolicy;
import com.rms.weather.core.quorum.QuorumSettings;
import com.rms.weather.core.schema.StationSchema;
import com.rms.weather.store.memory.InMemoryReplicatedStationStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StoreConfigTest {

    private final StoreConfig config = new StoreConfig();

    @Test
    void defaultsAreWriteOneReadAllOverThreeReplicas() {
        QuorumSettings q = config.quorumSettings(new StoreProperties());

        assertThat(q).isEqualTo(QuorumSettings.writeOneReadAll(3));
    }

    @Test
    void nonOverlappingQuorumsFailStartupByDefault() {
        StoreProperties props = new StoreProperties();
        props.setReadAcks(2);

        assertThatThrownBy(() -> StoreConfig.buildQuorumSettings(props))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("read-after-write");
    }

    @Test
    void nonOverlappingQuorumsOnlyWarnWhenAllowed() {
        StoreProperties props = new StoreProperties();
        props.setReadAcks(1);
        props.setRequireReadAfterWrite(false);

        QuorumSettings q = StoreConfig.buildQuorumSettings(props);

        assertThat(q.guaranteesReadAfterWrite()).isFalse();
    }

    @Test
    void zeroAcksIsAConfigurationError() {
        StoreProperties props = new StoreProperties();
        props.setWriteAcks(0);

        assertThatThrownBy(() -> StoreConfig.buildQuorumSettings(props))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void keyspaceNameIsValidated() {
        StoreProperties props = new StoreProperties();
        props.setKeyspace("weather; DROP");

        assertThatThrownBy(() -> config.stationSchema(props)).isInstanceOf(ConfigurationException.class);

        props.setKeyspace("weather_test");
        StationSchema schema = config.stationSchema(props);
        assertThat(schema.qualifiedTable()).isEqualTo("weather_test.stations");
    }

    @Test
    void inMemoryStoreHandsOffHintsInTheBackground() throws InterruptedException {
        StoreProperties props = new StoreProperties();
        props.setHintHandoffInterval(Duration.ofMillis(10));
        InMemoryReplicatedStationStore store = (InMemoryReplicatedStationStore) config.inMemoryStationStore(props);
        try {
            store.upsert(new Observation("S1", LocalDate.of(2022, 1, 1), "N", null, 1), QuorumPolicy.one()).block();

            long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
            while (store.pendingHints() > 0 && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }

            assertThat(store.pendingHints()).isZero();
        } finally {
            store.close();
        }
    }
}

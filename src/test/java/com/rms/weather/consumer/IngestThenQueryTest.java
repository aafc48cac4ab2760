package com.rms.weather.consumer;

import com.rms.weather.config.JacksonConfig;
import com.rms.weather.core.codec.ObservationCodec;
import com.rms.weather.core.quorum.QuorumSettings;
import com.rms.weather.core.schema.StationSchema;
import com.rms.weather.query.StationNotFoundException;
import com.rms.weather.query.StationQueryService;
import com.rms.weather.store.memory.InMemoryReplicatedStationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Stream messages through the ingestor, answers through the query service,
 * one in-memory replica set underneath.
 */
class IngestThenQueryTest {

    private static final QuorumSettings QUORUM = QuorumSettings.writeOneReadAll(3);

    private InMemoryReplicatedStationStore store;
    private ObservationIngestor ingestor;
    private StationQueryService queries;
    private long seq;

    @BeforeEach
    void setUp() {
        store = new InMemoryReplicatedStationStore(3);
        ingestor = new ObservationIngestor(new ObservationCodec(JacksonConfig.newObjectMapper()), store, QUORUM,
                new IngestionProperties(), new ObservationIngestorTest.RecordingSink(), new IngestionStats());
        queries = new StationQueryService(store, StationSchema.standard("weather", 3), QUORUM);
    }

    private void deliver(String json) {
        ObservationIngestorTest.TestMessage msg = new ObservationIngestorTest.TestMessage(++seq, json);
        assertThat(ingestor.process(msg).block()).isEqualTo(IngestOutcome.APPLIED);
        assertThat(msg.acks.get()).isEqualTo(1);
    }

    @Test
    void stationMaxOverOutOfOrderDatesAndUnseenStation() {
        deliver("{\"station_id\": \"USR0000WDDG\", \"date\": \"2021-07-04\", \"tmax\": 344}");
        deliver("{\"station_id\": \"USR0000WDDG\", \"date\": \"1995-01-01\", \"tmax\": 210}");

        StepVerifier.create(queries.stationMax("USR0000WDDG")).expectNext(344).verifyComplete();
        StepVerifier.create(queries.stationName("USW00099999"))
                .expectError(StationNotFoundException.class)
                .verify();
    }

    @ParameterizedTest(name = "write order {0}")
    @ValueSource(strings = {"0,1,2", "0,2,1", "1,0,2", "1,2,0", "2,0,1", "2,1,0"})
    void maxIsIndependentOfWriteOrder(String order) {
        String[] dates = {"1995-01-01", "2003-06-15", "2021-07-04"};
        int[] tmax = {210, 415, 344};

        for (String idx : order.split(",")) {
            int i = Integer.parseInt(idx);
            deliver("{\"station_id\": \"USR0000WDDG\", \"date\": \"" + dates[i] + "\", \"tmax\": " + tmax[i] + "}");
        }

        StepVerifier.create(queries.stationMax("USR0000WDDG")).expectNext(415).verifyComplete();
        List<String> stored = store.readObservations("USR0000WDDG", QUORUM.read())
                .map(r -> r.date().toString())
                .collectList()
                .block();
        assertThat(stored).containsExactly(dates);
    }
}

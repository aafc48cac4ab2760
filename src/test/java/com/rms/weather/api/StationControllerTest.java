package com.rms.weather.api;

import com.rms.weather.core.quorum.QuorumSettings;
import com.rms.weather.core.schema.StationSchema;
import com.rms.weather.core.store.StationStore;
import com.rms.weather.query.StationQueryService;
import com.rms.weather.store.memory.InMemoryReplicatedStationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StationControllerTest {

    private InMemoryReplicatedStationStore store;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        store = new InMemoryReplicatedStationStore(3);
        client = clientFor(store);
    }

    private static WebTestClient clientFor(StationStore store) {
        StationQueryService service = new StationQueryService(store, StationSchema.standard("weather", 3),
                QuorumSettings.writeOneReadAll(3));
        return WebTestClient.bindToController(new StationController(service))
                .controllerAdvice(new StationApiExceptionHandler())
                .build();
    }

    private void record(String id, String body) {
        client.post().uri("/api/stations/{id}/records", id)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isNoContent();
    }

    @Test
    void recordThenQueryMax() {
        record("USR0000WDDG", "{\"date\":\"2022-01-01\",\"tmin\":10,\"tmax\":344}");
        record("USR0000WDDG", "{\"date\":\"2022-01-02\",\"tmax\":210}");

        client.get().uri("/api/stations/USR0000WDDG/max")
                .exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.tmax").isEqualTo(344);
    }

    @Test
    void paddedStationIdFindsTheStation() {
        record("X", "{\"date\":\"2022-01-01\",\"tmax\":5}");

        client.get().uri("/api/stations/{id}/max", " X")
                .exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.tmax").isEqualTo(5);
    }

    @Test
    void unknownStationIs404() {
        client.get().uri("/api/stations/NOPE/max")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody().jsonPath("$.code").isEqualTo("not_found");

        client.get().uri("/api/stations/NOPE/name")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void unavailableReadIs503() {
        record("S1", "{\"date\":\"2022-01-01\",\"tmax\":1}");
        store.markDown(1);

        client.get().uri("/api/stations/S1/max")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody().jsonPath("$.code").isEqualTo("unavailable");
    }

    @Test
    void invalidRecordBodyIs400() {
        client.post().uri("/api/stations/S1/records")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"date\":\"2022-01-01\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody().jsonPath("$.code").isEqualTo("bad_request");

        client.post().uri("/api/stations/S1/records")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"date\":\"yesterday\",\"tmax\":1}")
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void schemaIsServedWithoutStoreAccess() {
        client.get().uri("/api/stations/schema")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.keyspace").isEqualTo("weather")
                .jsonPath("$.partitionKey").isEqualTo("id")
                .jsonPath("$.clusteringOrder").isEqualTo("ASC")
                .jsonPath("$.readQuorum").isEqualTo(3);
    }

    @Test
    void unexpectedFailureIs500WithoutDetails() {
        StationStore broken = mock(StationStore.class);
        when(broken.readObservations(anyString(), any())).thenReturn(Flux.error(new IllegalStateException("boom")));

        clientFor(broken).get().uri("/api/stations/S1/max")
                .exchange()
                .expectStatus().is5xxServerError()
                .expectBody()
                .jsonPath("$.code").isEqualTo("internal_error")
                .jsonPath("$.message").isEqualTo("Request failed");
    }
}

package com.rms.weather.api;

import com.rms.weather.query.SchemaDescription;
import com.rms.weather.query.StationQueryService;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import reactor.core.publisher.Mono;

/**
 * Station query surface.
 *
 * <ul>
 *   <li>{@code GET  /api/stations/schema}</li>
 *   <li>{@code GET  /api/stations/{stationId}/name}</li>
 *   <li>{@code GET  /api/stations/{stationId}/max}</li>
 *   <li>{@code POST /api/stations/{stationId}/records}</li>
 * </ul>
 *
 * Errors are mapped by {@link StationApiExceptionHandler}.
 */
@RestController
@RequestMapping(path = "/api/stations", produces = MediaType.APPLICATION_JSON_VALUE)
public class StationController {

    private final StationQueryService queries;

    public StationController(StationQueryService queries) {
        this.queries = queries;
    }

    @GetMapping("/schema")
    public SchemaDescription schema() {
        return queries.stationSchema();
    }

    @GetMapping("/{stationId}/name")
    public Mono<StationNameReply> name(@PathVariable String stationId) {
        return queries.stationName(stationId).map(StationNameReply::new);
    }

    @GetMapping("/{stationId}/max")
    public Mono<StationMaxReply> max(@PathVariable String stationId) {
        return queries.stationMax(stationId).map(StationMaxReply::new);
    }

    @PostMapping(path = "/{stationId}/records", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> record(@PathVariable String stationId, @Valid @RequestBody RecordTempsRequest req) {
        return queries.recordTemps(stationId, req.date(), req.tmin(), req.tmax());
    }
}

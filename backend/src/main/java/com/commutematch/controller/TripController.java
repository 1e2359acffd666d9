package com.commutematch.controller;

import com.commutematch.dto.CreateTripRequest;
import com.commutematch.dto.RouteUpdateRequest;
import com.commutematch.dto.TripMatchResponse;
import com.commutematch.dto.TripResponse;
import com.commutematch.entity.Trip;
import com.commutematch.matching.exception.IndexUnavailableException;
import com.commutematch.matching.exception.InvalidGeometryException;
import com.commutematch.matching.exception.TripNotFoundException;
import com.commutematch.service.TripMatchService;
import com.commutematch.service.TripService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.function.Supplier;

@RestController
@RequestMapping("/api/trips")
public class TripController {
    private static final Logger logger = LoggerFactory.getLogger(TripController.class);
    private final TripService tripService;
    private final TripMatchService tripMatchService;

    public TripController(TripService tripService, TripMatchService tripMatchService) {
        this.tripService = tripService;
        this.tripMatchService = tripMatchService;
    }

    @PostMapping
    public ResponseEntity<TripResponse> createTrip(@Valid @RequestBody CreateTripRequest request) {
        return handle("create trip", () -> {
            Trip trip = tripService.createTrip(request);
            return ResponseEntity.status(HttpStatus.CREATED).body(TripResponse.from(trip));
        });
    }

    @GetMapping("/{tripId}")
    public ResponseEntity<TripResponse> getTrip(@PathVariable String tripId) {
        return handle("get trip", () -> ResponseEntity.ok(TripResponse.from(tripService.getTrip(tripId))));
    }

    @PutMapping("/{tripId}/route")
    public ResponseEntity<TripResponse> updateRoute(@PathVariable String tripId,
                                                    @Valid @RequestBody RouteUpdateRequest request) {
        return handle("update route", () ->
                ResponseEntity.ok(TripResponse.from(tripService.updateRoute(tripId, request.getPolyline()))));
    }

    @PostMapping("/{tripId}/confirm")
    public ResponseEntity<TripResponse> confirmMatch(@PathVariable String tripId) {
        return handle("confirm match", () -> ResponseEntity.ok(TripResponse.from(tripService.confirmMatch(tripId))));
    }

    @PostMapping("/{tripId}/cancel")
    public ResponseEntity<TripResponse> cancelTrip(@PathVariable String tripId) {
        return handle("cancel trip", () -> ResponseEntity.ok(TripResponse.from(tripService.cancelTrip(tripId))));
    }

    @GetMapping("/{tripId}/matches")
    public ResponseEntity<TripMatchResponse> getMatches(@PathVariable String tripId) {
        return handle("get matches", () -> tripMatchService.findLatest(tripId)
                .map(match -> ResponseEntity.ok(TripMatchResponse.from(match)))
                .orElseGet(() -> ResponseEntity.notFound().build()));
    }

    @PostMapping("/{tripId}/matches/refresh")
    public ResponseEntity<Void> refreshMatches(@PathVariable String tripId) {
        return handle("refresh matches", () -> {
            tripService.requestRematch(tripId);
            return ResponseEntity.accepted().<Void>build();
        });
    }

    private <T> ResponseEntity<T> handle(String action, Supplier<ResponseEntity<T>> call) {
        try {
            return call.get();
        } catch (InvalidGeometryException | IllegalArgumentException e) {
            logger.warn("Invalid request to {}: {}", action, e.getMessage());
            return ResponseEntity.badRequest().build();
        } catch (TripNotFoundException e) {
            logger.info("{} failed: {}", action, e.getMessage());
            return ResponseEntity.notFound().build();
        } catch (IllegalStateException e) {
            logger.warn("{} rejected: {}", action, e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        } catch (IndexUnavailableException e) {
            logger.error("{} failed, spatial index unavailable: {}", action, e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        } catch (Exception e) {
            logger.error("{} failed", action, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
    }
}

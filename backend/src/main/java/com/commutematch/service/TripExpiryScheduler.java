package com.commutematch.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class TripExpiryScheduler {

    private static final Logger logger = LoggerFactory.getLogger(TripExpiryScheduler.class);

    private final TripService tripService;
    private final Duration grace;

    public TripExpiryScheduler(TripService tripService,
                               @Value("${trips.expiry.grace-minutes:10}") long graceMinutes) {
        this.tripService = tripService;
        this.grace = Duration.ofMinutes(graceMinutes);
    }

    @Scheduled(fixedDelayString = "${trips.expiry.sweep-interval-ms:60000}")
    public void expireOverdueTrips() {
        try {
            tripService.expireOverdueTrips(grace);
        } catch (RuntimeException e) {
            logger.error("Trip expiry sweep failed", e);
        }
    }
}

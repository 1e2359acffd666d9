package com.commutematch.service;

import com.commutematch.matching.MatchResultSink;
import com.commutematch.matching.MatchingOrchestrator;
import com.commutematch.matching.exception.TripNotFoundException;
import com.commutematch.matching.model.MatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Service;

/**
 * Runs one matching pass per "trip created/updated" job.
 * <p>
 * An unavailable index is rethrown so the container's error handler redelivers the job.
 */
@Service
public class MatchJobConsumer {

    private static final Logger logger = LoggerFactory.getLogger(MatchJobConsumer.class);

    private final MatchingOrchestrator orchestrator;
    private final MatchResultSink resultSink;

    public MatchJobConsumer(MatchingOrchestrator orchestrator, MatchResultSink resultSink) {
        this.orchestrator = orchestrator;
        this.resultSink = resultSink;
    }

    @KafkaListener(topics = "${matching.jobs.topic:trip-match-jobs}", groupId = "trip-matcher")
    public void consumeMatchJob(
            @Payload String payload,
            @Header(name = KafkaHeaders.RECEIVED_KEY, required = false) String key) {
        String tripId = key != null && !key.isBlank() ? key : payload;
        if (tripId == null || tripId.isBlank()) {
            logger.error("Match job without trip id, key={}, payload={}", key, payload);
            return;
        }
        logger.info("Received match job for trip {}", tripId);

        MatchResult result;
        try {
            result = orchestrator.findMatches(tripId.trim());
        } catch (TripNotFoundException e) {
            logger.warn("Dropping match job: {}", e.getMessage());
            return;
        }
        resultSink.accept(result);
    }
}

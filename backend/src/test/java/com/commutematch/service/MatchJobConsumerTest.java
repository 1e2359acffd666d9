package com.commutematch.service;

import com.commutematch.matching.MatchResultSink;
import com.commutematch.matching.MatchingOrchestrator;
import com.commutematch.matching.exception.IndexUnavailableException;
import com.commutematch.matching.exception.TripNotFoundException;
import com.commutematch.matching.model.MatchCandidate;
import com.commutematch.matching.model.MatchResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class MatchJobConsumerTest {

    @Mock
    private MatchingOrchestrator orchestrator;

    @Mock
    private MatchResultSink resultSink;

    @InjectMocks
    private MatchJobConsumer consumer;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    void resultIsHandedToSink() {
        MatchResult result = new MatchResult("t1",
                List.of(new MatchCandidate("t2", 0.9, 1, 1, 0.8, 0.5, Duration.ofMinutes(5))),
                Instant.parse("2026-03-02T08:00:00Z"));
        when(orchestrator.findMatches("t1")).thenReturn(result);

        consumer.consumeMatchJob("t1", "t1");

        verify(resultSink).accept(result);
    }

    @Test
    void emptyResultIsStillRecorded() {
        MatchResult empty = MatchResult.empty("t1", Instant.parse("2026-03-02T08:00:00Z"));
        when(orchestrator.findMatches("t1")).thenReturn(empty);

        consumer.consumeMatchJob("t1", "t1");

        verify(resultSink).accept(empty);
    }

    @Test
    void payloadIsUsedWhenKeyMissing() {
        when(orchestrator.findMatches("t9")).thenReturn(MatchResult.empty("t9", Instant.EPOCH));

        consumer.consumeMatchJob("t9", null);

        verify(orchestrator).findMatches("t9");
    }

    @Test
    void missingTripIsDropped() {
        when(orchestrator.findMatches("gone")).thenThrow(new TripNotFoundException("gone"));

        assertDoesNotThrow(() -> consumer.consumeMatchJob("gone", "gone"));
        verify(resultSink, never()).accept(any());
    }

    @Test
    void unavailableIndexIsRethrownForRedelivery() {
        when(orchestrator.findMatches("t1")).thenThrow(new IndexUnavailableException("redis down"));

        assertThrows(IndexUnavailableException.class, () -> consumer.consumeMatchJob("t1", "t1"));
        verify(resultSink, never()).accept(any());
    }

    @Test
    void blankJobIsIgnored() {
        consumer.consumeMatchJob(" ", null);

        verifyNoInteractions(orchestrator, resultSink);
    }
}

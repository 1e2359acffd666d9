package com.commutematch.config;

import com.commutematch.matching.CandidateRetriever;
import com.commutematch.matching.MatchingOrchestrator;
import com.commutematch.matching.MatchingSettings;
import com.commutematch.matching.OverlapScorer;
import com.commutematch.matching.PolylineSampler;
import com.commutematch.matching.Ranker;
import com.commutematch.matching.ScoreWeights;
import com.commutematch.matching.TripStore;
import com.commutematch.matching.index.H3SpatialIndex;
import com.commutematch.matching.index.RedisGeoSpatialIndex;
import com.commutematch.matching.index.SpatialIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the matching engine from {@code matching.*} properties. Invalid score weights fail startup.
 */
@Configuration
public class MatchingConfig {

    private static final Logger logger = LoggerFactory.getLogger(MatchingConfig.class);

    @Value("${matching.sample-interval-meters:150}")
    private double sampleIntervalMeters;

    @Value("${matching.match-radius-meters:200}")
    private double matchRadiusMeters;

    @Value("${matching.time-window-minutes:15}")
    private long timeWindowMinutes;

    @Value("${matching.max-start-distance-meters:1000}")
    private double maxStartDistanceMeters;

    @Value("${matching.max-end-distance-meters:1000}")
    private double maxEndDistanceMeters;

    @Value("${matching.result-limit:5}")
    private int resultLimit;

    @Value("${matching.query-timeout-ms:5000}")
    private long queryTimeoutMs;

    // 0 means one thread per available processor
    @Value("${matching.concurrency:0}")
    private int concurrency;

    @Bean
    public PolylineSampler polylineSampler() {
        return new PolylineSampler(sampleIntervalMeters);
    }

    @Bean
    public ScoreWeights scoreWeights(@Value("${matching.weights.overlap:0.5}") double overlap,
                                     @Value("${matching.weights.start-proximity:0.2}") double startProximity,
                                     @Value("${matching.weights.end-proximity:0.2}") double endProximity,
                                     @Value("${matching.weights.time-delta:0.1}") double timeDelta) {
        ScoreWeights weights = new ScoreWeights(overlap, startProximity, endProximity, timeDelta);
        logger.info("Match score weights: {}", weights);
        return weights;
    }

    @Bean
    public MatchingSettings matchingSettings() {
        return new MatchingSettings(matchRadiusMeters, Duration.ofMinutes(timeWindowMinutes), resultLimit);
    }

    @Bean
    public OverlapScorer overlapScorer(ScoreWeights weights, MatchingSettings settings) {
        return new OverlapScorer(weights, settings.radiusMeters(), maxStartDistanceMeters,
                maxEndDistanceMeters, settings.timeWindow());
    }

    @Bean
    public Ranker ranker() {
        return new Ranker();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService matchingExecutor() {
        int threads = effectiveConcurrency();
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread t = new Thread(runnable, "matching-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        logger.info("Matching executor started with {} threads", threads);
        return Executors.newFixedThreadPool(threads, factory);
    }

    @Bean
    @ConditionalOnProperty(name = "matching.index.type", havingValue = "redis", matchIfMissing = true)
    public SpatialIndex redisSpatialIndex(StringRedisTemplate redisTemplate,
                                          @Value("${matching.index.redis-key:trip-samples}") String geoKey) {
        return new RedisGeoSpatialIndex(redisTemplate, geoKey);
    }

    @Bean
    @ConditionalOnProperty(name = "matching.index.type", havingValue = "memory")
    public SpatialIndex h3SpatialIndex(@Value("${matching.index.h3-resolution:9}") int resolution) throws IOException {
        return new H3SpatialIndex(resolution);
    }

    @Bean
    public CandidateRetriever candidateRetriever(SpatialIndex spatialIndex, TripStore tripStore,
                                                 ExecutorService matchingExecutor) {
        return new CandidateRetriever(spatialIndex, tripStore, matchingExecutor, Duration.ofMillis(queryTimeoutMs));
    }

    @Bean
    public MatchingOrchestrator matchingOrchestrator(TripStore tripStore,
                                                     CandidateRetriever candidateRetriever,
                                                     OverlapScorer overlapScorer,
                                                     Ranker ranker,
                                                     MatchingSettings settings,
                                                     ExecutorService matchingExecutor,
                                                     Clock clock) {
        return new MatchingOrchestrator(tripStore, candidateRetriever, overlapScorer, ranker, settings,
                matchingExecutor, effectiveConcurrency(), clock);
    }

    private int effectiveConcurrency() {
        return concurrency > 0 ? concurrency : Runtime.getRuntime().availableProcessors();
    }
}

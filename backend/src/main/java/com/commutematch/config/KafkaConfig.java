package com.commutematch.config;

import com.commutematch.matching.exception.MatchingException;
import org.apache.kafka.clients.admin.NewTopic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.ExponentialBackOff;
import org.springframework.util.backoff.FixedBackOff;

/**
 * Match job topic and redelivery policy. Spring Boot wires the error handler bean into the
 * listener container factory.
 */
@Configuration
public class KafkaConfig {

    private static final Logger logger = LoggerFactory.getLogger(KafkaConfig.class);

    @Bean
    public NewTopic matchJobsTopic(@Value("${matching.jobs.topic:trip-match-jobs}") String topic,
                                   @Value("${matching.jobs.partitions:3}") int partitions) {
        return TopicBuilder.name(topic).partitions(partitions).replicas(1).build();
    }

    @Bean
    public DefaultErrorHandler matchJobErrorHandler(
            @Value("${matching.jobs.retry.initial-interval-ms:1000}") long initialIntervalMs,
            @Value("${matching.jobs.retry.max-elapsed-ms:60000}") long maxElapsedMs) {
        ExponentialBackOff backOff = new ExponentialBackOff(initialIntervalMs, 2.0);
        backOff.setMaxElapsedTime(maxElapsedMs);
        DefaultErrorHandler handler = new DefaultErrorHandler(
                (record, e) -> logger.error("Giving up on match job key={} after retries: {}",
                        record.key(), e.getMessage()),
                backOff);
        // Null falls back to the exponential back-off.
        handler.setBackOffFunction((record, e) -> isRetryable(e) ? null : new FixedBackOff(0L, 0L));
        return handler;
    }

    /**
     * Walks the cause chain for a {@link MatchingException}; anything else is retried.
     */
    static boolean isRetryable(Throwable failure) {
        Throwable current = failure;
        while (current != null) {
            if (current instanceof MatchingException) {
                return ((MatchingException) current).isRetryable();
            }
            current = current.getCause();
        }
        return true;
    }
}

package com.commutematch.matching.index;

import com.commutematch.matching.exception.IndexUnavailableException;
import com.commutematch.matching.model.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.geo.Circle;
import org.springframework.data.geo.Distance;
import org.springframework.data.geo.GeoResult;
import org.springframework.data.geo.GeoResults;
import org.springframework.data.geo.Point;
import org.springframework.data.redis.connection.RedisGeoCommands;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Spatial index on a Redis GEO set.
 * <p>
 * Every sampled point is a member {@code <tripId>#<sampleIndex>} of one GEO key; a companion
 * set per trip remembers its members so they can be dropped together.
 */
public class RedisGeoSpatialIndex implements SpatialIndex {

    private static final Logger logger = LoggerFactory.getLogger(RedisGeoSpatialIndex.class);

    public static final String DEFAULT_GEO_KEY = "trip-samples";
    private static final char MEMBER_SEPARATOR = '#';

    private final StringRedisTemplate redisTemplate;
    private final String geoKey;

    public RedisGeoSpatialIndex(StringRedisTemplate redisTemplate) {
        this(redisTemplate, DEFAULT_GEO_KEY);
    }

    public RedisGeoSpatialIndex(StringRedisTemplate redisTemplate, String geoKey) {
        this.redisTemplate = redisTemplate;
        this.geoKey = geoKey;
    }

    @Override
    public Set<IndexHit> queryNear(Coordinate point, double radiusMeters) {
        GeoResults<RedisGeoCommands.GeoLocation<String>> results;
        try {
            results = redisTemplate.opsForGeo().radius(geoKey,
                    new Circle(new Point(point.lon(), point.lat()),
                            new Distance(radiusMeters, RedisGeoCommands.DistanceUnit.METERS)),
                    RedisGeoCommands.GeoRadiusCommandArgs.newGeoRadiusArgs().includeDistance());
        } catch (DataAccessException e) {
            throw new IndexUnavailableException("Redis GEO query failed near " + point, e);
        }

        Map<String, Double> nearest = new HashMap<>();
        if (results != null) {
            for (GeoResult<RedisGeoCommands.GeoLocation<String>> result : results.getContent()) {
                String tripId = tripIdOf(result.getContent().getName());
                double distance = result.getDistance() != null ? result.getDistance().getValue() : 0.0;
                nearest.merge(tripId, distance, Math::min);
            }
        }
        Set<IndexHit> hits = new HashSet<>();
        nearest.forEach((tripId, d) -> hits.add(new IndexHit(tripId, d)));
        return hits;
    }

    @Override
    public void index(String tripId, List<Coordinate> sampledPoints) {
        remove(tripId);
        if (sampledPoints.isEmpty()) {
            return;
        }
        Map<String, Point> members = new HashMap<>();
        for (int i = 0; i < sampledPoints.size(); i++) {
            Coordinate c = sampledPoints.get(i);
            members.put(tripId + MEMBER_SEPARATOR + i, new Point(c.lon(), c.lat()));
        }
        try {
            redisTemplate.opsForGeo().add(geoKey, members);
            redisTemplate.opsForSet().add(membersKey(tripId), members.keySet().toArray(new String[0]));
            logger.info("Indexed {} samples for trip {}", members.size(), tripId);
        } catch (DataAccessException e) {
            throw new IndexUnavailableException("Failed to index trip " + tripId, e);
        }
    }

    @Override
    public void remove(String tripId) {
        try {
            Set<String> members = redisTemplate.opsForSet().members(membersKey(tripId));
            if (members == null || members.isEmpty()) {
                return;
            }
            redisTemplate.opsForGeo().remove(geoKey, members.toArray(new String[0]));
            redisTemplate.delete(membersKey(tripId));
            logger.debug("Removed {} samples of trip {} from {}", members.size(), tripId, geoKey);
        } catch (DataAccessException e) {
            throw new IndexUnavailableException("Failed to remove trip " + tripId + " from index", e);
        }
    }

    private String membersKey(String tripId) {
        return geoKey + ":members:" + tripId;
    }

    static String tripIdOf(String member) {
        int cut = member.lastIndexOf(MEMBER_SEPARATOR);
        return cut < 0 ? member : member.substring(0, cut);
    }
}

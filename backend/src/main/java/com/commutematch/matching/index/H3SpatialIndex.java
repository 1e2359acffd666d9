package com.commutematch.matching.index;

import com.commutematch.matching.GeoUtils;
import com.commutematch.matching.model.Coordinate;
import com.uber.h3core.H3Core;
import com.uber.h3core.LengthUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process index that buckets sampled points into H3 cells.
 * <p>
 * A query scans the k-ring of cells around the query point and keeps samples that are
 * within the radius by great-circle distance.
 */
public class H3SpatialIndex implements SpatialIndex {

    private static final Logger logger = LoggerFactory.getLogger(H3SpatialIndex.class);

    public static final int DEFAULT_RESOLUTION = 9;

    private final H3Core h3;
    private final int resolution;
    private final double edgeLengthMeters;

    // cell -> trip -> samples of that trip inside the cell
    private final Map<Long, Map<String, List<Coordinate>>> cells = new ConcurrentHashMap<>();
    private final Map<String, Set<Long>> cellsByTrip = new ConcurrentHashMap<>();

    public H3SpatialIndex() throws IOException {
        this(DEFAULT_RESOLUTION);
    }

    public H3SpatialIndex(int resolution) throws IOException {
        try {
            this.h3 = H3Core.newInstance();
            logger.info("Successfully initialized H3Core at resolution {}", resolution);
        } catch (IOException e) {
            logger.error("Failed to initialize H3Core: {}", e.getMessage());
            throw e;
        }
        this.resolution = resolution;
        this.edgeLengthMeters = h3.getHexagonEdgeLengthAvg(resolution, LengthUnit.m);
    }

    @Override
    public Set<IndexHit> queryNear(Coordinate point, double radiusMeters) {
        long center = h3.latLngToCell(point.lat(), point.lon(), resolution);
        Map<String, Double> nearest = new HashMap<>();
        for (Long cell : h3.gridDisk(center, ringSize(radiusMeters))) {
            Map<String, List<Coordinate>> trips = cells.get(cell);
            if (trips == null) {
                continue;
            }
            trips.forEach((tripId, samples) -> {
                for (Coordinate sample : samples) {
                    double d = GeoUtils.haversineMeters(point, sample);
                    if (d <= radiusMeters) {
                        nearest.merge(tripId, d, Math::min);
                    }
                }
            });
        }
        Set<IndexHit> hits = new HashSet<>();
        nearest.forEach((tripId, d) -> hits.add(new IndexHit(tripId, d)));
        return hits;
    }

    @Override
    public synchronized void index(String tripId, List<Coordinate> sampledPoints) {
        remove(tripId);
        Map<Long, List<Coordinate>> grouped = new HashMap<>();
        for (Coordinate sample : sampledPoints) {
            long cell = h3.latLngToCell(sample.lat(), sample.lon(), resolution);
            grouped.computeIfAbsent(cell, c -> new ArrayList<>()).add(sample);
        }
        grouped.forEach((cell, samples) ->
                cells.computeIfAbsent(cell, c -> new ConcurrentHashMap<>()).put(tripId, List.copyOf(samples)));
        cellsByTrip.put(tripId, Set.copyOf(grouped.keySet()));
        logger.debug("Indexed trip {} into {} cells", tripId, grouped.size());
    }

    @Override
    public synchronized void remove(String tripId) {
        Set<Long> owned = cellsByTrip.remove(tripId);
        if (owned == null) {
            return;
        }
        for (Long cell : owned) {
            cells.computeIfPresent(cell, (c, trips) -> {
                trips.remove(tripId);
                return trips.isEmpty() ? null : trips;
            });
        }
    }

    public int size() {
        return cellsByTrip.size();
    }

    /**
     * Number of rings to scan so that every cell holding a sample within the radius is visited.
     * Ring k+1 centres sit at least 1.5 edge lengths further out than ring k.
     */
    int ringSize(double radiusMeters) {
        return (int) Math.ceil((radiusMeters + 2 * edgeLengthMeters) / (1.5 * edgeLengthMeters)) + 1;
    }
}

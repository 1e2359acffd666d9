package com.commutematch.matching.index;

import com.commutematch.matching.GeoUtils;
import com.commutematch.matching.model.Coordinate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class H3SpatialIndexTest {

    private static final Coordinate MG_ROAD = new Coordinate(12.9756, 77.6066);

    private H3SpatialIndex index;

    @BeforeEach
    void setUp() throws IOException {
        index = new H3SpatialIndex();
    }

    private static Coordinate north(Coordinate from, double meters) {
        return new Coordinate(from.lat() + Math.toDegrees(meters / GeoUtils.EARTH_RADIUS_METERS), from.lon());
    }

    @Test
    void findsTripWithSampleInsideRadius() {
        index.index("t1", List.of(north(MG_ROAD, 150), north(MG_ROAD, 600)));

        Set<IndexHit> hits = index.queryNear(MG_ROAD, 200);

        assertEquals(1, hits.size());
        IndexHit hit = hits.iterator().next();
        assertEquals("t1", hit.tripId());
        assertEquals(150.0, hit.matchedSampleDistance(), 0.01);
    }

    @Test
    void radiusIsRespected() {
        index.index("t1", List.of(north(MG_ROAD, 150)));

        assertTrue(index.queryNear(MG_ROAD, 100).isEmpty());
        assertEquals(1, index.queryNear(MG_ROAD, 200).size());
    }

    @Test
    void reportsNearestSamplePerTrip() {
        index.index("t1", List.of(north(MG_ROAD, 180), north(MG_ROAD, 40), north(MG_ROAD, 120)));

        Set<IndexHit> hits = index.queryNear(MG_ROAD, 200);

        assertEquals(1, hits.size());
        assertEquals(40.0, hits.iterator().next().matchedSampleDistance(), 0.01);
    }

    @Test
    void largeRadiusReachesAcrossManyCells() {
        index.index("far", List.of(north(MG_ROAD, 1900)));

        assertEquals(1, index.queryNear(MG_ROAD, 2000).size());
        assertTrue(index.queryNear(MG_ROAD, 1800).isEmpty());
    }

    @Test
    void reindexReplacesPreviousSamples() {
        index.index("t1", List.of(MG_ROAD));
        index.index("t1", List.of(north(MG_ROAD, 5000)));

        assertTrue(index.queryNear(MG_ROAD, 200).isEmpty());
        assertEquals(1, index.queryNear(north(MG_ROAD, 5000), 200).size());
        assertEquals(1, index.size());
    }

    @Test
    void removeDropsTrip() {
        index.index("t1", List.of(MG_ROAD));
        index.index("t2", List.of(north(MG_ROAD, 50)));

        index.remove("t1");
        index.remove("unknown");

        Set<IndexHit> hits = index.queryNear(MG_ROAD, 200);
        assertEquals(1, hits.size());
        assertEquals("t2", hits.iterator().next().tripId());
    }
}

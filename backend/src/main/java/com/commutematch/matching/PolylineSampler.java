package com.commutematch.matching;

import com.commutematch.matching.exception.InvalidGeometryException;
import com.commutematch.matching.model.Coordinate;

import java.util.ArrayList;
import java.util.List;

/**
 * Reduces a route polyline to points spaced at a fixed arc length.
 * <p>
 * The first and last polyline points are always kept, so a straight route of length
 * {@code L} sampled every {@code I} metres yields {@code ceil(L / I) + 1} points.
 */
public class PolylineSampler {

    public static final double DEFAULT_INTERVAL_METERS = 150;

    // Absorbs rounding when the route length is an exact multiple of the interval.
    private static final double CROSSING_EPSILON_METERS = 1e-6;
    private static final double TAIL_TOLERANCE_METERS = 1e-3;

    private final double defaultIntervalMeters;

    public PolylineSampler() {
        this(DEFAULT_INTERVAL_METERS);
    }

    public PolylineSampler(double defaultIntervalMeters) {
        requirePositive(defaultIntervalMeters);
        this.defaultIntervalMeters = defaultIntervalMeters;
    }

    public double getDefaultIntervalMeters() {
        return defaultIntervalMeters;
    }

    public List<Coordinate> sample(List<Coordinate> polyline) {
        return sample(polyline, defaultIntervalMeters);
    }

    public List<Coordinate> sample(List<Coordinate> polyline, double intervalMeters) {
        requirePositive(intervalMeters);
        validate(polyline);
        if (polyline.size() <= 1) {
            return List.copyOf(polyline);
        }

        List<Coordinate> samples = new ArrayList<>();
        samples.add(polyline.get(0));

        double travelled = 0;
        double nextMark = intervalMeters;
        double lastMark = 0;
        for (int i = 1; i < polyline.size(); i++) {
            Coordinate from = polyline.get(i - 1);
            Coordinate to = polyline.get(i);
            double segment = GeoUtils.haversineMeters(from, to);
            if (segment == 0) {
                continue;
            }
            while (travelled + segment >= nextMark - CROSSING_EPSILON_METERS) {
                double fraction = Math.min(1.0, Math.max(0.0, (nextMark - travelled) / segment));
                samples.add(GeoUtils.interpolate(from, to, fraction));
                lastMark = nextMark;
                nextMark += intervalMeters;
            }
            travelled += segment;
        }

        Coordinate last = polyline.get(polyline.size() - 1);
        int tail = samples.size() - 1;
        if (tail > 0 && Math.abs(travelled - lastMark) <= TAIL_TOLERANCE_METERS) {
            samples.set(tail, last);
        } else {
            samples.add(last);
        }
        return List.copyOf(samples);
    }

    private static void validate(List<Coordinate> polyline) {
        if (polyline == null) {
            throw new InvalidGeometryException("Polyline is required");
        }
        for (int i = 0; i < polyline.size(); i++) {
            Coordinate c = polyline.get(i);
            if (c == null || !c.isValid()) {
                throw InvalidGeometryException.outOfRange(c, i);
            }
        }
    }

    private static void requirePositive(double intervalMeters) {
        if (!(intervalMeters > 0) || Double.isInfinite(intervalMeters)) {
            throw new IllegalArgumentException("Sampling interval must be positive: " + intervalMeters);
        }
    }
}

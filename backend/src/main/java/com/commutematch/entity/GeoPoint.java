package com.commutematch.entity;

import com.commutematch.matching.model.Coordinate;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class GeoPoint {

    @Column(name = "lat", nullable = false)
    private double lat;

    @Column(name = "lon", nullable = false)
    private double lon;

    protected GeoPoint() {
    }

    public GeoPoint(double lat, double lon) {
        this.lat = lat;
        this.lon = lon;
    }

    public static GeoPoint from(Coordinate coordinate) {
        return new GeoPoint(coordinate.lat(), coordinate.lon());
    }

    public Coordinate toCoordinate() {
        return new Coordinate(lat, lon);
    }

    public double getLat() { return lat; }
    public double getLon() { return lon; }
}

package com.commutematch.dto;

import com.commutematch.matching.model.Coordinate;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.List;

public class CreateTripRequest {
    @NotBlank
    private String userId;
    @NotNull @DecimalMin("-90") @DecimalMax("90")
    private Double originLat;
    @NotNull @DecimalMin("-180") @DecimalMax("180")
    private Double originLon;
    @NotNull @DecimalMin("-90") @DecimalMax("90")
    private Double destinationLat;
    @NotNull @DecimalMin("-180") @DecimalMax("180")
    private Double destinationLon;
    @NotNull
    private Instant departTime;
    // Optional; fetched from the directions provider when absent.
    private List<Coordinate> polyline;

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }
    public Double getOriginLat() { return originLat; }
    public void setOriginLat(Double originLat) { this.originLat = originLat; }
    public Double getOriginLon() { return originLon; }
    public void setOriginLon(Double originLon) { this.originLon = originLon; }
    public Double getDestinationLat() { return destinationLat; }
    public void setDestinationLat(Double destinationLat) { this.destinationLat = destinationLat; }
    public Double getDestinationLon() { return destinationLon; }
    public void setDestinationLon(Double destinationLon) { this.destinationLon = destinationLon; }
    public Instant getDepartTime() { return departTime; }
    public void setDepartTime(Instant departTime) { this.departTime = departTime; }
    public List<Coordinate> getPolyline() { return polyline; }
    public void setPolyline(List<Coordinate> polyline) { this.polyline = polyline; }
}

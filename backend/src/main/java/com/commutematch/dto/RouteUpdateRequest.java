package com.commutematch.dto;

import com.commutematch.matching.model.Coordinate;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public class RouteUpdateRequest {
    @NotEmpty
    private List<Coordinate> polyline;

    public List<Coordinate> getPolyline() { return polyline; }
    public void setPolyline(List<Coordinate> polyline) { this.polyline = polyline; }
}

package com.commutematch.service;

import com.commutematch.matching.model.Coordinate;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Fetches route geometry from an OSRM-compatible directions service.
 */
@Service
public class DirectionsClient {

    private static final Logger logger = LoggerFactory.getLogger(DirectionsClient.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String directionsUrl;

    public DirectionsClient(RestTemplate restTemplate,
                            ObjectMapper objectMapper,
                            @Value("${directions.url:http://router.project-osrm.org/route/v1/driving}") String directionsUrl) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.directionsUrl = directionsUrl;
    }

    /**
     * Route from origin to destination, or the straight line between them when the provider
     * has no usable answer.
     */
    public List<Coordinate> fetchRoute(Coordinate origin, Coordinate destination) {
        // OSRM expects lon,lat;lon,lat
        String coords = String.format(Locale.US, "%f,%f;%f,%f",
                origin.lon(), origin.lat(), destination.lon(), destination.lat());
        String url = directionsUrl + "/" + coords + "?overview=full&geometries=geojson&steps=false&alternatives=false";

        try {
            String response = restTemplate.getForObject(url, String.class);
            List<Coordinate> points = parseGeoJsonRoute(response);
            if (points.size() >= 2) {
                logger.info("Fetched {} route points for coords={}", points.size(), coords);
                return points;
            }
            logger.warn("No usable route geometry for coords={}, falling back to straight line", coords);
        } catch (RestClientException | IOException e) {
            logger.warn("Route fetch failed for coords={}: {}", coords, e.getMessage());
        }
        return List.of(origin, destination);
    }

    List<Coordinate> parseGeoJsonRoute(String response) throws IOException {
        if (response == null) {
            return List.of();
        }
        JsonNode routes = objectMapper.readTree(response).get("routes");
        if (routes == null || !routes.isArray() || routes.isEmpty()) {
            return List.of();
        }
        JsonNode coordinates = routes.get(0).path("geometry").path("coordinates");
        if (!coordinates.isArray()) {
            return List.of();
        }
        List<Coordinate> points = new ArrayList<>(coordinates.size());
        for (JsonNode c : coordinates) {
            if (c.size() < 2) continue;
            points.add(new Coordinate(c.get(1).asDouble(), c.get(0).asDouble()));
        }
        return points;
    }
}

package com.riansoft.route_planner.util;

import com.riansoft.route_planner.model.GeoPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GeoUtilsTest {

    private static final GeoPoint STUTTGART = new GeoPoint(48.7758, 9.1829);
    private static final GeoPoint MUNICH = new GeoPoint(48.1351, 11.5820);

    @Test
    @DisplayName("Stuttgart to Munich is roughly 190 km as the crow flies")
    void haversineKnownDistance() {
        double km = GeoUtils.haversineKm(STUTTGART, MUNICH);
        assertTrue(km > 185 && km < 195, "got " + km);
        assertEquals(GeoUtils.haversineMeters(STUTTGART, MUNICH), GeoUtils.haversineMeters(MUNICH, STUTTGART), 1e-6);
        assertEquals(0.0, GeoUtils.haversineMeters(STUTTGART, STUTTGART), 1e-9);
    }

    @Test
    @DisplayName("destination lands at the requested distance")
    void destinationDistance() {
        GeoPoint east = GeoUtils.destination(STUTTGART, 90, 500);
        assertEquals(500, GeoUtils.haversineMeters(STUTTGART, east), 0.5);
        assertTrue(east.lon > STUTTGART.lon);
    }

    @Test
    @DisplayName("circle starts due north and keeps every point on the radius")
    void circlePoints() {
        List<GeoPoint> circle = GeoUtils.circle(STUTTGART, 500, 8);
        assertEquals(8, circle.size());
        assertTrue(circle.get(0).lat > STUTTGART.lat);
        assertEquals(STUTTGART.lon, circle.get(0).lon, 1e-9);
        for (GeoPoint point : circle) {
            assertEquals(500, GeoUtils.haversineMeters(STUTTGART, point), 0.5);
        }
    }

    @Test
    @DisplayName("centroid and rounding")
    void centroidAndRound() {
        GeoPoint centre = GeoUtils.centroid(List.of(new GeoPoint(48.0, 9.0), new GeoPoint(49.0, 10.0)));
        assertEquals(48.5, centre.lat, 1e-9);
        assertEquals(9.5, centre.lon, 1e-9);
        assertEquals(48.7833, GeoUtils.round(48.78334, 4), 1e-12);
    }
}

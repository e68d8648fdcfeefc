package com.riansoft.route_planner.util;

import com.riansoft.route_planner.model.GeoPoint;

import java.util.ArrayList;
import java.util.List;

public final class GeoUtils {

    public static final double EARTH_RADIUS_METERS = 6_371_000.0;

    private GeoUtils() {
    }

    /**
     * Great-circle distance between two points in meters (haversine formula).
     */
    public static double haversineMeters(GeoPoint a, GeoPoint b) {
        return haversineMeters(a.lat, a.lon, b.lat, b.lon);
    }

    public static double haversineMeters(double lat1, double lon1, double lat2, double lon2) {
        double latDistance = Math.toRadians(lat2 - lat1);
        double lonDistance = Math.toRadians(lon2 - lon1);
        double a = Math.sin(latDistance / 2) * Math.sin(latDistance / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(lonDistance / 2) * Math.sin(lonDistance / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_METERS * c;
    }

    public static double haversineKm(GeoPoint a, GeoPoint b) {
        return haversineMeters(a, b) / 1000.0;
    }

    /**
     * Point reached by travelling {@code distanceMeters} from {@code origin} on the given bearing (degrees from north).
     */
    public static GeoPoint destination(GeoPoint origin, double bearingDegrees, double distanceMeters) {
        double angular = distanceMeters / EARTH_RADIUS_METERS;
        double bearing = Math.toRadians(bearingDegrees);
        double lat1 = Math.toRadians(origin.lat);
        double lon1 = Math.toRadians(origin.lon);
        double lat2 = Math.asin(Math.sin(lat1) * Math.cos(angular)
                + Math.cos(lat1) * Math.sin(angular) * Math.cos(bearing));
        double lon2 = lon1 + Math.atan2(Math.sin(bearing) * Math.sin(angular) * Math.cos(lat1),
                Math.cos(angular) - Math.sin(lat1) * Math.sin(lat2));
        double lon = (Math.toDegrees(lon2) + 540.0) % 360.0 - 180.0;
        return new GeoPoint(Math.toDegrees(lat2), lon);
    }

    /**
     * {@code count} points evenly spaced on a circle around {@code center}, starting due north.
     */
    public static List<GeoPoint> circle(GeoPoint center, double radiusMeters, int count) {
        List<GeoPoint> points = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            points.add(destination(center, 360.0 * i / count, radiusMeters));
        }
        return points;
    }

    /** Arithmetic mean of the coordinates. Fine for city-sized groups away from the antimeridian. */
    public static GeoPoint centroid(List<GeoPoint> points) {
        double lat = 0;
        double lon = 0;
        for (GeoPoint point : points) {
            lat += point.lat;
            lon += point.lon;
        }
        return new GeoPoint(lat / points.size(), lon / points.size());
    }

    public static double round(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.round(value * scale) / scale;
    }
}

package com.riansoft.route_planner.dto;

import com.riansoft.route_planner.model.GeoPoint;

// Map front ends read longitude as "lng", so the geometry is exposed that way
public class LatLngDto {
    private double lat;
    private double lng;

    public LatLngDto() {}

    public LatLngDto(double lat, double lng) {
        this.lat = lat;
        this.lng = lng;
    }

    public static LatLngDto of(GeoPoint point) {
        return new LatLngDto(point.lat, point.lon);
    }

    public double getLat() { return lat; }
    public void setLat(double lat) { this.lat = lat; }
    public double getLng() { return lng; }
    public void setLng(double lng) { this.lng = lng; }
}

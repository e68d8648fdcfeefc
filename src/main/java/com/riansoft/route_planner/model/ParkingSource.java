package com.riansoft.route_planner.model;

public enum ParkingSource {
    CACHED("cached"),
    LIVE_POI("live-poi"),
    SYNTHETIC_ROAD_SNAP("synthetic-road-snap");

    private final String tag;

    ParkingSource(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}

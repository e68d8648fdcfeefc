package com.riansoft.route_planner.model;

public enum DistanceProvenance {
    ROAD_NETWORK("road-network"),
    GREAT_CIRCLE_ESTIMATE("great-circle-estimate");

    private final String tag;

    DistanceProvenance(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}

package com.riansoft.route_planner.model;

public enum WaypointKind {
    DEPOT,
    PARKING,
    DELIVERY
}

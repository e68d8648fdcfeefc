package com.riansoft.route_planner.model;

public enum AssignmentStrategy {
    BALANCED,
    SEQUENTIAL
}

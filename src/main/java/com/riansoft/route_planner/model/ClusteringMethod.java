package com.riansoft.route_planner.model;

public enum ClusteringMethod {
    /** Radius based density expansion, cluster count follows the data. */
    DENSITY,
    /** Iterative centroid assignment with a fixed cluster count. */
    CENTROID
}

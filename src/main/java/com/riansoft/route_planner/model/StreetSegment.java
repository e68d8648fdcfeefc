package com.riansoft.route_planner.model;

import java.util.Collections;
import java.util.List;

/**
 * A street way carrying a parking tag, as downloaded from the map-data service.
 */
public class StreetSegment {
    public final long wayId;
    public final String name;
    public final String address;
    public final List<GeoPoint> geometry;

    public StreetSegment(long wayId, String name, String address, List<GeoPoint> geometry) {
        this.wayId = wayId;
        this.name = name;
        this.address = address;
        this.geometry = Collections.unmodifiableList(geometry);
    }
}

package com.riansoft.route_planner.model;

import java.util.Objects;

/**
 * A depot, delivery or parking point. The sequencer treats all three the same way.
 */
public class Stop {
    public final String id;
    public final GeoPoint point;
    public final String name;
    public final String address;

    public Stop(String id, GeoPoint point) {
        this(id, point, null, null);
    }

    public Stop(String id, GeoPoint point, String name, String address) {
        this.id = Objects.requireNonNull(id, "id");
        this.point = point;
        this.name = name;
        this.address = address;
    }

    public boolean hasLocation() {
        return point != null && point.isValid();
    }

    @Override
    public String toString() {
        return name != null ? id + " '" + name + "' " + point : id + " " + point;
    }
}

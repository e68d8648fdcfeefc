package com.riansoft.route_planner.model;

public class Driver {
    public final long id;
    public final String name;
    public final boolean available;

    public Driver(long id, String name) {
        this(id, name, true);
    }

    public Driver(long id, String name, boolean available) {
        this.id = id;
        this.name = name;
        this.available = available;
    }
}

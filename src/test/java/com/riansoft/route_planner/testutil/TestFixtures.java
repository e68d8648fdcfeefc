package com.riansoft.route_planner.testutil;

import com.riansoft.route_planner.cache.AvailabilityProbe;
import com.riansoft.route_planner.config.RoutePlannerProperties;
import com.riansoft.route_planner.model.GeoPoint;
import com.riansoft.route_planner.model.Stop;
import com.riansoft.route_planner.service.distance.DistanceService;
import com.riansoft.route_planner.util.GeoUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

public final class TestFixtures {

    /** Stuttgart city centre. */
    public static final GeoPoint DEPOT = new GeoPoint(48.7833, 9.1817);

    private TestFixtures() {
    }

    /** Defaults, with the native solver switched off so tests stay deterministic and fast. */
    public static RoutePlannerProperties properties() {
        RoutePlannerProperties properties = new RoutePlannerProperties();
        properties.getSequencing().setExactSolverEnabled(false);
        return properties;
    }

    public static Clock fixedClock() {
        return new MutableClock(Instant.parse("2024-05-01T08:00:00Z"));
    }

    public static DistanceService distanceService(FakeRoadNetworkClient client) {
        return new DistanceService(client, new AvailabilityProbe(Duration.ofSeconds(30), fixedClock()), properties());
    }

    public static Stop stop(String id, double lat, double lon) {
        return new Stop(id, new GeoPoint(lat, lon), "Stop " + id, null);
    }

    public static Stop depot() {
        return new Stop("depot", DEPOT, "Depot", "Stuttgart");
    }

    /** Point {@code km} kilometres from {@code origin} on {@code bearing}. */
    public static GeoPoint offset(GeoPoint origin, double bearing, double km) {
        return GeoUtils.destination(origin, bearing, km * 1000.0);
    }
}

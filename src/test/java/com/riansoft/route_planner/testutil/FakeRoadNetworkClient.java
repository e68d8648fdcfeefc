package com.riansoft.route_planner.testutil;

import com.riansoft.route_planner.model.DistanceMatrix;
import com.riansoft.route_planner.model.DistanceProvenance;
import com.riansoft.route_planner.model.GeoPoint;
import com.riansoft.route_planner.model.RoadRoute;
import com.riansoft.route_planner.model.TravelCost;
import com.riansoft.route_planner.model.TurnInstruction;
import com.riansoft.route_planner.service.distance.RoadNetworkClient;
import com.riansoft.route_planner.util.GeoUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory routing service. When "up" it answers with haversine distances stretched by 1.2
 * (so answers are distinguishable from estimates) at 36 km/h; when "down" every call behaves like a timeout.
 */
public class FakeRoadNetworkClient implements RoadNetworkClient {

    public static final double DETOUR_FACTOR = 1.2;

    private volatile boolean up;
    private volatile boolean probeAnswer;
    private volatile GeoPoint snapOffset;
    public final AtomicInteger tableCalls = new AtomicInteger();
    public final AtomicInteger probeCalls = new AtomicInteger();
    public final AtomicInteger nearestCalls = new AtomicInteger();

    private FakeRoadNetworkClient(boolean up) {
        this.up = up;
        this.probeAnswer = up;
    }

    public static FakeRoadNetworkClient up() {
        return new FakeRoadNetworkClient(true);
    }

    public static FakeRoadNetworkClient down() {
        return new FakeRoadNetworkClient(false);
    }

    public void setUp(boolean up) {
        this.up = up;
        this.probeAnswer = up;
    }

    /** Lets the probe disagree with the real calls. */
    public void setProbeAnswer(boolean probeAnswer) {
        this.probeAnswer = probeAnswer;
    }

    /** Snapped points are moved by this lat/lon delta. */
    public void setSnapOffset(GeoPoint snapOffset) {
        this.snapOffset = snapOffset;
    }

    @Override
    public boolean probe() {
        probeCalls.incrementAndGet();
        return probeAnswer;
    }

    @Override
    public Optional<TravelCost> route(GeoPoint from, GeoPoint to) {
        if (!up) {
            return Optional.empty();
        }
        return Optional.of(cost(from, to));
    }

    @Override
    public Optional<RoadRoute> route(List<GeoPoint> points) {
        if (!up || points.size() < 2) {
            return Optional.empty();
        }
        List<TravelCost> legs = new ArrayList<>();
        double distance = 0;
        double duration = 0;
        for (int i = 0; i + 1 < points.size(); i++) {
            TravelCost leg = cost(points.get(i), points.get(i + 1));
            legs.add(leg);
            distance += leg.distanceMeters;
            duration += leg.durationSeconds;
        }
        return Optional.of(new RoadRoute(distance, duration, legs, new ArrayList<>(points),
                DistanceProvenance.ROAD_NETWORK));
    }

    @Override
    public Optional<DistanceMatrix> table(List<GeoPoint> sources, List<GeoPoint> destinations) {
        tableCalls.incrementAndGet();
        if (!up) {
            return Optional.empty();
        }
        double[][] distances = new double[sources.size()][destinations.size()];
        double[][] durations = new double[sources.size()][destinations.size()];
        for (int i = 0; i < sources.size(); i++) {
            for (int j = 0; j < destinations.size(); j++) {
                TravelCost cost = cost(sources.get(i), destinations.get(j));
                distances[i][j] = cost.distanceMeters;
                durations[i][j] = cost.durationSeconds;
            }
        }
        return Optional.of(new DistanceMatrix(distances, durations, DistanceProvenance.ROAD_NETWORK));
    }

    @Override
    public Optional<GeoPoint> nearest(GeoPoint point) {
        nearestCalls.incrementAndGet();
        if (!up) {
            return Optional.empty();
        }
        GeoPoint offset = snapOffset;
        return Optional.of(offset == null ? point : new GeoPoint(point.lat + offset.lat, point.lon + offset.lon));
    }

    @Override
    public Optional<List<TurnInstruction>> directions(GeoPoint from, GeoPoint to) {
        if (!up) {
            return Optional.empty();
        }
        TravelCost cost = cost(from, to);
        return Optional.of(List.of(
                new TurnInstruction("Depart", "", cost.distanceMeters, cost.durationSeconds),
                new TurnInstruction("Arrive at destination", "", 0, 0)));
    }

    private static TravelCost cost(GeoPoint from, GeoPoint to) {
        double meters = GeoUtils.haversineMeters(from, to) * DETOUR_FACTOR;
        return new TravelCost(meters, meters / 10.0, DistanceProvenance.ROAD_NETWORK);
    }
}

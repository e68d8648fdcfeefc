package com.riansoft.route_planner.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Node arena for sequencing one cluster. Node 0 is the depot, node {@code i + 1} is stop {@code i}.
 * {@code nodePoints} holds the point the vehicle actually drives to: the parking point when one
 * was resolved for the stop, the delivery coordinate otherwise.
 */
public class DataModel {
    public final Stop depot;
    public final List<Stop> stops;
    public final List<GeoPoint> nodePoints;
    public final boolean[] parked;
    public final DistanceMatrix matrix;
    public final int depotIndex = 0;

    public DataModel(Stop depot, List<Stop> stops, Map<Integer, ParkingCandidate> parkingByStop, DistanceMatrix matrix) {
        this.depot = depot;
        this.stops = Collections.unmodifiableList(new ArrayList<>(stops));
        this.parked = new boolean[stops.size()];
        List<GeoPoint> points = new ArrayList<>(stops.size() + 1);
        points.add(depot.point);
        for (int i = 0; i < stops.size(); i++) {
            ParkingCandidate parking = parkingByStop == null ? null : parkingByStop.get(i);
            parked[i] = parking != null;
            points.add(parking != null ? parking.point : stops.get(i).point);
        }
        this.nodePoints = Collections.unmodifiableList(points);
        if (matrix != null && (matrix.rows() != points.size() || !matrix.isSquare())) {
            throw new IllegalArgumentException("matrix is " + matrix.rows() + "x" + matrix.cols()
                    + " but model has " + points.size() + " nodes");
        }
        this.matrix = matrix;
    }

    /** Same arena with a distance matrix over {@link #nodePoints}. */
    public DataModel withMatrix(DistanceMatrix matrix) {
        return new DataModel(depot, stops, nodePoints, parked, matrix);
    }

    private DataModel(Stop depot, List<Stop> stops, List<GeoPoint> nodePoints, boolean[] parked, DistanceMatrix matrix) {
        if (matrix.rows() != nodePoints.size() || !matrix.isSquare()) {
            throw new IllegalArgumentException("matrix is " + matrix.rows() + "x" + matrix.cols()
                    + " but model has " + nodePoints.size() + " nodes");
        }
        this.depot = depot;
        this.stops = stops;
        this.nodePoints = nodePoints;
        this.parked = parked;
        this.matrix = matrix;
    }

    public int nodeCount() {
        return nodePoints.size();
    }

    public int stopCount() {
        return stops.size();
    }

    public static int nodeOf(int stopIndex) {
        return stopIndex + 1;
    }

    public static int stopOf(int node) {
        return node - 1;
    }

    /** Total distance of depot -> order... -> depot, where {@code order} holds stop indices. */
    public double tourDistance(List<Integer> order) {
        double total = 0;
        int previous = depotIndex;
        for (int stopIndex : order) {
            int node = nodeOf(stopIndex);
            total += matrix.distance(previous, node);
            previous = node;
        }
        return total + matrix.distance(previous, depotIndex);
    }
}

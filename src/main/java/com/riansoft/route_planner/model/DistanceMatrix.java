package com.riansoft.route_planner.model;

/**
 * Source x destination table of distances (meters) and durations (seconds).
 * Every cell comes from the same provenance; the arrays are copied on the way in and never exposed.
 */
public class DistanceMatrix {
    private final double[][] distances;
    private final double[][] durations;
    private final DistanceProvenance provenance;

    public DistanceMatrix(double[][] distances, double[][] durations, DistanceProvenance provenance) {
        if (distances.length != durations.length) {
            throw new IllegalArgumentException("distance and duration tables differ in row count");
        }
        int cols = distances.length == 0 ? 0 : distances[0].length;
        this.distances = new double[distances.length][];
        this.durations = new double[durations.length][];
        for (int i = 0; i < distances.length; i++) {
            if (distances[i].length != cols || durations[i].length != cols) {
                throw new IllegalArgumentException("ragged matrix row " + i);
            }
            this.distances[i] = distances[i].clone();
            this.durations[i] = durations[i].clone();
        }
        this.provenance = provenance;
    }

    public int rows() {
        return distances.length;
    }

    public int cols() {
        return distances.length == 0 ? 0 : distances[0].length;
    }

    public boolean isSquare() {
        return rows() == cols();
    }

    public double distance(int from, int to) {
        return distances[from][to];
    }

    public double duration(int from, int to) {
        return durations[from][to];
    }

    public TravelCost cost(int from, int to) {
        return new TravelCost(distances[from][to], durations[from][to], provenance);
    }

    public DistanceProvenance provenance() {
        return provenance;
    }
}

package com.riansoft.route_planner.service.clustering;

import com.riansoft.route_planner.config.RoutePlannerProperties;
import com.riansoft.route_planner.model.Cluster;
import com.riansoft.route_planner.model.ClusteringMethod;
import com.riansoft.route_planner.model.DistanceMatrix;
import com.riansoft.route_planner.model.GeoPoint;
import com.riansoft.route_planner.service.distance.DistanceService;
import com.riansoft.route_planner.util.GeoUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Groups orders into driver-sized clusters, either by density or by centroid iteration.
 * Every input index ends up in exactly one cluster and no cluster exceeds the size limit.
 */
@Service
public class ClusteringService {

    private static final Logger log = LoggerFactory.getLogger(ClusteringService.class);

    private final DistanceService distanceService;
    private final RoutePlannerProperties.Clustering config;

    public ClusteringService(DistanceService distanceService, RoutePlannerProperties properties) {
        this.distanceService = distanceService;
        this.config = properties.getClustering();
    }

    public List<Cluster> cluster(List<GeoPoint> points, int maxClusterSize, int minClusterSize, ClusteringMethod method) {
        return cluster(points, maxClusterSize, minClusterSize, method, null);
    }

    /**
     * @param numClusters centroid method only; {@code null} derives it from the size limit
     */
    public List<Cluster> cluster(List<GeoPoint> points, int maxClusterSize, int minClusterSize,
                                 ClusteringMethod method, Integer numClusters) {
        if (maxClusterSize < 1) {
            throw new IllegalArgumentException("maxClusterSize must be at least 1, got " + maxClusterSize);
        }
        int n = points.size();
        if (n == 0) {
            return List.of();
        }
        int minSize = Math.max(1, minClusterSize);

        List<List<Integer>> groups;
        if (n < minSize) {
            log.info("[CLUSTER] {} points below minimum {}, one cluster per point", n, minSize);
            groups = singletons(n);
        } else if (method == ClusteringMethod.CENTROID) {
            int k = numClusters != null && numClusters > 0 ? numClusters : (n + maxClusterSize - 1) / maxClusterSize;
            groups = centroid(points, k);
        } else {
            groups = density(points, config.getRadiusKm() * 1000.0, minSize);
        }

        List<Cluster> clusters = new ArrayList<>();
        for (List<Integer> group : groups) {
            for (List<Integer> chunk : split(group, maxClusterSize)) {
                clusters.add(new Cluster(chunk));
            }
        }
        log.info("[CLUSTER] {} points -> {} clusters ({})", n, clusters.size(),
                method == null ? ClusteringMethod.DENSITY : method);
        return clusters;
    }

    List<List<Integer>> density(List<GeoPoint> points, double radiusMeters, int minClusterSize) {
        DistanceMatrix matrix = distanceService.matrix(points);
        int n = points.size();
        boolean[] visited = new boolean[n];
        boolean[] assigned = new boolean[n];
        List<List<Integer>> clusters = new ArrayList<>();
        List<Integer> noise = new ArrayList<>();

        for (int i = 0; i < n; i++) {
            if (visited[i]) {
                continue;
            }
            visited[i] = true;
            List<Integer> neighbors = neighbors(matrix, i, radiusMeters);
            if (neighbors.size() < minClusterSize - 1) {
                noise.add(i);
                continue;
            }

            List<Integer> cluster = new ArrayList<>();
            cluster.add(i);
            assigned[i] = true;
            Deque<Integer> frontier = new ArrayDeque<>(neighbors);
            while (!frontier.isEmpty()) {
                int j = frontier.poll();
                if (!visited[j]) {
                    visited[j] = true;
                    List<Integer> reach = neighbors(matrix, j, radiusMeters);
                    if (reach.size() >= minClusterSize - 1) {
                        frontier.addAll(reach);
                    }
                }
                if (!assigned[j]) {
                    assigned[j] = true;
                    cluster.add(j);
                }
            }

            if (cluster.size() >= minClusterSize) {
                clusters.add(cluster);
            } else {
                for (int member : cluster) {
                    assigned[member] = false;
                }
                noise.addAll(cluster);
            }
        }

        // a noise point may have been absorbed as a border point later on
        for (int p : noise) {
            if (assigned[p]) {
                continue;
            }
            if (clusters.isEmpty()) {
                List<Integer> single = new ArrayList<>();
                single.add(p);
                clusters.add(single);
                assigned[p] = true;
                continue;
            }
            int nearest = 0;
            double best = Double.POSITIVE_INFINITY;
            for (int c = 0; c < clusters.size(); c++) {
                double total = 0;
                for (int member : clusters.get(c)) {
                    total += matrix.distance(p, member);
                }
                double average = total / clusters.get(c).size();
                if (average < best) {
                    best = average;
                    nearest = c;
                }
            }
            clusters.get(nearest).add(p);
            assigned[p] = true;
        }
        log.debug("[CLUSTER] density: {} clusters, {} noise points folded in", clusters.size(), noise.size());
        return clusters;
    }

    private static List<Integer> neighbors(DistanceMatrix matrix, int i, double radiusMeters) {
        List<Integer> result = new ArrayList<>();
        for (int j = 0; j < matrix.cols(); j++) {
            if (j != i && matrix.distance(i, j) <= radiusMeters) {
                result.add(j);
            }
        }
        return result;
    }

    List<List<Integer>> centroid(List<GeoPoint> points, int k) {
        int n = points.size();
        if (n <= k) {
            return singletons(n);
        }

        List<GeoPoint> centroids = initialCentroids(points, k);
        List<List<Integer>> groups = new ArrayList<>();
        for (int iteration = 0; iteration < config.getMaxIterations(); iteration++) {
            groups = new ArrayList<>();
            for (int c = 0; c < k; c++) {
                groups.add(new ArrayList<>());
            }
            for (int i = 0; i < n; i++) {
                groups.get(nearestCentroid(points.get(i), centroids)).add(i);
            }

            boolean converged = true;
            for (int c = 0; c < k; c++) {
                List<Integer> members = groups.get(c);
                if (members.isEmpty()) {
                    continue;
                }
                List<GeoPoint> located = new ArrayList<>();
                for (int member : members) {
                    located.add(points.get(member));
                }
                GeoPoint moved = GeoUtils.centroid(located);
                if (GeoUtils.haversineMeters(centroids.get(c), moved) > config.getCentroidThresholdMeters()) {
                    converged = false;
                }
                centroids.set(c, moved);
            }
            if (converged) {
                log.debug("[CLUSTER] centroid converged after {} iterations", iteration + 1);
                break;
            }
        }
        groups.removeIf(List::isEmpty);
        return groups;
    }

    /**
     * Farthest-point seeding from point 0, so repeated runs agree.
     */
    private static List<GeoPoint> initialCentroids(List<GeoPoint> points, int k) {
        List<GeoPoint> centroids = new ArrayList<>();
        centroids.add(points.get(0));
        double[] closest = new double[points.size()];
        for (int i = 0; i < points.size(); i++) {
            closest[i] = GeoUtils.haversineMeters(points.get(i), points.get(0));
        }
        while (centroids.size() < k) {
            int farthest = 0;
            for (int i = 1; i < points.size(); i++) {
                if (closest[i] > closest[farthest]) {
                    farthest = i;
                }
            }
            GeoPoint next = points.get(farthest);
            centroids.add(next);
            for (int i = 0; i < points.size(); i++) {
                closest[i] = Math.min(closest[i], GeoUtils.haversineMeters(points.get(i), next));
            }
        }
        return centroids;
    }

    private static int nearestCentroid(GeoPoint point, List<GeoPoint> centroids) {
        int nearest = 0;
        double best = Double.POSITIVE_INFINITY;
        for (int c = 0; c < centroids.size(); c++) {
            double d = GeoUtils.haversineMeters(point, centroids.get(c));
            if (d < best) {
                best = d;
                nearest = c;
            }
        }
        return nearest;
    }

    /**
     * Cuts an oversized group into {@code ceil(n / max)} contiguous chunks whose sizes differ by at most one.
     */
    static List<List<Integer>> split(List<Integer> group, int maxClusterSize) {
        int n = group.size();
        if (n <= maxClusterSize) {
            return List.of(group);
        }
        int parts = (n + maxClusterSize - 1) / maxClusterSize;
        int base = n / parts;
        int remainder = n % parts;
        List<List<Integer>> chunks = new ArrayList<>();
        int from = 0;
        for (int p = 0; p < parts; p++) {
            int to = from + base + (p < remainder ? 1 : 0);
            chunks.add(new ArrayList<>(group.subList(from, to)));
            from = to;
        }
        log.info("[CLUSTER] split cluster of {} into {} chunks", n, parts);
        return chunks;
    }

    private static List<List<Integer>> singletons(int n) {
        List<List<Integer>> groups = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            List<Integer> single = new ArrayList<>();
            single.add(i);
            groups.add(single);
        }
        return groups;
    }
}

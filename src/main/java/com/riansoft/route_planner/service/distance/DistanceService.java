package com.riansoft.route_planner.service.distance;

import com.riansoft.route_planner.cache.AvailabilityProbe;
import com.riansoft.route_planner.config.RoutePlannerProperties;
import com.riansoft.route_planner.model.DistanceMatrix;
import com.riansoft.route_planner.model.GeoPoint;
import com.riansoft.route_planner.model.RoadRoute;
import com.riansoft.route_planner.model.TravelCost;
import com.riansoft.route_planner.model.TurnInstruction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Distance oracle: road-network answers when the routing service cooperates, great-circle estimates otherwise.
 * Nothing here throws because of the network; the last tier always answers.
 */
@Service
public class DistanceService {

    private static final Logger log = LoggerFactory.getLogger(DistanceService.class);

    private final RoadNetworkClient roadNetworkClient;
    private final AvailabilityProbe probe;
    private final List<DistanceTier> tiers;
    private final GreatCircleTier estimator;

    @Autowired
    public DistanceService(RoadNetworkClient roadNetworkClient, AvailabilityProbe roadNetworkProbe,
                           RoutePlannerProperties properties) {
        this(roadNetworkClient, roadNetworkProbe, new GreatCircleTier(properties.getEstimate()));
    }

    public DistanceService(RoadNetworkClient roadNetworkClient, AvailabilityProbe probe, GreatCircleTier estimator) {
        this.roadNetworkClient = roadNetworkClient;
        this.probe = probe;
        this.estimator = estimator;
        this.tiers = List.of(new RoadNetworkTier(roadNetworkClient, probe), estimator);
    }

    public DistanceMatrix matrix(List<GeoPoint> points) {
        return matrix(points, points, false);
    }

    /**
     * @param bypassProbe try the road network even if the cached probe says it is down
     */
    public DistanceMatrix matrix(List<GeoPoint> points, boolean bypassProbe) {
        return matrix(points, points, bypassProbe);
    }

    public DistanceMatrix matrix(List<GeoPoint> sources, List<GeoPoint> destinations) {
        return matrix(sources, destinations, false);
    }

    public DistanceMatrix matrix(List<GeoPoint> sources, List<GeoPoint> destinations, boolean bypassProbe) {
        DistanceMatrix matrix = firstAvailable(tier -> tier.matrix(sources, destinations), bypassProbe);
        log.info("[DISTANCE] {}x{} matrix from {}", matrix.rows(), matrix.cols(), matrix.provenance().tag());
        return matrix;
    }

    public TravelCost pair(GeoPoint from, GeoPoint to) {
        return pair(from, to, false);
    }

    public TravelCost pair(GeoPoint from, GeoPoint to, boolean bypassProbe) {
        if (from.equals(to)) {
            return estimator.estimate(from, to);
        }
        return firstAvailable(tier -> tier.pair(from, to), bypassProbe);
    }

    public RoadRoute route(List<GeoPoint> points) {
        return route(points, false);
    }

    /**
     * Legs through consecutive points from one tier. Path geometry is only present for road-network answers.
     */
    public RoadRoute route(List<GeoPoint> points, boolean bypassProbe) {
        RoadRoute route = firstAvailable(tier -> tier.route(points), bypassProbe);
        log.info("[DISTANCE] {}-point route {} m from {}", points.size(), Math.round(route.distanceMeters),
                route.provenance.tag());
        return route;
    }

    /** Nearest routable point, or the point itself when the routing service cannot say. */
    public GeoPoint snapToRoad(GeoPoint point) {
        return trySnapToRoad(point).orElse(point);
    }

    public Optional<GeoPoint> trySnapToRoad(GeoPoint point) {
        if (!probe.isAvailable(roadNetworkClient::probe)) {
            return Optional.empty();
        }
        Optional<GeoPoint> snapped = roadNetworkClient.nearest(point);
        probe.record(snapped.isPresent());
        return snapped;
    }

    public Optional<List<TurnInstruction>> directions(GeoPoint from, GeoPoint to) {
        if (!probe.isAvailable(roadNetworkClient::probe)) {
            return Optional.empty();
        }
        return roadNetworkClient.directions(from, to);
    }

    public TravelCost estimate(GeoPoint from, GeoPoint to) {
        return estimator.estimate(from, to);
    }

    private <T> T firstAvailable(Function<DistanceTier, Optional<T>> attempt, boolean bypassProbe) {
        for (DistanceTier tier : tiers) {
            if (!bypassProbe && !tier.isLikelyAvailable()) {
                log.debug("[DISTANCE] skipping {} tier, probe says unavailable", tier.provenance().tag());
                continue;
            }
            Optional<T> result = attempt.apply(tier);
            if (result.isPresent()) {
                return result.get();
            }
            log.warn("[DISTANCE] {} tier unavailable, falling back", tier.provenance().tag());
        }
        throw new IllegalStateException("great-circle tier must always answer");
    }
}

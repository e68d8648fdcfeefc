package com.riansoft.route_planner.service.parking;

import com.riansoft.route_planner.cache.TtlCache;
import com.riansoft.route_planner.config.RoutePlannerProperties;
import com.riansoft.route_planner.exception.PlanningException;
import com.riansoft.route_planner.model.GeoPoint;
import com.riansoft.route_planner.model.ParkingCandidate;
import com.riansoft.route_planner.model.Stop;
import com.riansoft.route_planner.service.distance.DistanceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Finds somewhere to leave the vehicle near a delivery.
 * Tiers run in order: static candidates, live POI query, synthetic road-snapped points.
 * When all of them come back empty the nearest static candidate is used regardless of radius.
 */
@Service
public class ParkingResolverService {

    private static final Logger log = LoggerFactory.getLogger(ParkingResolverService.class);

    private final List<ParkingTier> tiers;
    private final ExecutorService executor;
    private final RoutePlannerProperties properties;

    public ParkingResolverService(ParkingPoiClient poiClient,
                                  @Qualifier("parkingPoiCache") TtlCache<String, List<Stop>> parkingPoiCache,
                                  DistanceService distanceService,
                                  @Qualifier("plannerExecutor") ExecutorService plannerExecutor,
                                  RoutePlannerProperties properties) {
        this.tiers = List.of(
                new StaticParkingTier(),
                new LivePoiParkingTier(poiClient, parkingPoiCache),
                new SyntheticParkingTier(distanceService));
        this.executor = plannerExecutor;
        this.properties = properties;
    }

    public ParkingOptions defaultOptions() {
        return ParkingOptions.from(properties);
    }

    public Optional<ParkingCandidate> resolve(GeoPoint deliveryPoint, List<Stop> staticCandidates) {
        return resolve(deliveryPoint, staticCandidates, defaultOptions());
    }

    public Optional<ParkingCandidate> resolve(GeoPoint deliveryPoint, List<Stop> staticCandidates,
                                              ParkingOptions options) {
        List<Stop> candidates = staticCandidates == null ? List.of() : staticCandidates;
        for (ParkingTier tier : tiers) {
            Optional<ParkingCandidate> found = tier.attempt(deliveryPoint, candidates, options);
            if (found.isPresent()) {
                log.info("[PARKING] {} -> {} ({})", deliveryPoint, found.get().point, tier.source().tag());
                return found;
            }
        }
        Optional<ParkingCandidate> lastResort = StaticParkingTier.nearest(deliveryPoint, candidates,
                Double.POSITIVE_INFINITY);
        if (lastResort.isPresent()) {
            log.warn("[PARKING] {} -> {} (cached, outside {} m)", deliveryPoint, lastResort.get().point,
                    options.getMaxStaticRadiusMeters());
        } else {
            log.warn("[PARKING] no parking found for {}", deliveryPoint);
        }
        return lastResort;
    }

    /**
     * Resolves parking for every stop concurrently on the planner pool.
     *
     * @return stop index to candidate; stops without parking are absent
     */
    public Map<Integer, ParkingCandidate> resolveAll(List<Stop> stops, List<Stop> staticCandidates,
                                                     ParkingOptions options) {
        List<Callable<Optional<ParkingCandidate>>> jobs = new ArrayList<>();
        for (Stop stop : stops) {
            jobs.add(() -> resolve(stop.point, staticCandidates, options));
        }
        Map<Integer, ParkingCandidate> byStop = new HashMap<>();
        try {
            List<Future<Optional<ParkingCandidate>>> futures = executor.invokeAll(jobs);
            for (int i = 0; i < futures.size(); i++) {
                try {
                    Optional<ParkingCandidate> candidate = futures.get(i).get();
                    if (candidate.isPresent()) {
                        byStop.put(i, candidate.get());
                    }
                } catch (ExecutionException e) {
                    log.warn("[PARKING] lookup for stop {} failed, delivering without parking: {}",
                            stops.get(i).id, e.getCause().toString());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PlanningException(PlanningException.Reason.CANCELLED, "parking resolution cancelled", e);
        }
        log.info("[PARKING] resolved {}/{} stops", byStop.size(), stops.size());
        return byStop;
    }
}

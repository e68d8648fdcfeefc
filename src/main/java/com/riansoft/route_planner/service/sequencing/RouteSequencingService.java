package com.riansoft.route_planner.service.sequencing;

import com.riansoft.route_planner.config.RoutePlannerProperties;
import com.riansoft.route_planner.model.DataModel;
import com.riansoft.route_planner.model.DistanceMatrix;
import com.riansoft.route_planner.model.ParkingCandidate;
import com.riansoft.route_planner.model.Stop;
import com.riansoft.route_planner.service.distance.DistanceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Orders the stops of one route. Strategies run in declared order (OR-Tools, 2-opt, nearest neighbor)
 * and the first usable answer wins. Travel cost to a parked stop is measured to its parking point.
 */
@Service
public class RouteSequencingService {

    private static final Logger log = LoggerFactory.getLogger(RouteSequencingService.class);

    private final DistanceService distanceService;
    private final List<SequencingStrategy> strategies;

    @Autowired
    public RouteSequencingService(DistanceService distanceService, OrToolsSequencingStrategy exactStrategy,
                                  RoutePlannerProperties properties) {
        this(distanceService, List.of(
                exactStrategy,
                new TwoOptSequencingStrategy(properties.getSequencing().getTwoOptMaxPasses()),
                new NearestNeighborSequencingStrategy()));
    }

    RouteSequencingService(DistanceService distanceService, List<SequencingStrategy> strategies) {
        this.distanceService = distanceService;
        this.strategies = strategies;
    }

    public SequencingResult sequence(Stop depot, List<Stop> stops, Map<Integer, ParkingCandidate> parkingByStop) {
        DataModel draft = new DataModel(depot, stops, parkingByStop, null);
        DistanceMatrix matrix = distanceService.matrix(draft.nodePoints);
        return sequence(draft.withMatrix(matrix));
    }

    public SequencingResult sequence(DataModel model) {
        if (model.stopCount() == 0) {
            return new SequencingResult(List.of(), SequencingTier.NEAREST_NEIGHBOR, model);
        }
        for (SequencingStrategy strategy : strategies) {
            if (!strategy.isAvailable()) {
                continue;
            }
            Optional<List<Integer>> order;
            try {
                order = strategy.attempt(model);
            } catch (RuntimeException e) {
                log.warn("[SEQUENCE] {} failed: {}", strategy.tier().tag(), e.getMessage());
                continue;
            }
            if (order.isPresent() && isPermutation(order.get(), model.stopCount())) {
                SequencingResult result = new SequencingResult(new ArrayList<>(order.get()), strategy.tier(), model);
                log.info("[SEQUENCE] {} stops, {} m via {} ({})", model.stopCount(),
                        Math.round(result.distanceMeters), strategy.tier().tag(), result.provenance.tag());
                return result;
            }
            log.warn("[SEQUENCE] {} gave no usable order, trying next", strategy.tier().tag());
        }
        // the greedy construction cannot fail
        return new SequencingResult(NearestNeighborSequencingStrategy.construct(model),
                SequencingTier.NEAREST_NEIGHBOR, model);
    }

    private static boolean isPermutation(List<Integer> order, int n) {
        if (order.size() != n) {
            return false;
        }
        Set<Integer> seen = new HashSet<>();
        for (int stop : order) {
            if (stop < 0 || stop >= n || !seen.add(stop)) {
                return false;
            }
        }
        return true;
    }
}

package com.riansoft.route_planner.service.sequencing;

import com.google.ortools.Loader;
import com.google.ortools.constraintsolver.Assignment;
import com.google.ortools.constraintsolver.FirstSolutionStrategy;
import com.google.ortools.constraintsolver.LocalSearchMetaheuristic;
import com.google.ortools.constraintsolver.RoutingIndexManager;
import com.google.ortools.constraintsolver.RoutingModel;
import com.google.ortools.constraintsolver.RoutingSearchParameters;
import com.google.ortools.constraintsolver.main;
import com.google.protobuf.Duration;
import com.riansoft.route_planner.config.RoutePlannerProperties;
import com.riansoft.route_planner.model.DataModel;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Single-vehicle routing model solved by OR-Tools: cheapest insertion, then guided local search
 * under a wall-clock limit. Unavailable when the native library could not be loaded.
 */
@Component
public class OrToolsSequencingStrategy implements SequencingStrategy {

    private static final Logger log = LoggerFactory.getLogger(OrToolsSequencingStrategy.class);

    private final RoutePlannerProperties.Sequencing config;
    private volatile boolean loaded;

    public OrToolsSequencingStrategy(RoutePlannerProperties properties) {
        this.config = properties.getSequencing();
    }

    @PostConstruct
    public void init() {
        if (!config.isExactSolverEnabled()) {
            log.info("[SOLVER] OR-Tools tier disabled by configuration");
            return;
        }
        try {
            log.info("[SOLVER] loading OR-Tools native libraries...");
            Loader.loadNativeLibraries();
            loaded = true;
            log.info("[SOLVER] OR-Tools ready");
        } catch (Exception | LinkageError e) {
            log.warn("[SOLVER] OR-Tools native libraries unavailable, falling back to local search: {}", e.toString());
        }
    }

    @Override
    public SequencingTier tier() {
        return SequencingTier.EXACT;
    }

    @Override
    public boolean isAvailable() {
        return loaded && config.isExactSolverEnabled();
    }

    @Override
    public Optional<List<Integer>> attempt(DataModel model) {
        if (model.stopCount() < 2) {
            List<Integer> trivial = new ArrayList<>();
            for (int i = 0; i < model.stopCount(); i++) {
                trivial.add(i);
            }
            return Optional.of(trivial);
        }

        RoutingIndexManager manager = new RoutingIndexManager(model.nodeCount(), 1, model.depotIndex);
        RoutingModel routing = new RoutingModel(manager);

        final int costCallbackIndex = routing.registerTransitCallback(
                (long fromIndex, long toIndex) -> {
                    int fromNode = manager.indexToNode(fromIndex);
                    int toNode = manager.indexToNode(toIndex);
                    return Math.round(model.matrix.distance(fromNode, toNode));
                });
        routing.setArcCostEvaluatorOfAllVehicles(costCallbackIndex);

        RoutingSearchParameters searchParameters = main.defaultRoutingSearchParameters().toBuilder()
                .setFirstSolutionStrategy(FirstSolutionStrategy.Value.PARALLEL_CHEAPEST_INSERTION)
                .setLocalSearchMetaheuristic(LocalSearchMetaheuristic.Value.GUIDED_LOCAL_SEARCH)
                .setSolutionLimit(config.getSolutionLimit())
                .setTimeLimit(Duration.newBuilder().setSeconds(config.getTimeLimitSeconds()).build())
                .build();

        log.debug("[SOLVER] solving {} stops (limit {} solutions / {} s)", model.stopCount(),
                config.getSolutionLimit(), config.getTimeLimitSeconds());
        Assignment solution = routing.solveWithParameters(searchParameters);
        if (solution == null) {
            log.warn("[SOLVER] no solution within budget, status {}", routing.status());
            return Optional.empty();
        }

        List<Integer> order = new ArrayList<>();
        long index = routing.start(0);
        while (!routing.isEnd(index)) {
            int node = manager.indexToNode(index);
            if (node != model.depotIndex) {
                order.add(DataModel.stopOf(node));
            }
            index = solution.value(routing.nextVar(index));
        }
        return Optional.of(orient(model, order));
    }

    /**
     * A symmetric tour and its reverse cost the same; prefer the one that leaves the depot on the shorter leg.
     */
    static List<Integer> orient(DataModel model, List<Integer> order) {
        if (order.size() < 2) {
            return order;
        }
        List<Integer> reversed = new ArrayList<>(order);
        Collections.reverse(reversed);
        if (Math.abs(model.tourDistance(order) - model.tourDistance(reversed)) > 1e-6) {
            return order;
        }
        double firstLeg = model.matrix.distance(model.depotIndex, DataModel.nodeOf(order.get(0)));
        double lastLeg = model.matrix.distance(model.depotIndex, DataModel.nodeOf(reversed.get(0)));
        return lastLeg < firstLeg ? reversed : order;
    }
}

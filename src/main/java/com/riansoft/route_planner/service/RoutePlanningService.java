package com.riansoft.route_planner.service;

import com.riansoft.route_planner.config.RoutePlannerProperties;
import com.riansoft.route_planner.dto.ImprovementDto;
import com.riansoft.route_planner.dto.OptimizationSuggestionDto;
import com.riansoft.route_planner.dto.PlanningRequestDto;
import com.riansoft.route_planner.dto.PlanningResultDto;
import com.riansoft.route_planner.dto.RouteAssignmentDto;
import com.riansoft.route_planner.dto.RoutePlanDto;
import com.riansoft.route_planner.dto.RouteStatisticsDto;
import com.riansoft.route_planner.exception.PlanningException;
import com.riansoft.route_planner.model.Cluster;
import com.riansoft.route_planner.model.ClusteringMethod;
import com.riansoft.route_planner.model.GeoPoint;
import com.riansoft.route_planner.model.ParkingCandidate;
import com.riansoft.route_planner.model.Stop;
import com.riansoft.route_planner.service.analysis.RouteAnalysisService;
import com.riansoft.route_planner.service.assembly.RouteAssemblyService;
import com.riansoft.route_planner.service.assignment.DriverAssignmentService;
import com.riansoft.route_planner.service.clustering.ClusteringService;
import com.riansoft.route_planner.service.parking.ParkingResolverService;
import com.riansoft.route_planner.service.sequencing.RouteSequencingService;
import com.riansoft.route_planner.service.sequencing.SequencingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Entry point of the engine: cluster, assign, then per route resolve parking, sequence and assemble.
 */
@Service
public class RoutePlanningService {

    private static final Logger log = LoggerFactory.getLogger(RoutePlanningService.class);

    private final ClusteringService clusteringService;
    private final DriverAssignmentService driverAssignmentService;
    private final ParkingResolverService parkingResolverService;
    private final RouteSequencingService routeSequencingService;
    private final RouteAssemblyService routeAssemblyService;
    private final RouteAnalysisService routeAnalysisService;
    private final RoutePlannerProperties properties;

    @Autowired
    public RoutePlanningService(ClusteringService clusteringService, DriverAssignmentService driverAssignmentService,
                                ParkingResolverService parkingResolverService,
                                RouteSequencingService routeSequencingService,
                                RouteAssemblyService routeAssemblyService, RouteAnalysisService routeAnalysisService,
                                RoutePlannerProperties properties) {
        this.clusteringService = clusteringService;
        this.driverAssignmentService = driverAssignmentService;
        this.parkingResolverService = parkingResolverService;
        this.routeSequencingService = routeSequencingService;
        this.routeAssemblyService = routeAssemblyService;
        this.routeAnalysisService = routeAnalysisService;
        this.properties = properties;
    }

    public PlanningResultDto plan(PlanningRequestDto request) {
        Stop depot = requireDepot(request.getDepot());
        List<Stop> orders = new ArrayList<>();
        for (Stop order : request.getOrders()) {
            if (order.hasLocation()) {
                orders.add(order);
            }
        }
        if (orders.isEmpty()) {
            throw new PlanningException(PlanningException.Reason.NO_STOPS, "no geolocated orders to plan");
        }
        if (request.getDrivers() == null || request.getDrivers().isEmpty()) {
            throw new PlanningException(PlanningException.Reason.NO_DRIVERS, "no drivers to assign routes to");
        }
        log.info("========= [PLAN] {} orders, {} drivers ==========", orders.size(), request.getDrivers().size());

        RoutePlannerProperties.Clustering clustering = properties.getClustering();
        List<GeoPoint> points = new ArrayList<>();
        orders.forEach(order -> points.add(order.point));
        List<Cluster> clusters = clusteringService.cluster(points,
                request.getMaxClusterSize() != null ? request.getMaxClusterSize() : clustering.getMaxClusterSize(),
                request.getMinClusterSize() != null ? request.getMinClusterSize() : clustering.getMinClusterSize(),
                request.getClusteringMethod() != null ? request.getClusteringMethod() : clustering.getMethod(),
                request.getNumClusters());

        List<RouteAssignmentDto> assignments = driverAssignmentService.assign(clusters, request.getDrivers(),
                request.getAssignmentStrategy(), orders);

        List<RoutePlanDto> plans = new ArrayList<>();
        for (RouteAssignmentDto assignment : assignments) {
            if (Thread.currentThread().isInterrupted()) {
                throw new PlanningException(PlanningException.Reason.CANCELLED, "planning cancelled");
            }
            List<Stop> stops = new ArrayList<>();
            assignment.getOrderIndices().forEach(index -> stops.add(orders.get(index)));

            Map<Integer, ParkingCandidate> parking = request.isParkingAware()
                    ? parkingResolverService.resolveAll(stops, request.getStaticParking(),
                    parkingResolverService.defaultOptions())
                    : Map.of();
            SequencingResult sequence = routeSequencingService.sequence(depot, stops, parking);

            List<Stop> ordered = new ArrayList<>();
            Map<Integer, ParkingCandidate> orderedParking = new HashMap<>();
            for (int position = 0; position < sequence.order.size(); position++) {
                int stopIndex = sequence.order.get(position);
                ordered.add(stops.get(stopIndex));
                if (parking.containsKey(stopIndex)) {
                    orderedParking.put(position, parking.get(stopIndex));
                }
            }

            RoutePlanDto plan = routeAssemblyService.assemble(depot, ordered, orderedParking, request.getStartTime());
            plan.setRouteIndex(assignment.getRouteIndex());
            plan.setDriverId(assignment.getDriverId());
            plan.setRouteName(assignment.getRouteName());
            plan.setColor(assignment.getColor());
            plan.setSequencingTier(sequence.tier.tag());
            plans.add(plan);
        }

        RouteStatisticsDto statistics = routeAnalysisService.statistics(assignments, plans, orders.size());
        log.info("========= [PLAN] {} routes, {} km total ==========", plans.size(),
                String.format(Locale.ROOT, "%.2f", statistics.getTotalDistanceKm()));
        return new PlanningResultDto(assignments, plans, statistics);
    }

    /**
     * Re-sequences an existing route and reports how much shorter it would be.
     * The current order is kept when no shorter one is found.
     */
    public OptimizationSuggestionDto suggestOptimization(Stop depot, List<Stop> currentRoute, LocalDateTime startTime) {
        requireDepot(depot);
        if (currentRoute == null || currentRoute.isEmpty()) {
            throw new PlanningException(PlanningException.Reason.NO_STOPS, "route has no stops");
        }
        for (Stop stop : currentRoute) {
            if (!stop.hasLocation()) {
                throw new PlanningException(PlanningException.Reason.NO_STOPS, "stop " + stop.id + " has no location");
            }
        }

        List<Integer> current = new ArrayList<>();
        for (int i = 0; i < currentRoute.size(); i++) {
            current.add(i);
        }
        SequencingResult sequence = routeSequencingService.sequence(depot, currentRoute, Map.of());
        ImprovementDto improvement = routeAssemblyService.improvement(depot, currentRoute, current, sequence.order);
        List<Integer> optimized = sequence.order;
        if (improvement.getDistanceSavedKm() < 0) {
            optimized = current;
            improvement = new ImprovementDto(improvement.getOriginalDistanceKm(), improvement.getOriginalDistanceKm());
        }

        List<Stop> ordered = new ArrayList<>();
        List<String> ids = new ArrayList<>();
        for (int index : optimized) {
            ordered.add(currentRoute.get(index));
            ids.add(currentRoute.get(index).id);
        }
        RoutePlanDto plan = routeAssemblyService.assemble(depot, ordered, Map.of(), startTime);
        plan.setSequencingTier(sequence.tier.tag());

        return new OptimizationSuggestionDto(suggestionText(improvement), improvement, optimized, ids, plan);
    }

    static String suggestionText(ImprovementDto improvement) {
        if (improvement.getImprovementPercent() > 5) {
            return String.format(Locale.ROOT, "Optimization can save %.2f km (%.1f%%)",
                    improvement.getDistanceSavedKm(), improvement.getImprovementPercent());
        }
        if (improvement.getImprovementPercent() < 1) {
            return "Current route is already well optimized";
        }
        return "Route optimization complete";
    }

    private static Stop requireDepot(Stop depot) {
        if (depot == null || !depot.hasLocation()) {
            throw new PlanningException(PlanningException.Reason.DEPOT_MISSING, "depot has no coordinates");
        }
        return depot;
    }
}

package com.riansoft.route_planner.service.analysis;

import com.riansoft.route_planner.dto.InsertionAnalysisDto;
import com.riansoft.route_planner.dto.RouteAssignmentDto;
import com.riansoft.route_planner.dto.RouteConflictDto;
import com.riansoft.route_planner.dto.RoutePlanDto;
import com.riansoft.route_planner.dto.RouteStatisticsDto;
import com.riansoft.route_planner.model.GeoPoint;
import com.riansoft.route_planner.model.Stop;
import com.riansoft.route_planner.util.GeoUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Read-only checks over finished plans: totals, overlapping routes, and whether a late order fits a running route.
 * Distances here are straight-line.
 */
@Service
public class RouteAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(RouteAnalysisService.class);

    public static final double DEFAULT_CONFLICT_THRESHOLD_KM = 1.0;
    public static final double DEFAULT_MAX_DETOUR_KM = 5.0;

    public RouteStatisticsDto statistics(List<RouteAssignmentDto> assignments, List<RoutePlanDto> plans, int totalOrders) {
        Set<Integer> scheduled = new HashSet<>();
        Set<Long> drivers = new HashSet<>();
        for (RouteAssignmentDto assignment : assignments) {
            scheduled.addAll(assignment.getOrderIndices());
            drivers.add(assignment.getDriverId());
        }
        double distanceKm = 0;
        double timeMinutes = 0;
        for (RoutePlanDto plan : plans) {
            distanceKm += plan.getTotalDistanceKm();
            timeMinutes += plan.getTotalTimeMinutes();
        }

        RouteStatisticsDto stats = new RouteStatisticsDto();
        stats.setTotalRoutes(assignments.size());
        stats.setTotalOrders(scheduled.size());
        stats.setUnscheduledOrders(Math.max(0, totalOrders - scheduled.size()));
        stats.setDriversUsed(drivers.size());
        stats.setTotalDistanceKm(distanceKm);
        stats.setTotalTimeMinutes(timeMinutes);
        if (!assignments.isEmpty()) {
            stats.setAverageOrdersPerRoute((double) scheduled.size() / assignments.size());
            stats.setAverageDistancePerRouteKm(distanceKm / assignments.size());
        }
        return stats;
    }

    public List<RouteConflictDto> detectConflicts(List<RouteAssignmentDto> routes, List<Stop> orders) {
        return detectConflicts(routes, orders, DEFAULT_CONFLICT_THRESHOLD_KM);
    }

    /**
     * Every pair of deliveries on two different routes closer than {@code thresholdKm}.
     */
    public List<RouteConflictDto> detectConflicts(List<RouteAssignmentDto> routes, List<Stop> orders,
                                                  double thresholdKm) {
        List<RouteConflictDto> conflicts = new ArrayList<>();
        for (int i = 0; i < routes.size(); i++) {
            for (int j = i + 1; j < routes.size(); j++) {
                RouteAssignmentDto first = routes.get(i);
                RouteAssignmentDto second = routes.get(j);
                for (int a : first.getOrderIndices()) {
                    for (int b : second.getOrderIndices()) {
                        Stop one = orders.get(a);
                        Stop other = orders.get(b);
                        if (!one.hasLocation() || !other.hasLocation()) {
                            continue;
                        }
                        double km = GeoUtils.haversineKm(one.point, other.point);
                        if (km < thresholdKm) {
                            conflicts.add(new RouteConflictDto(first, second, one.id, other.id, km));
                        }
                    }
                }
            }
        }
        if (!conflicts.isEmpty()) {
            log.info("[ANALYSIS] {} cross-route conflicts under {} km", conflicts.size(), thresholdKm);
        }
        return conflicts;
    }

    public InsertionAnalysisDto analyzeInsertion(Stop newOrder, GeoPoint driverLocation, List<Stop> remainingRoute) {
        return analyzeInsertion(newOrder, driverLocation, remainingRoute, DEFAULT_MAX_DETOUR_KM);
    }

    /**
     * Detour of driving to {@code newOrder} before the next remaining stop instead of going straight there.
     */
    public InsertionAnalysisDto analyzeInsertion(Stop newOrder, GeoPoint driverLocation, List<Stop> remainingRoute,
                                                 double maxDetourKm) {
        InsertionAnalysisDto analysis = new InsertionAnalysisDto();
        if (newOrder == null || !newOrder.hasLocation()) {
            analysis.setCanAdd(false);
            analysis.setSuggestion("Order missing location data");
            return analysis;
        }

        double toOrder = GeoUtils.haversineKm(driverLocation, newOrder.point);
        double detour = 0;
        if (remainingRoute != null && !remainingRoute.isEmpty() && remainingRoute.get(0).hasLocation()) {
            GeoPoint next = remainingRoute.get(0).point;
            detour = toOrder + GeoUtils.haversineKm(newOrder.point, next) - GeoUtils.haversineKm(driverLocation, next);
        }
        boolean canAdd = toOrder <= maxDetourKm && detour <= maxDetourKm;

        analysis.setCanAdd(canAdd);
        analysis.setDistanceToOrderKm(toOrder);
        analysis.setDetourDistanceKm(detour);
        analysis.setRecommendedInsertionIndex(canAdd ? 0 : null);
        analysis.setSuggestion(canAdd
                ? String.format(Locale.ROOT, "Order is %.2f km away. Detour: %.2f km", toOrder, detour)
                : String.format(Locale.ROOT, "Order is too far (%.2f km) or detour too large (%.2f km)", toOrder, detour));
        return analysis;
    }
}

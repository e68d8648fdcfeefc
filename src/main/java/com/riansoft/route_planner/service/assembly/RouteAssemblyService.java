package com.riansoft.route_planner.service.assembly;

import com.riansoft.route_planner.dto.ImprovementDto;
import com.riansoft.route_planner.dto.LatLngDto;
import com.riansoft.route_planner.dto.RoutePlanDto;
import com.riansoft.route_planner.dto.WaypointDto;
import com.riansoft.route_planner.exception.PlanningException;
import com.riansoft.route_planner.model.DataModel;
import com.riansoft.route_planner.model.GeoPoint;
import com.riansoft.route_planner.model.ParkingCandidate;
import com.riansoft.route_planner.model.RoadRoute;
import com.riansoft.route_planner.model.Stop;
import com.riansoft.route_planner.model.TurnInstruction;
import com.riansoft.route_planner.model.WaypointKind;
import com.riansoft.route_planner.service.distance.DistanceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

@Service
public class RouteAssemblyService {

    private static final Logger log = LoggerFactory.getLogger(RouteAssemblyService.class);

    private final DistanceService distanceService;
    private final ExecutorService executor;

    public RouteAssemblyService(DistanceService distanceService,
                                @Qualifier("plannerExecutor") ExecutorService plannerExecutor) {
        this.distanceService = distanceService;
        this.executor = plannerExecutor;
    }

    /**
     * Builds depot, then parking (if any) and delivery per stop, then depot again.
     *
     * @param parkingByStop keyed by position in {@code orderedStops}
     * @param startTime     when set, every waypoint gets an estimated arrival
     */
    public RoutePlanDto assemble(Stop depot, List<Stop> orderedStops, Map<Integer, ParkingCandidate> parkingByStop,
                                 LocalDateTime startTime) {
        List<WaypointDto> waypoints = new ArrayList<>();
        waypoints.add(waypoint(WaypointKind.DEPOT, depot, depot.point));
        for (int i = 0; i < orderedStops.size(); i++) {
            Stop stop = orderedStops.get(i);
            ParkingCandidate parking = parkingByStop == null ? null : parkingByStop.get(i);
            if (parking != null) {
                WaypointDto parkingWaypoint = new WaypointDto(WaypointKind.PARKING, stop.id,
                        parking.name != null ? parking.name : "Parking", stop.address,
                        parking.point.lat, parking.point.lon);
                parkingWaypoint.setParkingSource(parking.source.tag());
                waypoints.add(parkingWaypoint);
            }
            waypoints.add(waypoint(WaypointKind.DELIVERY, stop, stop.point));
        }
        waypoints.add(waypoint(WaypointKind.DEPOT, depot, depot.point));

        List<GeoPoint> chain = new ArrayList<>();
        for (WaypointDto waypoint : waypoints) {
            chain.add(new GeoPoint(waypoint.getLat(), waypoint.getLon()));
        }
        RoadRoute route = distanceService.route(chain);

        if (startTime != null) {
            double elapsedSeconds = 0;
            waypoints.get(0).setEstimatedArrival(startTime);
            for (int i = 1; i < waypoints.size(); i++) {
                elapsedSeconds += route.legs.get(i - 1).durationSeconds;
                waypoints.get(i).setEstimatedArrival(startTime.plusSeconds(Math.round(elapsedSeconds)));
            }
        }

        List<LatLngDto> path = new ArrayList<>();
        for (GeoPoint point : route.geometry.isEmpty() ? chain : route.geometry) {
            path.add(LatLngDto.of(point));
        }

        RoutePlanDto plan = new RoutePlanDto(waypoints, route.distanceMeters / 1000.0,
                route.durationSeconds / 60.0, route.provenance.tag(), path);
        log.info("[ASSEMBLY] {} waypoints, {} km, {} min ({})", waypoints.size(),
                String.format("%.2f", plan.getTotalDistanceKm()), Math.round(plan.getTotalTimeMinutes()),
                plan.getDistanceProvenance());
        return plan;
    }

    /**
     * Scores two visiting orders of the same stops against one matrix.
     */
    public ImprovementDto improvement(Stop depot, List<Stop> stops, List<Integer> originalOrder,
                                      List<Integer> optimizedOrder) {
        DataModel draft = new DataModel(depot, stops, null, null);
        DataModel model = draft.withMatrix(distanceService.matrix(draft.nodePoints));
        return new ImprovementDto(model.tourDistance(originalOrder) / 1000.0,
                model.tourDistance(optimizedOrder) / 1000.0);
    }

    /**
     * Turn-by-turn instructions per leg of the plan, fetched concurrently. A leg whose lookup fails gets an empty list.
     */
    public List<List<TurnInstruction>> fetchDirections(RoutePlanDto plan) {
        List<WaypointDto> waypoints = plan.getWaypoints();
        List<Callable<List<TurnInstruction>>> jobs = new ArrayList<>();
        for (int i = 0; i + 1 < waypoints.size(); i++) {
            GeoPoint from = new GeoPoint(waypoints.get(i).getLat(), waypoints.get(i).getLon());
            GeoPoint to = new GeoPoint(waypoints.get(i + 1).getLat(), waypoints.get(i + 1).getLon());
            jobs.add(() -> distanceService.directions(from, to).orElse(List.of()));
        }
        List<List<TurnInstruction>> legs = new ArrayList<>();
        try {
            for (Future<List<TurnInstruction>> future : executor.invokeAll(jobs)) {
                try {
                    legs.add(future.get());
                } catch (ExecutionException e) {
                    log.warn("[ASSEMBLY] directions lookup failed: {}", e.getCause().getMessage());
                    legs.add(List.of());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PlanningException(PlanningException.Reason.CANCELLED, "directions lookup cancelled", e);
        }
        return legs;
    }

    private static WaypointDto waypoint(WaypointKind kind, Stop stop, GeoPoint point) {
        return new WaypointDto(kind, stop.id, stop.name, stop.address, point.lat, point.lon);
    }
}

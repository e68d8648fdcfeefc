package com.riansoft.route_planner.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * Drivable itinerary for one route: depot, then parking/delivery waypoints in travel order, then depot.
 */
public class RoutePlanDto {
    private int routeIndex;
    private Long driverId;
    private String routeName;
    private String color;
    private List<WaypointDto> waypoints = new ArrayList<>();
    private double totalDistanceKm;
    private double totalTimeMinutes;
    private String distanceProvenance;
    private String sequencingTier;
    private List<LatLngDto> path = new ArrayList<>();

    public RoutePlanDto() {}

    public RoutePlanDto(List<WaypointDto> waypoints, double totalDistanceKm, double totalTimeMinutes,
                        String distanceProvenance, List<LatLngDto> path) {
        this.waypoints = waypoints;
        this.totalDistanceKm = totalDistanceKm;
        this.totalTimeMinutes = totalTimeMinutes;
        this.distanceProvenance = distanceProvenance;
        this.path = path;
    }

    public int getRouteIndex() { return routeIndex; }
    public void setRouteIndex(int routeIndex) { this.routeIndex = routeIndex; }
    public Long getDriverId() { return driverId; }
    public void setDriverId(Long driverId) { this.driverId = driverId; }
    public String getRouteName() { return routeName; }
    public void setRouteName(String routeName) { this.routeName = routeName; }
    public String getColor() { return color; }
    public void setColor(String color) { this.color = color; }
    public List<WaypointDto> getWaypoints() { return waypoints; }
    public void setWaypoints(List<WaypointDto> waypoints) { this.waypoints = waypoints; }
    public double getTotalDistanceKm() { return totalDistanceKm; }
    public void setTotalDistanceKm(double totalDistanceKm) { this.totalDistanceKm = totalDistanceKm; }
    public double getTotalTimeMinutes() { return totalTimeMinutes; }
    public void setTotalTimeMinutes(double totalTimeMinutes) { this.totalTimeMinutes = totalTimeMinutes; }
    public String getDistanceProvenance() { return distanceProvenance; }
    public void setDistanceProvenance(String distanceProvenance) { this.distanceProvenance = distanceProvenance; }
    public String getSequencingTier() { return sequencingTier; }
    public void setSequencingTier(String sequencingTier) { this.sequencingTier = sequencingTier; }
    public List<LatLngDto> getPath() { return path; }
    public void setPath(List<LatLngDto> path) { this.path = path; }
}

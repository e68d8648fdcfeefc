package com.riansoft.route_planner.dto;

import java.util.Locale;

// Two deliveries on different routes that sit close enough to be served by one driver
public class RouteConflictDto {
    private int firstRouteIndex;
    private int secondRouteIndex;
    private String firstDriverName;
    private String secondDriverName;
    private String firstOrderId;
    private String secondOrderId;
    private double distanceKm;
    private String suggestion;

    public RouteConflictDto() {}

    public RouteConflictDto(RouteAssignmentDto first, RouteAssignmentDto second, String firstOrderId,
                            String secondOrderId, double distanceKm) {
        this.firstRouteIndex = first.getRouteIndex();
        this.secondRouteIndex = second.getRouteIndex();
        this.firstDriverName = first.getDriverName();
        this.secondDriverName = second.getDriverName();
        this.firstOrderId = firstOrderId;
        this.secondOrderId = secondOrderId;
        this.distanceKm = distanceKm;
        this.suggestion = String.format(Locale.ROOT, "Drivers %s and %s are within %.2f km", firstDriverName, secondDriverName, distanceKm);
    }

    public int getFirstRouteIndex() { return firstRouteIndex; }
    public void setFirstRouteIndex(int firstRouteIndex) { this.firstRouteIndex = firstRouteIndex; }
    public int getSecondRouteIndex() { return secondRouteIndex; }
    public void setSecondRouteIndex(int secondRouteIndex) { this.secondRouteIndex = secondRouteIndex; }
    public String getFirstDriverName() { return firstDriverName; }
    public void setFirstDriverName(String firstDriverName) { this.firstDriverName = firstDriverName; }
    public String getSecondDriverName() { return secondDriverName; }
    public void setSecondDriverName(String secondDriverName) { this.secondDriverName = secondDriverName; }
    public String getFirstOrderId() { return firstOrderId; }
    public void setFirstOrderId(String firstOrderId) { this.firstOrderId = firstOrderId; }
    public String getSecondOrderId() { return secondOrderId; }
    public void setSecondOrderId(String secondOrderId) { this.secondOrderId = secondOrderId; }
    public double getDistanceKm() { return distanceKm; }
    public void setDistanceKm(double distanceKm) { this.distanceKm = distanceKm; }
    public String getSuggestion() { return suggestion; }
    public void setSuggestion(String suggestion) { this.suggestion = suggestion; }
}

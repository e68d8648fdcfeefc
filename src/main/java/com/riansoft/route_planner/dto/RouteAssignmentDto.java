package com.riansoft.route_planner.dto;

import java.util.List;

// Cluster -> driver mapping. orderIndices keep cluster membership order, not the travel sequence
public class RouteAssignmentDto {
    private long driverId;
    private String driverName;
    private List<Integer> orderIndices;
    private List<String> orderIds;
    private int orderCount;
    private String routeName;
    private String color;
    private int routeIndex;

    public RouteAssignmentDto() {}

    public RouteAssignmentDto(long driverId, String driverName, List<Integer> orderIndices, List<String> orderIds,
                              String routeName, String color, int routeIndex) {
        this.driverId = driverId;
        this.driverName = driverName;
        this.orderIndices = orderIndices;
        this.orderIds = orderIds;
        this.orderCount = orderIndices.size();
        this.routeName = routeName;
        this.color = color;
        this.routeIndex = routeIndex;
    }

    public long getDriverId() { return driverId; }
    public void setDriverId(long driverId) { this.driverId = driverId; }
    public String getDriverName() { return driverName; }
    public void setDriverName(String driverName) { this.driverName = driverName; }
    public List<Integer> getOrderIndices() { return orderIndices; }
    public void setOrderIndices(List<Integer> orderIndices) { this.orderIndices = orderIndices; }
    public List<String> getOrderIds() { return orderIds; }
    public void setOrderIds(List<String> orderIds) { this.orderIds = orderIds; }
    public int getOrderCount() { return orderCount; }
    public void setOrderCount(int orderCount) { this.orderCount = orderCount; }
    public String getRouteName() { return routeName; }
    public void setRouteName(String routeName) { this.routeName = routeName; }
    public String getColor() { return color; }
    public void setColor(String color) { this.color = color; }
    public int getRouteIndex() { return routeIndex; }
    public void setRouteIndex(int routeIndex) { this.routeIndex = routeIndex; }
}

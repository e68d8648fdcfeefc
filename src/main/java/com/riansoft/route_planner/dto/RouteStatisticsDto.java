package com.riansoft.route_planner.dto;

public class RouteStatisticsDto {
    private int totalRoutes;
    private int totalOrders;
    private int unscheduledOrders;
    private int driversUsed;
    private double totalDistanceKm;
    private double totalTimeMinutes;
    private double averageOrdersPerRoute;
    private double averageDistancePerRouteKm;

    public int getTotalRoutes() { return totalRoutes; }
    public void setTotalRoutes(int totalRoutes) { this.totalRoutes = totalRoutes; }
    public int getTotalOrders() { return totalOrders; }
    public void setTotalOrders(int totalOrders) { this.totalOrders = totalOrders; }
    public int getUnscheduledOrders() { return unscheduledOrders; }
    public void setUnscheduledOrders(int unscheduledOrders) { this.unscheduledOrders = unscheduledOrders; }
    public int getDriversUsed() { return driversUsed; }
    public void setDriversUsed(int driversUsed) { this.driversUsed = driversUsed; }
    public double getTotalDistanceKm() { return totalDistanceKm; }
    public void setTotalDistanceKm(double totalDistanceKm) { this.totalDistanceKm = totalDistanceKm; }
    public double getTotalTimeMinutes() { return totalTimeMinutes; }
    public void setTotalTimeMinutes(double totalTimeMinutes) { this.totalTimeMinutes = totalTimeMinutes; }
    public double getAverageOrdersPerRoute() { return averageOrdersPerRoute; }
    public void setAverageOrdersPerRoute(double averageOrdersPerRoute) { this.averageOrdersPerRoute = averageOrdersPerRoute; }
    public double getAverageDistancePerRouteKm() { return averageDistancePerRouteKm; }
    public void setAverageDistancePerRouteKm(double averageDistancePerRouteKm) { this.averageDistancePerRouteKm = averageDistancePerRouteKm; }
}

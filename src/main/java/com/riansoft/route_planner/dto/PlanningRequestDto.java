package com.riansoft.route_planner.dto;

import com.riansoft.route_planner.model.AssignmentStrategy;
import com.riansoft.route_planner.model.ClusteringMethod;
import com.riansoft.route_planner.model.Driver;
import com.riansoft.route_planner.model.Stop;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Input of one planning run. Null tuning fields fall back to the configured defaults.
 * Orders must already be geolocated.
 */
public class PlanningRequestDto {
    private Stop depot;
    private List<Stop> orders = new ArrayList<>();
    private List<Driver> drivers = new ArrayList<>();
    private List<Stop> staticParking = new ArrayList<>();
    private Integer maxClusterSize;
    private Integer minClusterSize;
    private Integer numClusters;
    private ClusteringMethod clusteringMethod;
    private AssignmentStrategy assignmentStrategy = AssignmentStrategy.BALANCED;
    private boolean parkingAware;
    private LocalDateTime startTime;

    public Stop getDepot() { return depot; }
    public void setDepot(Stop depot) { this.depot = depot; }
    public List<Stop> getOrders() { return orders; }
    public void setOrders(List<Stop> orders) { this.orders = orders; }
    public List<Driver> getDrivers() { return drivers; }
    public void setDrivers(List<Driver> drivers) { this.drivers = drivers; }
    public List<Stop> getStaticParking() { return staticParking; }
    public void setStaticParking(List<Stop> staticParking) { this.staticParking = staticParking; }
    public Integer getMaxClusterSize() { return maxClusterSize; }
    public void setMaxClusterSize(Integer maxClusterSize) { this.maxClusterSize = maxClusterSize; }
    public Integer getMinClusterSize() { return minClusterSize; }
    public void setMinClusterSize(Integer minClusterSize) { this.minClusterSize = minClusterSize; }
    public Integer getNumClusters() { return numClusters; }
    public void setNumClusters(Integer numClusters) { this.numClusters = numClusters; }
    public ClusteringMethod getClusteringMethod() { return clusteringMethod; }
    public void setClusteringMethod(ClusteringMethod clusteringMethod) { this.clusteringMethod = clusteringMethod; }
    public AssignmentStrategy getAssignmentStrategy() { return assignmentStrategy; }
    public void setAssignmentStrategy(AssignmentStrategy assignmentStrategy) { this.assignmentStrategy = assignmentStrategy; }
    public boolean isParkingAware() { return parkingAware; }
    public void setParkingAware(boolean parkingAware) { this.parkingAware = parkingAware; }
    public LocalDateTime getStartTime() { return startTime; }
    public void setStartTime(LocalDateTime startTime) { this.startTime = startTime; }
}

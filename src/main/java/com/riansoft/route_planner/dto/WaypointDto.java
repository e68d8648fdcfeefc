package com.riansoft.route_planner.dto;

import com.riansoft.route_planner.model.WaypointKind;

import java.time.LocalDateTime;

public class WaypointDto {
    private WaypointKind kind;
    private String stopId;
    private String name;
    private String address;
    private double lat;
    private double lon;
    private String parkingSource;
    private LocalDateTime estimatedArrival;

    public WaypointDto() {}

    public WaypointDto(WaypointKind kind, String stopId, String name, String address, double lat, double lon) {
        this.kind = kind;
        this.stopId = stopId;
        this.name = name;
        this.address = address;
        this.lat = lat;
        this.lon = lon;
    }

    public WaypointKind getKind() { return kind; }
    public void setKind(WaypointKind kind) { this.kind = kind; }
    public String getStopId() { return stopId; }
    public void setStopId(String stopId) { this.stopId = stopId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getAddress() { return address; }
    public void setAddress(String address) { this.address = address; }
    public double getLat() { return lat; }
    public void setLat(double lat) { this.lat = lat; }
    public double getLon() { return lon; }
    public void setLon(double lon) { this.lon = lon; }
    public String getParkingSource() { return parkingSource; }
    public void setParkingSource(String parkingSource) { this.parkingSource = parkingSource; }
    public LocalDateTime getEstimatedArrival() { return estimatedArrival; }
    public void setEstimatedArrival(LocalDateTime estimatedArrival) { this.estimatedArrival = estimatedArrival; }
}

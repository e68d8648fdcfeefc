package com.riansoft.route_planner.model;

public class TurnInstruction {
    public final String instruction;
    public final String roadName;
    public final double distanceMeters;
    public final double durationSeconds;

    public TurnInstruction(String instruction, String roadName, double distanceMeters, double durationSeconds) {
        this.instruction = instruction;
        this.roadName = roadName;
        this.distanceMeters = distanceMeters;
        this.durationSeconds = durationSeconds;
    }

    @Override
    public String toString() {
        return String.format("%s (%.0f m)", instruction, distanceMeters);
    }
}

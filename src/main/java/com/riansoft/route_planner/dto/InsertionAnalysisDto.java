package com.riansoft.route_planner.dto;

public class InsertionAnalysisDto {
    private boolean canAdd;
    private double distanceToOrderKm;
    private double detourDistanceKm;
    private Integer recommendedInsertionIndex;
    private String suggestion;

    public boolean isCanAdd() { return canAdd; }
    public void setCanAdd(boolean canAdd) { this.canAdd = canAdd; }
    public double getDistanceToOrderKm() { return distanceToOrderKm; }
    public void setDistanceToOrderKm(double distanceToOrderKm) { this.distanceToOrderKm = distanceToOrderKm; }
    public double getDetourDistanceKm() { return detourDistanceKm; }
    public void setDetourDistanceKm(double detourDistanceKm) { this.detourDistanceKm = detourDistanceKm; }
    public Integer getRecommendedInsertionIndex() { return recommendedInsertionIndex; }
    public void setRecommendedInsertionIndex(Integer recommendedInsertionIndex) { this.recommendedInsertionIndex = recommendedInsertionIndex; }
    public String getSuggestion() { return suggestion; }
    public void setSuggestion(String suggestion) { this.suggestion = suggestion; }
}

package com.riansoft.route_planner.dto;

import java.util.List;

public class OptimizationSuggestionDto {
    private String suggestion;
    private ImprovementDto improvement;
    private List<Integer> optimizedOrder;
    private List<String> optimizedStopIds;
    private RoutePlanDto optimizedPlan;

    public OptimizationSuggestionDto() {}

    public OptimizationSuggestionDto(String suggestion, ImprovementDto improvement, List<Integer> optimizedOrder,
                                     List<String> optimizedStopIds, RoutePlanDto optimizedPlan) {
        this.suggestion = suggestion;
        this.improvement = improvement;
        this.optimizedOrder = optimizedOrder;
        this.optimizedStopIds = optimizedStopIds;
        this.optimizedPlan = optimizedPlan;
    }

    public String getSuggestion() { return suggestion; }
    public void setSuggestion(String suggestion) { this.suggestion = suggestion; }
    public ImprovementDto getImprovement() { return improvement; }
    public void setImprovement(ImprovementDto improvement) { this.improvement = improvement; }
    public List<Integer> getOptimizedOrder() { return optimizedOrder; }
    public void setOptimizedOrder(List<Integer> optimizedOrder) { this.optimizedOrder = optimizedOrder; }
    public List<String> getOptimizedStopIds() { return optimizedStopIds; }
    public void setOptimizedStopIds(List<String> optimizedStopIds) { this.optimizedStopIds = optimizedStopIds; }
    public RoutePlanDto getOptimizedPlan() { return optimizedPlan; }
    public void setOptimizedPlan(RoutePlanDto optimizedPlan) { this.optimizedPlan = optimizedPlan; }
}

package com.riansoft.route_planner.dto;

import java.util.List;

public class PlanningResultDto {
    private List<RouteAssignmentDto> assignments;
    private List<RoutePlanDto> routePlans;
    private RouteStatisticsDto statistics;

    public PlanningResultDto() {}

    public PlanningResultDto(List<RouteAssignmentDto> assignments, List<RoutePlanDto> routePlans,
                             RouteStatisticsDto statistics) {
        this.assignments = assignments;
        this.routePlans = routePlans;
        this.statistics = statistics;
    }

    public List<RouteAssignmentDto> getAssignments() { return assignments; }
    public void setAssignments(List<RouteAssignmentDto> assignments) { this.assignments = assignments; }
    public List<RoutePlanDto> getRoutePlans() { return routePlans; }
    public void setRoutePlans(List<RoutePlanDto> routePlans) { this.routePlans = routePlans; }
    public RouteStatisticsDto getStatistics() { return statistics; }
    public void setStatistics(RouteStatisticsDto statistics) { this.statistics = statistics; }
}

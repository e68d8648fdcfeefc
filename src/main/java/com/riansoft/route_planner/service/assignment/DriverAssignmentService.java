package com.riansoft.route_planner.service.assignment;

import com.riansoft.route_planner.dto.RouteAssignmentDto;
import com.riansoft.route_planner.model.AssignmentStrategy;
import com.riansoft.route_planner.model.Cluster;
import com.riansoft.route_planner.model.Driver;
import com.riansoft.route_planner.model.Stop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Hands clusters to drivers and gives each resulting route a short name and a color.
 */
@Service
public class DriverAssignmentService {

    private static final Logger log = LoggerFactory.getLogger(DriverAssignmentService.class);

    static final List<String> ROUTE_COLORS = List.of(
            "#9b59b6", "#e91e63", "#00bcd4", "#4caf50", "#ff9800",
            "#2196f3", "#f44336", "#009688", "#ffc107", "#795548",
            "#607d8b", "#9c27b0", "#ff5722", "#00acc1", "#8bc34a");

    public List<RouteAssignmentDto> assign(List<Cluster> clusters, List<Driver> drivers, AssignmentStrategy strategy) {
        return assign(clusters, drivers, strategy, null);
    }

    /**
     * @param orders when given, assignments also carry the order identifiers of their members
     */
    public List<RouteAssignmentDto> assign(List<Cluster> clusters, List<Driver> drivers, AssignmentStrategy strategy,
                                           List<Stop> orders) {
        if (clusters == null || clusters.isEmpty() || drivers == null || drivers.isEmpty()) {
            return List.of();
        }
        List<Driver> pool = new ArrayList<>();
        for (Driver driver : drivers) {
            if (driver.available) {
                pool.add(driver);
            }
        }
        if (pool.isEmpty()) {
            log.warn("[ASSIGN] no available drivers, using all {}", drivers.size());
            pool = new ArrayList<>(drivers);
        }

        List<RouteAssignmentDto> assignments = strategy == AssignmentStrategy.SEQUENTIAL
                ? sequential(clusters, pool, orders)
                : balanced(clusters, pool, orders);

        Set<Long> used = new HashSet<>();
        assignments.forEach(a -> used.add(a.getDriverId()));
        log.info("[ASSIGN] {} clusters -> {} drivers ({})", clusters.size(), used.size(),
                strategy == null ? AssignmentStrategy.BALANCED : strategy);
        return assignments;
    }

    // largest cluster first, to whoever carries the least so far; ties go to the lowest driver id
    private List<RouteAssignmentDto> balanced(List<Cluster> clusters, List<Driver> pool, List<Stop> orders) {
        List<Integer> bySize = new ArrayList<>();
        for (int i = 0; i < clusters.size(); i++) {
            bySize.add(i);
        }
        bySize.sort(Comparator.comparingInt((Integer i) -> clusters.get(i).size()).reversed());

        List<Driver> byId = new ArrayList<>(pool);
        byId.sort(Comparator.comparingLong(d -> d.id));
        int[] load = new int[byId.size()];

        List<RouteAssignmentDto> assignments = new ArrayList<>();
        for (int clusterIndex : bySize) {
            int lightest = 0;
            for (int d = 1; d < byId.size(); d++) {
                if (load[d] < load[lightest]) {
                    lightest = d;
                }
            }
            Cluster cluster = clusters.get(clusterIndex);
            load[lightest] += cluster.size();
            assignments.add(toAssignment(byId.get(lightest), cluster, assignments.size(), orders));
        }
        return assignments;
    }

    private List<RouteAssignmentDto> sequential(List<Cluster> clusters, List<Driver> pool, List<Stop> orders) {
        List<RouteAssignmentDto> assignments = new ArrayList<>();
        for (int i = 0; i < clusters.size(); i++) {
            assignments.add(toAssignment(pool.get(i % pool.size()), clusters.get(i), i, orders));
        }
        return assignments;
    }

    private RouteAssignmentDto toAssignment(Driver driver, Cluster cluster, int slot, List<Stop> orders) {
        List<String> orderIds = new ArrayList<>();
        if (orders != null) {
            for (int index : cluster.members()) {
                orderIds.add(orders.get(index).id);
            }
        }
        String driverName = driver.name == null || driver.name.isBlank() ? "Driver " + driver.id : driver.name;
        return new RouteAssignmentDto(driver.id, driverName, new ArrayList<>(cluster.members()), orderIds,
                routeName(driver.name, slot), color(slot), slot);
    }

    /**
     * "Michael Schneider" gives "MS", "Anna" gives "AN", an empty name gives "R{slot + 1}".
     */
    public static String routeName(String driverName, int slot) {
        if (driverName == null || driverName.isBlank()) {
            return "R" + (slot + 1);
        }
        String[] words = driverName.trim().split("\\s+");
        if (words.length >= 2) {
            return ("" + words[0].charAt(0) + words[1].charAt(0)).toUpperCase();
        }
        return words[0].substring(0, Math.min(2, words[0].length())).toUpperCase();
    }

    public static String color(int slot) {
        return ROUTE_COLORS.get(slot % ROUTE_COLORS.size());
    }
}

package com.riansoft.route_planner.service.sequencing;

import com.riansoft.route_planner.model.DataModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Greedy tour from the depot. Ties go to the lowest stop index.
 */
public class NearestNeighborSequencingStrategy implements SequencingStrategy {

    @Override
    public SequencingTier tier() {
        return SequencingTier.NEAREST_NEIGHBOR;
    }

    @Override
    public Optional<List<Integer>> attempt(DataModel model) {
        return Optional.of(construct(model));
    }

    static List<Integer> construct(DataModel model) {
        int n = model.stopCount();
        boolean[] visited = new boolean[n];
        List<Integer> order = new ArrayList<>(n);
        int current = model.depotIndex;
        for (int step = 0; step < n; step++) {
            int next = -1;
            double best = Double.POSITIVE_INFINITY;
            for (int stop = 0; stop < n; stop++) {
                if (visited[stop]) {
                    continue;
                }
                double d = model.matrix.distance(current, DataModel.nodeOf(stop));
                if (next < 0 || d < best) {
                    next = stop;
                    best = d;
                }
            }
            visited[next] = true;
            order.add(next);
            current = DataModel.nodeOf(next);
        }
        return order;
    }
}

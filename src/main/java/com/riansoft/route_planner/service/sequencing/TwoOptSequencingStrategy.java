package com.riansoft.route_planner.service.sequencing;

import com.riansoft.route_planner.model.DataModel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Nearest-neighbor tour refined by segment reversals.
 * A reversal is kept only if it strictly shortens the whole tour, so asymmetric matrices are handled too.
 */
public class TwoOptSequencingStrategy implements SequencingStrategy {

    private static final double EPSILON = 1e-9;

    private final int maxPasses;

    public TwoOptSequencingStrategy(int maxPasses) {
        this.maxPasses = maxPasses;
    }

    @Override
    public SequencingTier tier() {
        return SequencingTier.TWO_OPT;
    }

    @Override
    public boolean isAvailable() {
        return maxPasses > 0;
    }

    @Override
    public Optional<List<Integer>> attempt(DataModel model) {
        return Optional.of(improve(model, NearestNeighborSequencingStrategy.construct(model), maxPasses));
    }

    static List<Integer> improve(DataModel model, List<Integer> start, int maxPasses) {
        List<Integer> tour = new ArrayList<>(start);
        double best = model.tourDistance(tour);
        int passes = 0;
        boolean improved = true;
        while (improved && passes < maxPasses) {
            improved = false;
            passes++;
            for (int i = 0; i < tour.size() - 1; i++) {
                for (int j = i + 1; j < tour.size(); j++) {
                    Collections.reverse(tour.subList(i, j + 1));
                    double candidate = model.tourDistance(tour);
                    if (candidate < best - EPSILON) {
                        best = candidate;
                        improved = true;
                    } else {
                        Collections.reverse(tour.subList(i, j + 1));
                    }
                }
            }
        }
        return tour;
    }
}

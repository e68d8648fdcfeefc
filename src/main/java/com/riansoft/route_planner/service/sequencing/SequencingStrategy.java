package com.riansoft.route_planner.service.sequencing;

import com.riansoft.route_planner.model.DataModel;

import java.util.List;
import java.util.Optional;

/**
 * One way of ordering the stops of a {@link DataModel}. Empty means the next strategy should run.
 */
public interface SequencingStrategy {

    SequencingTier tier();

    default boolean isAvailable() {
        return true;
    }

    /**
     * @return stop indices in visiting order, depot excluded
     */
    Optional<List<Integer>> attempt(DataModel model);
}

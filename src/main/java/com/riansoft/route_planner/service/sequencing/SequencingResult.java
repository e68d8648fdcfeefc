package com.riansoft.route_planner.service.sequencing;

import com.riansoft.route_planner.model.DataModel;
import com.riansoft.route_planner.model.DistanceProvenance;

import java.util.Collections;
import java.util.List;

public class SequencingResult {
    public final List<Integer> order;
    public final SequencingTier tier;
    public final DistanceProvenance provenance;
    public final double distanceMeters;
    public final DataModel model;

    public SequencingResult(List<Integer> order, SequencingTier tier, DataModel model) {
        this.order = Collections.unmodifiableList(order);
        this.tier = tier;
        this.model = model;
        this.provenance = model.matrix.provenance();
        this.distanceMeters = model.tourDistance(order);
    }
}

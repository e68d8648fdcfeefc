package com.riansoft.route_planner.service.sequencing;

public enum SequencingTier {
    EXACT("or-tools"),
    TWO_OPT("two-opt"),
    NEAREST_NEIGHBOR("nearest-neighbor");

    private final String tag;

    SequencingTier(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}

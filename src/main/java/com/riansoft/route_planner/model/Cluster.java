package com.riansoft.route_planner.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Set of order indices that one driver will serve. Member order carries no meaning.
 */
public class Cluster {
    private final List<Integer> members;

    public Cluster(List<Integer> members) {
        if (members.isEmpty()) {
            throw new IllegalArgumentException("cluster must not be empty");
        }
        this.members = Collections.unmodifiableList(new ArrayList<>(members));
    }

    public List<Integer> members() {
        return members;
    }

    public int size() {
        return members.size();
    }

    @Override
    public String toString() {
        return "Cluster" + members;
    }
}

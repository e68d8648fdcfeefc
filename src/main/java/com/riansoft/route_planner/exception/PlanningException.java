package com.riansoft.route_planner.exception;

/**
 * Raised when a planning request cannot be served. Network trouble never ends up here;
 * only missing input or cancellation does.
 */
public class PlanningException extends RuntimeException {

    public enum Reason {
        NO_STOPS,
        NO_DRIVERS,
        DEPOT_MISSING,
        CANCELLED
    }

    private final Reason reason;

    public PlanningException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public PlanningException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}

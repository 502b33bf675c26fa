package org.Aayush.planner.transit;

import org.Aayush.planner.core.PlannerException;

/**
 * Thrown when a transit table is incomplete, asymmetric, or otherwise unusable.
 */
public final class InfeasibleTransitTableException extends PlannerException {
    public static final String REASON_VENUE_REQUIRED = "TRANSIT_VENUE_REQUIRED";
    public static final String REASON_EMPTY_TABLE = "TRANSIT_EMPTY_TABLE";
    public static final String REASON_NEGATIVE_COST = "TRANSIT_NEGATIVE_COST";
    public static final String REASON_SELF_ROUTE = "TRANSIT_SELF_ROUTE";
    public static final String REASON_MISSING_PAIR = "TRANSIT_MISSING_PAIR";
    public static final String REASON_ASYMMETRIC_PAIR = "TRANSIT_ASYMMETRIC_PAIR";

    public InfeasibleTransitTableException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}

package org.Aayush.planner.catalog;

import org.Aayush.planner.core.PlannerException;

/**
 * Thrown when programme data cannot form a valid occurrence.
 *
 * <p>Raised while the catalog is being built, before any optimization starts.</p>
 */
public final class MalformedEventException extends PlannerException {
    public static final String REASON_TITLE_REQUIRED = "CATALOG_TITLE_REQUIRED";
    public static final String REASON_START_REQUIRED = "CATALOG_START_REQUIRED";
    public static final String REASON_UNPARSEABLE_START = "CATALOG_UNPARSEABLE_START";
    public static final String REASON_NON_POSITIVE_DURATION = "CATALOG_NON_POSITIVE_DURATION";
    public static final String REASON_DURATION_OUT_OF_RANGE = "CATALOG_DURATION_OUT_OF_RANGE";
    public static final String REASON_UNKNOWN_VENUE = "CATALOG_UNKNOWN_VENUE";
    public static final String REASON_NO_OCCURRENCES = "CATALOG_NO_OCCURRENCES";

    public MalformedEventException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public MalformedEventException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}

package org.Aayush.planner.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Planner contract exception with deterministic reason codes.
 *
 * <p>Messages are prefixed with the reason code so logs stay greppable.</p>
 */
@Getter
public class PlannerException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded planner failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public PlannerException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded planner failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public PlannerException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}

package io.twsbridge.domain.order;

import java.math.BigDecimal;

/**
 * Order lifecycle states.
 *
 * <pre>
 * CREATED -> PENDING_SUBMIT -> {PRE_SUBMITTED, SUBMITTED} -> PARTIALLY_FILLED* -> {FILLED, CANCELLED, REJECTED}
 * </pre>
 */
public enum OrderState {
    CREATED(0),
    PENDING_SUBMIT(1),
    PRE_SUBMITTED(2),
    SUBMITTED(3),
    PARTIALLY_FILLED(4),
    FILLED(5),
    CANCELLED(5),
    REJECTED(5);

    private final int rank;

    OrderState(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public boolean isTerminal() {
        return rank == 5;
    }

    /**
     * Map a gateway status string onto a state.
     *
     * PendingCancel carries no state of its own; callers see it as the
     * cancelPending flag, so null is returned for it.
     */
    public static OrderState fromGatewayStatus(String status, BigDecimal filled,
                                               BigDecimal remaining) {
        if (status == null) {
            return null;
        }
        return switch (status) {
            case "ApiPending", "PendingSubmit" -> PENDING_SUBMIT;
            case "PreSubmitted" -> PRE_SUBMITTED;
            case "Submitted" -> isPartial(filled, remaining) ? PARTIALLY_FILLED : SUBMITTED;
            case "Filled" -> FILLED;
            case "ApiCancelled", "Cancelled" -> CANCELLED;
            case "Inactive", "Rejected" -> REJECTED;
            default -> null;
        };
    }

    private static boolean isPartial(BigDecimal filled, BigDecimal remaining) {
        return filled != null && remaining != null
            && filled.signum() > 0 && remaining.signum() > 0;
    }
}

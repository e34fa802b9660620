package io.twsbridge.domain.request;

import io.twsbridge.domain.contract.Contract;

/**
 * Exercise or lapse an option position. Outcomes arrive as order status,
 * execution and error messages keyed by the request id.
 *
 * @param override true to exercise even if the option is out of the money,
 *                 or to lapse one that is in the money
 */
public record ExerciseOptionsRequest(
    long requestId,
    Contract contract,
    Action action,
    int quantity,
    String account,
    boolean override
) implements ClientRequest {

    public enum Action {
        EXERCISE(1),
        LAPSE(2);

        private final int code;

        Action(int code) {
            this.code = code;
        }

        public int code() {
            return code;
        }
    }

    public ExerciseOptionsRequest {
        if (contract == null) {
            throw new IllegalArgumentException("Contract cannot be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("Action cannot be null");
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive");
        }
        if (account == null) {
            account = "";
        }
    }
}

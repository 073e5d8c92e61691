package info.mouts.orderpipeline.domain;

import java.util.Optional;

/**
 * Represents the stage an order has reached in the kitchen pipeline.
 * The value travels on the wire as the {@code order_status} field of every
 * order event.
 */
public enum OrderStatus {
    /**
     * Initial state, set when the order is accepted over HTTP.
     */
    ORDERED,

    /**
     * The order has been picked up and is being prepared.
     */
    PREPARING,

    /**
     * Preparation finished, the order is waiting to be handed over.
     */
    PREPARED,

    /**
     * The order reached the client. Terminal.
     */
    DELIVERED,

    /**
     * The order could not be advanced. Terminal.
     */
    CANCELLED;

    /**
     * Tells whether no further stage follows this one.
     *
     * @return {@code true} for {@link #DELIVERED} and {@link #CANCELLED}.
     */
    public boolean isTerminal() {
        return this == DELIVERED || this == CANCELLED;
    }

    /**
     * Resolves a wire value to a status without throwing on unknown values.
     *
     * @param value The raw {@code order_status} value, may be null.
     * @return The matching status, or empty if the value is not one of the known
     *         names (the comparison is case-sensitive).
     */
    public static Optional<OrderStatus> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }

        for (OrderStatus status : values()) {
            if (status.name().equals(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}

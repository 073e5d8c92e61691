package info.mouts.orderpipeline.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * A semi-structured order event as it travels through the queue.
 * Only {@code order_status} (and the optional {@code client_id}) have a meaning
 * to the pipeline; every other field is carried through untouched.
 *
 * <p>
 * Instances are treated as immutable once handed to another component: status
 * changes go through {@link #withStatus(OrderStatus)}, which returns a copy.
 * </p>
 */
@ToString
@EqualsAndHashCode
public class OrderEvent {
    public static final String ORDER_STATUS_FIELD = "order_status";
    public static final String CLIENT_ID_FIELD = "client_id";

    private final Map<String, Object> fields;

    public OrderEvent(Map<String, Object> fields) {
        this.fields = new LinkedHashMap<>(fields);
    }

    /**
     * Exposes every field as a top-level JSON property.
     *
     * @return A read-only view of the event fields.
     */
    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    /**
     * Returns the raw {@code order_status} value.
     *
     * @return The status text, or null if absent or not a string.
     */
    @JsonIgnore
    public String getRawStatus() {
        Object value = fields.get(ORDER_STATUS_FIELD);
        return value instanceof String ? (String) value : null;
    }

    /**
     * Resolves {@code order_status} to a known {@link OrderStatus}.
     *
     * @return The status, or empty when the value is absent or unknown.
     */
    @JsonIgnore
    public Optional<OrderStatus> getStatus() {
        return OrderStatus.fromValue(getRawStatus());
    }

    /**
     * Returns the identity of the client that owns this order.
     *
     * @return The client id, or empty if the event does not carry one.
     */
    @JsonIgnore
    public Optional<String> getClientId() {
        Object value = fields.get(CLIENT_ID_FIELD);
        if (value instanceof String && !((String) value).isBlank()) {
            return Optional.of((String) value);
        }
        return Optional.empty();
    }

    /**
     * Creates a copy of this event with {@code order_status} overwritten.
     *
     * @param status The new status.
     * @return A new event, this instance is left unchanged.
     */
    public OrderEvent withStatus(OrderStatus status) {
        return with(ORDER_STATUS_FIELD, status.name());
    }

    /**
     * Creates a copy of this event with one field added or replaced.
     *
     * @param name  The field name.
     * @param value The field value.
     * @return A new event, this instance is left unchanged.
     */
    public OrderEvent with(String name, Object value) {
        OrderEvent copy = new OrderEvent(fields);
        copy.fields.put(name, value);
        return copy;
    }
}

package info.mouts.orderpipeline.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import info.mouts.orderpipeline.domain.OrderEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Message pushed to a live client when an order is delivered or fails.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OrderNotificationDTO {
    public static final String ORDER_DELIVERED = "ORDER_DELIVERED";
    public static final String ORDER_FAILED = "ORDER_FAILED";

    private String type;
    private String message;
    private String error;
    private OrderEvent order;
}

package info.mouts.orderpipeline.dto;

import java.util.Map;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "Acknowledgement returned once an order has been handed to the kitchen queue")
public class OrderAcceptedResponseDTO {
    @Schema(description = "Human readable outcome", example = "Order accepted successfully! The kitchen is being notified.")
    private String message;

    @Schema(description = "The order as it was published, including order_status and client_id")
    private Map<String, Object> data;
}

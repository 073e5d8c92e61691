package info.mouts.orderpipeline.controller;

import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import info.mouts.orderpipeline.domain.OrderEvent;
import info.mouts.orderpipeline.dto.OrderAcceptedResponseDTO;
import info.mouts.orderpipeline.service.OrderService;
import info.mouts.orderpipeline.util.RabbitMqUtils;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;

/**
 * REST controller accepting new orders into the kitchen pipeline.
 * Orders are acknowledged as soon as they are queued; progress is pushed to the
 * client over the {@code /ws} connection.
 */
@RestController
@RequestMapping("/api/v1/orders")
@Tag(name = "Orders API", description = "Endpoints for placing orders")
@Slf4j
public class OrderController {
    static final String ACCEPTED_MESSAGE = "Order accepted successfully! The kitchen is being notified.";

    private final OrderService orderService;

    public OrderController(OrderService orderService) {
        this.orderService = orderService;
    }

    /**
     * Places a new order. The body is an arbitrary JSON object describing the
     * order, it is forwarded unchanged apart from {@code order_status} and
     * {@code client_id}.
     *
     * @param payload  The order.
     * @param clientId The client that should receive updates, optional.
     * @return A {@link ResponseEntity} with status 202 and the queued event.
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Place an Order", description = "Queues an order for the kitchen and returns immediately.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Order accepted", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = OrderAcceptedResponseDTO.class))),
            @ApiResponse(responseCode = "400", description = "Invalid order payload", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "503", description = "Order could not be sent to the kitchen", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "500", description = "Internal Server Error", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<OrderAcceptedResponseDTO> placeOrder(@RequestBody Map<String, Object> payload,
            @Parameter(description = "Client that receives the order updates") @RequestHeader(name = RabbitMqUtils.CLIENT_ID_HEADER, required = false) String clientId) {
        OrderEvent event = orderService.placeOrder(payload, clientId);

        OrderAcceptedResponseDTO response = OrderAcceptedResponseDTO.builder()
                .message(ACCEPTED_MESSAGE)
                .data(event.getFields())
                .build();

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }
}

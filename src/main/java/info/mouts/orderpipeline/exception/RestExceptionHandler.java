package info.mouts.orderpipeline.exception;

import java.net.URI;
import java.time.Instant;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import lombok.extern.slf4j.Slf4j;

/**
 * Global exception handler for the REST controllers.
 * Maps exceptions to HTTP status codes and formats responses using the Problem
 * Details for HTTP APIs standard (RFC 7807). Every response carries a stable
 * {@code code} property clients can switch on.
 */
@RestControllerAdvice
@Slf4j
public class RestExceptionHandler {
    public static final String INVALID_ORDER_PAYLOAD = "INVALID_ORDER_PAYLOAD";
    public static final String ORDER_PUBLISH_FAILED = "ORDER_PUBLISH_FAILED";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    /**
     * Capture {@link InvalidOrderRequestException} and returns HTTP 400 Bad
     * Request.
     *
     * @param ex      The caught {@link InvalidOrderRequestException}.
     * @param request The current web request.
     * @return A {@link ProblemDetail} object representing the error.
     */
    @ExceptionHandler(InvalidOrderRequestException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ProblemDetail handleInvalidOrderRequestException(InvalidOrderRequestException ex, WebRequest request) {
        log.warn("Handling InvalidOrderRequestException: {}", ex.getMessage());

        return buildProblemDetail(HttpStatus.BAD_REQUEST, ex.getMessage(), "Invalid Order", INVALID_ORDER_PAYLOAD,
                request);
    }

    /**
     * Capture {@link HttpMessageNotReadableException} and returns HTTP 400 Bad
     * Request. This occurs when the body is not valid JSON or not a JSON object.
     *
     * @param ex      The caught {@link HttpMessageNotReadableException}.
     * @param request The current web request.
     * @return A {@link ProblemDetail} object representing the error.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ProblemDetail handleHttpMessageNotReadableException(HttpMessageNotReadableException ex,
            WebRequest request) {
        log.warn("Handling HttpMessageNotReadableException: {}", ex.getMessage());

        return buildProblemDetail(HttpStatus.BAD_REQUEST, "Invalid order data provided", "Invalid Order",
                INVALID_ORDER_PAYLOAD, request);
    }

    /**
     * Capture {@link EventPublishException} and returns HTTP 503 Service
     * Unavailable. The order was not queued and may be retried by the client.
     *
     * @param ex      The caught {@link EventPublishException}.
     * @param request The current web request.
     * @return A {@link ProblemDetail} object representing the error.
     */
    @ExceptionHandler(EventPublishException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public ProblemDetail handleEventPublishException(EventPublishException ex, WebRequest request) {
        log.error("Handling EventPublishException: {}", ex.getMessage());

        return buildProblemDetail(HttpStatus.SERVICE_UNAVAILABLE,
                "Failed to send order to the kitchen, please try again later.", "Order Not Queued",
                ORDER_PUBLISH_FAILED, request);
    }

    /**
     * Catches any other unhandled exceptions. Returns HTTP 500 Internal Server
     * Error with a generic message to avoid exposing internal details.
     *
     * @param ex      The caught {@link Exception}.
     * @param request The current web request.
     * @return A {@link ProblemDetail} object representing the error.
     */
    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ProblemDetail handleGenericException(Exception ex, WebRequest request) {
        log.error("Handling unexpected exception: {}", ex.getMessage(), ex);

        return buildProblemDetail(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected internal error occurred.",
                "Internal Server Error", INTERNAL_ERROR, request);
    }

    private ProblemDetail buildProblemDetail(HttpStatus status, String detail, String title, String code,
            WebRequest request) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, detail);
        problemDetail.setTitle(title);
        problemDetail.setProperty("code", code);
        problemDetail.setProperty("timestamp", Instant.now());
        problemDetail.setInstance(URI.create(request.getDescription(false)));

        return problemDetail;
    }
}

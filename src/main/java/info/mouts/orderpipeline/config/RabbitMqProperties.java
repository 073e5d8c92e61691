package info.mouts.orderpipeline.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Strongly-typed RabbitMQ settings, bound from {@code app.rabbitmq.*}.
 *
 * <pre>
 * app:
 *   rabbitmq:
 *     host: localhost
 *     port: 5672
 *     username: guest
 *     password: guest
 *     default-queue: kitchen-order-queue
 *     publish-timeout: 15s
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.rabbitmq")
public class RabbitMqProperties {

    @NotBlank
    private String host = "localhost";

    @Min(1)
    @Max(65535)
    private int port = 5672;

    @NotBlank
    private String username = "guest";

    private String password = "guest";

    @NotBlank
    private String virtualHost = "/";

    /** Queue used when a publish call does not name one. */
    @NotBlank
    private String defaultQueue = "kitchen-order-queue";

    /** Upper bound for a single publish, broker confirmation included. */
    @NotNull
    private Duration publishTimeout = Duration.ofSeconds(15);

    @NotNull
    private Duration connectionTimeout = Duration.ofSeconds(10);

    /**
     * Describes the broker endpoint for log and error messages. The password is
     * never included.
     *
     * @return A string of the form {@code user@host:port/vhost}.
     */
    public String describeEndpoint() {
        return username + "@" + host + ":" + port + virtualHost;
    }
}

package info.mouts.orderpipeline.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import lombok.Data;

/**
 * Settings of the order pipeline itself, bound from {@code app.pipeline.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.pipeline")
public class PipelineProperties {

    /** Queue every order stage is published to and consumed from. */
    @NotBlank
    private String orderQueue = "kitchen-order-queue";

    /** Client that receives notifications for orders placed without a client id. */
    @NotBlank
    private String defaultClientId = "pizza";

    /** Unacknowledged deliveries the broker may push to this consumer. */
    @Min(1)
    private int prefetchCount = 50;

    @Valid
    private Preparation preparation = new Preparation();

    @Valid
    private Workers workers = new Workers();

    @Getter
    @Setter
    public static class Preparation {
        /** Shortest simulated preparation time, whole seconds. */
        @NotNull
        private Duration minDelay = Duration.ofSeconds(1);

        /** Longest simulated preparation time, inclusive. */
        @NotNull
        private Duration maxDelay = Duration.ofSeconds(6);
    }

    @Getter
    @Setter
    public static class Workers {
        @Min(1)
        private int coreSize = 8;

        @Min(1)
        private int maxSize = 32;

        /** Deliveries waiting for a worker before dispatch blocks. */
        @Min(0)
        private int queueCapacity = 100;
    }
}

package info.mouts.orderpipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class OrderPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrderPipelineApplication.class, args);
    }
}

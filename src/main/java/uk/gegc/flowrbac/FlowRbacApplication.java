package uk.gegc.flowrbac;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FlowRbacApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlowRbacApplication.class, args);
    }
}

package io.chronoledger.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication(scanBasePackages = "io.chronoledger")
@ConfigurationPropertiesScan
public class ClApplication {
    public static void main(String[] args) {
        SpringApplication.run(ClApplication.class, args);
    }
}

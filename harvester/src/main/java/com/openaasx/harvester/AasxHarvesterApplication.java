package com.openaasx.harvester;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AasxHarvesterApplication {

    public static void main(String[] args) {
        SpringApplication.run(AasxHarvesterApplication.class, args);
    }
}

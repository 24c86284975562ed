package com.studio.access;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DoorAccessApplication {

    public static void main(String[] args) {
        SpringApplication.run(DoorAccessApplication.class, args);
    }
}

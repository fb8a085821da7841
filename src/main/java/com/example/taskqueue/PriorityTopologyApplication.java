package com.example.taskqueue;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PriorityTopologyApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(PriorityTopologyApplication.class, args)));
    }
}

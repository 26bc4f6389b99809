package com.taskgateway.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * Main application entry point for the Task Gateway.
 */
@SpringBootApplication
@ComponentScan(basePackages = {
    "com.taskgateway.api",
    "com.taskgateway.engine"
})
public class TaskGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskGatewayApplication.class, args);
    }
}
